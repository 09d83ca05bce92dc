package works.mvs.exceptions;

/**
 * A loading run was aborted because one of the tree's nodes could not be loaded.
 * Nothing from the aborted run was committed to the scene host.
 */
public class TreeLoadingException extends Exception {
	private final String nodeKind;
	private final String nodePath;

	/**
	 * @return null if the failure is not attributable to one node
	 */
	public String nodeKind() {
		return this.nodeKind;
	}

	/**
	 * @return location of the offending node, like {@code root/download[0]/parse[0]}
	 */
	public String nodePath() {
		return this.nodePath;
	}

	public TreeLoadingException(String nodeKind, String nodePath, Throwable cause) {
		super(fullMessage(nodeKind, nodePath, cause), cause);
		this.nodeKind = nodeKind;
		this.nodePath = nodePath;
	}

	public TreeLoadingException(String message) {
		super(message);
		this.nodeKind = null;
		this.nodePath = null;
	}

	public TreeLoadingException(String message, Throwable cause) {
		super(message, cause);
		this.nodeKind = null;
		this.nodePath = null;
	}

	private static String fullMessage(String nodeKind, String nodePath, Throwable cause) {
		return "Unable to load \"" + nodeKind + "\" node at " + nodePath + ": " + cause.getMessage();
	}
}
