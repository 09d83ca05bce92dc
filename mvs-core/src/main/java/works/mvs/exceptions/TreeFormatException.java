package works.mvs.exceptions;

/**
 * Serialized tree data does not have the expected shape.
 */
public class TreeFormatException extends Exception {
	public TreeFormatException(String message) {
		super(message);
	}

	public TreeFormatException(String message, Throwable cause) {
		super(message, cause);
	}

	public TreeFormatException(Throwable cause) {
		super(cause);
	}
}
