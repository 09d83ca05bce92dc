package works.mvs.exceptions;

/**
 * A node parameter has a value that cannot be realized in a scene.
 * <p>
 * Fatal to the loading run in which it occurs: the tree is considered corrupt
 * or incompatible, and nothing from that run is committed.
 */
public class InvalidParameterException extends IllegalArgumentException {
	private final String parameterName;

	public String parameterName() {
		return this.parameterName;
	}

	public InvalidParameterException(String parameterName, String message) {
		super(message);
		this.parameterName = parameterName;
	}

	public InvalidParameterException(String parameterName, String message, Throwable cause) {
		super(message, cause);
		this.parameterName = parameterName;
	}
}
