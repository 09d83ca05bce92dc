package works.mvs.exceptions;

/**
 * A selector cannot be evaluated, usually because it uses a query language
 * the structure query engine does not support, or its query text is malformed.
 */
public class InvalidSelectorException extends IllegalArgumentException {
	public InvalidSelectorException(String message) {
		super(message);
	}

	public InvalidSelectorException(String message, Throwable cause) {
		super(message, cause);
	}
}
