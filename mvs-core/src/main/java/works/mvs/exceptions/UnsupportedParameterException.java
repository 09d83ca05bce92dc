package works.mvs.exceptions;

/**
 * A parameter names a variant (a structure type, representation type, file format...)
 * that this library does not know how to load.
 */
public class UnsupportedParameterException extends InvalidParameterException {
	private final String value;

	public String value() {
		return this.value;
	}

	public UnsupportedParameterException(String nodeKind, String parameterName, String value) {
		super(parameterName, fullMessage(nodeKind, parameterName, value));
		this.value = value;
	}

	private static String fullMessage(String nodeKind, String parameterName, String value) {
		return "Unsupported " + parameterName + " for \"" + nodeKind + "\" node: \"" + value + "\"";
	}
}
