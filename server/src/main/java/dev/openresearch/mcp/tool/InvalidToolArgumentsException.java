package dev.openresearch.mcp.tool;

/**
 * Raised when tool arguments are missing, malformed or out of range.
 */
public class InvalidToolArgumentsException extends IllegalArgumentException {

	public InvalidToolArgumentsException(String message) {
		super(message);
	}

	public InvalidToolArgumentsException(String message, Throwable cause) {
		super(message, cause);
	}

}
