package glr;

/**
 * Base class of all exceptions thrown by the grammar analysis and the parsers.
 */
public class GLRException extends RuntimeException {

	public GLRException(String message) {
		super(message);
	}

	public GLRException(String message, Throwable cause) {
		super(message, cause);
	}
}
