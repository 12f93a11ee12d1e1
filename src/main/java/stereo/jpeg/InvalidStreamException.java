package stereo.jpeg;

/**
 * Input that should be a JPEG stream (or an MPO file) has a broken or missing
 * marker structure.
 */
public class InvalidStreamException extends Exception {

	private static final long serialVersionUID = 1L;

	public InvalidStreamException(String message) {
		super(message);
	}

	public InvalidStreamException(String message, Throwable cause) {
		super(message, cause);
	}
}
