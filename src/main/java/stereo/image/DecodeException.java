package stereo.image;

import java.nio.file.Path;

/**
 * Thrown when a file or byte stream cannot be decoded into a raster image.
 */
public class DecodeException extends Exception {

	private static final long serialVersionUID = 1L;

	private final Path path;

	public DecodeException(Path path, String message) {
		super(path + ": " + message);
		this.path = path;
	}

	public DecodeException(Path path, Throwable cause) {
		super(path + ": " + cause.getMessage(), cause);
		this.path = path;
	}

	public DecodeException(String message) {
		super(message);
		this.path = null;
	}

	/**
	 * @return offending file, or null when the image came from memory
	 */
	public Path getPath() {
		return path;
	}
}
