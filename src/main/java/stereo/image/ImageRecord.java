package stereo.image;

import java.awt.Dimension;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One image found by a directory scan. The capture time is either the EXIF
 * digitized/original time or the file modification time, and may be missing.
 * Dimensions are read from the image header on first request.
 */
public final class ImageRecord {
	private final Path path;
	private final LocalDateTime captureTime;
	private final long byteSize;
	private Dimension dimension;

	public ImageRecord(Path path, LocalDateTime captureTime, long byteSize) {
		this.path = Objects.requireNonNull(path, "path");
		this.captureTime = captureTime;
		this.byteSize = byteSize;
	}

	public Path getPath() {
		return path;
	}

	public LocalDateTime getCaptureTime() {
		return captureTime;
	}

	public boolean hasCaptureTime() {
		return captureTime != null;
	}

	public long getByteSize() {
		return byteSize;
	}

	public String getName() {
		return path.getFileName().toString();
	}

	public synchronized int getWidth() throws DecodeException {
		return dimension().width;
	}

	public synchronized int getHeight() throws DecodeException {
		return dimension().height;
	}

	private Dimension dimension() throws DecodeException {
		if (dimension == null) {
			dimension = ImageLoader.readDimension(path);
		}
		return dimension;
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof ImageRecord)) {
			return false;
		}
		return path.equals(((ImageRecord) other).path);
	}

	@Override
	public int hashCode() {
		return path.hashCode();
	}

	@Override
	public String toString() {
		return getName() + (captureTime == null ? "" : " @ " + captureTime);
	}
}
