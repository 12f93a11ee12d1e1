package stereo.metadata;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

import stereo.jpeg.InvalidStreamException;

/**
 * Key-value access to image metadata. Keys are namespaced the way exiftool
 * names them, e.g. {@code EXIF:DateTimeOriginal}.
 */
public interface MetadataStore {
	String DATE_TIME = "EXIF:DateTime";
	String DATE_TIME_ORIGINAL = "EXIF:DateTimeOriginal";
	String DATE_TIME_DIGITIZED = "EXIF:DateTimeDigitized";
	String YCBCR_POSITIONING = "EXIF:YCbCrPositioning";
	String MAKE = "EXIF:Make";
	String MODEL = "EXIF:Model";

	/**
	 * @return the known keys present in the image; empty when it carries no metadata
	 */
	Map<String, String> read(byte[] image) throws InvalidStreamException;

	Map<String, String> read(Path image) throws IOException, InvalidStreamException;

	/**
	 * @return copy of the JPEG stream with the given keys set
	 */
	byte[] write(byte[] jpeg, Map<String, String> values) throws InvalidStreamException;
}
