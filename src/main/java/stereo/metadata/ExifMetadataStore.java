package stereo.metadata;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;

import stereo.jpeg.InvalidStreamException;
import stereo.jpeg.JpegSegments;
import stereo.jpeg.JpegSegments.Segment;

/**
 * {@link MetadataStore} backed by the APP1 Exif segment of JPEG streams.
 * Reading goes through metadata-extractor, writing rebuilds the segment with
 * {@link ExifBlock}.
 */
public class ExifMetadataStore implements MetadataStore {
	private static Logger logger = LogManager.getLogger();

	public static final DateTimeFormatter EXIF_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss");

	private static final class Tag {
		final ExifBlock.Directory directory;
		final Class<? extends Directory> readFrom;
		final int number;
		final int type;

		Tag(ExifBlock.Directory directory, Class<? extends Directory> readFrom, int number, int type) {
			this.directory = directory;
			this.readFrom = readFrom;
			this.number = number;
			this.type = type;
		}
	}

	private static final Map<String, Tag> TAGS;
	static {
		Map<String, Tag> tags = new LinkedHashMap<>();
		tags.put(MAKE, new Tag(ExifBlock.Directory.IFD0, ExifIFD0Directory.class, ExifIFD0Directory.TAG_MAKE,
				ExifBlock.TYPE_ASCII));
		tags.put(MODEL, new Tag(ExifBlock.Directory.IFD0, ExifIFD0Directory.class, ExifIFD0Directory.TAG_MODEL,
				ExifBlock.TYPE_ASCII));
		tags.put(DATE_TIME, new Tag(ExifBlock.Directory.IFD0, ExifIFD0Directory.class, ExifIFD0Directory.TAG_DATETIME,
				ExifBlock.TYPE_ASCII));
		tags.put(YCBCR_POSITIONING, new Tag(ExifBlock.Directory.IFD0, ExifIFD0Directory.class,
				ExifIFD0Directory.TAG_YCBCR_POSITIONING, ExifBlock.TYPE_SHORT));
		tags.put(DATE_TIME_ORIGINAL, new Tag(ExifBlock.Directory.EXIF, ExifSubIFDDirectory.class,
				ExifSubIFDDirectory.TAG_DATETIME_ORIGINAL, ExifBlock.TYPE_ASCII));
		tags.put(DATE_TIME_DIGITIZED, new Tag(ExifBlock.Directory.EXIF, ExifSubIFDDirectory.class,
				ExifSubIFDDirectory.TAG_DATETIME_DIGITIZED, ExifBlock.TYPE_ASCII));
		TAGS = Collections.unmodifiableMap(tags);
	}

	@Override
	public Map<String, String> read(byte[] image) throws InvalidStreamException {
		try {
			return read(new ByteArrayInputStream(image), "image");
		} catch (IOException e) {
			throw new InvalidStreamException("image: " + e.getMessage(), e);
		}
	}

	@Override
	public Map<String, String> read(Path image) throws IOException, InvalidStreamException {
		try (InputStream input = Files.newInputStream(image)) {
			return read(input, image.toString());
		}
	}

	private static Map<String, String> read(InputStream input, String label) throws IOException, InvalidStreamException {
		Metadata metadata;
		try {
			metadata = ImageMetadataReader.readMetadata(input);
		} catch (ImageProcessingException e) {
			throw new InvalidStreamException(label + ": " + e.getMessage(), e);
		}
		Map<String, String> values = new LinkedHashMap<>();
		for (Map.Entry<String, Tag> entry : TAGS.entrySet()) {
			Tag tag = entry.getValue();
			Directory directory = metadata.getFirstDirectoryOfType(tag.readFrom);
			if (directory == null || !directory.containsTag(tag.number)) {
				continue;
			}
			String value = directory.getString(tag.number);
			if (value != null) {
				values.put(entry.getKey(), value.trim());
			}
		}
		return values;
	}

	@Override
	public byte[] write(byte[] jpeg, Map<String, String> values) throws InvalidStreamException {
		List<Segment> segments = JpegSegments.headerSegments(jpeg, "image");
		Segment exif = JpegSegments.find(segments, JpegSegments.APP1, jpeg, ExifBlock.SIGNATURE);
		ExifBlock block = exif == null ? new ExifBlock(ByteOrder.BIG_ENDIAN)
				: ExifBlock.parse(jpeg, exif.getPayloadOffset(), exif.getPayloadLength());
		for (Map.Entry<String, String> value : values.entrySet()) {
			Tag tag = TAGS.get(value.getKey());
			if (tag == null) {
				throw new IllegalArgumentException("unsupported metadata key: " + value.getKey());
			}
			if (tag.type == ExifBlock.TYPE_ASCII) {
				block.setString(tag.directory, tag.number, value.getValue());
			} else {
				try {
					block.setShort(tag.directory, tag.number, Integer.parseInt(value.getValue().trim()));
				} catch (NumberFormatException e) {
					throw new IllegalArgumentException(value.getKey() + " needs a number: " + value.getValue(), e);
				}
			}
		}
		byte[] segment = JpegSegments.segmentBytes(JpegSegments.APP1, block.toPayload());
		if (exif != null) {
			return JpegSegments.insert(JpegSegments.remove(jpeg, Arrays.asList(exif)), exif.getOffset(), segment);
		}
		// a JFIF APP0 segment has to stay first
		int position = 2;
		if (!segments.isEmpty() && segments.get(0).getMarker() == JpegSegments.APP0) {
			position = segments.get(0).getEnd();
		}
		logger.debug("adding an Exif segment at offset {}", position);
		return JpegSegments.insert(jpeg, position, segment);
	}

	/**
	 * capture time of the shot: digitized time, else original time, else null
	 */
	public static LocalDateTime captureTime(Map<String, String> values) {
		LocalDateTime time = parseTimestamp(values.get(DATE_TIME_DIGITIZED));
		if (time == null) {
			time = parseTimestamp(values.get(DATE_TIME_ORIGINAL));
		}
		return time;
	}

	public static LocalDateTime parseTimestamp(String value) {
		if (value == null || value.isBlank()) {
			return null;
		}
		try {
			return LocalDateTime.parse(value.trim(), EXIF_TIMESTAMP);
		} catch (DateTimeParseException e) {
			logger.warn("invalid Exif timestamp '{}'", value);
			return null;
		}
	}

	public static String formatTimestamp(LocalDateTime time) {
		return EXIF_TIMESTAMP.format(time);
	}
}
