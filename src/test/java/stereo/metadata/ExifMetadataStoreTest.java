package stereo.metadata;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import stereo.TestImages;
import stereo.image.ImageLoader;
import stereo.jpeg.InvalidStreamException;
import stereo.jpeg.JpegSegments;
import stereo.jpeg.JpegSegments.Segment;

public class ExifMetadataStoreTest {
	private static byte[] jpeg;

	private final ExifMetadataStore store = new ExifMetadataStore();

	@BeforeAll
	public static void encode() throws Exception {
		jpeg = TestImages.jpeg(TestImages.blocks(64, 48, 8, 5));
	}

	private static long exifSegments(byte[] data) throws InvalidStreamException {
		return JpegSegments.headerSegments(data, "test").stream()
				.filter(s -> s.getMarker() == JpegSegments.APP1 && s.payloadStartsWith(data, ExifBlock.SIGNATURE))
				.count();
	}

	@Test
	public void plainJpegHasNoMetadata() throws Exception {
		assertTrue(store.read(jpeg).isEmpty());
	}

	@Test
	public void writtenValuesReadBack() throws Exception {
		Map<String, String> values = new HashMap<>();
		values.put(MetadataStore.DATE_TIME_ORIGINAL, "2021:06:01 12:30:00");
		values.put(MetadataStore.DATE_TIME_DIGITIZED, "2021:06:01 12:30:01");
		values.put(MetadataStore.YCBCR_POSITIONING, "2");
		values.put(MetadataStore.MAKE, "Fujifilm");

		byte[] written = store.write(jpeg, values);

		assertEquals(values, store.read(written));
		ImageLoader.decode(written, "written");
	}

	@Test
	public void newSegmentFollowsJfifHeader() throws Exception {
		byte[] written = store.write(jpeg, Collections.singletonMap(MetadataStore.MODEL, "W3"));

		List<Segment> segments = JpegSegments.headerSegments(written, "written");
		assertEquals(JpegSegments.APP0, segments.get(0).getMarker());
		assertEquals(JpegSegments.APP1, segments.get(1).getMarker());
		assertEquals(jpeg.length + segments.get(1).getLength(), written.length);
	}

	@Test
	public void rewriteReplacesSegmentAndKeepsOtherTags() throws Exception {
		byte[] first = store.write(jpeg, Collections.singletonMap(MetadataStore.MAKE, "Fujifilm"));
		byte[] second = store.write(first, Collections.singletonMap(MetadataStore.DATE_TIME, "2020:01:01 00:00:00"));

		assertEquals(1, exifSegments(second));
		Map<String, String> values = store.read(second);
		assertEquals("Fujifilm", values.get(MetadataStore.MAKE));
		assertEquals("2020:01:01 00:00:00", values.get(MetadataStore.DATE_TIME));
	}

	@Test
	public void unknownKeyIsRejected() {
		assertThrows(IllegalArgumentException.class,
				() -> store.write(jpeg, Collections.singletonMap("XMP:Rating", "5")));
	}

	@Test
	public void chromaPositioningMustBeNumeric() {
		assertThrows(IllegalArgumentException.class,
				() -> store.write(jpeg, Collections.singletonMap(MetadataStore.YCBCR_POSITIONING, "co-sited")));
	}

	@Test
	public void readsOnlyTheHeadOfAFile(@TempDir Path dir) throws Exception {
		byte[] written = store.write(jpeg, Collections.singletonMap(MetadataStore.DATE_TIME_ORIGINAL, "2019:02:03 04:05:06"));
		Path file = Files.write(dir.resolve("shot.jpg"), written);

		assertEquals("2019:02:03 04:05:06", store.read(file).get(MetadataStore.DATE_TIME_ORIGINAL));
	}

	@Test
	public void unknownFormatIsInvalid() {
		assertThrows(InvalidStreamException.class, () -> store.read(new byte[] { 1, 2, 3, 4, 5, 6, 7, 8 }));
	}

	@Test
	public void writingNeedsJpeg() {
		assertThrows(InvalidStreamException.class,
				() -> store.write(new byte[] { 'G', 'I', 'F', '8', '9', 'a' }, new HashMap<>()));
	}

	@Test
	public void captureTimePrefersDigitized() {
		Map<String, String> values = new HashMap<>();
		values.put(MetadataStore.DATE_TIME_ORIGINAL, "2021:06:01 12:30:00");
		assertEquals(LocalDateTime.of(2021, 6, 1, 12, 30, 0), ExifMetadataStore.captureTime(values));

		values.put(MetadataStore.DATE_TIME_DIGITIZED, "2021:06:01 12:30:07");
		assertEquals(LocalDateTime.of(2021, 6, 1, 12, 30, 7), ExifMetadataStore.captureTime(values));
	}

	@Test
	public void malformedTimestampIsIgnored() {
		assertNull(ExifMetadataStore.parseTimestamp("0000:00:00 00:00:00"));
		assertNull(ExifMetadataStore.parseTimestamp("   "));
		assertNull(ExifMetadataStore.captureTime(Collections.singletonMap(MetadataStore.DATE_TIME_ORIGINAL, "yesterday")));
	}

	@Test
	public void timestampFormatRoundTrips() {
		LocalDateTime time = LocalDateTime.of(2022, 12, 24, 18, 5, 9);
		assertEquals("2022:12:24 18:05:09", ExifMetadataStore.formatTimestamp(time));
		assertEquals(time, ExifMetadataStore.parseTimestamp("2022:12:24 18:05:09"));
	}
}
