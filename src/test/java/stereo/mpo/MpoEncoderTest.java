package stereo.mpo;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import stereo.TestImages;
import stereo.image.ImageLoader;
import stereo.jpeg.InvalidStreamException;
import stereo.jpeg.JpegSegments;
import stereo.metadata.ExifMetadataStore;
import stereo.metadata.MetadataStore;

public class MpoEncoderTest {
	private static final Clock CLOCK = Clock.fixed(Instant.parse("2023-03-04T05:06:07Z"), ZoneOffset.UTC);

	private static byte[] left;
	private static byte[] right;

	private final ExifMetadataStore metadata = new ExifMetadataStore();
	private final MpoEncoder encoder = new MpoEncoder(metadata, CLOCK);

	@BeforeAll
	public static void encodeViews() throws Exception {
		left = TestImages.jpeg(TestImages.blocks(96, 64, 8, 11));
		right = TestImages.jpeg(TestImages.blocks(96, 64, 8, 12));
	}

	@Test
	public void stereoEntriesDescribeConcatenation() {
		List<MpfEntry> entries = MpoEncoder.stereoEntries(1000, 2000);

		assertEquals(new MpfEntry(0x00000000L, 1000, 0, 0), entries.get(0));
		assertEquals(new MpfEntry(0x00020000L, 2000, 1000, 0), entries.get(1));
	}

	@Test
	public void entriesMatchFinalStreams() throws Exception {
		MpoContainer container = encoder.encode(left, right);
		List<MpfEntry> entries = container.getEntries();

		assertEquals(2, entries.size());
		assertEquals(0, entries.get(0).getOffset());
		assertEquals(container.getStream1().length, entries.get(0).getSize());
		assertEquals(container.getStream1().length, entries.get(1).getOffset());
		assertEquals(container.getStream2().length, entries.get(1).getSize());
		assertEquals(container.getStream1().length + container.getStream2().length, container.toBytes().length);
		assertEquals("Baseline Stereo Image", container.getMpType());
	}

	@Test
	public void decoderReadsBackWhatWasWritten() throws Exception {
		MpoContainer container = encoder.encode(left, right);

		MpoContainer decoded = new MpoDecoder().decode(container.toBytes());

		assertEquals(container.getEntries(), decoded.getEntries());
		assertArrayEquals(container.getStream1(), decoded.getStream1());
		assertArrayEquals(container.getStream2(), decoded.getStream2());
	}

	@Test
	public void indexSegmentIsVersionedAndCountsTwoImages() throws Exception {
		byte[] stream1 = encoder.encode(left, right).getStream1();
		JpegSegments.Segment mpf = JpegSegments.find(JpegSegments.headerSegments(stream1, "stream1"),
				JpegSegments.APP2, stream1, MpfSegment.SIGNATURE);

		MpfSegment.Index index = MpfSegment.parse(stream1, mpf.getPayloadOffset(), mpf.getPayloadLength());

		assertEquals("0100", index.getVersion());
		assertEquals(2, index.getNumberOfImages());
		assertEquals(MpfSegment.STEREO_INDEX_PAYLOAD_LENGTH, mpf.getPayloadLength());
	}

	@Test
	public void bothViewsStayDecodable() throws Exception {
		MpoContainer container = encoder.encode(left, right);

		assertEquals(96, ImageLoader.decode(container.getStream1(), "stream1").getWidth());
		assertEquals(96, ImageLoader.decode(container.getStream2(), "stream2").getWidth());
	}

	@Test
	public void timestampsComeFromClockWithoutCaptureTime() throws Exception {
		MpoContainer container = encoder.encode(left, right);

		for (byte[] stream : new byte[][] { container.getStream1(), container.getStream2() }) {
			Map<String, String> values = metadata.read(stream);
			assertEquals("2023:03:04 05:06:07", values.get(MetadataStore.DATE_TIME));
			assertEquals("2023:03:04 05:06:07", values.get(MetadataStore.DATE_TIME_ORIGINAL));
			assertEquals("2023:03:04 05:06:07", values.get(MetadataStore.DATE_TIME_DIGITIZED));
			assertEquals("2", values.get(MetadataStore.YCBCR_POSITIONING));
		}
	}

	@Test
	public void leftCaptureTimeWinsOverClock() throws Exception {
		byte[] shot = metadata.write(left,
				Collections.singletonMap(MetadataStore.DATE_TIME_ORIGINAL, "2019:08:09 10:11:12"));
		byte[] other = metadata.write(right,
				Collections.singletonMap(MetadataStore.DATE_TIME_ORIGINAL, "2019:08:09 10:11:14"));

		MpoContainer container = encoder.encode(shot, other);

		LocalDateTime expected = LocalDateTime.of(2019, 8, 9, 10, 11, 12);
		assertEquals(expected, ExifMetadataStore.captureTime(metadata.read(container.getStream1())));
		assertEquals(expected, ExifMetadataStore.captureTime(metadata.read(container.getStream2())));
	}

	@Test
	public void reencodingReplacesOldIndex() throws Exception {
		MpoContainer first = encoder.encode(left, right);
		MpoContainer second = encoder.encode(first.getStream1(), first.getStream2());

		long mpfSegments = JpegSegments.headerSegments(second.getStream1(), "stream1").stream()
				.filter(s -> s.getMarker() == JpegSegments.APP2
						&& s.payloadStartsWith(second.getStream1(), MpfSegment.SIGNATURE))
				.count();
		assertEquals(1, mpfSegments);
		assertEquals(first.getStream1().length, second.getStream1().length);
	}

	@Test
	public void nonJpegInputIsRejected() {
		byte[] png = { (byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A };

		assertThrows(InvalidStreamException.class, () -> encoder.encode(png, right));
		assertThrows(InvalidStreamException.class, () -> encoder.encode(left, new byte[0]));
	}

	@Test
	public void fileIsMovedIntoPlace(@TempDir Path dir) throws Exception {
		Path leftFile = Files.write(dir.resolve("l.jpg"), left);
		Path rightFile = Files.write(dir.resolve("r.jpg"), right);
		Path destination = dir.resolve("pair.mpo");

		MpoContainer container = encoder.encode(leftFile, rightFile, destination);

		assertArrayEquals(container.toBytes(), Files.readAllBytes(destination));
		try (Stream<Path> files = Files.list(dir)) {
			assertEquals(3, files.count());
		}
	}

	@Test
	public void unwritableDestinationFails(@TempDir Path dir) throws Exception {
		Path leftFile = Files.write(dir.resolve("l.jpg"), left);
		Path rightFile = Files.write(dir.resolve("r.jpg"), right);

		assertThrows(IOException.class,
				() -> encoder.encode(leftFile, rightFile, dir.resolve("missing").resolve("pair.mpo")));
		assertTrue(Files.notExists(dir.resolve("missing")));
	}
}
