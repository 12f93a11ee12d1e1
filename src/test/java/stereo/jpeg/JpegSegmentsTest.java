package stereo.jpeg;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import stereo.TestImages;
import stereo.jpeg.JpegSegments.Segment;

public class JpegSegmentsTest {
	private static byte[] jpeg;

	@BeforeAll
	public static void encode() throws Exception {
		jpeg = TestImages.jpeg(TestImages.blocks(64, 48, 8, 3));
	}

	@Test
	public void walksHeaderUpToImageData() throws Exception {
		List<Segment> segments = JpegSegments.headerSegments(jpeg, "test");

		assertEquals(JpegSegments.APP0, segments.get(0).getMarker());
		assertEquals(2, segments.get(0).getOffset());
		assertEquals(JpegSegments.SOS, segments.get(segments.size() - 1).getMarker());
		for (int i = 1; i < segments.size(); i++) {
			assertEquals(segments.get(i - 1).getEnd(), segments.get(i).getOffset());
		}
	}

	@Test
	public void rejectsStreamWithoutStartOfImage() {
		byte[] png = { (byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A };
		assertFalse(JpegSegments.hasSoi(png, 0));
		assertThrows(InvalidStreamException.class, () -> JpegSegments.headerSegments(png, "png"));
	}

	@Test
	public void truncatedHeaderIsAnErrorOnlyForCompleteStreams() throws Exception {
		byte[] head = Arrays.copyOf(jpeg, 30);

		assertThrows(InvalidStreamException.class, () -> JpegSegments.headerSegments(head, "head"));
		List<Segment> segments = JpegSegments.headerSegments(head, 0, false, "head");
		assertEquals(1, segments.size());
		assertEquals(JpegSegments.APP0, segments.get(0).getMarker());
	}

	@Test
	public void insertedSegmentCanBeFoundAndRemoved() throws Exception {
		byte[] signature = { 'T', 'E', 'S', 'T', 0 };
		byte[] payload = Arrays.copyOf(signature, 20);
		int position = JpegSegments.afterLeadingApplicationSegments(JpegSegments.headerSegments(jpeg, "test"), 0);

		byte[] edited = JpegSegments.insert(jpeg, position, JpegSegments.segmentBytes(JpegSegments.APP2, payload));
		List<Segment> segments = JpegSegments.headerSegments(edited, "edited");
		Segment inserted = JpegSegments.find(segments, JpegSegments.APP2, edited, signature);

		assertEquals(position, inserted.getOffset());
		assertEquals(payload.length + 4, inserted.getLength());
		assertTrue(inserted.payloadStartsWith(edited, signature));
		assertArrayEquals(jpeg, JpegSegments.remove(edited, Arrays.asList(inserted)));
	}

	@Test
	public void oversizedPayloadDoesNotFitASegment() {
		assertThrows(InvalidStreamException.class,
				() -> JpegSegments.segmentBytes(JpegSegments.APP1, new byte[0xFFFE]));
	}

	@Test
	public void segmentLengthFieldIsBigEndian() throws Exception {
		byte[] segment = JpegSegments.segmentBytes(JpegSegments.APP2, new byte[300]);

		assertEquals(0xFF, segment[0] & 0xFF);
		assertEquals(JpegSegments.APP2, segment[1] & 0xFF);
		assertEquals(302, JpegSegments.readUnsignedShort(segment, 2));
	}
}
