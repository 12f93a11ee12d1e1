package stereo.metadata;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.ByteOrder;

import org.junit.jupiter.api.Test;

import stereo.jpeg.InvalidStreamException;
import stereo.metadata.ExifBlock.Directory;

public class ExifBlockTest {
	private static final int IMAGE_DESCRIPTION = 0x010E;
	private static final int GPS_VERSION = 0x0000;
	private static final int INTEROP_INDEX = 0x0001;

	private static ExifBlock reparse(ExifBlock block) throws InvalidStreamException {
		byte[] payload = block.toPayload();
		return ExifBlock.parse(payload, 0, payload.length);
	}

	@Test
	public void littleEndianBlockKeepsItsOrder() throws Exception {
		ExifBlock block = new ExifBlock(ByteOrder.LITTLE_ENDIAN);
		block.setString(Directory.IFD0, 0x0132, "2018:07:08 09:10:11");
		block.setShort(Directory.IFD0, 0x0213, 2);

		ExifBlock parsed = reparse(block);

		assertEquals(ByteOrder.LITTLE_ENDIAN, parsed.getOrder());
		assertEquals("2018:07:08 09:10:11", parsed.getString(Directory.IFD0, 0x0132));
		assertEquals(Long.valueOf(2), parsed.getNumber(Directory.IFD0, 0x0213));
	}

	@Test
	public void subDirectoriesSurviveRewrite() throws Exception {
		ExifBlock block = new ExifBlock(ByteOrder.BIG_ENDIAN);
		block.setString(Directory.IFD0, IMAGE_DESCRIPTION, "a fairly long description of the shot");
		block.setString(Directory.EXIF, 0x9003, "2018:07:08 09:10:11");
		block.setShort(Directory.GPS, GPS_VERSION, 2);
		block.setString(Directory.INTEROP, INTEROP_INDEX, "R98");

		ExifBlock parsed = reparse(block);

		assertEquals("a fairly long description of the shot", parsed.getString(Directory.IFD0, IMAGE_DESCRIPTION));
		assertEquals("2018:07:08 09:10:11", parsed.getString(Directory.EXIF, 0x9003));
		assertEquals(Long.valueOf(2), parsed.getNumber(Directory.GPS, GPS_VERSION));
		assertEquals("R98", parsed.getString(Directory.INTEROP, INTEROP_INDEX));
	}

	@Test
	public void pointerTagsAreNotExposedAsValues() throws Exception {
		ExifBlock block = new ExifBlock(ByteOrder.BIG_ENDIAN);
		block.setString(Directory.EXIF, 0x9004, "2018:07:08 09:10:11");

		ExifBlock parsed = reparse(block);

		assertFalse(parsed.contains(Directory.IFD0, ExifBlock.EXIF_POINTER));
		assertTrue(parsed.isEmpty(Directory.GPS));
	}

	@Test
	public void missingValuesAreNull() throws Exception {
		ExifBlock parsed = reparse(new ExifBlock(ByteOrder.BIG_ENDIAN));

		assertNull(parsed.getString(Directory.IFD0, 0x0132));
		assertNull(parsed.getNumber(Directory.IFD0, 0x0213));
	}

	@Test
	public void payloadWithoutByteOrderMarkIsInvalid() {
		byte[] payload = { 'E', 'x', 'i', 'f', 0, 0, 'X', 'X', 0, 42, 0, 0, 0, 8 };
		assertThrows(InvalidStreamException.class, () -> ExifBlock.parse(payload, 0, payload.length));
	}

	@Test
	public void directoryLoopIsCutOff() throws Exception {
		// IFD0 at offset 8 with one Exif pointer back to itself
		byte[] payload = new byte[6 + 8 + 2 + 12 + 4];
		System.arraycopy(ExifBlock.SIGNATURE, 0, payload, 0, 6);
		byte[] tiff = { 'M', 'M', 0, 42, 0, 0, 0, 8, 0, 1, (byte) 0x87, 0x69, 0, 4, 0, 0, 0, 1, 0, 0, 0, 8, 0, 0, 0, 0 };
		System.arraycopy(tiff, 0, payload, 6, tiff.length);

		ExifBlock parsed = ExifBlock.parse(payload, 0, payload.length);

		assertTrue(parsed.isEmpty(Directory.EXIF));
	}
}
