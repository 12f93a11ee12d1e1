package stereo.mpo;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import stereo.jpeg.InvalidStreamException;

/**
 * APP2 "MPF\0" payloads: a TIFF structure holding the MP Index IFD (first
 * image only) and the MP Attribute IFD. Payloads are written big-endian and
 * read in either byte order.
 */
public final class MpfSegment {
	public static final byte[] SIGNATURE = { 'M', 'P', 'F', 0 };
	public static final byte[] VERSION = { '0', '1', '0', '0' };

	static final int MPF_VERSION = 0xB000;
	static final int NUMBER_OF_IMAGES = 0xB001;
	static final int MP_ENTRY = 0xB002;
	static final int MP_INDIVIDUAL_NUM = 0xB101;
	static final int BASE_VIEWPOINT_NUM = 0xB204;

	private static final int TYPE_LONG = 4;
	private static final int TYPE_UNDEFINED = 7;

	public static final int ENTRY_LENGTH = 16;
	private static final int HEADER_LENGTH = 8;
	private static final int IFD_ENTRY_LENGTH = 12;

	// count, three entries, next-IFD offset
	private static final int THREE_ENTRY_IFD_LENGTH = 2 + 3 * IFD_ENTRY_LENGTH + 4;

	/**
	 * Length of the index payload for two images; it does not depend on the
	 * entry values, so the final stream lengths can be known before it is built.
	 */
	public static final int STEREO_INDEX_PAYLOAD_LENGTH = SIGNATURE.length + HEADER_LENGTH + THREE_ENTRY_IFD_LENGTH
			+ 2 * ENTRY_LENGTH + THREE_ENTRY_IFD_LENGTH;

	private MpfSegment() {
	}

	/**
	 * Parsed MP Index IFD.
	 */
	public static final class Index {
		private final String version;
		private final long numberOfImages;
		private final List<MpfEntry> entries;
		private final int endianOffset;

		Index(String version, long numberOfImages, List<MpfEntry> entries, int endianOffset) {
			this.version = version;
			this.numberOfImages = numberOfImages;
			this.entries = Collections.unmodifiableList(entries);
			this.endianOffset = endianOffset;
		}

		public String getVersion() {
			return version;
		}

		public long getNumberOfImages() {
			return numberOfImages;
		}

		public List<MpfEntry> getEntries() {
			return entries;
		}

		/**
		 * absolute position of the MP endian field in the parsed data
		 */
		public int getEndianOffset() {
			return endianOffset;
		}
	}

	/**
	 * MP Index IFD followed by the Attribute IFD of the first image.
	 */
	public static byte[] indexPayload(List<MpfEntry> entries) {
		int entriesOffset = HEADER_LENGTH + THREE_ENTRY_IFD_LENGTH;
		int attributeOffset = entriesOffset + ENTRY_LENGTH * entries.size();
		ByteBuffer payload = ByteBuffer.allocate(SIGNATURE.length + attributeOffset + THREE_ENTRY_IFD_LENGTH);
		payload.put(SIGNATURE);
		ByteBuffer tiff = payload.slice().order(ByteOrder.BIG_ENDIAN);
		writeHeader(tiff);

		int position = HEADER_LENGTH;
		tiff.putShort(position, (short) 3);
		position += 2;
		position = writeEntry(tiff, position, MPF_VERSION, TYPE_UNDEFINED, VERSION.length, version());
		position = writeEntry(tiff, position, NUMBER_OF_IMAGES, TYPE_LONG, 1, entries.size());
		position = writeEntry(tiff, position, MP_ENTRY, TYPE_UNDEFINED, ENTRY_LENGTH * entries.size(), entriesOffset);
		tiff.putInt(position, attributeOffset);

		position = entriesOffset;
		for (MpfEntry entry : entries) {
			tiff.putInt(position, (int) entry.getAttribute());
			tiff.putInt(position + 4, (int) entry.getSize());
			tiff.putInt(position + 8, (int) entry.getOffset());
			tiff.putInt(position + 12, (int) entry.getDependency());
			position += ENTRY_LENGTH;
		}
		writeAttributes(tiff, attributeOffset, 1);
		return payload.array();
	}

	/**
	 * Attribute IFD alone, as carried by every image after the first.
	 */
	public static byte[] attributePayload(int individualNum) {
		ByteBuffer payload = ByteBuffer.allocate(SIGNATURE.length + HEADER_LENGTH + THREE_ENTRY_IFD_LENGTH);
		payload.put(SIGNATURE);
		ByteBuffer tiff = payload.slice().order(ByteOrder.BIG_ENDIAN);
		writeHeader(tiff);
		writeAttributes(tiff, HEADER_LENGTH, individualNum);
		return payload.array();
	}

	private static void writeHeader(ByteBuffer tiff) {
		tiff.put(0, (byte) 'M');
		tiff.put(1, (byte) 'M');
		tiff.putShort(2, (short) 42);
		tiff.putInt(4, HEADER_LENGTH);
	}

	private static void writeAttributes(ByteBuffer tiff, int start, int individualNum) {
		int position = start;
		tiff.putShort(position, (short) 3);
		position += 2;
		position = writeEntry(tiff, position, MPF_VERSION, TYPE_UNDEFINED, VERSION.length, version());
		position = writeEntry(tiff, position, MP_INDIVIDUAL_NUM, TYPE_LONG, 1, individualNum);
		position = writeEntry(tiff, position, BASE_VIEWPOINT_NUM, TYPE_LONG, 1, 1);
		tiff.putInt(position, 0);
	}

	private static int writeEntry(ByteBuffer tiff, int position, int tag, int type, int count, int value) {
		tiff.putShort(position, (short) tag);
		tiff.putShort(position + 2, (short) type);
		tiff.putInt(position + 4, count);
		tiff.putInt(position + 8, value);
		return position + IFD_ENTRY_LENGTH;
	}

	private static int version() {
		return ByteBuffer.wrap(VERSION).order(ByteOrder.BIG_ENDIAN).getInt();
	}

	/**
	 * @param offset start of the payload, at the "MPF\0" signature
	 */
	public static Index parse(byte[] data, int offset, int length) throws InvalidStreamException {
		if (length < SIGNATURE.length + HEADER_LENGTH) {
			throw new InvalidStreamException("MPF payload too short: " + length + " bytes");
		}
		int endian = offset + SIGNATURE.length;
		ByteOrder order;
		if (data[endian] == 'I' && data[endian + 1] == 'I') {
			order = ByteOrder.LITTLE_ENDIAN;
		} else if (data[endian] == 'M' && data[endian + 1] == 'M') {
			order = ByteOrder.BIG_ENDIAN;
		} else {
			throw new InvalidStreamException("MPF payload has no byte order mark");
		}
		ByteBuffer tiff = ByteBuffer.wrap(data, endian, length - SIGNATURE.length).slice().order(order);
		if (tiff.getShort(2) != 42) {
			throw new InvalidStreamException("MPF payload has a bad magic number");
		}
		long ifd = unsigned(tiff.getInt(4));
		if (ifd < HEADER_LENGTH || ifd + 2 > tiff.limit()) {
			throw new InvalidStreamException("MP Index IFD offset " + ifd + " is outside the segment");
		}
		int start = (int) ifd;
		int count = tiff.getShort(start) & 0xFFFF;
		if (start + 2 + (long) IFD_ENTRY_LENGTH * count > tiff.limit()) {
			throw new InvalidStreamException("MP Index IFD runs past the end of the segment");
		}

		String version = null;
		long numberOfImages = -1;
		long entriesCount = -1;
		long entriesOffset = -1;
		for (int i = 0; i < count; i++) {
			int position = start + 2 + IFD_ENTRY_LENGTH * i;
			int tag = tiff.getShort(position) & 0xFFFF;
			long components = unsigned(tiff.getInt(position + 4));
			if (tag == MPF_VERSION) {
				byte[] chars = new byte[4];
				for (int b = 0; b < 4; b++) {
					chars[b] = tiff.get(position + 8 + b);
				}
				version = new String(chars, StandardCharsets.US_ASCII);
			} else if (tag == NUMBER_OF_IMAGES) {
				numberOfImages = unsigned(tiff.getInt(position + 8));
			} else if (tag == MP_ENTRY) {
				entriesCount = components;
				entriesOffset = unsigned(tiff.getInt(position + 8));
			}
		}
		if (numberOfImages < 0 || entriesOffset < 0) {
			throw new InvalidStreamException("MPF segment carries no MP Index IFD");
		}
		if (entriesCount != numberOfImages * ENTRY_LENGTH) {
			throw new InvalidStreamException(
					"MP Entry holds " + entriesCount + " bytes for " + numberOfImages + " images");
		}
		if (entriesOffset + entriesCount > tiff.limit()) {
			throw new InvalidStreamException("MP Entry runs past the end of the segment");
		}
		List<MpfEntry> entries = new ArrayList<>();
		for (int i = 0; i < numberOfImages; i++) {
			int position = (int) entriesOffset + ENTRY_LENGTH * i;
			entries.add(new MpfEntry(unsigned(tiff.getInt(position)), unsigned(tiff.getInt(position + 4)),
					unsigned(tiff.getInt(position + 8)), unsigned(tiff.getInt(position + 12))));
		}
		return new Index(version, numberOfImages, entries, endian);
	}

	private static long unsigned(int value) {
		return value & 0xFFFFFFFFL;
	}
}
