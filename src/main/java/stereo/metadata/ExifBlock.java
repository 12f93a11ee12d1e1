package stereo.metadata;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import stereo.jpeg.InvalidStreamException;

/**
 * Entries of an APP1 Exif payload (IFD0 and its Exif, GPS and Interoperability
 * sub-directories). Values are kept as raw bytes in the block's byte order so
 * unknown tags survive a rewrite. The thumbnail directory is not kept.
 */
public class ExifBlock {
	public static final byte[] SIGNATURE = { 'E', 'x', 'i', 'f', 0, 0 };

	public enum Directory {
		IFD0, EXIF, GPS, INTEROP
	}

	public static final int TYPE_ASCII = 2;
	public static final int TYPE_SHORT = 3;
	public static final int TYPE_LONG = 4;

	static final int EXIF_POINTER = 0x8769;
	static final int GPS_POINTER = 0x8825;
	static final int INTEROP_POINTER = 0xA005;

	// bytes per component, indexed by TIFF field type
	private static final int[] TYPE_SIZES = { 0, 1, 1, 2, 4, 8, 1, 1, 2, 4, 8, 4, 8 };

	private static final int TIFF_HEADER_LENGTH = 8;
	private static final int ENTRY_LENGTH = 12;

	static final class Entry {
		final int type;
		final int count;
		final byte[] value;

		Entry(int type, int count, byte[] value) {
			this.type = type;
			this.count = count;
			this.value = value;
		}
	}

	private final ByteOrder order;
	private final Map<Directory, TreeMap<Integer, Entry>> directories = new EnumMap<>(Directory.class);

	public ExifBlock(ByteOrder order) {
		this.order = order;
		for (Directory directory : Directory.values()) {
			directories.put(directory, new TreeMap<>());
		}
	}

	public ByteOrder getOrder() {
		return order;
	}

	/**
	 * @param offset start of the payload, at the "Exif\0\0" signature
	 */
	public static ExifBlock parse(byte[] data, int offset, int length) throws InvalidStreamException {
		int tiff = offset + SIGNATURE.length;
		if (length < SIGNATURE.length + TIFF_HEADER_LENGTH) {
			throw new InvalidStreamException("Exif payload too short: " + length + " bytes");
		}
		ByteOrder order;
		if (data[tiff] == 'I' && data[tiff + 1] == 'I') {
			order = ByteOrder.LITTLE_ENDIAN;
		} else if (data[tiff] == 'M' && data[tiff + 1] == 'M') {
			order = ByteOrder.BIG_ENDIAN;
		} else {
			throw new InvalidStreamException("Exif payload has no TIFF byte order mark");
		}
		ByteBuffer buffer = ByteBuffer.wrap(data, tiff, length - SIGNATURE.length).slice().order(order);
		if (buffer.getShort(2) != 42) {
			throw new InvalidStreamException("Exif payload has a bad TIFF magic number");
		}
		ExifBlock block = new ExifBlock(order);
		block.readDirectory(buffer, unsigned(buffer.getInt(4)), Directory.IFD0, new HashSet<>());
		return block;
	}

	private void readDirectory(ByteBuffer buffer, long offset, Directory directory, Set<Long> visited)
			throws InvalidStreamException {
		if (offset < TIFF_HEADER_LENGTH || offset + 2 > buffer.limit() || !visited.add(offset)) {
			return;
		}
		int start = (int) offset;
		int count = buffer.getShort(start) & 0xFFFF;
		if (start + 2 + (long) ENTRY_LENGTH * count > buffer.limit()) {
			throw new InvalidStreamException("Exif " + directory + " directory runs past the end of the segment");
		}
		Map<Directory, Long> children = new EnumMap<>(Directory.class);
		TreeMap<Integer, Entry> entries = directories.get(directory);
		for (int i = 0; i < count; i++) {
			int position = start + 2 + ENTRY_LENGTH * i;
			int tag = buffer.getShort(position) & 0xFFFF;
			int type = buffer.getShort(position + 2) & 0xFFFF;
			long components = unsigned(buffer.getInt(position + 4));
			Directory child = childDirectory(directory, tag);
			if (child != null) {
				children.put(child, unsigned(buffer.getInt(position + 8)));
				continue;
			}
			if (type < 1 || type >= TYPE_SIZES.length) {
				continue;
			}
			long size = TYPE_SIZES[type] * components;
			if (size > buffer.limit()) {
				continue;
			}
			int valueOffset = size <= 4 ? position + 8 : (int) Math.min(unsigned(buffer.getInt(position + 8)), Integer.MAX_VALUE);
			if (valueOffset + size > buffer.limit()) {
				continue;
			}
			byte[] value = new byte[(int) size];
			for (int b = 0; b < value.length; b++) {
				value[b] = buffer.get(valueOffset + b);
			}
			entries.put(tag, new Entry(type, (int) components, value));
		}
		for (Map.Entry<Directory, Long> child : children.entrySet()) {
			readDirectory(buffer, child.getValue(), child.getKey(), visited);
		}
	}

	private static Directory childDirectory(Directory parent, int tag) {
		if (parent == Directory.IFD0 && tag == EXIF_POINTER) {
			return Directory.EXIF;
		}
		if (parent == Directory.IFD0 && tag == GPS_POINTER) {
			return Directory.GPS;
		}
		if (parent == Directory.EXIF && tag == INTEROP_POINTER) {
			return Directory.INTEROP;
		}
		return null;
	}

	public boolean contains(Directory directory, int tag) {
		return directories.get(directory).containsKey(tag);
	}

	public boolean isEmpty(Directory directory) {
		return directories.get(directory).isEmpty();
	}

	/**
	 * @return the ASCII value without its terminating NUL, or null
	 */
	public String getString(Directory directory, int tag) {
		Entry entry = directories.get(directory).get(tag);
		if (entry == null || entry.type != TYPE_ASCII) {
			return null;
		}
		int end = entry.value.length;
		while (end > 0 && entry.value[end - 1] == 0) {
			end--;
		}
		return new String(entry.value, 0, end, StandardCharsets.US_ASCII);
	}

	/**
	 * @return first component of a SHORT or LONG value, or null
	 */
	public Long getNumber(Directory directory, int tag) {
		Entry entry = directories.get(directory).get(tag);
		if (entry == null || entry.value.length == 0) {
			return null;
		}
		ByteBuffer value = ByteBuffer.wrap(entry.value).order(order);
		if (entry.type == TYPE_SHORT && entry.value.length >= 2) {
			return (long) (value.getShort(0) & 0xFFFF);
		}
		if (entry.type == TYPE_LONG && entry.value.length >= 4) {
			return unsigned(value.getInt(0));
		}
		return null;
	}

	public void setString(Directory directory, int tag, String text) {
		byte[] characters = text.getBytes(StandardCharsets.US_ASCII);
		byte[] value = new byte[characters.length + 1];
		System.arraycopy(characters, 0, value, 0, characters.length);
		directories.get(directory).put(tag, new Entry(TYPE_ASCII, value.length, value));
	}

	public void setShort(Directory directory, int tag, int number) {
		byte[] value = ByteBuffer.allocate(2).order(order).putShort((short) number).array();
		directories.get(directory).put(tag, new Entry(TYPE_SHORT, 1, value));
	}

	/**
	 * @return APP1 payload starting with the Exif signature
	 */
	public byte[] toPayload() {
		boolean hasInterop = !isEmpty(Directory.INTEROP);
		boolean hasExif = !isEmpty(Directory.EXIF) || hasInterop;
		boolean hasGps = !isEmpty(Directory.GPS);

		Map<Directory, TreeMap<Integer, Entry>> layout = new EnumMap<>(Directory.class);
		for (Directory directory : Directory.values()) {
			if (directory == Directory.IFD0 || (directory == Directory.EXIF && hasExif)
					|| (directory == Directory.GPS && hasGps) || (directory == Directory.INTEROP && hasInterop)) {
				layout.put(directory, new TreeMap<>(directories.get(directory)));
			}
		}
		// pointer placeholders take part in the size computation
		if (hasExif) {
			layout.get(Directory.IFD0).put(EXIF_POINTER, pointer(0));
		}
		if (hasGps) {
			layout.get(Directory.IFD0).put(GPS_POINTER, pointer(0));
		}
		if (hasInterop) {
			layout.get(Directory.EXIF).put(INTEROP_POINTER, pointer(0));
		}

		Map<Directory, Integer> offsets = new EnumMap<>(Directory.class);
		int position = TIFF_HEADER_LENGTH;
		for (Map.Entry<Directory, TreeMap<Integer, Entry>> directory : layout.entrySet()) {
			offsets.put(directory.getKey(), position);
			position += directoryLength(directory.getValue());
		}
		if (hasExif) {
			layout.get(Directory.IFD0).put(EXIF_POINTER, pointer(offsets.get(Directory.EXIF)));
		}
		if (hasGps) {
			layout.get(Directory.IFD0).put(GPS_POINTER, pointer(offsets.get(Directory.GPS)));
		}
		if (hasInterop) {
			layout.get(Directory.EXIF).put(INTEROP_POINTER, pointer(offsets.get(Directory.INTEROP)));
		}

		byte[] payload = new byte[SIGNATURE.length + position];
		System.arraycopy(SIGNATURE, 0, payload, 0, SIGNATURE.length);
		ByteBuffer tiff = ByteBuffer.wrap(payload, SIGNATURE.length, position).slice().order(order);
		tiff.put(0, (byte) (order == ByteOrder.LITTLE_ENDIAN ? 'I' : 'M'));
		tiff.put(1, (byte) (order == ByteOrder.LITTLE_ENDIAN ? 'I' : 'M'));
		tiff.putShort(2, (short) 42);
		tiff.putInt(4, TIFF_HEADER_LENGTH);
		for (Map.Entry<Directory, TreeMap<Integer, Entry>> directory : layout.entrySet()) {
			writeDirectory(tiff, offsets.get(directory.getKey()), directory.getValue());
		}
		return payload;
	}

	private Entry pointer(int offset) {
		return new Entry(TYPE_LONG, 1, ByteBuffer.allocate(4).order(order).putInt(offset).array());
	}

	private static int directoryLength(TreeMap<Integer, Entry> entries) {
		int length = 2 + ENTRY_LENGTH * entries.size() + 4;
		for (Entry entry : entries.values()) {
			if (entry.value.length > 4) {
				length += even(entry.value.length);
			}
		}
		return length;
	}

	private static void writeDirectory(ByteBuffer tiff, int start, TreeMap<Integer, Entry> entries) {
		int data = start + 2 + ENTRY_LENGTH * entries.size() + 4;
		tiff.putShort(start, (short) entries.size());
		int position = start + 2;
		for (Map.Entry<Integer, Entry> tagged : entries.entrySet()) {
			Entry entry = tagged.getValue();
			tiff.putShort(position, (short) tagged.getKey().intValue());
			tiff.putShort(position + 2, (short) entry.type);
			tiff.putInt(position + 4, entry.count);
			if (entry.value.length <= 4) {
				for (int b = 0; b < entry.value.length; b++) {
					tiff.put(position + 8 + b, entry.value[b]);
				}
			} else {
				tiff.putInt(position + 8, data);
				for (int b = 0; b < entry.value.length; b++) {
					tiff.put(data + b, entry.value[b]);
				}
				data += even(entry.value.length);
			}
			position += ENTRY_LENGTH;
		}
		// no further image directory, the thumbnail is dropped
		tiff.putInt(position, 0);
	}

	private static int even(int length) {
		return (length + 1) & ~1;
	}

	private static long unsigned(int value) {
		return value & 0xFFFFFFFFL;
	}
}
