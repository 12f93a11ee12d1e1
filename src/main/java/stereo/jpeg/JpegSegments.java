package stereo.jpeg;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Walks and edits the marker segments in front of the image data of a JPEG
 * stream. Entropy coded data is never touched.
 */
public final class JpegSegments {
	public static final int SOI = 0xD8;
	public static final int EOI = 0xD9;
	public static final int SOS = 0xDA;
	public static final int APP0 = 0xE0;
	public static final int APP1 = 0xE1;
	public static final int APP2 = 0xE2;

	private static final int MAX_SEGMENT_LENGTH = 0xFFFF;

	private JpegSegments() {
	}

	/**
	 * A marker segment. The offset points at its 0xFF byte, the length covers
	 * marker, length field and payload.
	 */
	public static final class Segment {
		private final int marker;
		private final int offset;
		private final int length;

		Segment(int marker, int offset, int length) {
			this.marker = marker;
			this.offset = offset;
			this.length = length;
		}

		public int getMarker() {
			return marker;
		}

		public int getOffset() {
			return offset;
		}

		public int getLength() {
			return length;
		}

		public int getEnd() {
			return offset + length;
		}

		public int getPayloadOffset() {
			return offset + 4;
		}

		public int getPayloadLength() {
			return length - 4;
		}

		public boolean payloadStartsWith(byte[] data, byte[] signature) {
			if (getPayloadLength() < signature.length) {
				return false;
			}
			for (int i = 0; i < signature.length; i++) {
				if (data[getPayloadOffset() + i] != signature[i]) {
					return false;
				}
			}
			return true;
		}

		@Override
		public String toString() {
			return String.format("FF%02X@%d+%d", marker, offset, length);
		}
	}

	public static boolean hasSoi(byte[] data, int offset) {
		return data.length >= offset + 2 && (data[offset] & 0xFF) == 0xFF && (data[offset + 1] & 0xFF) == SOI;
	}

	/**
	 * Segments of a complete stream up to and including SOS.
	 *
	 * @throws InvalidStreamException when the stream does not start with SOI or
	 *         its segments do not lead to image data
	 */
	public static List<Segment> headerSegments(byte[] data, String label) throws InvalidStreamException {
		return headerSegments(data, 0, true, label);
	}

	/**
	 * @param complete false when data holds only the head of a file; the walk
	 *        then stops quietly where the data ends
	 */
	public static List<Segment> headerSegments(byte[] data, int start, boolean complete, String label)
			throws InvalidStreamException {
		if (!hasSoi(data, start)) {
			throw new InvalidStreamException(label + ": no JPEG start of image marker");
		}
		List<Segment> segments = new ArrayList<>();
		int pos = start + 2;
		while (true) {
			if (pos + 4 > data.length) {
				if (complete) {
					throw new InvalidStreamException(label + ": stream ends before image data");
				}
				return segments;
			}
			if ((data[pos] & 0xFF) != 0xFF) {
				throw new InvalidStreamException(label + ": expected marker at offset " + pos);
			}
			int marker = data[pos + 1] & 0xFF;
			if (marker == 0xFF) {
				// fill byte
				pos++;
				continue;
			}
			if (marker == SOI || marker == EOI) {
				throw new InvalidStreamException(label + String.format(": unexpected marker FF%02X at offset %d", marker, pos));
			}
			if (marker == 0x01 || (marker >= 0xD0 && marker <= 0xD7)) {
				pos += 2;
				continue;
			}
			int length = readUnsignedShort(data, pos + 2);
			if (length < 2) {
				throw new InvalidStreamException(label + ": bad segment length " + length + " at offset " + pos);
			}
			if (pos + 2 + length > data.length) {
				if (complete) {
					throw new InvalidStreamException(label + ": segment at offset " + pos + " runs past the end");
				}
				return segments;
			}
			segments.add(new Segment(marker, pos, 2 + length));
			if (marker == SOS) {
				return segments;
			}
			pos += 2 + length;
		}
	}

	public static Segment find(List<Segment> segments, int marker, byte[] data, byte[] signature) {
		for (Segment segment : segments) {
			if (segment.getMarker() == marker && segment.payloadStartsWith(data, signature)) {
				return segment;
			}
		}
		return null;
	}

	/**
	 * position after the APP0/APP1 segments that directly follow SOI
	 */
	public static int afterLeadingApplicationSegments(List<Segment> segments, int soiOffset) {
		int position = soiOffset + 2;
		for (Segment segment : segments) {
			if (segment.getMarker() != APP0 && segment.getMarker() != APP1) {
				break;
			}
			position = segment.getEnd();
		}
		return position;
	}

	public static byte[] segmentBytes(int marker, byte[] payload) throws InvalidStreamException {
		int length = payload.length + 2;
		if (length > MAX_SEGMENT_LENGTH) {
			throw new InvalidStreamException(String.format("FF%02X payload of %d bytes does not fit a segment", marker,
					payload.length));
		}
		byte[] segment = new byte[payload.length + 4];
		segment[0] = (byte) 0xFF;
		segment[1] = (byte) marker;
		segment[2] = (byte) ((length >> 8) & 0xFF);
		segment[3] = (byte) (length & 0xFF);
		System.arraycopy(payload, 0, segment, 4, payload.length);
		return segment;
	}

	public static byte[] insert(byte[] jpeg, int position, byte[] segment) {
		byte[] result = new byte[jpeg.length + segment.length];
		System.arraycopy(jpeg, 0, result, 0, position);
		System.arraycopy(segment, 0, result, position, segment.length);
		System.arraycopy(jpeg, position, result, position + segment.length, jpeg.length - position);
		return result;
	}

	/**
	 * copy of the stream without the given segments
	 */
	public static byte[] remove(byte[] jpeg, Collection<Segment> segments) {
		if (segments.isEmpty()) {
			return jpeg;
		}
		ByteArrayOutputStream out = new ByteArrayOutputStream(jpeg.length);
		int pos = 0;
		for (Segment segment : segments) {
			out.write(jpeg, pos, segment.getOffset() - pos);
			pos = segment.getEnd();
		}
		out.write(jpeg, pos, jpeg.length - pos);
		return out.toByteArray();
	}

	public static int readUnsignedShort(byte[] data, int offset) {
		return ((data[offset] & 0xFF) << 8) | (data[offset + 1] & 0xFF);
	}
}
