package stereo.mpo;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import stereo.jpeg.InvalidStreamException;
import stereo.jpeg.JpegSegments;
import stereo.jpeg.JpegSegments.Segment;

/**
 * Splits an MPO file into its first two JPEG streams using the MP Index of
 * the first stream.
 */
public class MpoDecoder {
	private static Logger logger = LogManager.getLogger();

	public MpoContainer decode(Path file) throws IOException, InvalidStreamException {
		return decode(Files.readAllBytes(file), file.getFileName().toString());
	}

	public MpoContainer decode(byte[] data) throws InvalidStreamException {
		return decode(data, "mpo");
	}

	private MpoContainer decode(byte[] data, String label) throws InvalidStreamException {
		List<Segment> segments = JpegSegments.headerSegments(data, label);
		Segment mpf = JpegSegments.find(segments, JpegSegments.APP2, data, MpfSegment.SIGNATURE);
		if (mpf == null) {
			throw new InvalidStreamException(label + ": no MPF segment in the first image");
		}
		MpfSegment.Index index = MpfSegment.parse(data, mpf.getPayloadOffset(), mpf.getPayloadLength());
		List<MpfEntry> entries = index.getEntries();
		if (entries.size() < 2) {
			throw new InvalidStreamException(label + ": MP Index lists " + entries.size() + " image(s), two needed");
		}
		if (entries.size() > 2) {
			logger.debug("{}: {} images listed, keeping the first two", label, entries.size());
		}

		MpfEntry first = entries.get(0);
		byte[] stream1 = slice(data, 0, first.getSize(), label);

		MpfEntry second = entries.get(1);
		long start = second.getOffset();
		if (!startsImage(data, start)) {
			// cameras count offsets from the MP endian field
			start = second.getOffset() + index.getEndianOffset();
			if (!startsImage(data, start)) {
				throw new InvalidStreamException(label + ": no JPEG stream at entry offset " + second.getOffset());
			}
		}
		byte[] stream2 = slice(data, start, second.getSize(), label);
		return new MpoContainer(entries.subList(0, 2), stream1, stream2);
	}

	private static boolean startsImage(byte[] data, long offset) {
		return offset > 0 && offset < data.length && JpegSegments.hasSoi(data, (int) offset);
	}

	private static byte[] slice(byte[] data, long offset, long size, String label) throws InvalidStreamException {
		if (size < 2 || offset + size > data.length) {
			throw new InvalidStreamException(
					label + ": entry of " + size + " bytes at " + offset + " does not fit " + data.length + " bytes");
		}
		return Arrays.copyOfRange(data, (int) offset, (int) (offset + size));
	}
}
