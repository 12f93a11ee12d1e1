package stereo.mpo;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import stereo.jpeg.InvalidStreamException;
import stereo.jpeg.JpegSegments;
import stereo.jpeg.JpegSegments.Segment;
import stereo.metadata.ExifMetadataStore;
import stereo.metadata.MetadataStore;
import stereo.util.AtomicFiles;

/**
 * Packs a left and a right JPEG stream into one MPO file. Both streams get the
 * same capture timestamps and co-sited chroma positioning, the first stream
 * carries the MP index and every stream its MP attributes.
 */
public class MpoEncoder {
	private static Logger logger = LogManager.getLogger();

	static final String CO_SITED = "2";

	private final MetadataStore metadata;
	private final Clock clock;

	public MpoEncoder() {
		this(new ExifMetadataStore(), Clock.systemDefaultZone());
	}

	public MpoEncoder(MetadataStore metadata, Clock clock) {
		this.metadata = metadata;
		this.clock = clock;
	}

	public MpoContainer encode(byte[] leftJpeg, byte[] rightJpeg) throws InvalidStreamException {
		JpegSegments.headerSegments(leftJpeg, "left stream");
		JpegSegments.headerSegments(rightJpeg, "right stream");

		String timestamp = ExifMetadataStore.formatTimestamp(timestamp(leftJpeg));
		Map<String, String> normalized = new LinkedHashMap<>();
		normalized.put(MetadataStore.DATE_TIME, timestamp);
		normalized.put(MetadataStore.DATE_TIME_ORIGINAL, timestamp);
		normalized.put(MetadataStore.DATE_TIME_DIGITIZED, timestamp);
		normalized.put(MetadataStore.YCBCR_POSITIONING, CO_SITED);

		byte[] left = withoutMpf(metadata.write(leftJpeg, normalized), "left stream");
		byte[] right = withoutMpf(metadata.write(rightJpeg, normalized), "right stream");

		byte[] stream2 = insertApp2(right, MpfSegment.attributePayload(2), "right stream");
		int length1 = left.length + MpfSegment.STEREO_INDEX_PAYLOAD_LENGTH + 4;
		List<MpfEntry> entries = stereoEntries(length1, stream2.length);
		byte[] stream1 = insertApp2(left, MpfSegment.indexPayload(entries), "left stream");
		if (stream1.length != length1) {
			throw new IllegalStateException("index segment changed size: " + stream1.length + " != " + length1);
		}

		logger.debug("{}: {} + {} bytes, timestamp {}", MpoContainer.MP_TYPE, stream1.length, stream2.length,
				timestamp);
		return new MpoContainer(entries, stream1, stream2);
	}

	/**
	 * Encodes the two files and moves the result into place at destination.
	 */
	public MpoContainer encode(Path left, Path right, Path destination) throws IOException, InvalidStreamException {
		MpoContainer container = encode(Files.readAllBytes(left), Files.readAllBytes(right));
		AtomicFiles.write(destination, container.toBytes());
		logger.info("{} written to {}", MpoContainer.MP_TYPE, destination);
		return container;
	}

	/**
	 * MP entries of a left/right pair whose final streams have the given lengths.
	 * Offsets count from the start of the combined file.
	 */
	public static List<MpfEntry> stereoEntries(long length1, long length2) {
		List<MpfEntry> entries = new ArrayList<>(2);
		entries.add(new MpfEntry(MpfEntry.PRIMARY_ATTRIBUTE, length1, 0, 0));
		entries.add(new MpfEntry(MpfEntry.STEREO_ATTRIBUTE, length2, length1, 0));
		return entries;
	}

	private LocalDateTime timestamp(byte[] leftJpeg) throws InvalidStreamException {
		LocalDateTime original = ExifMetadataStore
				.parseTimestamp(metadata.read(leftJpeg).get(MetadataStore.DATE_TIME_ORIGINAL));
		return original != null ? original : LocalDateTime.now(clock);
	}

	private static byte[] withoutMpf(byte[] jpeg, String label) throws InvalidStreamException {
		List<Segment> old = new ArrayList<>();
		for (Segment segment : JpegSegments.headerSegments(jpeg, label)) {
			if (segment.getMarker() == JpegSegments.APP2 && segment.payloadStartsWith(jpeg, MpfSegment.SIGNATURE)) {
				old.add(segment);
			}
		}
		if (!old.isEmpty()) {
			logger.debug("{}: replacing {} MPF segment(s)", label, old.size());
		}
		return JpegSegments.remove(jpeg, old);
	}

	private static byte[] insertApp2(byte[] jpeg, byte[] payload, String label) throws InvalidStreamException {
		List<Segment> segments = JpegSegments.headerSegments(jpeg, label);
		int position = JpegSegments.afterLeadingApplicationSegments(segments, 0);
		return JpegSegments.insert(jpeg, position, JpegSegments.segmentBytes(JpegSegments.APP2, payload));
	}
}
