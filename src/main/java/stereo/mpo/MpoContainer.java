package stereo.mpo;

import java.util.Collections;
import java.util.List;

/**
 * Two JPEG streams and the MP entries describing where each one sits in the
 * combined file.
 */
public final class MpoContainer {
	/** MP type of a two-view stereo file; MPF has no tag for it, so it is only reported. */
	public static final String MP_TYPE = "Baseline Stereo Image";

	private final List<MpfEntry> entries;
	private final byte[] stream1;
	private final byte[] stream2;

	public MpoContainer(List<MpfEntry> entries, byte[] stream1, byte[] stream2) {
		this.entries = Collections.unmodifiableList(entries);
		this.stream1 = stream1;
		this.stream2 = stream2;
	}

	public List<MpfEntry> getEntries() {
		return entries;
	}

	public byte[] getStream1() {
		return stream1;
	}

	public byte[] getStream2() {
		return stream2;
	}

	public String getMpType() {
		return MP_TYPE;
	}

	/**
	 * the file contents, stream 1 directly followed by stream 2
	 */
	public byte[] toBytes() {
		byte[] bytes = new byte[stream1.length + stream2.length];
		System.arraycopy(stream1, 0, bytes, 0, stream1.length);
		System.arraycopy(stream2, 0, bytes, stream1.length, stream2.length);
		return bytes;
	}
}
