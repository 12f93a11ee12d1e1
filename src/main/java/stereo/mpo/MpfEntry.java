package stereo.mpo;

/**
 * One MP Entry of the MP Index IFD: where an individual image lives inside the
 * multi-picture file and what kind of image it is.
 */
public final class MpfEntry {
	public static final long PRIMARY_ATTRIBUTE = 0x00000000L;
	public static final long STEREO_ATTRIBUTE = 0x00020000L;

	private final long attribute;
	private final long size;
	private final long offset;
	private final long dependency;

	public MpfEntry(long attribute, long size, long offset, long dependency) {
		this.attribute = attribute;
		this.size = size;
		this.offset = offset;
		this.dependency = dependency;
	}

	public long getAttribute() {
		return attribute;
	}

	public long getSize() {
		return size;
	}

	public long getOffset() {
		return offset;
	}

	/**
	 * both dependent image entry numbers, first one in the high 16 bits
	 */
	public long getDependency() {
		return dependency;
	}

	@Override
	public boolean equals(Object other) {
		if (!(other instanceof MpfEntry)) {
			return false;
		}
		MpfEntry entry = (MpfEntry) other;
		return attribute == entry.attribute && size == entry.size && offset == entry.offset
				&& dependency == entry.dependency;
	}

	@Override
	public int hashCode() {
		return Long.hashCode(attribute) * 31 * 31 * 31 + Long.hashCode(size) * 31 * 31 + Long.hashCode(offset) * 31
				+ Long.hashCode(dependency);
	}

	@Override
	public String toString() {
		return String.format("attribute=0x%08X size=%d offset=%d dependency=%d", attribute, size, offset, dependency);
	}
}
