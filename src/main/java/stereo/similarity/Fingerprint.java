package stereo.similarity;

/**
 * Perceptual hash of an image. Bit 63 holds the lowest DCT frequency.
 */
public final class Fingerprint {
	public static final int BITS = 64;

	private final long bits;

	public Fingerprint(long bits) {
		this.bits = bits;
	}

	public long getBits() {
		return bits;
	}

	public int length() {
		return BITS;
	}

	/**
	 * Hamming distance between two fingerprints
	 */
	public int distance(Fingerprint other) {
		if (other.length() != length()) {
			throw new IllegalArgumentException("fingerprints of different length: " + length() + " and " + other.length());
		}
		return Long.bitCount(bits ^ other.bits);
	}

	public static Fingerprint fromHex(String hex) {
		return new Fingerprint(Long.parseUnsignedLong(hex, 16));
	}

	public String toHex() {
		return String.format("%016x", bits);
	}

	@Override
	public boolean equals(Object other) {
		return other instanceof Fingerprint && ((Fingerprint) other).bits == bits;
	}

	@Override
	public int hashCode() {
		return Long.hashCode(bits);
	}

	@Override
	public String toString() {
		return toHex();
	}
}
