package stereo.pairing;

import java.util.Collections;
import java.util.List;

import stereo.image.ImageRecord;

/**
 * Pairs found by one matcher run and the images left over. Every input image
 * is in exactly one of the two.
 */
public final class MatchResult {
	private final List<Pair> pairs;
	private final List<ImageRecord> singles;

	public MatchResult(List<Pair> pairs, List<ImageRecord> singles) {
		this.pairs = Collections.unmodifiableList(pairs);
		this.singles = Collections.unmodifiableList(singles);
	}

	public List<Pair> getPairs() {
		return pairs;
	}

	public List<ImageRecord> getSingles() {
		return singles;
	}

	@Override
	public String toString() {
		return pairs.size() + " pairs, " + singles.size() + " singles";
	}
}
