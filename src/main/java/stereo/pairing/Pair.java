package stereo.pairing;

import java.util.Objects;

import stereo.image.ImageRecord;

/**
 * Left and right view of one stereo shot. Pairs found by capture time have
 * the earlier image on the left; pairs zipped from Left/Right folders take
 * their roles from the folder.
 */
public final class Pair {
	private final ImageRecord left;
	private final ImageRecord right;

	public Pair(ImageRecord left, ImageRecord right) {
		this.left = Objects.requireNonNull(left, "left");
		this.right = Objects.requireNonNull(right, "right");
		if (left.equals(right)) {
			throw new IllegalArgumentException("an image cannot pair with itself: " + left);
		}
	}

	public ImageRecord getLeft() {
		return left;
	}

	public ImageRecord getRight() {
		return right;
	}

	@Override
	public boolean equals(Object other) {
		if (!(other instanceof Pair)) {
			return false;
		}
		Pair pair = (Pair) other;
		return left.equals(pair.left) && right.equals(pair.right);
	}

	@Override
	public int hashCode() {
		return 31 * left.hashCode() + right.hashCode();
	}

	@Override
	public String toString() {
		return left.getPath() + " + " + right.getPath();
	}
}
