package stereo.alignment;

import java.awt.image.BufferedImage;

import georegression.struct.homography.Homography2D_F64;

/**
 * Left view and the right view resampled onto it; both have the left view's size.
 */
public final class AlignmentResult {
	private final Homography2D_F64 leftToRight;
	private final BufferedImage left;
	private final BufferedImage alignedRight;

	public AlignmentResult(Homography2D_F64 leftToRight, BufferedImage left, BufferedImage alignedRight) {
		if (left.getWidth() != alignedRight.getWidth() || left.getHeight() != alignedRight.getHeight()) {
			throw new IllegalArgumentException("aligned right view is " + alignedRight.getWidth() + "x"
					+ alignedRight.getHeight() + ", left is " + left.getWidth() + "x" + left.getHeight());
		}
		this.leftToRight = leftToRight;
		this.left = left;
		this.alignedRight = alignedRight;
	}

	/**
	 * maps a left pixel position to the matching position in the original right image
	 */
	public Homography2D_F64 getLeftToRight() {
		return leftToRight;
	}

	public BufferedImage getLeft() {
		return left;
	}

	public BufferedImage getAlignedRight() {
		return alignedRight;
	}
}
