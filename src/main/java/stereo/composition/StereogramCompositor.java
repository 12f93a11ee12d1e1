package stereo.composition;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

import stereo.config.OutputFormat;

/**
 * Arranges two equally sized views into stereogram images. None of the
 * methods modifies its inputs.
 */
public class StereogramCompositor {

	public BufferedImage compose(OutputFormat format, BufferedImage left, BufferedImage right) {
		switch (format) {
		case ANAGLYPH:
			return anaglyph(left, right);
		case SIDE_BY_SIDE:
			return sideBySide(left, right);
		case SIDE_BY_SIDE_REVERSED:
			return sideBySideReversed(left, right);
		case LEFT_RIGHT_LEFT:
			return leftRightLeft(left, right);
		case LEFT:
			checkDimensions(left, right);
			return copy(left);
		case RIGHT:
			checkDimensions(left, right);
			return copy(right);
		default:
			throw new IllegalArgumentException(format + " is not a pixel format");
		}
	}

	/**
	 * red channel of the left view, green and blue of the right view
	 */
	public BufferedImage anaglyph(BufferedImage left, BufferedImage right) {
		checkDimensions(left, right);
		int width = left.getWidth();
		int height = left.getHeight();
		int[] leftRow = new int[width];
		int[] rightRow = new int[width];
		int[] outputRow = new int[width];
		BufferedImage anaglyph = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
		for (int y = 0; y < height; y++) {
			left.getRGB(0, y, width, 1, leftRow, 0, width);
			right.getRGB(0, y, width, 1, rightRow, 0, width);
			for (int x = 0; x < width; x++) {
				outputRow[x] = (leftRow[x] & 0xFF0000) | (rightRow[x] & 0x00FFFF);
			}
			anaglyph.setRGB(0, y, width, 1, outputRow, 0, width);
		}
		return anaglyph;
	}

	/**
	 * parallel view: left view on the left
	 */
	public BufferedImage sideBySide(BufferedImage left, BufferedImage right) {
		checkDimensions(left, right);
		return panels(left, right);
	}

	/**
	 * cross view: right view on the left
	 */
	public BufferedImage sideBySideReversed(BufferedImage left, BufferedImage right) {
		checkDimensions(left, right);
		return panels(right, left);
	}

	public BufferedImage leftRightLeft(BufferedImage left, BufferedImage right) {
		checkDimensions(left, right);
		return panels(left, right, left);
	}

	private static BufferedImage panels(BufferedImage... views) {
		int width = views[0].getWidth();
		int height = views[0].getHeight();
		BufferedImage canvas = new BufferedImage(width * views.length, height, BufferedImage.TYPE_INT_RGB);
		Graphics2D g = canvas.createGraphics();
		try {
			for (int i = 0; i < views.length; i++) {
				g.drawImage(views[i], i * width, 0, null);
			}
		} finally {
			g.dispose();
		}
		return canvas;
	}

	private static BufferedImage copy(BufferedImage view) {
		return panels(view);
	}

	private static void checkDimensions(BufferedImage left, BufferedImage right) {
		if (left.getWidth() != right.getWidth() || left.getHeight() != right.getHeight()) {
			throw new DimensionMismatchException(left.getWidth(), left.getHeight(), right.getWidth(), right.getHeight());
		}
	}
}
