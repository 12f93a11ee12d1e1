package stereo.similarity;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.Arrays;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import net.coobird.thumbnailator.Thumbnails;
import stereo.image.DecodeException;
import stereo.image.ImageLoader;
import stereo.image.ImageRecord;

/**
 * DCT based perceptual hash. The image is shrunk to a 32x32 luma grid, a 2-D
 * DCT-II is applied and the 8x8 lowest frequencies are compared with their
 * median, one bit per coefficient.
 */
public class PerceptualHasher {
	private static Logger logger = LogManager.getLogger();

	private static final int HASH_SIZE = 8;
	private static final int GRID_SIZE = HASH_SIZE * 4;

	// cosines of the DCT-II basis, only the frequencies the hash keeps
	private static final double[][] COSINES = new double[HASH_SIZE][GRID_SIZE];
	static {
		for (int k = 0; k < HASH_SIZE; k++) {
			for (int n = 0; n < GRID_SIZE; n++) {
				COSINES[k][n] = Math.cos(Math.PI * k * (2 * n + 1) / (2.0 * GRID_SIZE));
			}
		}
	}

	public Fingerprint fingerprint(ImageRecord image) throws DecodeException {
		Fingerprint fingerprint = fingerprint(ImageLoader.load(image.getPath()));
		logger.debug("fingerprint of {} is {}", image.getName(), fingerprint);
		return fingerprint;
	}

	public Fingerprint fingerprint(BufferedImage image) throws DecodeException {
		BufferedImage grid;
		try {
			grid = Thumbnails.of(image)
					.forceSize(GRID_SIZE, GRID_SIZE)
					.imageType(BufferedImage.TYPE_INT_RGB)
					.asBufferedImage();
		} catch (IOException e) {
			throw new DecodeException("cannot shrink image for hashing: " + e.getMessage());
		}
		return hash(luma(grid));
	}

	public static int distance(Fingerprint a, Fingerprint b) {
		return a.distance(b);
	}

	private static double[][] luma(BufferedImage grid) {
		double[][] pixels = new double[GRID_SIZE][GRID_SIZE];
		for (int y = 0; y < GRID_SIZE; y++) {
			for (int x = 0; x < GRID_SIZE; x++) {
				int rgb = grid.getRGB(x, y);
				int r = (rgb >> 16) & 0xFF;
				int g = (rgb >> 8) & 0xFF;
				int b = rgb & 0xFF;
				pixels[y][x] = 0.299 * r + 0.587 * g + 0.114 * b;
			}
		}
		return pixels;
	}

	static Fingerprint hash(double[][] pixels) {
		// rows first, keeping only the low horizontal frequencies
		double[][] rows = new double[GRID_SIZE][HASH_SIZE];
		for (int y = 0; y < GRID_SIZE; y++) {
			for (int k = 0; k < HASH_SIZE; k++) {
				double sum = 0;
				for (int x = 0; x < GRID_SIZE; x++) {
					sum += pixels[y][x] * COSINES[k][x];
				}
				rows[y][k] = 2 * sum;
			}
		}
		double[] lowFrequencies = new double[HASH_SIZE * HASH_SIZE];
		for (int ky = 0; ky < HASH_SIZE; ky++) {
			for (int kx = 0; kx < HASH_SIZE; kx++) {
				double sum = 0;
				for (int y = 0; y < GRID_SIZE; y++) {
					sum += rows[y][kx] * COSINES[ky][y];
				}
				lowFrequencies[ky * HASH_SIZE + kx] = 2 * sum;
			}
		}

		double[] sorted = Arrays.copyOf(lowFrequencies, lowFrequencies.length);
		Arrays.sort(sorted);
		int middle = sorted.length / 2;
		double median = (sorted[middle - 1] + sorted[middle]) / 2;

		long bits = 0;
		for (int i = 0; i < lowFrequencies.length; i++) {
			if (lowFrequencies[i] > median) {
				bits |= 1L << (Fingerprint.BITS - 1 - i);
			}
		}
		return new Fingerprint(bits);
	}
}
