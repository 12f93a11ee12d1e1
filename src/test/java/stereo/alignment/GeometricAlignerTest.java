package stereo.alignment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import boofcv.struct.geo.AssociatedPair;
import georegression.struct.homography.Homography2D_F64;
import georegression.struct.point.Point2D_F64;
import georegression.transform.homography.HomographyPointOps_F64;
import stereo.TestImages;
import stereo.config.FeaturePipeline;
import stereo.image.DecodeException;
import stereo.image.ImageRecord;

public class GeometricAlignerTest {
	private static final int SHIFT = 12;

	private static BufferedImage left;
	private static BufferedImage right;

	private final GeometricAligner aligner = new GeometricAligner();

	@BeforeAll
	public static void createViews() {
		left = TestImages.blocks(320, 240, 10, 42);
		right = TestImages.shifted(left, SHIFT);
	}

	@Test
	public void recoversHorizontalShift() throws Exception {
		AlignmentResult result = aligner.align(left, right);

		Point2D_F64 mapped = new Point2D_F64();
		HomographyPointOps_F64.transform(result.getLeftToRight(), 160, 120, mapped);
		assertEquals(160 - SHIFT, mapped.x, 1.5);
		assertEquals(120, mapped.y, 1.5);
	}

	@Test
	public void alignedViewMatchesLeftGrid() throws Exception {
		AlignmentResult result = aligner.align(left, right);

		assertEquals(left.getWidth(), result.getAlignedRight().getWidth());
		assertEquals(left.getHeight(), result.getAlignedRight().getHeight());
		// centre of a block, away from colour edges
		int expected = left.getRGB(155, 125);
		int actual = result.getAlignedRight().getRGB(155, 125);
		for (int shift = 0; shift <= 16; shift += 8) {
			int e = (expected >> shift) & 0xFF;
			int a = (actual >> shift) & 0xFF;
			assertTrue(Math.abs(e - a) <= 40, "channel at bit " + shift + ": " + e + " vs " + a);
		}
	}

	@Test
	public void featurelessImageIsRejected() {
		BufferedImage flat = TestImages.filled(320, 240, 0x808080);

		InsufficientFeaturesException e = assertThrows(InsufficientFeaturesException.class,
				() -> aligner.align(flat, right));
		assertTrue(e.getFound() < e.getRequired());
	}

	@Test
	public void laplacianFilteredAssociationRecoversShift() throws Exception {
		GeometricAligner filtered = new GeometricAligner(AlignerConfigurationFactory.of(FeaturePipeline.SURF_BRIGHT));

		AlignmentResult result = filtered.align(left, right);

		Point2D_F64 mapped = new Point2D_F64();
		HomographyPointOps_F64.transform(result.getLeftToRight(), 160, 120, mapped);
		assertEquals(160 - SHIFT, mapped.x, 1.5);
		assertEquals(120, mapped.y, 1.5);
	}

	@Test
	public void tooFewCorrespondencesFail() {
		List<AssociatedPair> pairs = new ArrayList<>();
		for (int i = 0; i < 5; i++) {
			pairs.add(new AssociatedPair(10 * i, 20 * i, 10 * i - SHIFT, 20 * i));
		}

		AlignmentException e = assertThrows(AlignmentException.class, () -> aligner.estimate(pairs));
		assertFalse(e instanceof InsufficientFeaturesException);
	}

	@Test
	public void determinantOfIdentityIsOne() {
		assertEquals(1.0, GeometricAligner.determinant(new Homography2D_F64()), 1e-12);
	}

	@Test
	public void missingFileIsDecodeFailure(@TempDir Path dir) {
		ImageRecord missing = new ImageRecord(dir.resolve("missing.jpg"), null, 0);
		ImageRecord other = new ImageRecord(dir.resolve("other.jpg"), null, 0);

		assertThrows(DecodeException.class, () -> aligner.align(missing, other));
	}
}
