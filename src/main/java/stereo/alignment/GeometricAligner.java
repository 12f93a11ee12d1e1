package stereo.alignment;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ddogleg.fitting.modelset.ModelMatcher;
import org.ddogleg.struct.FastQueue;

import boofcv.abst.feature.associate.AssociateDescription;
import boofcv.abst.feature.detdesc.DetectDescribePoint;
import boofcv.alg.distort.ImageDistort;
import boofcv.alg.distort.PixelTransformHomography_F32;
import boofcv.alg.distort.impl.DistortSupport;
import boofcv.alg.interpolate.InterpolatePixelS;
import boofcv.core.image.border.BorderType;
import boofcv.factory.geo.ConfigRansac;
import boofcv.factory.geo.FactoryMultiViewRobust;
import boofcv.factory.interpolate.FactoryInterpolation;
import boofcv.io.image.ConvertBufferedImage;
import boofcv.struct.feature.AssociatedIndex;
import boofcv.struct.feature.BrightFeature;
import boofcv.struct.geo.AssociatedPair;
import boofcv.struct.image.GrayF32;
import boofcv.struct.image.Planar;
import georegression.struct.homography.Homography2D_F64;
import georegression.struct.point.Point2D_F64;
import stereo.image.DecodeException;
import stereo.image.ImageLoader;
import stereo.image.ImageRecord;

/**
 * Aligns the right view of a stereo pair onto the left one. SURF features of
 * both luma channels are associated one-to-one, a homography is fitted with
 * RANSAC and the right view is rendered through it onto the left pixel grid.
 */
public class GeometricAligner implements ImageAligner {
	private static Logger logger = LogManager.getLogger();

	public static final int MINIMUM_CORRESPONDENCES = 10;
	private static final double MINIMUM_DETERMINANT = 1e-9;

	private final DetectDescribePoint<GrayF32, BrightFeature> detDesc;
	private final AssociateDescription<BrightFeature> associate;
	private final int ransacIterations;
	private final double inlierThreshold;
	private final int minimumFeatures;

	public GeometricAligner() {
		this(AlignerConfigurationFactory.surfGreedy());
	}

	public GeometricAligner(AlignerConfiguration config) {
		this.detDesc = config.detDesc;
		this.associate = config.associate;
		this.ransacIterations = config.ransacIterations;
		this.inlierThreshold = config.inlierThreshold;
		this.minimumFeatures = config.minimumFeatures;
	}

	@Override
	public AlignmentResult align(ImageRecord left, ImageRecord right) throws DecodeException, AlignmentException {
		BufferedImage leftImage = ImageLoader.load(left.getPath());
		BufferedImage rightImage = ImageLoader.load(right.getPath());
		return align(left.getName(), leftImage, right.getName(), rightImage);
	}

	public AlignmentResult align(BufferedImage leftImage, BufferedImage rightImage) throws AlignmentException {
		return align("left", leftImage, "right", rightImage);
	}

	private AlignmentResult align(String leftName, BufferedImage leftImage, String rightName, BufferedImage rightImage)
			throws AlignmentException {
		Planar<GrayF32> leftColor = ConvertBufferedImage.convertFromPlanar(leftImage, null, true, GrayF32.class);
		Planar<GrayF32> rightColor = ConvertBufferedImage.convertFromPlanar(rightImage, null, true, GrayF32.class);

		DescribedImage main = new DescribedImage(leftName, leftColor, detDesc);
		requireFeatures(main);
		DescribedImage secondary = new DescribedImage(rightName, rightColor, detDesc);
		requireFeatures(secondary);

		List<AssociatedPair> pairs = correspondences(main, secondary);
		logger.debug("{} correspondences between {} and {}", pairs.size(), leftName, rightName);
		Homography2D_F64 leftToRight = estimate(pairs);

		Planar<GrayF32> aligned = render(rightColor, leftToRight, leftColor.width, leftColor.height);
		BufferedImage output = new BufferedImage(aligned.width, aligned.height, BufferedImage.TYPE_INT_RGB);
		ConvertBufferedImage.convertTo(aligned, output, true);
		return new AlignmentResult(leftToRight, ImageLoader.toRgb(leftImage), output);
	}

	private void requireFeatures(DescribedImage image) throws InsufficientFeaturesException {
		int found = image.describe();
		if (found < minimumFeatures) {
			throw new InsufficientFeaturesException(image.name, found, minimumFeatures);
		}
	}

	private List<AssociatedPair> correspondences(DescribedImage main, DescribedImage secondary) {
		associate.setSource(main.description);
		associate.setDestination(secondary.description);
		associate.associate();

		FastQueue<AssociatedIndex> matches = associate.getMatches();
		List<AssociatedPair> pairs = new ArrayList<>(matches.size);
		for (int i = 0; i < matches.size; i++) {
			AssociatedIndex match = matches.get(i);
			Point2D_F64 a = main.locationsOfFeaturePoints.get(match.src);
			Point2D_F64 b = secondary.locationsOfFeaturePoints.get(match.dst);

			pairs.add(new AssociatedPair(a, b, false));
		}
		return pairs;
	}

	/**
	 * robust fit of the homography taking left feature positions to right ones
	 */
	Homography2D_F64 estimate(List<AssociatedPair> pairs) throws AlignmentException {
		if (pairs.size() < MINIMUM_CORRESPONDENCES) {
			throw new AlignmentException("too few correspondences (" + pairs.size() + "), at least "
					+ MINIMUM_CORRESPONDENCES + " required");
		}
		ModelMatcher<Homography2D_F64, AssociatedPair> modelMatcher = FactoryMultiViewRobust.homographyRansac(null,
				new ConfigRansac(ransacIterations, inlierThreshold));
		if (!modelMatcher.process(pairs)) {
			throw new AlignmentException("homography fit did not converge");
		}
		Homography2D_F64 homography = modelMatcher.getModelParameters().copy();
		logger.debug("homography supported by {} of {} correspondences", modelMatcher.getMatchSet().size(),
				pairs.size());
		double determinant = determinant(homography);
		if (!Double.isFinite(determinant) || Math.abs(determinant) < MINIMUM_DETERMINANT) {
			throw new AlignmentException("degenerate homography, determinant " + determinant);
		}
		return homography;
	}

	static double determinant(Homography2D_F64 h) {
		return h.a11 * (h.a22 * h.a33 - h.a23 * h.a32)
				- h.a12 * (h.a21 * h.a33 - h.a23 * h.a31)
				+ h.a13 * (h.a21 * h.a32 - h.a22 * h.a31);
	}

	private static Planar<GrayF32> render(Planar<GrayF32> right, Homography2D_F64 leftToRight, int width, int height) {
		// Where the aligned view is rendered into, sized like the left view
		Planar<GrayF32> aligned = right.createNew(width, height);
		PixelTransformHomography_F32 model = new PixelTransformHomography_F32();
		InterpolatePixelS<GrayF32> interp = FactoryInterpolation.bilinearPixelS(GrayF32.class, BorderType.ZERO);
		ImageDistort<Planar<GrayF32>, Planar<GrayF32>> distort = DistortSupport.createDistortPL(GrayF32.class, model,
				interp, false);
		distort.setRenderAll(true);
		// output pixels are looked up in the right view
		model.set(leftToRight);
		distort.apply(right, aligned);
		return aligned;
	}
}
