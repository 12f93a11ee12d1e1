package stereo.alignment;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ddogleg.struct.FastQueue;

import boofcv.abst.feature.detdesc.DetectDescribePoint;
import boofcv.alg.color.ColorRgb;
import boofcv.alg.descriptor.UtilFeature;
import boofcv.struct.feature.BrightFeature;
import boofcv.struct.image.GrayF32;
import boofcv.struct.image.Planar;
import georegression.struct.point.Point2D_F64;

/**
 * One view of a pair with its luma channel, feature locations and descriptors.
 */
class DescribedImage {
	private static Logger logger = LogManager.getLogger();

	final String name;
	final Planar<GrayF32> colorImage;
	final GrayF32 grayImage;
	final FastQueue<BrightFeature> description;
	final List<Point2D_F64> locationsOfFeaturePoints;
	private final DetectDescribePoint<GrayF32, BrightFeature> detectDescriptor;

	DescribedImage(String name, Planar<GrayF32> image, DetectDescribePoint<GrayF32, BrightFeature> detectDescriptor) {
		this.name = name;
		this.colorImage = image;
		this.grayImage = new GrayF32(image.width, image.height);
		ColorRgb.rgbToGray_Weighted_F32(colorImage, grayImage);
		this.description = UtilFeature.createQueue(detectDescriptor, 1500);
		this.locationsOfFeaturePoints = new ArrayList<>();
		this.detectDescriptor = detectDescriptor;
	}

	/**
	 * detects and describes the features of the luma channel
	 *
	 * @return number of features found
	 */
	int describe() {
		detectDescriptor.detect(grayImage);
		description.reset();
		locationsOfFeaturePoints.clear();
		for (int i = 0; i < detectDescriptor.getNumberOfFeatures(); i++) {
			locationsOfFeaturePoints.add(detectDescriptor.getLocation(i).copy());
			description.grow().setTo(detectDescriptor.getDescription(i));
		}
		logger.debug("{}: {} features", name, description.size);
		return description.size;
	}
}
