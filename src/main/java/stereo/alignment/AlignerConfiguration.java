package stereo.alignment;

import boofcv.abst.feature.associate.AssociateDescription;
import boofcv.abst.feature.detdesc.DetectDescribePoint;
import boofcv.struct.feature.BrightFeature;
import boofcv.struct.image.GrayF32;

/**
 * Feature pipeline of the aligner. The detector and associator keep state
 * between calls, so one configuration serves one worker at a time.
 */
public class AlignerConfiguration {
	DetectDescribePoint<GrayF32, BrightFeature> detDesc;
	AssociateDescription<BrightFeature> associate;
	int ransacIterations = 5000;
	// maximum reprojection error in pixels of a RANSAC inlier
	double inlierThreshold = 5.0;
	int minimumFeatures = 10;
}
