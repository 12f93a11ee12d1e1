package stereo.alignment;

import boofcv.abst.feature.associate.WrapAssociateSurfBasic;
import boofcv.abst.feature.detect.interest.ConfigFastHessian;
import boofcv.alg.feature.associate.AssociateSurfBasic;
import boofcv.factory.feature.associate.FactoryAssociation;
import boofcv.factory.feature.detdesc.FactoryDetectDescribe;
import boofcv.struct.feature.BrightFeature;
import boofcv.struct.feature.TupleDesc_F64;
import boofcv.struct.image.GrayF32;
import stereo.config.FeaturePipeline;

public class AlignerConfigurationFactory {

	public static AlignerConfiguration of(FeaturePipeline pipeline) {
		switch (pipeline) {
		case SURF_BRIGHT:
			return surfGreedyBright();
		case SURF:
		default:
			return surfGreedy();
		}
	}

	/**
	 * stable SURF, every feature associated greedily with backwards validation
	 * so that no descriptor is matched twice
	 */
	public static AlignerConfiguration surfGreedy() {
		AlignerConfiguration config = new AlignerConfiguration();
		config.detDesc = FactoryDetectDescribe
				.surfStable(new ConfigFastHessian(1, 2, 1500, 1, 9, 4, 4), null, null, GrayF32.class);
		config.associate = FactoryAssociation.greedy(FactoryAssociation.scoreEuclidean(BrightFeature.class, true),
				Double.MAX_VALUE, true);
		return config;
	}

	/**
	 * Same detector, but only features with equal laplacian sign are compared
	 * and the association error is bounded. Fewer, cleaner matches.
	 */
	public static AlignerConfiguration surfGreedyBright() {
		AlignerConfiguration config = new AlignerConfiguration();
		config.detDesc = FactoryDetectDescribe
				.surfStable(new ConfigFastHessian(2, 2, 1400, 1, 9, 4, 4), null, null, GrayF32.class);
		config.associate = new WrapAssociateSurfBasic(new AssociateSurfBasic(
				FactoryAssociation.greedy(FactoryAssociation.scoreEuclidean(TupleDesc_F64.class, true), 0.04, true)));
		return config;
	}
}
