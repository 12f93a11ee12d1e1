package stereo.config;

/**
 * Feature detector and associator pair the aligner runs with.
 */
public enum FeaturePipeline {
	// stable SURF, greedy association with backwards validation
	SURF("surf"),
	// stable SURF, only features of equal laplacian sign compared
	SURF_BRIGHT("surf_bright");

	private final String key;

	FeaturePipeline(String key) {
		this.key = key;
	}

	public String getKey() {
		return key;
	}

	public static FeaturePipeline fromKey(String key) {
		String normalized = key.trim().toLowerCase();
		for (FeaturePipeline pipeline : values()) {
			if (pipeline.key.equals(normalized)) {
				return pipeline;
			}
		}
		throw new IllegalArgumentException("unknown feature pipeline: " + key);
	}
}
