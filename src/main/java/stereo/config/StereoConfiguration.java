package stereo.config;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Settings of one batch run. Instances are created by
 * {@link StereoConfigurationFactory} and not changed afterwards.
 */
public class StereoConfiguration {
	Duration timeDiffThreshold = Duration.ofSeconds(2);
	int hashDiffThreshold = 10;
	boolean strictAdjacency;
	Set<OutputFormat> requestedFormats = EnumSet.of(OutputFormat.ANAGLYPH);
	float jpegQuality = 0.95f;
	FeaturePipeline featurePipeline = FeaturePipeline.SURF;
	boolean recursive;
	boolean sortIntoFolders;

	StereoConfiguration() {
	}

	/**
	 * largest capture time gap of two images still considered for a pair
	 */
	public Duration getTimeDiffThreshold() {
		return timeDiffThreshold;
	}

	/**
	 * fingerprints must differ in fewer bits than this to pair
	 */
	public int getHashDiffThreshold() {
		return hashDiffThreshold;
	}

	public boolean isStrictAdjacency() {
		return strictAdjacency;
	}

	public Set<OutputFormat> getRequestedFormats() {
		return Collections.unmodifiableSet(requestedFormats);
	}

	public boolean needsAlignment() {
		for (OutputFormat format : requestedFormats) {
			if (format.isPixelFormat()) {
				return true;
			}
		}
		return false;
	}

	public float getJpegQuality() {
		return jpegQuality;
	}

	public FeaturePipeline getFeaturePipeline() {
		return featurePipeline;
	}

	/**
	 * sub-folders are matched each on its own, their outputs mirrored under the
	 * output root
	 */
	public boolean isRecursive() {
		return recursive;
	}

	/**
	 * matched images are moved into {@code _pairs}, the rest into
	 * {@code _singles}, beside their folder
	 */
	public boolean isSortIntoFolders() {
		return sortIntoFolders;
	}

	@Override
	public String toString() {
		return "StereoConfiguration{time=" + timeDiffThreshold.toMillis() / 1000.0 + "s, hash=" + hashDiffThreshold
				+ ", strict=" + strictAdjacency + ", formats=" + requestedFormats + ", features=" + featurePipeline.getKey()
				+ ", recursive=" + recursive + ", sort=" + sortIntoFolders + "}";
	}
}
