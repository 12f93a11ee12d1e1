package stereo.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Properties;

public class StereoConfigurationFactory {

	public static final String TIME_DIFF_THRESHOLD = "time_diff_threshold";
	public static final String HASH_DIFF_THRESHOLD = "hash_diff_threshold";
	public static final String STRICT_ADJACENCY = "strict_adjacency";
	public static final String REQUESTED_FORMATS = "requested_formats";
	public static final String JPEG_QUALITY = "jpeg_quality";
	public static final String ALIGNER = "aligner";
	public static final String RECURSIVE = "recursive";
	public static final String SORT_INTO_FOLDERS = "sort_into_folders";

	private static final double MIN_TIME_DIFF_SECONDS = 0.01;
	private static final int MIN_HASH_DIFF = 1;

	public static StereoConfiguration defaults() {
		return new StereoConfiguration();
	}

	/**
	 * greedy time + similarity pairing, as used for sorting a mixed folder
	 */
	public static StereoConfiguration greedy(Duration timeDiffThreshold, int hashDiffThreshold,
			Collection<OutputFormat> formats) {
		StereoConfiguration config = new StereoConfiguration();
		config.timeDiffThreshold = clampTime(timeDiffThreshold);
		config.hashDiffThreshold = Math.max(MIN_HASH_DIFF, hashDiffThreshold);
		config.requestedFormats = copyOf(formats);
		return config;
	}

	/**
	 * strict adjacency pairing of a captured burst, packed into MPO files
	 */
	public static StereoConfiguration burstMpo() {
		return strictAdjacency(EnumSet.of(OutputFormat.MPO));
	}

	public static StereoConfiguration strictAdjacency(Collection<OutputFormat> formats) {
		StereoConfiguration config = new StereoConfiguration();
		config.strictAdjacency = true;
		config.requestedFormats = copyOf(formats);
		return config;
	}

	public static StereoConfiguration fromFile(Path file) throws IOException {
		Properties properties = new Properties();
		try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			properties.load(reader);
		}
		return fromProperties(properties);
	}

	/**
	 * Reads the recognized options; missing keys keep their defaults. Values
	 * below the allowed minimum are raised to it, unparsable values are rejected.
	 */
	public static StereoConfiguration fromProperties(Properties properties) {
		StereoConfiguration config = new StereoConfiguration();
		String time = properties.getProperty(TIME_DIFF_THRESHOLD);
		if (time != null) {
			double seconds = parseDouble(TIME_DIFF_THRESHOLD, time);
			config.timeDiffThreshold = seconds(Math.max(MIN_TIME_DIFF_SECONDS, seconds));
		}
		String hash = properties.getProperty(HASH_DIFF_THRESHOLD);
		if (hash != null) {
			try {
				config.hashDiffThreshold = Math.max(MIN_HASH_DIFF, Integer.parseInt(hash.trim()));
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException(HASH_DIFF_THRESHOLD + " is not an integer: " + hash, e);
			}
		}
		String strict = properties.getProperty(STRICT_ADJACENCY);
		if (strict != null) {
			config.strictAdjacency = parseBoolean(STRICT_ADJACENCY, strict);
		}
		String formats = properties.getProperty(REQUESTED_FORMATS);
		if (formats != null) {
			EnumSet<OutputFormat> requested = EnumSet.noneOf(OutputFormat.class);
			for (String key : formats.split(",")) {
				if (!key.isBlank()) {
					requested.add(OutputFormat.fromKey(key));
				}
			}
			if (requested.isEmpty()) {
				throw new IllegalArgumentException(REQUESTED_FORMATS + " names no format");
			}
			config.requestedFormats = requested;
		}
		String quality = properties.getProperty(JPEG_QUALITY);
		if (quality != null) {
			double value = parseDouble(JPEG_QUALITY, quality);
			if (value <= 0 || value > 1) {
				throw new IllegalArgumentException(JPEG_QUALITY + " must be in (0, 1]: " + quality);
			}
			config.jpegQuality = (float) value;
		}
		String aligner = properties.getProperty(ALIGNER);
		if (aligner != null) {
			config.featurePipeline = FeaturePipeline.fromKey(aligner);
		}
		String recursive = properties.getProperty(RECURSIVE);
		if (recursive != null) {
			config.recursive = parseBoolean(RECURSIVE, recursive);
		}
		String sort = properties.getProperty(SORT_INTO_FOLDERS);
		if (sort != null) {
			config.sortIntoFolders = parseBoolean(SORT_INTO_FOLDERS, sort);
		}
		return config;
	}

	private static Duration clampTime(Duration threshold) {
		Duration minimum = seconds(MIN_TIME_DIFF_SECONDS);
		return threshold.compareTo(minimum) < 0 ? minimum : threshold;
	}

	private static Duration seconds(double seconds) {
		return Duration.ofNanos(Math.round(seconds * 1_000_000_000L));
	}

	private static EnumSet<OutputFormat> copyOf(Collection<OutputFormat> formats) {
		if (formats.isEmpty()) {
			throw new IllegalArgumentException("at least one output format is required");
		}
		return EnumSet.copyOf(formats);
	}

	private static double parseDouble(String key, String value) {
		try {
			return Double.parseDouble(value.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(key + " is not a number: " + value, e);
		}
	}

	private static boolean parseBoolean(String key, String value) {
		String normalized = value.trim().toLowerCase();
		switch (normalized) {
		case "true":
		case "yes":
		case "1":
			return true;
		case "false":
		case "no":
		case "0":
			return false;
		default:
			throw new IllegalArgumentException(key + " is not a boolean: " + value);
		}
	}
}
