package stereo.config;

/**
 * Outputs a batch can produce for each pair. The directory and name affixes
 * follow the folder convention of the stereo tools (rc, ii, xi, lrl, mpo, l, r).
 */
public enum OutputFormat {
	ANAGLYPH("anaglyph", "rc", "rc_", "", "jpg"),
	SIDE_BY_SIDE("side_by_side", "ii", "ii_", "", "jpg"),
	SIDE_BY_SIDE_REVERSED("side_by_side_reversed", "xi", "xi_", "", "jpg"),
	LEFT_RIGHT_LEFT("left_right_left", "lrl", "lrl_", "", "jpg"),
	MPO("mpo", "mpo", "", "", "mpo"),
	LEFT("left", "l", "", "_l", "jpg"),
	RIGHT("right", "r", "", "_r", "jpg");

	private final String key;
	private final String directory;
	private final String prefix;
	private final String suffix;
	private final String extension;

	OutputFormat(String key, String directory, String prefix, String suffix, String extension) {
		this.key = key;
		this.directory = directory;
		this.prefix = prefix;
		this.suffix = suffix;
		this.extension = extension;
	}

	public String getKey() {
		return key;
	}

	public String getDirectory() {
		return directory;
	}

	public String fileName(String baseName) {
		return prefix + baseName + suffix + "." + extension;
	}

	/**
	 * true for the formats built from decoded pixels rather than raw JPEG bytes
	 */
	public boolean isPixelFormat() {
		return this != MPO;
	}

	public static OutputFormat fromKey(String key) {
		String normalized = key.trim().toLowerCase();
		for (OutputFormat format : values()) {
			if (format.key.equals(normalized)) {
				return format;
			}
		}
		throw new IllegalArgumentException("unknown output format: " + key);
	}
}
