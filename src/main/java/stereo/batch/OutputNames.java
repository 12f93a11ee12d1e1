package stereo.batch;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Output name stems handed out for one output root. The first source gets its
 * file name without extension; a later source with the same stem gets the
 * extension appended ({@code a_png}), then a counter.
 */
public class OutputNames {
	private static Logger logger = LogManager.getLogger();

	private final Set<String> claimed = new HashSet<>();

	public synchronized String claim(Path source) {
		String name = source.getFileName().toString();
		int dot = name.lastIndexOf('.');
		String stem = dot <= 0 ? name : name.substring(0, dot);
		if (claimed.add(stem)) {
			return stem;
		}
		String base = dot <= 0 ? stem : stem + "_" + name.substring(dot + 1).toLowerCase();
		String candidate = base;
		for (int i = 2; !claimed.add(candidate); i++) {
			candidate = base + "_" + i;
		}
		logger.warn("output name {} is taken, {} is written as {}", stem, source, candidate);
		return candidate;
	}
}
