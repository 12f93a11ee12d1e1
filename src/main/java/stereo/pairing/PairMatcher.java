package stereo.pairing;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import stereo.config.StereoConfiguration;
import stereo.image.DecodeException;
import stereo.image.ImageRecord;
import stereo.similarity.Fingerprint;
import stereo.similarity.PerceptualHasher;

/**
 * Groups timestamped images into left/right pairs. All state of a run (the
 * used set and the fingerprint cache) lives inside one {@link #match} call.
 */
public class PairMatcher {
	private static Logger logger = LogManager.getLogger();

	static final Duration STRICT_MIN_GAP = Duration.ofSeconds(1);
	static final Duration STRICT_MAX_GAP = Duration.ofSeconds(4);

	private static final Comparator<ImageRecord> BY_CAPTURE_TIME = Comparator.comparing(ImageRecord::getCaptureTime,
			Comparator.nullsFirst(Comparator.<LocalDateTime>naturalOrder()));

	public interface FingerprintSource {
		Fingerprint fingerprint(ImageRecord image) throws DecodeException;
	}

	private final FingerprintSource fingerprints;

	public PairMatcher(PerceptualHasher hasher) {
		this(hasher::fingerprint);
	}

	public PairMatcher(FingerprintSource fingerprints) {
		this.fingerprints = fingerprints;
	}

	public MatchResult match(Collection<ImageRecord> images, StereoConfiguration config) {
		MatchResult result = config.isStrictAdjacency() ? matchStrictAdjacency(images)
				: matchGreedy(images, config.getTimeDiffThreshold(), config.getHashDiffThreshold());
		logger.info("matched {} images: {}", images.size(), result);
		return result;
	}

	/**
	 * Accepts adjacent images (in capture order) that are 1 to 4 seconds apart
	 * with no other capture time strictly between them. A rejected candidate
	 * moves the scan on by one image, so its later member can still pair with
	 * the image after it.
	 */
	public MatchResult matchStrictAdjacency(Collection<ImageRecord> images) {
		List<ImageRecord> singles = new ArrayList<>();
		List<ImageRecord> timed = new ArrayList<>();
		for (ImageRecord image : images) {
			if (image.hasCaptureTime()) {
				timed.add(image);
			} else {
				logger.warn("no capture time for {}, left single", image.getPath());
				singles.add(image);
			}
		}
		timed.sort(BY_CAPTURE_TIME);

		List<Pair> pairs = new ArrayList<>();
		Set<ImageRecord> used = new HashSet<>();
		int i = 0;
		while (i < timed.size() - 1) {
			ImageRecord first = timed.get(i);
			ImageRecord second = timed.get(i + 1);
			Duration gap = Duration.between(first.getCaptureTime(), second.getCaptureTime());
			if (gap.compareTo(STRICT_MIN_GAP) >= 0 && gap.compareTo(STRICT_MAX_GAP) <= 0) {
				ImageRecord between = findBetween(timed, first.getCaptureTime(), second.getCaptureTime());
				if (between == null) {
					pairs.add(new Pair(first, second));
					used.add(first);
					used.add(second);
					logger.info("paired {} and {} ({} ms apart)", first.getName(), second.getName(), gap.toMillis());
					i += 2;
				} else {
					logger.warn("skipped {} and {}: {} lies between", first.getName(), second.getName(), between.getName());
					i += 1;
				}
			} else {
				logger.debug("skipped {} and {}: {} ms apart", first.getName(), second.getName(), gap.toMillis());
				i += 1;
			}
		}
		for (ImageRecord image : timed) {
			if (!used.contains(image)) {
				singles.add(image);
			}
		}
		return new MatchResult(pairs, singles);
	}

	private static ImageRecord findBetween(List<ImageRecord> images, LocalDateTime from, LocalDateTime to) {
		for (ImageRecord other : images) {
			LocalDateTime time = other.getCaptureTime();
			if (time.isAfter(from) && time.isBefore(to)) {
				return other;
			}
		}
		return null;
	}

	/**
	 * First-fit pairing: every unused image takes the first later unused image
	 * inside the time window whose fingerprint is closer than the threshold. A
	 * committed pair is never revisited.
	 */
	public MatchResult matchGreedy(Collection<ImageRecord> images, Duration timeDiffThreshold, int hashDiffThreshold) {
		List<ImageRecord> sorted = new ArrayList<>(images);
		sorted.sort(BY_CAPTURE_TIME);

		List<Pair> pairs = new ArrayList<>();
		Set<ImageRecord> used = new HashSet<>();
		Map<ImageRecord, Fingerprint> cache = new HashMap<>();
		Set<ImageRecord> unreadable = new HashSet<>();

		for (int i = 0; i < sorted.size(); i++) {
			ImageRecord a = sorted.get(i);
			if (used.contains(a) || !a.hasCaptureTime()) {
				continue;
			}
			Fingerprint fingerprintA = fingerprint(a, cache, unreadable);
			if (fingerprintA == null) {
				continue;
			}
			for (int j = i + 1; j < sorted.size(); j++) {
				ImageRecord b = sorted.get(j);
				Duration gap = Duration.between(a.getCaptureTime(), b.getCaptureTime()).abs();
				if (gap.compareTo(timeDiffThreshold) > 0) {
					break;
				}
				if (used.contains(b)) {
					continue;
				}
				Fingerprint fingerprintB = fingerprint(b, cache, unreadable);
				if (fingerprintB == null) {
					continue;
				}
				int distance = fingerprintA.distance(fingerprintB);
				logger.debug("hash difference of {} and {} is {}", a.getName(), b.getName(), distance);
				if (distance < hashDiffThreshold) {
					pairs.add(new Pair(a, b));
					used.add(a);
					used.add(b);
					logger.info("paired {} and {} (hash difference {})", a.getName(), b.getName(), distance);
					break;
				}
			}
		}

		List<ImageRecord> singles = new ArrayList<>();
		for (ImageRecord image : sorted) {
			if (!used.contains(image)) {
				singles.add(image);
			}
		}
		return new MatchResult(pairs, singles);
	}

	private Fingerprint fingerprint(ImageRecord image, Map<ImageRecord, Fingerprint> cache, Set<ImageRecord> unreadable) {
		if (unreadable.contains(image)) {
			return null;
		}
		Fingerprint fingerprint = cache.get(image);
		if (fingerprint == null) {
			try {
				fingerprint = fingerprints.fingerprint(image);
				cache.put(image, fingerprint);
			} catch (DecodeException e) {
				logger.error("cannot fingerprint {}, it will stay single: {}", image.getPath(), e.getMessage());
				unreadable.add(image);
			}
		}
		return fingerprint;
	}

	/**
	 * Pairs the contents of separate Left and Right folders by file name order.
	 * Surplus files on either side stay single.
	 */
	public static MatchResult matchFolders(Collection<ImageRecord> leftImages, Collection<ImageRecord> rightImages) {
		List<ImageRecord> left = new ArrayList<>(leftImages);
		List<ImageRecord> right = new ArrayList<>(rightImages);
		left.sort(Comparator.comparing(ImageRecord::getName));
		right.sort(Comparator.comparing(ImageRecord::getName));

		int count = Math.min(left.size(), right.size());
		List<Pair> pairs = new ArrayList<>();
		for (int i = 0; i < count; i++) {
			pairs.add(new Pair(left.get(i), right.get(i)));
		}
		List<ImageRecord> singles = new ArrayList<>(left.subList(count, left.size()));
		singles.addAll(right.subList(count, right.size()));
		return new MatchResult(pairs, singles);
	}
}
