package stereo.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import stereo.batch.BatchProcessor;
import stereo.batch.BatchReport;
import stereo.batch.OutputNames;
import stereo.batch.PairOutcome;
import stereo.config.StereoConfiguration;
import stereo.config.StereoConfigurationFactory;
import stereo.image.ImageRecord;
import stereo.image.ImageScanner;
import stereo.image.ImageScanner.ScanResult;
import stereo.pairing.FolderSorter;
import stereo.pairing.MatchResult;
import stereo.pairing.PairMatcher;
import stereo.similarity.PerceptualHasher;

/**
 * Command line entry: pairs the images of a folder and writes the requested
 * stereo outputs into {@code _3d_<folder>} next to it. A folder holding
 * {@code Left} and {@code Right} sub-folders is paired by file name instead.
 * With {@code recursive} every sub-folder is matched on its own and its outputs
 * land under the same relative path of the output root.
 *
 * <pre>
 * StereoBatchRunner &lt;folder&gt; [config.properties]
 * </pre>
 */
public class StereoBatchRunner {
	private static Logger logger = LogManager.getLogger();

	static final String LEFT_FOLDER = "Left";
	static final String RIGHT_FOLDER = "Right";

	private final StereoConfiguration config;
	private final ImageScanner scanner;
	private final PairMatcher matcher;
	private final FolderSorter sorter;
	private final BatchProcessor processor;

	public StereoBatchRunner(StereoConfiguration config) {
		this(config, new ImageScanner(), new PairMatcher(new PerceptualHasher()), new FolderSorter(),
				new BatchProcessor(config));
	}

	StereoBatchRunner(StereoConfiguration config, ImageScanner scanner, PairMatcher matcher, FolderSorter sorter,
			BatchProcessor processor) {
		this.config = config;
		this.scanner = scanner;
		this.matcher = matcher;
		this.sorter = sorter;
		this.processor = processor;
	}

	public static Path outputRoot(Path folder) {
		Path absolute = folder.toAbsolutePath().normalize();
		Path parent = absolute.getParent() == null ? absolute : absolute.getParent();
		return parent.resolve(ImageScanner.OUTPUT_PREFIX + absolute.getFileName());
	}

	/**
	 * @return per folder the report of the pair batch, followed by the one of the
	 *         MPO batch if the folder held MPO files
	 */
	public List<BatchReport> process(Path folder) throws IOException, InterruptedException, ExecutionException {
		logger.entry(folder);
		logger.info("processing {} with {}", folder, config);
		Path root = outputRoot(folder);
		List<BatchReport> reports = new ArrayList<>();
		Path left = folder.resolve(LEFT_FOLDER);
		Path right = folder.resolve(RIGHT_FOLDER);
		if (Files.isDirectory(left) && Files.isDirectory(right)) {
			ScanResult leftScan = scanner.scan(left, false);
			ScanResult rightScan = scanner.scan(right, false);
			MatchResult matched = PairMatcher.matchFolders(leftScan.getImages(), rightScan.getImages());
			runBatches(matched, leftScan.getMpoFiles(), root, reports);
			return logger.traceExit(reports);
		}

		ScanResult scan = scanner.scan(folder, config.isRecursive());
		Map<Path, List<ImageRecord>> images = new TreeMap<>();
		for (ImageRecord image : scan.getImages()) {
			images.computeIfAbsent(image.getPath().getParent(), k -> new ArrayList<>()).add(image);
		}
		Map<Path, List<Path>> mpoFiles = new TreeMap<>();
		for (Path file : scan.getMpoFiles()) {
			mpoFiles.computeIfAbsent(file.getParent(), k -> new ArrayList<>()).add(file);
		}
		Set<Path> folders = new TreeSet<>(images.keySet());
		folders.addAll(mpoFiles.keySet());
		for (Path current : folders) {
			MatchResult matched = matcher.match(images.getOrDefault(current, Collections.emptyList()), config);
			if (config.isSortIntoFolders()) {
				matched = sorter.sort(matched);
			}
			Path target = root.resolve(folder.relativize(current).toString());
			if (!runBatches(matched, mpoFiles.getOrDefault(current, Collections.emptyList()), target, reports)) {
				logger.warn("batch cancelled, {} is not processed further", folder);
				break;
			}
		}
		return logger.traceExit(reports);
	}

	/**
	 * @return false when a batch was cancelled
	 */
	private boolean runBatches(MatchResult matched, List<Path> mpoFiles, Path target, List<BatchReport> reports)
			throws InterruptedException, ExecutionException {
		for (ImageRecord single : matched.getSingles()) {
			logger.info("no pair for {}", single.getPath());
		}
		OutputNames names = new OutputNames();
		BatchReport pairs = processor.submit(matched.getPairs(), target, names).get();
		reports.add(pairs);
		if (pairs.isCancelled()) {
			return false;
		}
		if (!mpoFiles.isEmpty()) {
			BatchReport mpo = processor.submitMpo(mpoFiles, target, names).get();
			reports.add(mpo);
			return !mpo.isCancelled();
		}
		return true;
	}

	public void shutdown() {
		processor.shutdown();
	}

	public static void main(String[] args) {
		if (args.length < 1 || args.length > 2) {
			System.err.println("usage: StereoBatchRunner <folder> [config.properties]");
			System.exit(2);
		}
		Path folder = Paths.get(args[0]);
		StereoBatchRunner runner = null;
		try {
			StereoConfiguration config = args.length == 2 ? StereoConfigurationFactory.fromFile(Paths.get(args[1]))
					: StereoConfigurationFactory.defaults();
			runner = new StereoBatchRunner(config);
			for (BatchReport report : runner.process(folder)) {
				System.out.println(report);
				for (PairOutcome skipped : report.getSkipped()) {
					System.out.println("  " + skipped);
				}
			}
		} catch (IOException | IllegalArgumentException | ExecutionException e) {
			logger.error("batch over {} failed", folder, e);
			System.exit(1);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.error("interrupted while waiting for the batch over {}", folder);
			System.exit(1);
		} finally {
			if (runner != null) {
				runner.shutdown();
			}
		}
	}
}
