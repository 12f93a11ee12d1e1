package stereo.batch;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import stereo.alignment.AlignerConfigurationFactory;
import stereo.alignment.AlignmentException;
import stereo.alignment.AlignmentResult;
import stereo.alignment.GeometricAligner;
import stereo.alignment.ImageAligner;
import stereo.composition.DimensionMismatchException;
import stereo.composition.StereogramCompositor;
import stereo.config.OutputFormat;
import stereo.config.StereoConfiguration;
import stereo.image.DecodeException;
import stereo.image.ImageLoader;
import stereo.jpeg.InvalidStreamException;
import stereo.mpo.MpoContainer;
import stereo.mpo.MpoDecoder;
import stereo.mpo.MpoEncoder;
import stereo.pairing.Pair;
import stereo.util.AtomicFiles;

/**
 * Turns pairs into the requested outputs under one output root. A batch runs
 * on a single worker, one pair after the other; a pair that fails is logged,
 * recorded and skipped.
 */
public class BatchProcessor {
	private static Logger logger = LogManager.getLogger();

	private final StereoConfiguration config;
	private final ImageAligner aligner;
	private final MpoEncoder encoder;
	private final MpoDecoder decoder = new MpoDecoder();
	private final StereogramCompositor compositor = new StereogramCompositor();
	private final PauseToken pauseToken = new PauseToken();
	private final ExecutorService worker = Executors.newSingleThreadExecutor();
	private ProgressListener progressListener = (done, total) -> {
	};

	public BatchProcessor(StereoConfiguration config) {
		this(config, new GeometricAligner(AlignerConfigurationFactory.of(config.getFeaturePipeline())),
				new MpoEncoder());
	}

	public BatchProcessor(StereoConfiguration config, ImageAligner aligner, MpoEncoder encoder) {
		this.config = config;
		this.aligner = aligner;
		this.encoder = encoder;
	}

	public PauseToken getPauseToken() {
		return pauseToken;
	}

	public void setProgressListener(ProgressListener progressListener) {
		this.progressListener = progressListener;
	}

	/**
	 * Runs the batch on the worker thread. An output root that cannot be created
	 * fails the future with an {@link IOException}.
	 */
	public Future<BatchReport> submit(List<Pair> pairs, Path outputRoot) {
		return submit(pairs, outputRoot, new OutputNames());
	}

	/**
	 * Same, with output names shared with other batches writing to the same
	 * root.
	 */
	public Future<BatchReport> submit(List<Pair> pairs, Path outputRoot, OutputNames names) {
		return worker.submit(() -> run(pairs, outputRoot, names));
	}

	public Future<BatchReport> submitMpo(List<Path> mpoFiles, Path outputRoot) {
		return submitMpo(mpoFiles, outputRoot, new OutputNames());
	}

	public Future<BatchReport> submitMpo(List<Path> mpoFiles, Path outputRoot, OutputNames names) {
		return worker.submit(() -> runMpo(mpoFiles, outputRoot, names));
	}

	public void shutdown() {
		worker.shutdown();
	}

	public BatchReport run(List<Pair> pairs, Path outputRoot) throws IOException {
		return run(pairs, outputRoot, new OutputNames());
	}

	public BatchReport run(List<Pair> pairs, Path outputRoot, OutputNames names) throws IOException {
		logger.entry(pairs.size(), outputRoot);
		Files.createDirectories(outputRoot);
		List<PairOutcome> outcomes = new ArrayList<>();
		boolean cancelled = false;
		for (Pair pair : pairs) {
			if (!awaitRunnable()) {
				cancelled = true;
				break;
			}
			outcomes.add(process(pair, outputRoot, names));
			progressListener.progress(outcomes.size(), pairs.size());
		}
		BatchReport report = new BatchReport(outcomes, cancelled);
		logger.info("batch into {}: {}", outputRoot, report);
		return logger.traceExit(report);
	}

	/**
	 * Splits MPO files into their views and writes the requested pixel formats.
	 * The views of an MPO are used as they are, without alignment.
	 */
	public BatchReport runMpo(List<Path> mpoFiles, Path outputRoot) throws IOException {
		return runMpo(mpoFiles, outputRoot, new OutputNames());
	}

	public BatchReport runMpo(List<Path> mpoFiles, Path outputRoot, OutputNames names) throws IOException {
		logger.entry(mpoFiles.size(), outputRoot);
		Files.createDirectories(outputRoot);
		List<PairOutcome> outcomes = new ArrayList<>();
		boolean cancelled = false;
		for (Path file : mpoFiles) {
			if (!awaitRunnable()) {
				cancelled = true;
				break;
			}
			outcomes.add(processMpo(file, outputRoot, names));
			progressListener.progress(outcomes.size(), mpoFiles.size());
		}
		BatchReport report = new BatchReport(outcomes, cancelled);
		logger.info("MPO batch into {}: {}", outputRoot, report);
		return logger.traceExit(report);
	}

	private boolean awaitRunnable() {
		try {
			return pauseToken.awaitRunnable();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.warn("batch worker interrupted, stopping");
			return false;
		}
	}

	PairOutcome process(Pair pair, Path outputRoot, OutputNames names) {
		String baseName = names.claim(pair.getLeft().getPath());
		List<Path> outputs = new ArrayList<>();
		try {
			if (config.needsAlignment()) {
				AlignmentResult aligned = aligner.align(pair.getLeft(), pair.getRight());
				for (OutputFormat format : config.getRequestedFormats()) {
					if (format.isPixelFormat()) {
						BufferedImage image = compositor.compose(format, aligned.getLeft(), aligned.getAlignedRight());
						outputs.add(writeJpeg(image, format, baseName, outputRoot));
					}
				}
			}
			if (config.getRequestedFormats().contains(OutputFormat.MPO)) {
				Path destination = destination(OutputFormat.MPO, baseName, outputRoot);
				encoder.encode(pair.getLeft().getPath(), pair.getRight().getPath(), destination);
				outputs.add(destination);
			}
		} catch (DecodeException | AlignmentException | InvalidStreamException | IOException
				| DimensionMismatchException e) {
			logger.error("skipping {} and {}: {}", pair.getLeft().getPath(), pair.getRight().getPath(), e.getMessage());
			return PairOutcome.skipped(pair, reason(e), outputs);
		} catch (RuntimeException e) {
			logger.error("skipping {} and {}", pair.getLeft().getPath(), pair.getRight().getPath(), e);
			return PairOutcome.skipped(pair, reason(e), outputs);
		}
		logger.debug("{} -> {}", pair, outputs);
		return PairOutcome.done(pair, outputs);
	}

	PairOutcome processMpo(Path file, Path outputRoot, OutputNames names) {
		String name = file.getFileName().toString();
		String baseName = names.claim(file);
		List<Path> outputs = new ArrayList<>();
		try {
			MpoContainer container = decoder.decode(file);
			BufferedImage left = null;
			BufferedImage right = null;
			for (OutputFormat format : config.getRequestedFormats()) {
				if (format == OutputFormat.MPO) {
					continue;
				}
				Path destination = destination(format, baseName, outputRoot);
				if (format == OutputFormat.LEFT) {
					// the views keep their own metadata
					AtomicFiles.write(destination, container.getStream1());
				} else if (format == OutputFormat.RIGHT) {
					AtomicFiles.write(destination, container.getStream2());
				} else {
					if (left == null) {
						left = ImageLoader.decode(container.getStream1(), name + " left view");
						right = ImageLoader.decode(container.getStream2(), name + " right view");
					}
					AtomicFiles.write(destination,
							ImageLoader.encodeJpeg(compositor.compose(format, left, right), config.getJpegQuality()));
				}
				outputs.add(destination);
			}
		} catch (DecodeException | InvalidStreamException | IOException | DimensionMismatchException e) {
			logger.error("skipping {}: {}", file, e.getMessage());
			return PairOutcome.skipped(file.toString(), reason(e), outputs);
		} catch (RuntimeException e) {
			logger.error("skipping {}", file, e);
			return PairOutcome.skipped(file.toString(), reason(e), outputs);
		}
		return PairOutcome.done(file.toString(), outputs);
	}

	private static String reason(Exception e) {
		return e.getClass().getSimpleName() + ": " + e.getMessage();
	}

	private Path writeJpeg(BufferedImage image, OutputFormat format, String baseName, Path outputRoot)
			throws IOException {
		Path destination = destination(format, baseName, outputRoot);
		AtomicFiles.write(destination, ImageLoader.encodeJpeg(image, config.getJpegQuality()));
		return destination;
	}

	private static Path destination(OutputFormat format, String baseName, Path outputRoot) throws IOException {
		Path directory = Files.createDirectories(outputRoot.resolve(format.getDirectory()));
		return directory.resolve(format.fileName(baseName));
	}
}
