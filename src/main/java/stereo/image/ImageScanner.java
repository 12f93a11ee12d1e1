package stereo.image;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import stereo.jpeg.InvalidStreamException;
import stereo.metadata.ExifMetadataStore;
import stereo.metadata.MetadataStore;

/**
 * Lists the images of a folder with their capture times. MPO files are
 * collected apart since they already hold a pair.
 */
public class ImageScanner {
	private static Logger logger = LogManager.getLogger();

	public static final String PAIRS_FOLDER = "_pairs";
	public static final String SINGLES_FOLDER = "_singles";
	public static final String OUTPUT_PREFIX = "_3d_";

	private final MetadataStore metadata;
	private final ZoneId zone;

	public ImageScanner() {
		this(new ExifMetadataStore(), ZoneId.systemDefault());
	}

	public ImageScanner(MetadataStore metadata, ZoneId zone) {
		this.metadata = metadata;
		this.zone = zone;
	}

	public static final class ScanResult {
		private final List<ImageRecord> images;
		private final List<Path> mpoFiles;

		ScanResult(List<ImageRecord> images, List<Path> mpoFiles) {
			this.images = Collections.unmodifiableList(images);
			this.mpoFiles = Collections.unmodifiableList(mpoFiles);
		}

		public List<ImageRecord> getImages() {
			return images;
		}

		public List<Path> getMpoFiles() {
			return mpoFiles;
		}
	}

	public ScanResult scan(Path folder, boolean recursive) throws IOException {
		logger.entry(folder, recursive);
		List<ImageRecord> images = new ArrayList<>();
		List<Path> mpoFiles = new ArrayList<>();
		Deque<Path> folders = new ArrayDeque<>();
		folders.push(folder);
		while (!folders.isEmpty()) {
			Path current = folders.pop();
			List<Path> children = new ArrayList<>();
			try (DirectoryStream<Path> stream = Files.newDirectoryStream(current)) {
				for (Path child : stream) {
					children.add(child);
				}
			}
			Collections.sort(children);
			for (Path child : children) {
				if (Files.isDirectory(child)) {
					if (recursive && !isSkippedFolder(child)) {
						folders.push(child);
					}
				} else if (isMpo(child)) {
					mpoFiles.add(child);
				} else if (isImage(child)) {
					images.add(record(child));
				}
			}
		}
		logger.info("{}: {} images, {} MPO files", folder, images.size(), mpoFiles.size());
		return logger.traceExit(new ScanResult(images, mpoFiles));
	}

	public ImageRecord record(Path file) throws IOException {
		return new ImageRecord(file, captureTime(file), Files.size(file));
	}

	/**
	 * EXIF digitized time, else EXIF original time, else the last modification
	 * time of the file
	 */
	public LocalDateTime captureTime(Path file) throws IOException {
		if (isJpeg(file)) {
			try {
				LocalDateTime time = ExifMetadataStore.captureTime(metadata.read(file));
				if (time != null) {
					return time;
				}
			} catch (InvalidStreamException e) {
				logger.warn("{}: {}, using the modification time", file, e.getMessage());
			}
		}
		return LocalDateTime.ofInstant(Files.getLastModifiedTime(file).toInstant(), zone);
	}

	static boolean isSkippedFolder(Path folder) {
		String name = folder.getFileName().toString();
		return name.equals(PAIRS_FOLDER) || name.equals(SINGLES_FOLDER) || name.startsWith(OUTPUT_PREFIX);
	}

	static boolean isImage(Path file) {
		String extension = extension(file);
		return isJpeg(file) || extension.equals("png");
	}

	static boolean isJpeg(Path file) {
		String extension = extension(file);
		return extension.equals("jpg") || extension.equals("jpeg");
	}

	static boolean isMpo(Path file) {
		return extension(file).equals("mpo");
	}

	private static String extension(Path file) {
		String name = file.getFileName().toString();
		return name.substring(name.lastIndexOf('.') + 1).toLowerCase();
	}
}
