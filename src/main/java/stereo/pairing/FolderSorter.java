package stereo.pairing;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import stereo.image.ImageRecord;
import stereo.image.ImageScanner;

/**
 * Moves matched images into a {@code _pairs} folder and the unmatched ones
 * into {@code _singles}, both created inside the folder the image was found
 * in. Later scans skip these folders.
 */
public class FolderSorter {
	private static Logger logger = LogManager.getLogger();

	/**
	 * @return the same pairs and singles, pointing at the moved files
	 */
	public MatchResult sort(MatchResult matched) throws IOException {
		logger.entry(matched);
		List<Pair> pairs = new ArrayList<>(matched.getPairs().size());
		for (Pair pair : matched.getPairs()) {
			pairs.add(new Pair(move(pair.getLeft(), ImageScanner.PAIRS_FOLDER),
					move(pair.getRight(), ImageScanner.PAIRS_FOLDER)));
		}
		List<ImageRecord> singles = new ArrayList<>(matched.getSingles().size());
		for (ImageRecord single : matched.getSingles()) {
			singles.add(move(single, ImageScanner.SINGLES_FOLDER));
		}
		logger.info("sorted {} pairs into {} and {} singles into {}", pairs.size(), ImageScanner.PAIRS_FOLDER,
				singles.size(), ImageScanner.SINGLES_FOLDER);
		return logger.traceExit(new MatchResult(pairs, singles));
	}

	ImageRecord move(ImageRecord image, String folderName) throws IOException {
		Path source = image.getPath();
		Path parent = source.toAbsolutePath().getParent();
		if (parent.getFileName() != null && parent.getFileName().toString().equals(folderName)) {
			return image;
		}
		Path target = Files.createDirectories(parent.resolve(folderName)).resolve(source.getFileName());
		try {
			Files.move(source, target);
		} catch (FileAlreadyExistsException e) {
			logger.warn("{} already exists, {} stays where it is", target, source);
			return image;
		}
		return new ImageRecord(target, image.getCaptureTime(), image.getByteSize());
	}
}
