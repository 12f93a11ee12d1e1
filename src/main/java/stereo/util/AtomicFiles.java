package stereo.util;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Writes files through a temporary sibling so a reader never sees a partly
 * written output.
 */
public final class AtomicFiles {
	private static Logger logger = LogManager.getLogger();

	private AtomicFiles() {
	}

	public static void write(Path destination, byte[] bytes) throws IOException {
		Path directory = destination.toAbsolutePath().getParent();
		Path temp = Files.createTempFile(directory, "." + destination.getFileName(), ".part");
		try {
			Files.write(temp, bytes);
			try {
				Files.move(temp, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
			} catch (AtomicMoveNotSupportedException e) {
				logger.debug("atomic move not supported in {}, replacing {}", directory, destination);
				Files.move(temp, destination, StandardCopyOption.REPLACE_EXISTING);
			}
		} catch (IOException e) {
			try {
				Files.deleteIfExists(temp);
			} catch (IOException cleanup) {
				e.addSuppressed(cleanup);
			}
			throw e;
		}
	}
}
