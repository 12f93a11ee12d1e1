package stereo.pairing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import stereo.image.ImageRecord;

public class FolderSorterTest {
	private static final LocalDateTime NOON = LocalDateTime.of(2023, 5, 1, 12, 0, 0);

	@TempDir
	Path dir;

	private final FolderSorter sorter = new FolderSorter();

	private ImageRecord image(Path folder, String name) throws Exception {
		Path file = Files.write(Files.createDirectories(folder).resolve(name), new byte[] { 1, 2, 3 });
		return new ImageRecord(file, NOON, 3);
	}

	@Test
	public void pairsAndSinglesMoveBesideTheirFolder() throws Exception {
		ImageRecord left = image(dir, "l.jpg");
		ImageRecord right = image(dir, "r.jpg");
		ImageRecord single = image(dir.resolve("sub"), "s.jpg");

		MatchResult sorted = sorter.sort(new MatchResult(Collections.singletonList(new Pair(left, right)),
				Collections.singletonList(single)));

		Pair moved = sorted.getPairs().get(0);
		assertEquals(dir.resolve("_pairs").resolve("l.jpg"), moved.getLeft().getPath());
		assertEquals(dir.resolve("_pairs").resolve("r.jpg"), moved.getRight().getPath());
		assertEquals(NOON, moved.getLeft().getCaptureTime());
		assertEquals(dir.resolve("sub").resolve("_singles").resolve("s.jpg"), sorted.getSingles().get(0).getPath());
		assertFalse(Files.exists(left.getPath()));
		assertTrue(Files.isRegularFile(moved.getRight().getPath()));
	}

	@Test
	public void existingTargetLeavesImageInPlace() throws Exception {
		ImageRecord single = image(dir, "dup.jpg");
		image(dir.resolve("_singles"), "dup.jpg");

		MatchResult sorted = sorter.sort(new MatchResult(Collections.emptyList(), Arrays.asList(single)));

		assertSame(single, sorted.getSingles().get(0));
		assertTrue(Files.isRegularFile(single.getPath()));
	}

	@Test
	public void imageAlreadyInSinglesStays() throws Exception {
		ImageRecord single = image(dir.resolve("_singles"), "old.jpg");

		MatchResult sorted = sorter.sort(new MatchResult(Collections.emptyList(), Arrays.asList(single)));

		assertSame(single, sorted.getSingles().get(0));
	}
}
