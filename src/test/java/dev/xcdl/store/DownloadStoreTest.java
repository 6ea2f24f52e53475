package dev.xcdl.store;

import static org.assertj.core.api.Assertions.*;

import dev.xcdl.model.DownloadRecord;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DownloadStoreTest {

	@TempDir
	Path tempDir;

	@Test
	void testRecordsSurviveReload() {
		// Given
		Path file = tempDir.resolve(".downloaded.json");
		DownloadStore store = new DownloadStore(file);
		store.load();

		// When
		assertThat(store.record("series:7", "Show S01E01.mkv", 812.4)).isTrue();
		assertThat(store.record("movie:42", "Some Movie.mp4", 1500.25)).isTrue();
		DownloadStore reloaded = new DownloadStore(file);
		reloaded.load();

		// Then
		assertThat(reloaded.size()).isEqualTo(2);
		assertThat(reloaded.all().keySet()).containsExactly("movie:42", "series:7");
		DownloadRecord record = reloaded.get("movie:42").orElseThrow();
		assertThat(record.filename()).isEqualTo("Some Movie.mp4");
		assertThat(record.sizeMegabytes()).isEqualTo(1500.25);
		assertThat(record.downloadedAtInstant()).isBeforeOrEqualTo(Instant.now());
	}

	@Test
	void testFileFormat() throws Exception {
		// Given
		Path file = tempDir.resolve("records.json");
		Files.writeString(file, """
				{"movie:42": {"downloaded_at": 1700000000, "filename": "Some Movie.mp4", "size_mb": 1500.25}}
				""");

		// When
		DownloadStore store = new DownloadStore(file);
		store.load();
		store.save();

		// Then
		assertThat(store.get("movie:42").orElseThrow().downloadedAt()).isEqualTo(1700000000L);
		String json = Files.readString(file);
		assertThat(json)
				.contains("\"downloaded_at\" : 1700000000")
				.contains("\"filename\" : \"Some Movie.mp4\"")
				.contains("\"size_mb\" : 1500.25");
		assertThat(json.indexOf("downloaded_at")).isLessThan(json.indexOf("size_mb"));
	}

	@Test
	void testMissingFileGivesEmptyStore() {
		DownloadStore store = new DownloadStore(tempDir.resolve("missing.json"));
		store.load();

		assertThat(store.size()).isZero();
		assertThat(store.contains("movie:1")).isFalse();
	}

	@Test
	void testCorruptFileIsBackedUp() throws Exception {
		// Given
		Path file = tempDir.resolve(".downloaded.json");
		Files.writeString(file, "{ this is not json");

		// When
		DownloadStore store = new DownloadStore(file);
		store.load();

		// Then
		assertThat(store.size()).isZero();
		assertThat(Files.exists(file)).isFalse();
		assertThat(store.backupFile()).isEqualTo(tempDir.resolve(".downloaded.json.backup"));
		assertThat(Files.readString(store.backupFile(), StandardCharsets.UTF_8)).isEqualTo("{ this is not json");

		assertThat(store.record("movie:1", "One.mp4", 10)).isTrue();
		assertThat(Files.exists(file)).isTrue();
	}

	@Test
	void testFailedMoveKeepsPreviousFile() throws Exception {
		// Given
		Path file = tempDir.resolve(".downloaded.json");
		DownloadStore good = new DownloadStore(file);
		good.load();
		good.record("movie:1", "One.mp4", 10);
		String before = Files.readString(file);

		DownloadStore store = new DownloadStore(file, (source, target) -> {
			throw new IOException("Disk full");
		});
		store.load();

		// When
		boolean written = store.record("movie:2", "Two.mp4", 20);

		// Then
		assertThat(written).isFalse();
		assertThat(store.contains("movie:2")).isFalse();
		assertThat(store.contains("movie:1")).isTrue();
		assertThat(Files.readString(file)).isEqualTo(before);
		try (Stream<Path> files = Files.list(tempDir)) {
			assertThat(files.map(p -> p.getFileName().toString())).containsExactly(".downloaded.json");
		}
	}

	@Test
	void testFailedRemoveKeepsRecord() {
		Path file = tempDir.resolve(".downloaded.json");
		DownloadStore good = new DownloadStore(file);
		good.load();
		good.record("movie:1", "One.mp4", 10);

		DownloadStore store = new DownloadStore(file, (source, target) -> {
			throw new IOException("Read-only file system");
		});
		store.load();

		assertThat(store.remove("movie:1")).isEqualTo(StoreUpdate.WRITE_FAILED);
		assertThat(store.contains("movie:1")).isTrue();
		assertThat(store.remove("movie:404")).isEqualTo(StoreUpdate.NOT_FOUND);
	}

	@Test
	void testWriteToMissingDirectoryFails() {
		DownloadStore store = new DownloadStore(tempDir.resolve("nope").resolve("records.json"));
		store.load();

		assertThat(store.record("movie:1", "One.mp4", 10)).isFalse();
		assertThat(store.size()).isZero();
	}

	@Test
	void testRecordFileTakesSizeFromFile() throws Exception {
		// Given
		DownloadStore store = new DownloadStore(tempDir.resolve(".downloaded.json"));
		store.load();
		Path media = tempDir.resolve("Some Movie.mp4");
		Files.write(media, new byte[2 * 1024 * 1024]);

		// When
		boolean present = store.recordFile("movie:42", "Some Movie.mp4", media);
		boolean missing = store.recordFile("movie:43", "Gone.mp4", tempDir.resolve("Gone.mp4"));

		// Then
		assertThat(present).isTrue();
		assertThat(missing).isTrue();
		assertThat(store.get("movie:42").orElseThrow().sizeMegabytes()).isEqualTo(2.0);
		assertThat(store.get("movie:43").orElseThrow().sizeMegabytes()).isZero();
		assertThat(store.isFilenameRecorded("Some Movie.mp4", "movie:43")).isTrue();
		assertThat(store.isFilenameRecorded("Some Movie.mp4", "movie:42")).isFalse();
	}
}
