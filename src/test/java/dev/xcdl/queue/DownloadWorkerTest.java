package dev.xcdl.queue;

import static org.assertj.core.api.Assertions.*;

import dev.xcdl.model.DownloadRecord;
import dev.xcdl.model.DownloadStatus;
import dev.xcdl.model.Kind;
import dev.xcdl.model.ProgressSnapshot;
import dev.xcdl.util.FileUtils;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

@Timeout(30)
class DownloadWorkerTest {
	private static final int MB = (int) FileUtils.MEGABYTE;

	@TempDir
	Path tempDir;

	private FakeCatalogProvider provider;
	private QueueManager manager;
	private final List<ProgressSnapshot> snapshots = new CopyOnWriteArrayList<>();

	@BeforeEach
	void setUp() {
		provider = new FakeCatalogProvider();
		DownloaderConfig config = DownloaderConfig.defaults(tempDir).withDelays(Duration.ZERO, Duration.ZERO);
		manager = new QueueManager(config, provider);
		manager.progress().addListener(snapshots::add);
		manager.start();
	}

	@AfterEach
	void tearDown() throws Exception {
		manager.close();
	}

	@Test
	void testDownloadCompletes() throws Exception {
		// Given
		provider.addContent(Kind.MOVIE, "42", "mp4", new byte[10 * MB]);

		// When
		EnqueueResult result = manager.enqueue(Kind.MOVIE, "42", "mp4", "Some Movie");
		manager.awaitCompletion();

		// Then
		assertThat(result.isQueued()).isTrue();
		Path file = tempDir.resolve("Some Movie.mp4");
		assertThat(Files.size(file)).isEqualTo(10L * MB);

		assertThat(snapshots.stream()
						.filter(s -> s.status() == DownloadStatus.DOWNLOADING)
						.map(ProgressSnapshot::percent))
				.containsExactly(10, 20, 30, 40, 50, 60, 70, 80, 90, 100);
		assertThat(snapshots)
				.extracting(ProgressSnapshot::status)
				.containsSubsequence(DownloadStatus.STARTING, DownloadStatus.DOWNLOADING, DownloadStatus.COMPLETE);

		DownloadRecord record = manager.downloadedRecords().get("movie:42");
		assertThat(record).isNotNull();
		assertThat(record.filename()).isEqualTo("Some Movie.mp4");
		assertThat(record.sizeMegabytes()).isEqualTo(10.0);
		assertThat(manager.getCompletedCount()).isEqualTo(1);
		assertThat(manager.getFailedCount()).isZero();
		assertThat(manager.enqueue(Kind.MOVIE, "42", "mp4", "Some Movie").outcome())
				.isEqualTo(EnqueueResult.Outcome.ALREADY_DOWNLOADED);
	}

	@Test
	void testJobsRunInQueueOrder() throws Exception {
		// Given
		manager.pause();
		provider.addContent(Kind.MOVIE, "1", "mp4", new byte[2 * MB]);
		provider.addContent(Kind.MOVIE, "2", "mp4", new byte[2 * MB]);
		provider.addContent(Kind.MOVIE, "3", "mp4", new byte[2 * MB]);
		String one = manager.enqueue(Kind.MOVIE, "1", "mp4", "One").jobId();
		manager.enqueue(Kind.MOVIE, "2", "mp4", "Two");
		String three = manager.enqueue(Kind.MOVIE, "3", "mp4", "Three").jobId();
		manager.reorder(List.of(three, one));

		// When
		manager.resume();
		manager.awaitCompletion();

		// Then
		assertThat(provider.getOpenedUrls())
				.containsExactly("fake://movie/3.mp4", "fake://movie/1.mp4", "fake://movie/2.mp4");
		assertThat(manager.getCompletedCount()).isEqualTo(3);
	}

	@Test
	void testStopDuringTransferKeepsPartialFile() throws Exception {
		// Given
		provider.addContent(Kind.MOVIE, "42", "mp4", new byte[10 * MB]);
		provider.onRead(Kind.MOVIE, "42", "mp4", 3L * MB, () -> manager.stop());

		// When
		manager.enqueue(Kind.MOVIE, "42", "mp4", "Some Movie");
		manager.awaitCompletion();

		// Then
		assertThat(Files.size(tempDir.resolve("Some Movie.mp4"))).isEqualTo(3L * MB);
		assertThat(manager.isDownloaded("movie:42")).isFalse();
		assertThat(manager.currentProgress().status()).isEqualTo(DownloadStatus.STOPPED);
		assertThat(manager.getCompletedCount()).isZero();
		assertThat(manager.getFailedCount()).isZero();
	}

	@Test
	void testStoppedQueueHoldsJobsUntilResumed() throws Exception {
		// Given
		provider.addContent(Kind.MOVIE, "1", "mp4", new byte[2 * MB]);
		manager.stop();

		// When
		manager.enqueue(Kind.MOVIE, "1", "mp4", "One");
		manager.awaitCompletion();

		// Then
		assertThat(provider.getOpenedUrls()).isEmpty();
		assertThat(manager.listQueue()).hasSize(1);

		manager.resume();
		manager.awaitCompletion();
		assertThat(manager.isDownloaded("movie:1")).isTrue();
	}

	@Test
	void testPauseDuringTransferWaitsAtChunkBoundary() throws Exception {
		// Given
		CountDownLatch paused = new CountDownLatch(1);
		manager.progress().addListener(s -> {
			if (s.status() == DownloadStatus.PAUSED) {
				paused.countDown();
			}
		});
		provider.addContent(Kind.MOVIE, "42", "mp4", new byte[4 * MB]);
		provider.onRead(Kind.MOVIE, "42", "mp4", 2L * MB, () -> manager.pause());

		// When
		manager.enqueue(Kind.MOVIE, "42", "mp4", "Some Movie");
		assertThat(paused.await(10, TimeUnit.SECONDS)).isTrue();

		// Then
		ProgressSnapshot snapshot = manager.currentProgress();
		assertThat(snapshot.bytesDownloaded()).isEqualTo(2L * MB);
		assertThat(snapshot.percent()).isEqualTo(50);
		assertThat(Files.size(tempDir.resolve("Some Movie.mp4"))).isEqualTo(2L * MB);

		manager.resume();
		manager.awaitCompletion();
		assertThat(Files.size(tempDir.resolve("Some Movie.mp4"))).isEqualTo(4L * MB);
		assertThat(manager.isDownloaded("movie:42")).isTrue();
	}

	@Test
	void testFailedTransferIsDropped() throws Exception {
		// Given
		provider.failOpen(Kind.MOVIE, "13", "mp4", "HTTP status: 404");
		provider.addContent(Kind.MOVIE, "14", "mp4", new byte[2 * MB]);

		// When
		manager.enqueue(Kind.MOVIE, "13", "mp4", "Broken");
		manager.enqueue(Kind.MOVIE, "14", "mp4", "Working");
		manager.awaitCompletion();

		// Then
		assertThat(snapshots)
				.filteredOn(s -> s.status() == DownloadStatus.ERROR)
				.extracting(ProgressSnapshot::message)
				.containsOnly("HTTP status: 404");
		assertThat(manager.isDownloaded("movie:13")).isFalse();
		assertThat(manager.isDownloaded("movie:14")).isTrue();
		assertThat(manager.getFailedCount()).isEqualTo(1);
		assertThat(manager.getCompletedCount()).isEqualTo(1);
		assertThat(manager.listQueue()).isEmpty();
	}

	@Test
	void testUnexpectedProviderErrorFailsOnlyThatJob() throws Exception {
		// Given
		provider.crashOpen(Kind.MOVIE, "13", "mp4", new IllegalArgumentException("Illegal character in path"));
		provider.addContent(Kind.MOVIE, "14", "mp4", new byte[2 * MB]);

		// When
		manager.enqueue(Kind.MOVIE, "13", "mp4", "Broken");
		manager.enqueue(Kind.MOVIE, "14", "mp4", "Working");
		manager.awaitCompletion();

		// Then
		assertThat(snapshots)
				.filteredOn(s -> s.status() == DownloadStatus.ERROR)
				.extracting(ProgressSnapshot::message)
				.containsOnly("IllegalArgumentException: Illegal character in path");
		assertThat(manager.isDownloaded("movie:13")).isFalse();
		assertThat(manager.isDownloaded("movie:14")).isTrue();
		assertThat(manager.getFailedCount()).isEqualTo(1);
		assertThat(manager.getCompletedCount()).isEqualTo(1);
		assertThat(manager.listQueue()).isEmpty();
	}

	@Test
	void testUnknownLengthKeepsPercentAtZero() throws Exception {
		provider.setAdvertiseLength(false);
		provider.addContent(Kind.MOVIE, "42", "mp4", new byte[3 * MB]);

		manager.enqueue(Kind.MOVIE, "42", "mp4", "Some Movie");
		manager.awaitCompletion();

		assertThat(snapshots)
				.filteredOn(s -> s.status() == DownloadStatus.DOWNLOADING)
				.extracting(ProgressSnapshot::percent)
				.containsOnly(0);
		assertThat(manager.isDownloaded("movie:42")).isTrue();
	}

	@Test
	void testTinyDownloadIsNotRecorded() throws Exception {
		provider.addContent(Kind.MOVIE, "42", "mp4", "<html>Not found</html>".getBytes());

		manager.enqueue(Kind.MOVIE, "42", "mp4", "Some Movie");
		manager.awaitCompletion();

		assertThat(Files.exists(tempDir.resolve("Some Movie.mp4"))).isTrue();
		assertThat(manager.isDownloaded("movie:42")).isFalse();
	}
}
