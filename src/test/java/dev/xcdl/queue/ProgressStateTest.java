package dev.xcdl.queue;

import static org.assertj.core.api.Assertions.*;

import dev.xcdl.model.DownloadStatus;
import dev.xcdl.model.ProgressSnapshot;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.junit.jupiter.api.Test;

class ProgressStateTest {

	@Test
	void testInitialSnapshotIsIdle() {
		ProgressSnapshot snapshot = new ProgressState().snapshot();

		assertThat(snapshot.status()).isEqualTo(DownloadStatus.IDLE);
		assertThat(snapshot.currentFile()).isEmpty();
		assertThat(snapshot.percent()).isZero();
	}

	@Test
	void testDownloadingComputesPercent() {
		// Given
		ProgressState state = new ProgressState();
		state.starting("movie.mkv", 3);

		// When
		state.downloading(512, 2048);

		// Then
		ProgressSnapshot snapshot = state.snapshot();
		assertThat(snapshot.currentFile()).isEqualTo("movie.mkv");
		assertThat(snapshot.status()).isEqualTo(DownloadStatus.DOWNLOADING);
		assertThat(snapshot.bytesDownloaded()).isEqualTo(512);
		assertThat(snapshot.percent()).isEqualTo(25);
		assertThat(snapshot.queueDepth()).isEqualTo(3);
	}

	@Test
	void testErrorKeepsFiguresAndCarriesMessage() {
		ProgressState state = new ProgressState();
		state.starting("movie.mkv", 0);
		state.downloading(1024, 4096);

		state.error("Connection reset");

		ProgressSnapshot snapshot = state.snapshot();
		assertThat(snapshot.status()).isEqualTo(DownloadStatus.ERROR);
		assertThat(snapshot.message()).isEqualTo("Connection reset");
		assertThat(snapshot.percent()).isEqualTo(25);
	}

	@Test
	void testFinishedClearsFiguresButKeepsStatus() {
		ProgressState state = new ProgressState();
		state.starting("movie.mkv", 1);
		state.downloading(4096, 4096);
		state.complete();

		state.finished(0);

		ProgressSnapshot snapshot = state.snapshot();
		assertThat(snapshot.status()).isEqualTo(DownloadStatus.COMPLETE);
		assertThat(snapshot.bytesDownloaded()).isZero();
		assertThat(snapshot.percent()).isZero();
		assertThat(snapshot.queueDepth()).isZero();
	}

	@Test
	void testListenersOnlySeeChanges() {
		// Given
		ProgressState state = new ProgressState();
		List<DownloadStatus> seen = new ArrayList<>();
		state.addListener(s -> seen.add(s.status()));

		// When
		state.waiting(DownloadStatus.IDLE, 0);
		state.status(DownloadStatus.PAUSED);
		state.status(DownloadStatus.PAUSED);
		state.waiting(DownloadStatus.IDLE, 0);

		// Then
		assertThat(seen).containsExactly(DownloadStatus.PAUSED, DownloadStatus.IDLE);
	}

	@Test
	void testRemovedListenerIsNotCalled() {
		// Given
		ProgressState state = new ProgressState();
		List<DownloadStatus> seen = new ArrayList<>();
		Consumer<ProgressSnapshot> listener = s -> seen.add(s.status());
		state.addListener(listener);
		state.status(DownloadStatus.PAUSED);

		// When
		state.removeListener(listener);
		state.status(DownloadStatus.STOPPED);

		// Then
		assertThat(seen).containsExactly(DownloadStatus.PAUSED);
		assertThat(state.snapshot().status()).isEqualTo(DownloadStatus.STOPPED);
	}

	@Test
	void testSnapshotFormatting() {
		ProgressSnapshot snapshot =
				new ProgressSnapshot("movie.mkv", 1024 * 1024, 4 * 1024 * 1024, 25, DownloadStatus.DOWNLOADING, 2, null);

		assertThat(snapshot.downloadedMegabytes()).isEqualTo(1.0);
		assertThat(snapshot.totalMegabytes()).isEqualTo(4.0);
		assertThat(snapshot.toString()).contains("DOWNLOADING", "movie.mkv", "25%", "2 queued");
	}
}
