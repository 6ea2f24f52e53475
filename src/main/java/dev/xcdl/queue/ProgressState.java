package dev.xcdl.queue;

import dev.xcdl.model.DownloadStatus;
import dev.xcdl.model.ProgressSnapshot;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * The single live progress record of the download worker. Each update replaces an immutable
 * {@link ProgressSnapshot}, so pollers always read a consistent state. Listeners are called on the
 * updating thread after every change.
 */
public class ProgressState {
	private volatile ProgressSnapshot current = ProgressSnapshot.idle();
	private final List<Consumer<ProgressSnapshot>> listeners = new CopyOnWriteArrayList<>();

	public ProgressSnapshot snapshot() {
		return current;
	}

	public void addListener(Consumer<ProgressSnapshot> listener) {
		listeners.add(listener);
	}

	public void removeListener(Consumer<ProgressSnapshot> listener) {
		listeners.remove(listener);
	}

	/** A job was taken from the queue and its transfer is being opened */
	public void starting(String filename, int queueDepth) {
		update(s -> new ProgressSnapshot(filename, 0, 0, 0, DownloadStatus.STARTING, queueDepth, null));
	}

	/** A chunk was written */
	public void downloading(long bytesDownloaded, long totalBytes) {
		update(s -> new ProgressSnapshot(
				s.currentFile(),
				bytesDownloaded,
				totalBytes,
				totalBytes > 0 ? (int) (bytesDownloaded * 100 / totalBytes) : s.percent(),
				DownloadStatus.DOWNLOADING,
				s.queueDepth(),
				null));
	}

	public void complete() {
		update(s -> new ProgressSnapshot(
				s.currentFile(), s.bytesDownloaded(), s.totalBytes(), 100, DownloadStatus.COMPLETE, s.queueDepth(), null));
	}

	public void error(String message) {
		update(s -> new ProgressSnapshot(
				s.currentFile(),
				s.bytesDownloaded(),
				s.totalBytes(),
				s.percent(),
				DownloadStatus.ERROR,
				s.queueDepth(),
				message));
	}

	/** Change the status only, keeping the transfer figures */
	public void status(DownloadStatus status) {
		update(s -> s.withStatus(status));
	}

	public void queueDepth(int queueDepth) {
		update(s -> s.withQueueDepth(queueDepth));
	}

	/** The job in flight is done; clear the per-job figures */
	public void finished(int queueDepth) {
		update(s -> new ProgressSnapshot(s.currentFile(), 0, 0, 0, s.status(), queueDepth, s.message()));
	}

	/** Nothing in flight: report the given status for an empty worker */
	public void waiting(DownloadStatus status, int queueDepth) {
		update(s -> new ProgressSnapshot("", 0, 0, 0, status, queueDepth, null));
	}

	private synchronized void update(UnaryOperator<ProgressSnapshot> change) {
		ProgressSnapshot next = change.apply(current);
		if (next.equals(current)) {
			return;
		}
		current = next;
		for (Consumer<ProgressSnapshot> listener : listeners) {
			listener.accept(next);
		}
	}
}
