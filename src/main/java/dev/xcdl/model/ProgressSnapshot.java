package dev.xcdl.model;

/**
 * Immutable view of the worker's current activity.
 *
 * @param currentFile file name of the job in flight, or empty when idle
 * @param bytesDownloaded bytes written so far for the job in flight
 * @param totalBytes advertised length of the transfer, 0 when unknown
 * @param percent completion percentage, only advanced when the total is known
 * @param status worker status
 * @param queueDepth number of jobs waiting in the queue
 * @param message detail for the status, e.g. the failure cause for {@link DownloadStatus#ERROR}
 */
public record ProgressSnapshot(
		String currentFile,
		long bytesDownloaded,
		long totalBytes,
		int percent,
		DownloadStatus status,
		int queueDepth,
		String message) {

	private static final double MEGABYTE = 1024 * 1024;

	public static ProgressSnapshot idle() {
		return new ProgressSnapshot("", 0, 0, 0, DownloadStatus.IDLE, 0, null);
	}

	public double downloadedMegabytes() {
		return Math.round(bytesDownloaded / MEGABYTE * 100) / 100.0;
	}

	public double totalMegabytes() {
		return Math.round(totalBytes / MEGABYTE * 100) / 100.0;
	}

	public ProgressSnapshot withStatus(DownloadStatus status) {
		return new ProgressSnapshot(currentFile, bytesDownloaded, totalBytes, percent, status, queueDepth, message);
	}

	public ProgressSnapshot withQueueDepth(int queueDepth) {
		return new ProgressSnapshot(currentFile, bytesDownloaded, totalBytes, percent, status, queueDepth, message);
	}

	@Override
	public String toString() {
		if (totalBytes > 0) {
			return "%s %s %.2f/%.2f MB (%d%%), %d queued"
					.formatted(status, currentFile, downloadedMegabytes(), totalMegabytes(), percent, queueDepth);
		}
		return "%s %s %.2f MB, %d queued".formatted(status, currentFile, downloadedMegabytes(), queueDepth);
	}
}
