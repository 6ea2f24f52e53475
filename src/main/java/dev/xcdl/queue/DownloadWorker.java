package dev.xcdl.queue;

import dev.xcdl.catalog.TransferStream;
import dev.xcdl.model.DownloadStatus;
import dev.xcdl.model.Job;
import dev.xcdl.util.FileUtils;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The single consumer of the job queue. Takes one job at a time from its {@link QueueManager},
 * streams it to disk chunk by chunk and records it as downloaded on success. Failed jobs are
 * dropped, not retried.
 */
class DownloadWorker implements Runnable {
	private static final Logger logger = LoggerFactory.getLogger(DownloadWorker.class);

	private enum Outcome {
		COMPLETED,
		STOPPED,
		FAILED
	}

	private final QueueManager manager;
	private final ProgressState progress;
	private final AtomicInteger completedDownloads = new AtomicInteger(0);
	private final AtomicInteger failedDownloads = new AtomicInteger(0);

	DownloadWorker(QueueManager manager) {
		this.manager = manager;
		this.progress = manager.progress();
	}

	@Override
	public void run() {
		logger.debug("Download worker started");
		while (true) {
			Job job;
			try {
				job = manager.nextJob();
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				break;
			}
			if (job == null) {
				break;
			}
			try {
				process(job);
			} finally {
				manager.jobFinished(job);
			}
			if (Thread.currentThread().isInterrupted()) {
				break;
			}
		}
		logger.debug("Download worker stopped");
	}

	int getCompletedCount() {
		return completedDownloads.get();
	}

	int getFailedCount() {
		return failedDownloads.get();
	}

	private void process(Job job) {
		logger.info("Downloading {} to {}", job.itemId(), job.destination());
		Outcome outcome;
		String failure = null;
		try {
			outcome = transfer(job);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			outcome = Outcome.STOPPED;
		} catch (IOException e) {
			// An interrupted transfer surfaces as an I/O error from the channel
			boolean interrupted = Thread.currentThread().isInterrupted() || manager.isShutdown();
			outcome = interrupted ? Outcome.STOPPED : Outcome.FAILED;
			failure = e.getMessage();
		} catch (Exception e) {
			// Anything else fails only this job; the worker keeps going
			logger.error("Unexpected error downloading {}", job.itemId(), e);
			outcome = Outcome.FAILED;
			failure = e.getClass().getSimpleName() + ": " + e.getMessage();
		}

		switch (outcome) {
			case STOPPED -> {
				progress.status(DownloadStatus.STOPPED);
				logger.info("Download of {} stopped, partial file left at {}", job.itemId(), job.destination());
			}
			case FAILED -> {
				failedDownloads.incrementAndGet();
				logger.warn("Download of {} failed: {}", job.itemId(), failure);
				progress.error(failure);
				linger(manager.config().errorCooldown());
			}
			case COMPLETED -> {
				completedDownloads.incrementAndGet();
				recordCompleted(job);
				progress.complete();
				linger(manager.config().completeLinger());
			}
		}
	}

	private Outcome transfer(Job job) throws IOException, InterruptedException {
		DownloaderConfig config = manager.config();
		Path destination = job.destination();
		try (TransferStream stream = manager.provider().open(job.url())) {
			long total = stream.contentLength();
			Path parent = destination.toAbsolutePath().getParent();
			if (parent != null) {
				FileUtils.ensureDirectory(parent);
			}

			byte[] buffer = new byte[config.chunkSize()];
			long downloaded = 0;
			try (InputStream in = stream.body();
					OutputStream out = Files.newOutputStream(destination)) {
				while (true) {
					int read = in.readNBytes(buffer, 0, buffer.length);
					if (read <= 0) {
						break;
					}
					if (!manager.awaitTransferPermit()) {
						return Outcome.STOPPED;
					}
					out.write(buffer, 0, read);
					downloaded += read;
					progress.downloading(downloaded, total);
				}
			}
		}
		return Outcome.COMPLETED;
	}

	private void recordCompleted(Job job) {
		Path destination = job.destination();
		long size;
		try {
			size = Files.exists(destination) ? FileUtils.getFileSize(destination) : 0;
		} catch (IOException e) {
			logger.warn("Cannot read size of {}: {}", destination, e.getMessage());
			return;
		}
		if (size <= manager.config().minFileSize()) {
			// Usually an error page saved in place of the media file
			logger.warn("Downloaded {} is only {} bytes, not recording it", destination.getFileName(), size);
			return;
		}
		if (manager.store().record(job.itemId(), job.filename(), FileUtils.toMegabytes(size))) {
			logger.info("Completed {} ({} MB)", job.filename(), FileUtils.toMegabytes(size));
		} else {
			logger.error("Completed {} but could not record it", job.filename());
		}
	}

	/** Keep the current status visible for a while */
	private void linger(Duration duration) {
		if (duration == null || duration.isZero() || duration.isNegative()) {
			return;
		}
		try {
			Thread.sleep(duration.toMillis());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}
}
