package dev.xcdl.queue;

import dev.xcdl.catalog.CatalogItem;
import dev.xcdl.catalog.CatalogProvider;
import dev.xcdl.catalog.SeriesInfo;
import dev.xcdl.matcher.FileMatcher;
import dev.xcdl.matcher.FilenameParser;
import dev.xcdl.matcher.ParsedName;
import dev.xcdl.matcher.ScannedFile;
import dev.xcdl.model.DownloadRecord;
import dev.xcdl.model.DownloadStatus;
import dev.xcdl.model.EpisodeJob;
import dev.xcdl.model.Job;
import dev.xcdl.model.Kind;
import dev.xcdl.model.MovieJob;
import dev.xcdl.model.ProgressSnapshot;
import dev.xcdl.store.DownloadStore;
import dev.xcdl.store.StoreUpdate;
import dev.xcdl.util.FileUtils;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owner of the download queue, the pause/stop controls, the progress state and the single download
 * worker. All commands from the outside go through this class. Queue mutations, the control flags
 * and the in-flight job are guarded by one lock; the worker waits on its condition while it has
 * nothing to do, is paused or is stopped.
 */
public class QueueManager implements AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(QueueManager.class);

	private final DownloaderConfig config;
	private final CatalogProvider provider;
	private final DownloadStore store;
	private final FileMatcher matcher;
	private final JobQueue queue = new JobQueue();
	private final ProgressState progress = new ProgressState();
	private final DownloadWorker worker;

	private final ReentrantLock lock = new ReentrantLock();
	private final Condition changed = lock.newCondition();

	// Guarded by lock
	private boolean paused;
	private boolean stopped;
	private boolean shutdown;
	private Job inFlight;

	private Thread workerThread;

	public QueueManager(DownloaderConfig config, CatalogProvider provider) {
		this(
				config,
				provider,
				new DownloadStore(config.storeFile()),
				new FileMatcher(config.downloadDir(), config.minFileSize(), config.matchTolerance()));
	}

	public QueueManager(DownloaderConfig config, CatalogProvider provider, DownloadStore store, FileMatcher matcher) {
		this.config = config;
		this.provider = provider;
		this.store = store;
		this.matcher = matcher;
		this.worker = new DownloadWorker(this);
	}

	/**
	 * Load the download records, index the download directory and start the worker thread. Should be
	 * called once after construction.
	 */
	public void start() {
		try {
			FileUtils.ensureDirectory(config.downloadDir());
		} catch (IOException e) {
			logger.warn("Cannot create download directory {}: {}", config.downloadDir(), e.getMessage());
		}
		store.load();
		matcher.scan();
		lock.lock();
		try {
			if (workerThread != null) {
				return;
			}
			workerThread = new Thread(worker, "download-worker");
			workerThread.start();
		} finally {
			lock.unlock();
		}
		logger.info("Download queue started, saving to {}", config.downloadDir().toAbsolutePath());
	}

	/**
	 * Queue a catalog item.
	 *
	 * @param kind The kind of item
	 * @param catalogId The catalog id of the movie or episode
	 * @param extension The container extension, e.g. "mkv"
	 * @param title The title, used for the destination file name
	 * @return The outcome, with the job id when the item was queued
	 */
	public EnqueueResult enqueue(Kind kind, String catalogId, String extension, String title) {
		if (kind == Kind.MOVIE) {
			return enqueue(CatalogItem.movie(catalogId, title, extension));
		}
		ParsedName parsed = FilenameParser.parse(title);
		if (parsed.isEpisode()) {
			return enqueue(CatalogItem.episode(
					catalogId, title, extension, parsed.seriesName(), parsed.season(), parsed.episode()));
		}
		return enqueue(CatalogItem.episode(catalogId, title, extension, null, 0, 0));
	}

	/** Queue a catalog item, skipping it when it is already downloaded or queued */
	public EnqueueResult enqueue(CatalogItem item) {
		String itemId = item.itemId();
		if (checkDownloaded(item)) {
			logger.debug("Skipping {}: already downloaded", itemId);
			return EnqueueResult.alreadyDownloaded(itemId);
		}

		Job job;
		lock.lock();
		try {
			job = createJob(item);
			queue.enqueue(job);
			progress.queueDepth(queue.size());
			changed.signalAll();
		} catch (DuplicateJobException e) {
			logger.debug("Skipping {}: already queued", itemId);
			return EnqueueResult.alreadyQueued(itemId);
		} finally {
			lock.unlock();
		}
		logger.info("Queued {} as {}", itemId, job.filename());
		return EnqueueResult.queued(itemId, job.id());
	}

	/**
	 * Queue all episodes of a series that are neither downloaded nor queued yet.
	 *
	 * @return Number of episodes added
	 */
	public int enqueueSeries(String seriesId) {
		SeriesInfo info = provider.seriesInfo(seriesId);
		int added = 0;
		for (CatalogItem episode : info.episodes()) {
			if (enqueue(episode).isQueued()) {
				added++;
			}
		}
		logger.info(
				"Queued {} of {} episodes of series {} ({})",
				added,
				info.episodes().size(),
				seriesId,
				info.name());
		return added;
	}

	public void pause() {
		lock.lock();
		try {
			paused = true;
			if (inFlight == null) {
				progress.waiting(stopped ? DownloadStatus.STOPPED : DownloadStatus.PAUSED, queue.size());
			}
			changed.signalAll();
		} finally {
			lock.unlock();
		}
		logger.info("Queue paused");
	}

	/** Clear both the pause and the stop flag */
	public void resume() {
		lock.lock();
		try {
			paused = false;
			stopped = false;
			if (inFlight == null) {
				progress.waiting(DownloadStatus.IDLE, queue.size());
			}
			changed.signalAll();
		} finally {
			lock.unlock();
		}
		logger.info("Queue resumed");
	}

	/** Stop the transfer in flight at its next chunk and stop taking jobs until resumed */
	public void stop() {
		lock.lock();
		try {
			stopped = true;
			paused = false;
			if (inFlight == null) {
				progress.waiting(DownloadStatus.STOPPED, queue.size());
			}
			changed.signalAll();
		} finally {
			lock.unlock();
		}
		logger.info("Queue stopped");
	}

	/**
	 * Drop every queued job. The job in flight keeps running.
	 *
	 * @return Number of jobs dropped
	 */
	public int clearQueue() {
		int dropped;
		lock.lock();
		try {
			dropped = queue.clear();
			progress.queueDepth(0);
			changed.signalAll();
		} finally {
			lock.unlock();
		}
		logger.info("Cleared {} queued jobs", dropped);
		return dropped;
	}

	/**
	 * Remove a queued job.
	 *
	 * @return true when the job was removed, false when no queued job has that id
	 */
	public boolean removeJob(String jobId) {
		lock.lock();
		try {
			Job removed = queue.remove(jobId);
			progress.queueDepth(queue.size());
			changed.signalAll();
			logger.info("Removed {} from the queue", removed.itemId());
			return true;
		} catch (JobNotFoundException e) {
			logger.debug(e.getMessage());
			return false;
		} finally {
			lock.unlock();
		}
	}

	/** Put the given jobs first, in order; the others follow in their current order */
	public void reorder(List<String> jobIds) {
		queue.reorder(jobIds);
	}

	public List<Job> listQueue() {
		return queue.list();
	}

	public boolean isQueued(String itemId) {
		return queue.contains(itemId);
	}

	public boolean isDownloaded(String itemId) {
		return store.contains(itemId);
	}

	/**
	 * Check whether a catalog item is downloaded: either recorded, or present on disk according to
	 * the file index. A file found on disk is recorded so the next check is a plain lookup.
	 */
	public boolean checkDownloaded(CatalogItem item) {
		String itemId = item.itemId();
		if (store.contains(itemId)) {
			return true;
		}
		Optional<ScannedFile> match = matcher.match(item);
		if (match.isEmpty()) {
			return false;
		}
		ScannedFile file = match.get();
		logger.info("Found {} on disk as {}, recording it", itemId, file.filename());
		if (!store.record(itemId, file.filename(), file.sizeMegabytes())) {
			logger.warn("Could not record {} after matching {}", itemId, file.filename());
		}
		return true;
	}

	/**
	 * Record an item as downloaded.
	 *
	 * @param itemId The item id
	 * @param filename The file name to record
	 * @param filepath Optional path of the file, used for its size
	 * @return true when the record was written
	 */
	public boolean markDownloaded(String itemId, String filename, Path filepath) {
		return store.recordFile(itemId, filename, filepath);
	}

	public StoreUpdate unmarkDownloaded(String itemId) {
		return store.remove(itemId);
	}

	/** Rebuild the index of files present in the download directory */
	public int scanFiles() {
		return matcher.scan();
	}

	public ProgressSnapshot currentProgress() {
		return progress.snapshot();
	}

	public Map<String, DownloadRecord> downloadedRecords() {
		return store.all();
	}

	public ProgressState progress() {
		return progress;
	}

	public int getCompletedCount() {
		return worker.getCompletedCount();
	}

	public int getFailedCount() {
		return worker.getFailedCount();
	}

	/**
	 * Wait until the queue is empty and no job is in flight. Returns early when the queue is stopped
	 * or closed, since no further progress is made in that state.
	 *
	 * @throws InterruptedException if interrupted while waiting
	 */
	public void awaitCompletion() throws InterruptedException {
		lock.lock();
		try {
			while ((!queue.isEmpty() || inFlight != null) && !shutdown && !(stopped && inFlight == null)) {
				changed.await();
			}
		} finally {
			lock.unlock();
		}
	}

	/** Stop the worker thread. The current transfer is abandoned like on {@link #stop()}. */
	@Override
	public void close() throws InterruptedException {
		Thread thread;
		lock.lock();
		try {
			shutdown = true;
			changed.signalAll();
			thread = workerThread;
		} finally {
			lock.unlock();
		}
		if (thread != null) {
			thread.interrupt();
			thread.join();
		}
		logger.info("Download queue closed");
	}

	// Worker side

	/**
	 * Block until a job may be started and hand it over. While waiting the status reflects why
	 * nothing is running.
	 *
	 * @return The next job, or null when the manager is closed
	 */
	Job nextJob() throws InterruptedException {
		lock.lock();
		try {
			while (true) {
				if (shutdown) {
					return null;
				}
				if (stopped) {
					progress.waiting(DownloadStatus.STOPPED, queue.size());
				} else if (paused) {
					progress.waiting(DownloadStatus.PAUSED, queue.size());
				} else if (queue.isEmpty()) {
					progress.waiting(DownloadStatus.IDLE, 0);
				} else {
					Job job = queue.dequeueFront();
					inFlight = job;
					progress.starting(job.filename(), queue.size());
					return job;
				}
				changed.await();
			}
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Called before each chunk is written. Blocks while paused.
	 *
	 * @return false when the transfer must be abandoned because the queue was stopped or closed
	 */
	boolean awaitTransferPermit() throws InterruptedException {
		lock.lock();
		try {
			while (paused && !stopped && !shutdown) {
				progress.status(DownloadStatus.PAUSED);
				changed.await();
			}
			return !stopped && !shutdown;
		} finally {
			lock.unlock();
		}
	}

	/** Called by the worker when it is done with its job, whatever the outcome */
	void jobFinished(Job job) {
		lock.lock();
		try {
			if (inFlight == job) {
				inFlight = null;
			}
			progress.finished(queue.size());
			changed.signalAll();
		} finally {
			lock.unlock();
		}
	}

	boolean isShutdown() {
		lock.lock();
		try {
			return shutdown;
		} finally {
			lock.unlock();
		}
	}

	DownloaderConfig config() {
		return config;
	}

	CatalogProvider provider() {
		return provider;
	}

	DownloadStore store() {
		return store;
	}

	/** Must be called with the lock held, so the destination cannot be claimed concurrently */
	private Job createJob(CatalogItem item) {
		String id = UUID.randomUUID().toString();
		String extension = item.extension() == null || item.extension().isBlank() ? "mp4" : item.extension();
		String filename = FileUtils.downloadFilename(item.title(), item.catalogId(), extension);
		if (isFilenameTaken(filename, item.itemId())) {
			String base = FileUtils.sanitizeFilename(item.title());
			// Untitled items already fall back to the catalog id, so only the kind tells them apart
			String suffixed =
					base.isEmpty() ? item.kind().key() + " " + item.catalogId() : base + " (" + item.catalogId() + ")";
			logger.info("{} is already used by another item, saving {} under a suffixed name", filename, item.itemId());
			filename = FileUtils.downloadFilename(suffixed, item.catalogId(), extension);
		}
		Path destination = config.downloadDir().resolve(filename);
		String url = provider.downloadUrl(item.kind(), item.catalogId(), extension);
		String displayName = item.title() == null || item.title().isBlank() ? filename : item.title();
		if (item.kind() == Kind.MOVIE) {
			return new MovieJob(id, url, destination, displayName, item.catalogId());
		}
		return new EpisodeJob(
				id, url, destination, displayName, item.catalogId(), item.seriesName(), item.season(), item.episode());
	}

	/** True when a queued job, the job in flight or another item's record already uses the file name */
	private boolean isFilenameTaken(String filename, String itemId) {
		if (inFlight != null && !inFlight.itemId().equals(itemId) && inFlight.filename().equals(filename)) {
			return true;
		}
		for (Job queued : queue.list()) {
			if (!queued.itemId().equals(itemId) && queued.filename().equals(filename)) {
				return true;
			}
		}
		return store.isFilenameRecorded(filename, itemId);
	}
}
