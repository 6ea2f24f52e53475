package dev.xcdl.queue;

import dev.xcdl.matcher.MatchRules;
import dev.xcdl.util.FileUtils;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration of the download queue.
 *
 * @param downloadDir directory receiving the media files
 * @param storeFile JSON file holding the download records
 * @param chunkSize bytes written per chunk; pause and stop take effect at chunk boundaries
 * @param minFileSize files must be larger than this to count as downloaded or be scanned
 * @param matchTolerance length tolerance of the movie name matcher
 * @param completeLinger how long the complete status stays visible after a download
 * @param errorCooldown how long the error status stays visible after a failed download
 */
public record DownloaderConfig(
		Path downloadDir,
		Path storeFile,
		int chunkSize,
		long minFileSize,
		double matchTolerance,
		Duration completeLinger,
		Duration errorCooldown) {

	public static final String STORE_FILENAME = ".downloaded.json";

	public static DownloaderConfig defaults(Path downloadDir) {
		return new DownloaderConfig(
				downloadDir,
				downloadDir.resolve(STORE_FILENAME),
				(int) FileUtils.MEGABYTE,
				FileUtils.MEGABYTE,
				MatchRules.DEFAULT_TOLERANCE,
				Duration.ofSeconds(2),
				Duration.ofSeconds(5));
	}

	public DownloaderConfig withStoreFile(Path storeFile) {
		return new DownloaderConfig(
				downloadDir, storeFile, chunkSize, minFileSize, matchTolerance, completeLinger, errorCooldown);
	}

	public DownloaderConfig withMatchTolerance(double matchTolerance) {
		return new DownloaderConfig(
				downloadDir, storeFile, chunkSize, minFileSize, matchTolerance, completeLinger, errorCooldown);
	}

	public DownloaderConfig withDelays(Duration completeLinger, Duration errorCooldown) {
		return new DownloaderConfig(
				downloadDir, storeFile, chunkSize, minFileSize, matchTolerance, completeLinger, errorCooldown);
	}
}
