package dev.xcdl;

import dev.xcdl.matcher.FileMatcher;
import dev.xcdl.matcher.ParsedName;
import dev.xcdl.matcher.ScannedFile;
import dev.xcdl.queue.DownloaderConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/** Scan command to show which media files the matcher recognizes in the download directory */
@Command(
		name = "scan",
		description = "Index the download directory and list the movies and episodes found in it",
		mixinStandardHelpOptions = true)
public class ScanCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Mixin
	private StorageOptions storage;

	@Override
	public Integer call() throws Exception {
		DownloaderConfig config = storage.toConfig();
		logger.info("xc-downloader - Scan");
		logger.info("====================");
		logger.info("Download directory: {}", config.downloadDir().toAbsolutePath());
		logger.info("");

		if (!Files.isDirectory(config.downloadDir())) {
			logger.error("Error: Download directory not found: {}", config.downloadDir().toAbsolutePath());
			return 1;
		}

		FileMatcher matcher = new FileMatcher(config.downloadDir(), config.minFileSize(), config.matchTolerance());
		int count = matcher.scan();

		int movies = 0;
		int episodes = 0;
		for (ScannedFile file : matcher.index().values()) {
			ParsedName parsed = file.parsed();
			if (parsed.isEpisode()) {
				episodes++;
				logger.info(
						"  [Episode] {} S{}E{} - {} ({} MB)",
						parsed.seriesName(),
						String.format("%02d", parsed.season()),
						String.format("%02d", parsed.episode()),
						file.filename(),
						file.sizeMegabytes());
			} else {
				movies++;
				logger.info("  [Movie] {} - {} ({} MB)", parsed.name(), file.filename(), file.sizeMegabytes());
			}
		}

		logger.info("");
		logger.info("Summary");
		logger.info("=======");
		logger.info("Files indexed: {}", count);
		logger.info("Movies: {}", movies);
		logger.info("Episodes: {}", episodes);
		return 0;
	}
}
