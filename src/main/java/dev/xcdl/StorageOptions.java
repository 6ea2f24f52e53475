package dev.xcdl;

import dev.xcdl.queue.DownloaderConfig;
import java.nio.file.Path;
import picocli.CommandLine.Option;

/** Options shared by all commands that touch the download directory */
public class StorageOptions {

	@Option(
			names = {"-d", "--download-dir"},
			description = "Directory receiving the downloads (default: $DOWNLOAD_PATH or /downloads)",
			defaultValue = "${env:DOWNLOAD_PATH:-/downloads}")
	Path downloadDir;

	@Option(
			names = {"--store"},
			description = "File holding the download records (default: <download-dir>/" + DownloaderConfig.STORE_FILENAME
					+ ")")
	Path storeFile;

	@Option(
			names = {"--match-tolerance"},
			description = "Maximum length difference between a movie title and a file name, as a fraction of the longer one (default: 0.5)",
			defaultValue = "0.5")
	double matchTolerance;

	DownloaderConfig toConfig() {
		DownloaderConfig config = DownloaderConfig.defaults(downloadDir).withMatchTolerance(matchTolerance);
		return storeFile != null ? config.withStoreFile(storeFile) : config;
	}
}
