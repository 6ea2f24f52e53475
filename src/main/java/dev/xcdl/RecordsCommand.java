package dev.xcdl;

import dev.xcdl.model.DownloadRecord;
import dev.xcdl.queue.DownloaderConfig;
import dev.xcdl.store.DownloadStore;
import dev.xcdl.store.StoreUpdate;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/** Records command to list, add or remove download records by hand */
@Command(
		name = "records",
		description = "List the download records, or mark and unmark items as downloaded",
		mixinStandardHelpOptions = true)
public class RecordsCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Mixin
	private StorageOptions storage;

	@Option(
			names = {"--mark"},
			paramLabel = "ITEM=PATH",
			description = "Record an item (e.g. movie:42) as downloaded to the given file, relative to the download directory")
	private Map<String, Path> mark;

	@Option(
			names = {"--unmark"},
			paramLabel = "ITEM",
			description = "Remove the record of an item (e.g. series:7)")
	private List<String> unmark;

	@Override
	public Integer call() throws Exception {
		DownloaderConfig config = storage.toConfig();
		DownloadStore store = new DownloadStore(config.storeFile());
		store.load();

		int errors = 0;
		if (mark != null) {
			for (Map.Entry<String, Path> entry : mark.entrySet()) {
				if (!markItem(store, config, entry.getKey(), entry.getValue())) {
					errors++;
				}
			}
		}
		if (unmark != null) {
			for (String itemId : unmark) {
				StoreUpdate update = store.remove(itemId);
				switch (update) {
					case UPDATED -> logger.info("Unmarked {}", itemId);
					case NOT_FOUND -> logger.warn("No record for {}", itemId);
					case WRITE_FAILED -> {
						logger.error("Error: Could not write {}", store.storeFile());
						errors++;
					}
				}
			}
		}

		if (mark == null && unmark == null) {
			listRecords(store);
		}
		return errors > 0 ? 1 : 0;
	}

	private boolean markItem(DownloadStore store, DownloaderConfig config, String itemId, Path path) {
		Path file = path.isAbsolute() ? path : config.downloadDir().resolve(path);
		if (!Files.isRegularFile(file)) {
			logger.warn("File {} does not exist, recording it anyway", file);
		}
		if (!store.recordFile(itemId, file.getFileName().toString(), file)) {
			logger.error("Error: Could not write {}", store.storeFile());
			return false;
		}
		logger.info("Marked {} as downloaded ({})", itemId, file.getFileName());
		return true;
	}

	private void listRecords(DownloadStore store) {
		logger.info("Download records in {}", store.storeFile().toAbsolutePath());
		logger.info("");
		for (Map.Entry<String, DownloadRecord> entry : store.all().entrySet()) {
			DownloadRecord record = entry.getValue();
			logger.info("  {} - {} ({} MB, {})", entry.getKey(), record.filename(), record.sizeMegabytes(), record.downloadedAtInstant());
		}
		logger.info("");
		logger.info("Total: {}", store.size());
	}
}
