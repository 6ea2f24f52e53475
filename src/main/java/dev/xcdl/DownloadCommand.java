package dev.xcdl;

import dev.xcdl.catalog.CatalogProvider;
import dev.xcdl.catalog.XtreamCatalogProvider;
import dev.xcdl.model.DownloadStatus;
import dev.xcdl.model.ProgressSnapshot;
import dev.xcdl.queue.EnqueueResult;
import dev.xcdl.queue.QueueManager;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/** Download command to queue catalog items and download them one after the other */
@Command(
		name = "download",
		description = "Queue movies, episodes or whole series and download them sequentially",
		mixinStandardHelpOptions = true)
public class DownloadCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Spec
	private CommandSpec spec;

	@Option(
			names = {"--url"},
			description = "Base URL of the provider (default: $XC_URL)",
			defaultValue = "${env:XC_URL:-http://provider-url.com:8080}")
	private String providerUrl;

	@Option(
			names = {"-u", "--username"},
			description = "Account name (default: $XC_USER)",
			defaultValue = "${env:XC_USER:-username}")
	private String username;

	@Option(
			names = {"-p", "--password"},
			description = "Account password (default: $XC_PASS)",
			defaultValue = "${env:XC_PASS:-password}")
	private String password;

	@Mixin
	private StorageOptions storage;

	@Parameters(
			arity = "1..*",
			paramLabel = "ITEM",
			description = "movie:<id>:<ext>[:<title>], series:<id>:<ext>[:<title>] or show:<seriesId>")
	private List<String> items;

	@Override
	public Integer call() throws Exception {
		List<ItemSpec> specs = new ArrayList<>();
		for (String item : items) {
			Optional<ItemSpec> parsed = ItemSpec.parse(item);
			if (parsed.isEmpty()) {
				throw new ParameterException(spec.commandLine(), "Invalid item: " + item);
			}
			specs.add(parsed.get());
		}

		logger.info("xc-downloader - Download");
		logger.info("========================");
		logger.info("Download directory: {}", storage.downloadDir.toAbsolutePath());
		logger.info("");

		CatalogProvider provider = new XtreamCatalogProvider(providerUrl, username, password);
		int queued = 0;
		int skipped = 0;

		try (QueueManager manager = new QueueManager(storage.toConfig(), provider)) {
			Consumer<ProgressSnapshot> printer = progressPrinter();
			manager.progress().addListener(printer);
			manager.start();

			for (ItemSpec s : specs) {
				if (s.wholeSeries()) {
					int added = manager.enqueueSeries(s.catalogId());
					logger.info("Series {}: {} episodes queued", s.catalogId(), added);
					queued += added;
					continue;
				}
				EnqueueResult result = manager.enqueue(s.kind(), s.catalogId(), s.extension(), s.title());
				switch (result.outcome()) {
					case QUEUED -> queued++;
					case ALREADY_QUEUED -> {
						logger.info("Skipping {} - already queued", result.itemId());
						skipped++;
					}
					case ALREADY_DOWNLOADED -> {
						logger.info("Skipping {} - already downloaded", result.itemId());
						skipped++;
					}
				}
			}

			logger.info("");
			logger.info("Waiting for {} downloads to complete...", queued);
			manager.awaitCompletion();
			manager.progress().removeListener(printer);

			logger.info("");
			logger.info("Summary");
			logger.info("=======");
			logger.info("Queued: {}", queued);
			logger.info("Skipped: {}", skipped);
			logger.info("Completed: {}", manager.getCompletedCount());
			logger.info("Failed: {}", manager.getFailedCount());

			return manager.getFailedCount() > 0 ? 1 : 0;
		}
	}

	/** Log progress once per status change or percent step */
	private static Consumer<ProgressSnapshot> progressPrinter() {
		return new Consumer<>() {
			private DownloadStatus lastStatus;
			private int lastPercent = -1;

			@Override
			public void accept(ProgressSnapshot snapshot) {
				if (snapshot.status() == lastStatus && snapshot.percent() == lastPercent) {
					return;
				}
				lastStatus = snapshot.status();
				lastPercent = snapshot.percent();
				if (snapshot.status() == DownloadStatus.ERROR) {
					logger.warn("  {} - {}", snapshot, snapshot.message());
				} else {
					logger.info("  {}", snapshot);
				}
			}
		};
	}
}
