package dev.xcdl.matcher;

import dev.xcdl.catalog.CatalogItem;
import dev.xcdl.model.Kind;
import dev.xcdl.util.FileUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Index of the media files already present in the download directory. The index is rebuilt
 * wholesale by {@link #scan()} and consulted by {@link #match(CatalogItem)}, which never mutates it.
 */
public class FileMatcher {
	private static final Logger logger = LoggerFactory.getLogger(FileMatcher.class);

	private final Path directory;
	private final long minFileSize;
	private final double tolerance;

	private volatile Map<String, ScannedFile> index = Collections.emptyMap();

	public FileMatcher(Path directory, long minFileSize, double tolerance) {
		this.directory = directory;
		this.minFileSize = minFileSize;
		this.tolerance = tolerance;
	}

	/**
	 * Scan the download directory and replace the index. Only regular, non-hidden files larger than
	 * the minimum size are indexed.
	 *
	 * @return Number of files indexed
	 */
	public int scan() {
		if (!Files.isDirectory(directory)) {
			logger.debug("Download directory {} does not exist, nothing to scan", directory);
			index = Collections.emptyMap();
			return 0;
		}

		long now = Instant.now().getEpochSecond();
		Map<String, ScannedFile> fresh = new LinkedHashMap<>();
		try (Stream<Path> paths = Files.list(directory)) {
			List<Path> files = paths.filter(Files::isRegularFile)
					.filter(p -> !p.getFileName().toString().startsWith("."))
					.sorted()
					.toList();
			for (Path file : files) {
				long size = sizeOf(file);
				if (size <= minFileSize) {
					continue;
				}
				String filename = file.getFileName().toString();
				String key = FilenameParser.normalize(filename);
				fresh.put(
						key,
						new ScannedFile(key, filename, FileUtils.toMegabytes(size), now, FilenameParser.parse(filename)));
			}
		} catch (IOException e) {
			logger.warn("Failed to scan {}: {}", directory, e.getMessage());
			return index.size();
		}

		index = Collections.unmodifiableMap(fresh);
		logger.info("Scanned {}: {} media files indexed", directory, fresh.size());
		return fresh.size();
	}

	/**
	 * Find a file on disk that looks like the given catalog item.
	 *
	 * @param item The catalog item to look for
	 * @return The matching file, or empty when none matches
	 */
	public Optional<ScannedFile> match(CatalogItem item) {
		Map<String, ScannedFile> current = index;
		if (current.isEmpty()) {
			return Optional.empty();
		}
		if (item.kind() == Kind.MOVIE) {
			String catalogName = catalogKey(item.title());
			return current.values().stream()
					.filter(f -> !f.parsed().isEpisode())
					.filter(f -> MatchRules.movieMatches(f.parsed().name(), catalogName, tolerance))
					.findFirst();
		}

		String seriesName = item.seriesName();
		int season = item.season();
		int episode = item.episode();
		if (!item.hasEpisodeNumber() || seriesName == null) {
			// Fall back to an SxxEyy marker in the title
			ParsedName fromTitle = FilenameParser.parse(item.title());
			if (!fromTitle.isEpisode()) {
				return Optional.empty();
			}
			if (!item.hasEpisodeNumber()) {
				season = fromTitle.season();
				episode = fromTitle.episode();
			}
			if (seriesName == null) {
				seriesName = fromTitle.seriesName();
			}
		}

		String catalogSeries = catalogKey(seriesName);
		int wantedSeason = season;
		int wantedEpisode = episode;
		return current.values().stream()
				.filter(f -> f.parsed().isEpisode())
				.filter(f -> MatchRules.episodeMatches(
						catalogKey(f.parsed().seriesName()),
						f.parsed().season(),
						f.parsed().episode(),
						catalogSeries,
						wantedSeason,
						wantedEpisode))
				.findFirst();
	}

	/** Snapshot of the current index keyed by normalized file name */
	public Map<String, ScannedFile> index() {
		return index;
	}

	private static String catalogKey(String name) {
		return FilenameParser.normalizeTitle(FileUtils.sanitizeFilename(name));
	}

	private static long sizeOf(Path file) {
		try {
			return FileUtils.getFileSize(file);
		} catch (IOException e) {
			logger.debug("Cannot read size of {}: {}", file, e.getMessage());
			return -1;
		}
	}
}
