package dev.xcdl.matcher;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Normalizes media file names and extracts series/season/episode information from them */
public class FilenameParser {

	private static final Pattern EXTENSION = Pattern.compile("\\.[A-Za-z0-9]{1,5}$");
	private static final Pattern SEPARATORS = Pattern.compile("[\\s_-]+");
	// Bounded so the numbers always fit an int; longer digit runs are not a marker
	private static final Pattern SEASON_EPISODE = Pattern.compile("(?i)s(\\d{1,4})\\s*e(\\d{1,4})(?!\\d)");
	private static final Pattern TRAILING_SEPARATORS = Pattern.compile("[\\s_.-]+$");

	private FilenameParser() {}

	/**
	 * Normalize a file name: strip the extension, lower-case, collapse runs of spaces, dashes and
	 * underscores into single spaces and trim.
	 */
	public static String normalize(String filename) {
		if (filename == null) {
			return "";
		}
		return normalizeTitle(stripExtension(filename));
	}

	/** Normalize a catalog title. Like {@link #normalize(String)} but keeps anything after a dot. */
	public static String normalizeTitle(String title) {
		if (title == null) {
			return "";
		}
		return SEPARATORS.matcher(title.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
	}

	public static String stripExtension(String filename) {
		return EXTENSION.matcher(filename).replaceFirst("");
	}

	/**
	 * Parse a file name. Names containing an {@code S<n>E<n>} marker are episodes, whose series name is
	 * the text before the marker; anything else is a movie keyed by its normalized name.
	 */
	public static ParsedName parse(String filename) {
		String base = filename == null ? "" : stripExtension(filename);
		String normalized = normalizeTitle(base);

		Matcher m = SEASON_EPISODE.matcher(base);
		if (m.find()) {
			String seriesName = TRAILING_SEPARATORS
					.matcher(base.substring(0, m.start()))
					.replaceFirst("")
					.trim();
			return ParsedName.episode(
					normalized, seriesName, Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
		}
		return ParsedName.movie(normalized);
	}
}
