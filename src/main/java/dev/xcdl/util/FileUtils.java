package dev.xcdl.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/** Utility class for file operations */
public class FileUtils {

	public static final long MEGABYTE = 1024L * 1024L;

	private static final Pattern ILLEGAL_FILENAME_CHARS = Pattern.compile("[<>:\"/\\\\|?*]");

	/** Ensure a directory exists, creating it if necessary */
	public static void ensureDirectory(Path directory) throws IOException {
		if (!Files.exists(directory)) {
			Files.createDirectories(directory);
		}
	}

	/** Get the size of a file in bytes */
	public static long getFileSize(Path file) throws IOException {
		return Files.size(file);
	}

	/** Convert a byte count to megabytes, rounded to two decimals */
	public static double toMegabytes(long bytes) {
		return Math.round(bytes * 100.0 / MEGABYTE) / 100.0;
	}

	/**
	 * Remove the characters that are illegal in file names on common file systems and trim the
	 * result.
	 *
	 * @param name The raw name, usually a catalog title
	 * @return The sanitized name, possibly empty
	 */
	public static String sanitizeFilename(String name) {
		if (name == null) {
			return "";
		}
		return ILLEGAL_FILENAME_CHARS.matcher(name).replaceAll("").trim();
	}

	/**
	 * Build the file name for a download: the sanitized title with the extension appended. Falls back
	 * to the fallback name when the title sanitizes to nothing.
	 */
	public static String downloadFilename(String title, String fallback, String extension) {
		String base = sanitizeFilename(title);
		if (base.isEmpty()) {
			base = sanitizeFilename(fallback);
		}
		if (extension == null || extension.isBlank()) {
			return base;
		}
		return base + "." + sanitizeFilename(extension);
	}
}
