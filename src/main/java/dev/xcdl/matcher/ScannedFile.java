package dev.xcdl.matcher;

/** A media file found in the download directory */
public record ScannedFile(
		String normalizedKey, String filename, double sizeMegabytes, long scannedAt, ParsedName parsed) {}
