package dev.xcdl.model;

import java.nio.file.Path;

/**
 * A queued request to fetch one catalog item to a destination path. Implementations are immutable;
 * {@link MovieJob} and {@link EpisodeJob} carry the fields relevant to their kind.
 */
public interface Job {
	/** Opaque unique token identifying this job in the queue */
	String id();

	/** Source location of the media file */
	String url();

	Path destination();

	String displayName();

	Kind kind();

	/** Catalog id the job was created for */
	String catalogId();

	/** Stable key of the catalog item, independent of the destination file name */
	default String itemId() {
		return kind().itemId(catalogId());
	}

	default String filename() {
		return destination().getFileName().toString();
	}
}
