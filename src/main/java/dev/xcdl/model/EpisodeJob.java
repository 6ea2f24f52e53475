package dev.xcdl.model;

import java.nio.file.Path;

/**
 * Download job for a single episode of a series. Season and episode are 0 when the catalog did not
 * provide them.
 */
public record EpisodeJob(
		String id,
		String url,
		Path destination,
		String displayName,
		String catalogId,
		String seriesName,
		int season,
		int episode)
		implements Job {

	@Override
	public Kind kind() {
		return Kind.SERIES;
	}
}
