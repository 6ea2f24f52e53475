package dev.xcdl.model;

import java.nio.file.Path;

/** Download job for a single movie */
public record MovieJob(String id, String url, Path destination, String displayName, String catalogId)
		implements Job {

	@Override
	public Kind kind() {
		return Kind.MOVIE;
	}
}
