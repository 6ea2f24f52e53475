package dev.xcdl.catalog;

import dev.xcdl.model.Kind;

/** Catalog category, either of movies or of series */
public record Category(Kind kind, String id, String name) {

	/** Name tagged with the kind, e.g. "[Movie] Action" */
	public String displayName() {
		return "[" + (kind == Kind.MOVIE ? "Movie" : "Series") + "] " + name;
	}
}
