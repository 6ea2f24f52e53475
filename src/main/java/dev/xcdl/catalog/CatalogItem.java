package dev.xcdl.catalog;

import dev.xcdl.model.Kind;

/**
 * A downloadable entry of the catalog: a movie, or one episode of a series. For movies the series
 * fields are null and season/episode are 0.
 */
public record CatalogItem(
		Kind kind, String catalogId, String title, String extension, String seriesName, int season, int episode) {

	public static CatalogItem movie(String catalogId, String title, String extension) {
		return new CatalogItem(Kind.MOVIE, catalogId, title, extension, null, 0, 0);
	}

	public static CatalogItem episode(
			String catalogId, String title, String extension, String seriesName, int season, int episode) {
		return new CatalogItem(Kind.SERIES, catalogId, title, extension, seriesName, season, episode);
	}

	public String itemId() {
		return kind.itemId(catalogId);
	}

	/** True when season and episode numbers are known */
	public boolean hasEpisodeNumber() {
		return season > 0 || episode > 0;
	}
}
