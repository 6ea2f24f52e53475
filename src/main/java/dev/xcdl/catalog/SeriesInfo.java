package dev.xcdl.catalog;

import java.util.List;

/** A series with all of its episodes flattened across seasons */
public record SeriesInfo(String seriesId, String name, List<CatalogItem> episodes) {}
