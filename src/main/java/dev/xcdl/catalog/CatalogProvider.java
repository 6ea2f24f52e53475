package dev.xcdl.catalog;

import dev.xcdl.model.Kind;
import java.io.IOException;
import java.util.List;

/**
 * Source of catalog metadata and media transfers. Listing methods never fail: provider errors are
 * logged and reported as empty results. Only {@link #open(String)} reports transport errors.
 */
public interface CatalogProvider {

	List<Category> movieCategories();

	List<Category> seriesCategories();

	List<CatalogItem> movies(String categoryId);

	/** Series of a category. Items have kind {@link Kind#SERIES} and carry the series id. */
	List<CatalogItem> series(String categoryId);

	/** Episodes of one series, or an empty {@link SeriesInfo} when unavailable */
	SeriesInfo seriesInfo(String seriesId);

	/** Direct download location of a catalog item */
	String downloadUrl(Kind kind, String catalogId, String extension);

	/**
	 * Open a streamed transfer.
	 *
	 * @param url location returned by {@link #downloadUrl(Kind, String, String)}
	 * @return the open transfer
	 * @throws IOException on transport errors or a non-success response
	 */
	TransferStream open(String url) throws IOException;
}
