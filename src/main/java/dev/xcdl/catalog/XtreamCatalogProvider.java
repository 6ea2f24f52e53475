package dev.xcdl.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.xcdl.model.Kind;
import dev.xcdl.util.HttpUtils;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Catalog provider for Xtream-Codes compatible servers. Metadata comes from {@code player_api.php},
 * media files from {@code /movie/} and {@code /series/} paths carrying the account credentials.
 */
public class XtreamCatalogProvider implements CatalogProvider {
	private static final Logger logger = LoggerFactory.getLogger(XtreamCatalogProvider.class);

	private final String baseUrl;
	private final String username;
	private final String password;
	private final HttpUtils httpUtils;
	private final ObjectMapper mapper = new ObjectMapper();

	public XtreamCatalogProvider(String baseUrl, String username, String password) {
		this(baseUrl, username, password, new HttpUtils());
	}

	public XtreamCatalogProvider(String baseUrl, String username, String password, HttpUtils httpUtils) {
		this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
		this.username = username;
		this.password = password;
		this.httpUtils = httpUtils;
	}

	@Override
	public List<Category> movieCategories() {
		return categories(Kind.MOVIE, apiCall("get_vod_categories", Map.of()));
	}

	@Override
	public List<Category> seriesCategories() {
		return categories(Kind.SERIES, apiCall("get_series_categories", Map.of()));
	}

	@Override
	public List<CatalogItem> movies(String categoryId) {
		JsonNode data = apiCall("get_vod_streams", Map.of("category_id", categoryId));
		List<CatalogItem> items = new ArrayList<>();
		if (data.isArray()) {
			for (JsonNode node : data) {
				String id = text(node, "stream_id");
				if (id == null) {
					continue;
				}
				items.add(CatalogItem.movie(id, text(node, "name"), text(node, "container_extension")));
			}
		}
		return items;
	}

	@Override
	public List<CatalogItem> series(String categoryId) {
		JsonNode data = apiCall("get_series", Map.of("category_id", categoryId));
		List<CatalogItem> items = new ArrayList<>();
		if (data.isArray()) {
			for (JsonNode node : data) {
				String id = text(node, "series_id");
				if (id == null) {
					continue;
				}
				String name = text(node, "name");
				items.add(new CatalogItem(Kind.SERIES, id, name, null, name, 0, 0));
			}
		}
		return items;
	}

	@Override
	public SeriesInfo seriesInfo(String seriesId) {
		JsonNode data = apiCall("get_series_info", Map.of("series_id", seriesId));
		String seriesName = text(data.path("info"), "name");
		List<CatalogItem> episodes = new ArrayList<>();

		// Episodes come as an object keyed by season number, each holding a list of episodes
		JsonNode seasons = data.path("episodes");
		Iterator<Map.Entry<String, JsonNode>> it = seasons.fields();
		while (it.hasNext()) {
			Map.Entry<String, JsonNode> season = it.next();
			int seasonNumber = number(season.getKey());
			for (JsonNode ep : season.getValue()) {
				String id = text(ep, "id");
				if (id == null) {
					continue;
				}
				int epSeason = ep.has("season") ? number(text(ep, "season")) : seasonNumber;
				episodes.add(CatalogItem.episode(
						id,
						text(ep, "title"),
						text(ep, "container_extension"),
						seriesName,
						epSeason,
						number(text(ep, "episode_num"))));
			}
		}
		return new SeriesInfo(seriesId, seriesName, episodes);
	}

	@Override
	public String downloadUrl(Kind kind, String catalogId, String extension) {
		String path = kind == Kind.MOVIE ? "movie" : "series";
		return "%s/%s/%s/%s/%s.%s"
				.formatted(baseUrl, path, segment(username), segment(password), segment(catalogId), extension);
	}

	@Override
	public TransferStream open(String url) throws IOException {
		return httpUtils.openStream(url);
	}

	/** Perform an API call; errors are logged and reported as a missing node */
	JsonNode apiCall(String action, Map<String, String> params) {
		Map<String, String> query = new LinkedHashMap<>(params);
		query.put("username", username);
		query.put("password", password);
		query.put("action", action);
		String url = baseUrl + "/player_api.php?" + encode(query);
		try {
			return mapper.readTree(httpUtils.downloadString(url));
		} catch (IOException e) {
			logger.error("API error ({}): {}", action, e.getMessage());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.warn("API call interrupted ({})", action);
		}
		return mapper.missingNode();
	}

	private List<Category> categories(Kind kind, JsonNode data) {
		List<Category> result = new ArrayList<>();
		if (data.isArray()) {
			for (JsonNode node : data) {
				String id = text(node, "category_id");
				if (id != null) {
					result.add(new Category(kind, id, text(node, "category_name")));
				}
			}
		}
		return result;
	}

	private static String encode(Map<String, String> query) {
		StringBuilder sb = new StringBuilder();
		for (Map.Entry<String, String> entry : query.entrySet()) {
			if (sb.length() > 0) {
				sb.append('&');
			}
			sb.append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
					.append('=')
					.append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
		}
		return sb.toString();
	}

	/** Percent-encode a single path segment; spaces become %20 rather than + */
	private static String segment(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
	}

	private static String text(JsonNode node, String field) {
		JsonNode value = node.get(field);
		if (value == null || value.isNull()) {
			return null;
		}
		return value.asText();
	}

	private static int number(String value) {
		if (value == null) {
			return 0;
		}
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			return 0;
		}
	}
}
