package dev.xcdl.model;

import java.util.Optional;

/** Kind of catalog item. The key is the prefix used in item ids ("movie:42", "series:7"). */
public enum Kind {
	MOVIE("movie"),
	SERIES("series");

	private final String key;

	Kind(String key) {
		this.key = key;
	}

	public String key() {
		return key;
	}

	/** Build the item id for a catalog id of this kind */
	public String itemId(String catalogId) {
		return key + ":" + catalogId;
	}

	public static Optional<Kind> fromKey(String key) {
		if (key == null) {
			return Optional.empty();
		}
		for (Kind kind : values()) {
			if (kind.key.equalsIgnoreCase(key.trim())) {
				return Optional.of(kind);
			}
		}
		return Optional.empty();
	}
}
