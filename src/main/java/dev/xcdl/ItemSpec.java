package dev.xcdl;

import dev.xcdl.model.Kind;
import java.util.Optional;

/**
 * An item named on the command line: {@code movie:<id>:<ext>[:<title>]} or
 * {@code series:<id>:<ext>[:<title>]} for a single movie or episode, {@code show:<seriesId>} for
 * all episodes of a series.
 */
public record ItemSpec(Kind kind, String catalogId, String extension, String title, boolean wholeSeries) {

	public static Optional<ItemSpec> parse(String spec) {
		if (spec == null) {
			return Optional.empty();
		}
		String[] parts = spec.split(":", 4);
		if (parts.length == 2 && parts[0].equalsIgnoreCase("show") && !parts[1].isBlank()) {
			return Optional.of(new ItemSpec(Kind.SERIES, parts[1].trim(), null, null, true));
		}
		if (parts.length < 3 || parts[1].isBlank() || parts[2].isBlank()) {
			return Optional.empty();
		}
		String title = parts.length == 4 ? parts[3].trim() : null;
		return Kind.fromKey(parts[0])
				.map(kind -> new ItemSpec(kind, parts[1].trim(), parts[2].trim(), title, false));
	}
}
