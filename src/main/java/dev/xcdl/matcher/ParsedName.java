package dev.xcdl.matcher;

/**
 * Structured metadata extracted from a file name.
 *
 * @param type movie or episode
 * @param name normalized name used as the match key
 * @param seriesName series name as written in the file name, null for movies
 * @param season season number, 0 for movies
 * @param episode episode number, 0 for movies
 */
public record ParsedName(Type type, String name, String seriesName, int season, int episode) {

	public enum Type {
		MOVIE,
		EPISODE
	}

	public static ParsedName movie(String normalizedName) {
		return new ParsedName(Type.MOVIE, normalizedName, null, 0, 0);
	}

	public static ParsedName episode(String normalizedName, String seriesName, int season, int episode) {
		return new ParsedName(Type.EPISODE, normalizedName, seriesName, season, episode);
	}

	public boolean isEpisode() {
		return type == Type.EPISODE;
	}
}
