package dev.xcdl.matcher;

/**
 * Pure matching heuristics between names found on disk and catalog names. All names are expected
 * to be normalized already.
 */
public class MatchRules {

	/** Default maximum length difference, as a fraction of the longer name */
	public static final double DEFAULT_TOLERANCE = 0.5;

	private MatchRules() {}

	/**
	 * One name contains the other and their lengths differ by less than {@code tolerance} times the
	 * longer length. The length check rejects short names that happen to occur inside long ones.
	 */
	public static boolean movieMatches(String fileName, String catalogName, double tolerance) {
		if (isBlank(fileName) || isBlank(catalogName)) {
			return false;
		}
		if (!contains(fileName, catalogName)) {
			return false;
		}
		int longer = Math.max(fileName.length(), catalogName.length());
		int difference = Math.abs(fileName.length() - catalogName.length());
		return difference < tolerance * longer;
	}

	/** Season and episode are equal and one series name contains the other */
	public static boolean episodeMatches(
			String fileSeries, int fileSeason, int fileEpisode, String catalogSeries, int season, int episode) {
		if (fileSeason != season || fileEpisode != episode) {
			return false;
		}
		if (isBlank(fileSeries) || isBlank(catalogSeries)) {
			return false;
		}
		return contains(fileSeries, catalogSeries);
	}

	private static boolean contains(String a, String b) {
		return a.contains(b) || b.contains(a);
	}

	private static boolean isBlank(String s) {
		return s == null || s.isBlank();
	}
}
