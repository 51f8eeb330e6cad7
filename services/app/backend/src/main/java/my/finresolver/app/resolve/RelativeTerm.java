package my.finresolver.app.resolve;

import my.finresolver.app.util.TextNormalizer;

import java.util.Locale;

public enum RelativeTerm {
	LATEST,
	MOST_RECENT,
	CURRENT,
	LAST_QUARTER,
	PREVIOUS_QUARTER,
	YTD,
	TTM;

	public static RelativeTerm fromKeyword(String keyword) {
		String value = TextNormalizer.collapseWhitespace(keyword).toLowerCase(Locale.ROOT);
		if (value.endsWith("quarter")) {
			return value.startsWith("previous") || value.startsWith("prior") ? PREVIOUS_QUARTER : LAST_QUARTER;
		}
		return switch (value) {
			case "latest" -> LATEST;
			case "most recent" -> MOST_RECENT;
			case "current" -> CURRENT;
			case "ytd", "year to date" -> YTD;
			default -> TTM;
		};
	}
}
