package my.finresolver.app.util;

import java.util.Locale;
import java.util.regex.Pattern;

public final class TextNormalizer {
	private static final Pattern POSSESSIVE = Pattern.compile("['\u2019]s\\b");
	private static final Pattern DISALLOWED = Pattern.compile("[^a-z0-9&%/ ]");
	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	private TextNormalizer() {
	}

	/**
	 * Lower-cases and strips punctuation except {@code & % /}; hyphens and dots become spaces.
	 */
	public static String normalize(String value) {
		if (value == null) {
			return "";
		}
		String lower = value.toLowerCase(Locale.ROOT);
		lower = POSSESSIVE.matcher(lower).replaceAll("");
		lower = lower.replace('\u2019', ' ').replace('\'', ' ');
		lower = DISALLOWED.matcher(lower).replaceAll(" ");
		return collapseWhitespace(lower);
	}

	public static String collapseWhitespace(String value) {
		if (value == null) {
			return "";
		}
		return WHITESPACE.matcher(value).replaceAll(" ").trim();
	}

	/**
	 * Whole-word containment on already normalized text.
	 */
	public static boolean containsPhrase(String haystack, String needle) {
		return indexOfPhrase(haystack, needle) >= 0;
	}

	public static int indexOfPhrase(String haystack, String needle) {
		if (haystack == null || needle == null || needle.isEmpty()) {
			return -1;
		}
		String padded = " " + haystack + " ";
		int index = padded.indexOf(" " + needle + " ");
		return index < 0 ? -1 : index;
	}

	/**
	 * Replaces one whole-word occurrence of {@code needle} with a single space.
	 */
	public static String removePhrase(String haystack, String needle) {
		int index = indexOfPhrase(haystack, needle);
		if (index < 0) {
			return haystack;
		}
		String padded = " " + haystack + " ";
		String removed = padded.substring(0, index) + " " + padded.substring(index + needle.length() + 2);
		return collapseWhitespace(removed);
	}

	public static String trimToNull(String value) {
		if (value == null) {
			return null;
		}
		String trimmed = value.trim();
		return trimmed.isEmpty() ? null : trimmed;
	}
}
