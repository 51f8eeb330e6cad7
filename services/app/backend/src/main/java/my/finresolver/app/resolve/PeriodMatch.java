package my.finresolver.app.resolve;

import java.util.Optional;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;

/**
 * First period phrasing found in a piece of text.
 */
public record PeriodMatch(PeriodForm form, MatchResult match) {
	public static Optional<PeriodMatch> find(String text) {
		if (text == null || text.isBlank()) {
			return Optional.empty();
		}
		for (PeriodForm form : PeriodForm.values()) {
			Matcher matcher = form.pattern().matcher(text);
			if (matcher.find()) {
				return Optional.of(new PeriodMatch(form, matcher.toMatchResult()));
			}
		}
		return Optional.empty();
	}

	public String text() {
		return match.group();
	}

	public int start() {
		return match.start();
	}

	public int end() {
		return match.end();
	}

	public String group(int index) {
		return match.group(index);
	}
}
