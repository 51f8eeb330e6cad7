package my.finresolver.app.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {
	@Test
	void normalize_lowercasesAndStripsPunctuation() {
		assertThat(TextNormalizer.normalize("  What's UBL's  D&A, (2021)? ")).isEqualTo("what ubl d&a 2021");
		assertThat(TextNormalizer.normalize("Debt/Equity %")).isEqualTo("debt/equity %");
		assertThat(TextNormalizer.normalize(null)).isEmpty();
	}

	@Test
	void containsPhrase_matchesWholeWordsOnly() {
		assertThat(TextNormalizer.containsPhrase("current ratio of luck", "ratio")).isTrue();
		assertThat(TextNormalizer.containsPhrase("operating ratios", "ratio")).isFalse();
		assertThat(TextNormalizer.containsPhrase("united bank limited", "united bank")).isTrue();
		assertThat(TextNormalizer.containsPhrase("united bank limited", "")).isFalse();
	}

	@Test
	void removePhrase_dropsOneOccurrenceAndCollapsesSpaces() {
		assertThat(TextNormalizer.removePhrase("eps of ubl for 2023", "ubl")).isEqualTo("eps of for 2023");
		assertThat(TextNormalizer.removePhrase("eps of hbl", "ubl")).isEqualTo("eps of hbl");
	}

	@Test
	void trimToNull_handlesBlank() {
		assertThat(TextNormalizer.trimToNull("   ")).isNull();
		assertThat(TextNormalizer.trimToNull(" x ")).isEqualTo("x");
	}
}
