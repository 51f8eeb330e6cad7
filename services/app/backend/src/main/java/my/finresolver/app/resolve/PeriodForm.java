package my.finresolver.app.resolve;

import my.finresolver.app.domain.PeriodPhraseType;

import java.util.regex.Pattern;

/**
 * Recognized period phrasings, in match priority order: explicit forms before relative ones.
 */
public enum PeriodForm {
	ISO_DATE(PeriodPhraseType.EXACT_DATE,
			"\\b(\\d{4})-(\\d{1,2})-(\\d{1,2})\\b"),
	NUMERIC_DATE(PeriodPhraseType.EXACT_DATE,
			"\\b(\\d{1,2})[-/.](\\d{1,2})[-/.](\\d{4})\\b"),
	DAY_MONTH_NAME_DATE(PeriodPhraseType.EXACT_DATE,
			"\\b(\\d{1,2})(?:st|nd|rd|th)?\\s+(" + PeriodForm.MONTHS + ")[a-z]*\\.?,?\\s+(\\d{4})\\b"),
	MONTH_NAME_DAY_DATE(PeriodPhraseType.EXACT_DATE,
			"\\b(" + PeriodForm.MONTHS + ")[a-z]*\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?,?\\s+(\\d{4})\\b"),
	QUARTER_YEAR(PeriodPhraseType.QUARTER_YEAR,
			"\\bq([1-4])\\s*[-/]?\\s*(?:of\\s+)?(?:fy\\s*'?(\\d{4}|\\d{2})|(\\d{4}))\\b"),
	YEAR_QUARTER(PeriodPhraseType.QUARTER_YEAR,
			"\\b(?:fy\\s*)?(\\d{4})\\s*[-/]?\\s*q([1-4])\\b"),
	ORDINAL_QUARTER(PeriodPhraseType.QUARTER_YEAR,
			"\\b(first|second|third|fourth|1st|2nd|3rd|4th)\\s+quarter\\s+(?:of\\s+)?(?:fy\\s*)?(\\d{4})\\b"),
	CUMULATIVE_TERM(PeriodPhraseType.QUARTER_YEAR,
			"\\b(3|6|9|12)\\s*m(?:onths?)?\\s+(?:of\\s+|ended\\s+)?(?:fy\\s*)?(\\d{4})\\b"),
	RELATIVE_FISCAL_YEAR(PeriodPhraseType.FISCAL_YEAR_ONLY,
			"\\b(current|this|last|previous|prior)\\s+(?:fiscal|financial)\\s+year\\b"),
	FISCAL_YEAR(PeriodPhraseType.FISCAL_YEAR_ONLY,
			"\\b(?:fy|fiscal\\s+year|financial\\s+year)\\s*'?(\\d{4}|\\d{2})\\b"),
	BARE_YEAR(PeriodPhraseType.FISCAL_YEAR_ONLY,
			"\\b((?:19|20)\\d{2})\\b"),
	RELATIVE(PeriodPhraseType.RELATIVE_TERM,
			"\\b(most\\s+recent\\s+quarter|latest\\s+quarter|last\\s+quarter|previous\\s+quarter|prior\\s+quarter"
					+ "|most\\s+recent|latest"
					+ "|current(?!\\s+(?:ratio|assets?|liabilit(?:y|ies)|portion|account|fiscal|financial))"
					+ "|ytd|year\\s+to\\s+date|ttm|ltm|trailing\\s+(?:twelve|12)\\s+months|last\\s+(?:twelve|12)\\s+months)\\b");

	static final String MONTHS = "jan|feb|mar|apr|may|jun|jul|aug|sep|oct|nov|dec";

	private final PeriodPhraseType phraseType;
	private final Pattern pattern;

	PeriodForm(PeriodPhraseType phraseType, String regex) {
		this.phraseType = phraseType;
		this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
	}

	public PeriodPhraseType phraseType() {
		return phraseType;
	}

	public Pattern pattern() {
		return pattern;
	}
}
