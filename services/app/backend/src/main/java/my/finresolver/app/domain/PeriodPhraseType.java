package my.finresolver.app.domain;

public enum PeriodPhraseType {
	EXACT_DATE,
	QUARTER_YEAR,
	FISCAL_YEAR_ONLY,
	RELATIVE_TERM
}
