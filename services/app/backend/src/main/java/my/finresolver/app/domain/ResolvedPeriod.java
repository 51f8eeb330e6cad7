package my.finresolver.app.domain;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Concrete period filter: either an exact period-end date or a term and fiscal year, never both.
 */
public final class ResolvedPeriod {
	private final LocalDate periodEnd;
	private final Long termId;
	private final Integer fiscalYear;
	private final PeriodBasis basis;
	private final PeriodPhraseType phraseType;
	private final String label;

	private ResolvedPeriod(LocalDate periodEnd,
						   Long termId,
						   Integer fiscalYear,
						   PeriodBasis basis,
						   PeriodPhraseType phraseType,
						   String label) {
		this.periodEnd = periodEnd;
		this.termId = termId;
		this.fiscalYear = fiscalYear;
		this.basis = basis == null ? PeriodBasis.STANDARD : basis;
		this.phraseType = phraseType;
		this.label = label;
	}

	public static ResolvedPeriod periodEnd(LocalDate periodEnd, PeriodBasis basis, PeriodPhraseType phraseType) {
		Objects.requireNonNull(periodEnd, "periodEnd");
		return new ResolvedPeriod(periodEnd, null, null, basis, phraseType, periodEnd.toString());
	}

	public static ResolvedPeriod termYear(Term term, int fiscalYear, PeriodBasis basis, PeriodPhraseType phraseType) {
		Objects.requireNonNull(term, "term");
		return new ResolvedPeriod(null, term.termId(), fiscalYear, basis, phraseType,
				term.label() + " " + fiscalYear);
	}

	public boolean hasPeriodEnd() {
		return periodEnd != null;
	}

	public LocalDate periodEnd() {
		return periodEnd;
	}

	public Long termId() {
		return termId;
	}

	public Integer fiscalYear() {
		return fiscalYear;
	}

	public PeriodBasis basis() {
		return basis;
	}

	public PeriodPhraseType phraseType() {
		return phraseType;
	}

	public String label() {
		return label;
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof ResolvedPeriod period)) {
			return false;
		}
		return Objects.equals(periodEnd, period.periodEnd)
				&& Objects.equals(termId, period.termId)
				&& Objects.equals(fiscalYear, period.fiscalYear)
				&& basis == period.basis
				&& phraseType == period.phraseType;
	}

	@Override
	public int hashCode() {
		return Objects.hash(periodEnd, termId, fiscalYear, basis, phraseType);
	}

	@Override
	public String toString() {
		return "ResolvedPeriod[" + label + ", " + basis + "]";
	}
}
