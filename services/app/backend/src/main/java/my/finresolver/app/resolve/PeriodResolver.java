package my.finresolver.app.resolve;

import my.finresolver.app.domain.MetricKind;
import my.finresolver.app.domain.PeriodBasis;
import my.finresolver.app.domain.PeriodPhraseType;
import my.finresolver.app.domain.ResolvedPeriod;
import my.finresolver.app.domain.Term;
import my.finresolver.app.lexicon.DissectionMatch;
import my.finresolver.app.metadata.MetadataSnapshot;
import my.finresolver.app.query.DataTable;
import my.finresolver.app.query.QueryBuilder;
import my.finresolver.app.query.QueryExecutor;
import my.finresolver.app.query.QueryRows;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a period phrase into either an exact period end or a term and fiscal year. Relative phrases
 * ("latest", "last quarter", "TTM") are looked up against the company's data.
 */
@Service
public class PeriodResolver {
	private static final Logger logger = LoggerFactory.getLogger(PeriodResolver.class);

	static final List<String> ACCEPTED_EXAMPLES = List.of(
			"2021-03-31", "31-03-2021", "31 March 2021", "Q2 2023", "Q2 FY2023", "6M 2023",
			"FY2022", "current fiscal year", "latest", "last quarter", "YTD", "TTM");
	private static final String[] CUMULATIVE_LABELS = {null, "3M", "6M", "9M", "12M"};
	private static final String ANNUAL_LABEL = "12M";
	private static final Map<String, Integer> ORDINALS = Map.of(
			"first", 1, "1st", 1, "second", 2, "2nd", 2, "third", 3, "3rd", 3, "fourth", 4, "4th", 4);

	private final QueryBuilder queryBuilder;
	private final QueryExecutor queryExecutor;
	private final Clock clock;

	public PeriodResolver(QueryBuilder queryBuilder, QueryExecutor queryExecutor, Clock clock) {
		this.queryBuilder = queryBuilder;
		this.queryExecutor = queryExecutor;
		this.clock = clock;
	}

	/**
	 * @param ratioTargeted whether the metric phrase carries a ratio indicator; relative phrases then look at
	 *                      the ratio table first
	 * @param dissection    dissection detected in the metric phrase, or {@code null}; relative phrases then look
	 *                      at that group's rows first
	 */
	public ResolvedPeriod resolve(String phrase,
								  CompanyContext company,
								  long consolidationId,
								  boolean ratioTargeted,
								  DissectionMatch dissection,
								  MetadataSnapshot snapshot) {
		PeriodMatch match = PeriodMatch.find(phrase)
				.orElseThrow(() -> new PeriodUnresolvableException(phrase,
						"Could not understand the period '" + phrase + "'", ACCEPTED_EXAMPLES));
		ResolvedPeriod period = switch (match.form()) {
			case ISO_DATE -> exactDate(phrase, match.group(1), match.group(2), match.group(3));
			case NUMERIC_DATE -> exactDate(phrase, match.group(3), match.group(2), match.group(1));
			case DAY_MONTH_NAME_DATE -> exactDate(phrase, match.group(3), month(match.group(2)), match.group(1));
			case MONTH_NAME_DAY_DATE -> exactDate(phrase, match.group(3), month(match.group(1)), match.group(2));
			case QUARTER_YEAR -> quarter(phrase, Integer.parseInt(match.group(1)),
					year(match.group(2) != null ? match.group(2) : match.group(3)), snapshot);
			case YEAR_QUARTER -> quarter(phrase, Integer.parseInt(match.group(2)), year(match.group(1)), snapshot);
			case ORDINAL_QUARTER -> quarter(phrase, ORDINALS.get(match.group(1).toLowerCase(Locale.ROOT)),
					year(match.group(2)), snapshot);
			case CUMULATIVE_TERM -> cumulative(phrase, match.group(1) + "M", year(match.group(2)), snapshot);
			case RELATIVE_FISCAL_YEAR -> relativeFiscalYear(phrase, match.group(1), company, snapshot);
			case FISCAL_YEAR, BARE_YEAR -> fiscalYear(phrase, year(match.group(1)), snapshot);
			case RELATIVE -> relative(phrase, RelativeTerm.fromKeyword(match.group(1)), company, consolidationId,
					ratioTargeted, dissection, snapshot);
		};
		logger.info("Resolved period '{}' as {} to {}.", phrase, match.form(), period);
		return period;
	}

	private ResolvedPeriod exactDate(String phrase, String year, String month, String day) {
		try {
			LocalDate date = LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day));
			return ResolvedPeriod.periodEnd(date, PeriodBasis.STANDARD, PeriodPhraseType.EXACT_DATE);
		} catch (DateTimeException ex) {
			throw new PeriodUnresolvableException(phrase, "'" + phrase + "' is not a valid calendar date",
					ACCEPTED_EXAMPLES);
		}
	}

	private static String month(String name) {
		String prefix = name.toLowerCase(Locale.ROOT).substring(0, 3);
		int index = List.of(PeriodForm.MONTHS.split("\\|")).indexOf(prefix);
		return String.valueOf(index + 1);
	}

	private static int year(String value) {
		int year = Integer.parseInt(value);
		return value.length() == 2 ? 2000 + year : year;
	}

	private ResolvedPeriod quarter(String phrase, int quarter, int fiscalYear, MetadataSnapshot snapshot) {
		Optional<Term> discrete = snapshot.termByLabel("Q" + quarter);
		if (discrete.isPresent()) {
			return ResolvedPeriod.termYear(discrete.get(), fiscalYear, PeriodBasis.QUARTERLY,
					PeriodPhraseType.QUARTER_YEAR);
		}
		return cumulative(phrase, CUMULATIVE_LABELS[quarter], fiscalYear, snapshot);
	}

	private ResolvedPeriod cumulative(String phrase, String label, int fiscalYear, MetadataSnapshot snapshot) {
		Term term = requireTerm(phrase, label, snapshot);
		return ResolvedPeriod.termYear(term, fiscalYear, PeriodBasis.STANDARD, PeriodPhraseType.QUARTER_YEAR);
	}

	private ResolvedPeriod fiscalYear(String phrase, int fiscalYear, MetadataSnapshot snapshot) {
		Term term = requireTerm(phrase, ANNUAL_LABEL, snapshot);
		return ResolvedPeriod.termYear(term, fiscalYear, PeriodBasis.STANDARD, PeriodPhraseType.FISCAL_YEAR_ONLY);
	}

	private ResolvedPeriod relativeFiscalYear(String phrase,
											  String qualifier,
											  CompanyContext company,
											  MetadataSnapshot snapshot) {
		int endMonth = company == null ? 12 : company.company().fiscalYearEndMonth();
		int current = fiscalYearLabel(LocalDate.now(clock), endMonth);
		String lower = qualifier.toLowerCase(Locale.ROOT);
		boolean previous = lower.equals("last") || lower.equals("previous") || lower.equals("prior");
		return fiscalYear(phrase, previous ? current - 1 : current, snapshot);
	}

	/**
	 * Fiscal years are labelled by the calendar year they end in.
	 */
	static int fiscalYearLabel(LocalDate date, int fiscalYearEndMonth) {
		return date.getMonthValue() > fiscalYearEndMonth ? date.getYear() + 1 : date.getYear();
	}

	private Term requireTerm(String phrase, String label, MetadataSnapshot snapshot) {
		return snapshot.termByLabel(label)
				.orElseThrow(() -> new PeriodUnresolvableException(phrase,
						"No reporting term '" + label + "' is defined for '" + phrase + "'", ACCEPTED_EXAMPLES));
	}

	private ResolvedPeriod relative(String phrase,
									RelativeTerm term,
									CompanyContext company,
									long consolidationId,
									boolean ratioTargeted,
									DissectionMatch dissection,
									MetadataSnapshot snapshot) {
		if (company == null) {
			throw new PeriodUnresolvableException(phrase,
					"'" + phrase + "' needs a company to look up available periods", ACCEPTED_EXAMPLES);
		}
		int offset = term == RelativeTerm.PREVIOUS_QUARTER ? 1 : 0;
		if (dissection != null) {
			LocalDate periodEnd = latestDissectionPeriod(phrase, term, company, consolidationId, dissection, offset,
					snapshot);
			if (periodEnd != null) {
				DataTable table = dissectionTable(term, dissection);
				return ResolvedPeriod.periodEnd(periodEnd, table.basis(), PeriodPhraseType.RELATIVE_TERM);
			}
		}
		List<DataTable> tables = switch (term) {
			case LATEST, MOST_RECENT, CURRENT -> ratioTargeted
					? List.of(DataTable.RATIO_DATA, DataTable.FINANCIAL_DATA, DataTable.FINANCIAL_DATA_QUARTER)
					: List.of(DataTable.FINANCIAL_DATA, DataTable.FINANCIAL_DATA_QUARTER);
			case LAST_QUARTER, PREVIOUS_QUARTER -> List.of(DataTable.FINANCIAL_DATA_QUARTER);
			case YTD -> List.of(DataTable.FINANCIAL_DATA);
			case TTM -> List.of(DataTable.FINANCIAL_DATA_TTM);
		};
		for (DataTable table : tables) {
			List<Map<String, Object>> rows = queryExecutor.fetch(
					queryBuilder.latestPeriod(company.companyId(), consolidationId, table, offset));
			if (rows.isEmpty()) {
				logger.debug("No periods in {} for company {}.", table.tableName(), company.companyId());
				continue;
			}
			LocalDate periodEnd = QueryRows.localDate(rows.get(0), "period_end");
			if (periodEnd != null) {
				return ResolvedPeriod.periodEnd(periodEnd, table.basis(), PeriodPhraseType.RELATIVE_TERM);
			}
		}
		throw new PeriodUnresolvableException(phrase,
				"No data is available to resolve '" + phrase + "' for " + company.company().name(), ACCEPTED_EXAMPLES);
	}

	private LocalDate latestDissectionPeriod(String phrase,
											 RelativeTerm term,
											 CompanyContext company,
											 long consolidationId,
											 DissectionMatch dissection,
											 int offset,
											 MetadataSnapshot snapshot) {
		DataTable table = dissectionTable(term, dissection);
		Long termId = null;
		if (term == RelativeTerm.YTD) {
			termId = requireTerm(phrase, ANNUAL_LABEL, snapshot).termId();
		}
		List<Map<String, Object>> rows = queryExecutor.fetch(queryBuilder.latestDissectionPeriod(
				company.companyId(), consolidationId, table, dissection.groupId(), termId, offset));
		if (rows.isEmpty()) {
			logger.debug("No {} periods in {} for company {}.", dissection.group().label(), table.tableName(),
					company.companyId());
			return null;
		}
		return QueryRows.localDate(rows.get(0), "period_end");
	}

	private static DataTable dissectionTable(RelativeTerm term, DissectionMatch dissection) {
		PeriodBasis basis = switch (term) {
			case LAST_QUARTER, PREVIOUS_QUARTER -> PeriodBasis.QUARTERLY;
			case TTM -> PeriodBasis.TTM;
			case LATEST, MOST_RECENT, CURRENT, YTD -> PeriodBasis.STANDARD;
		};
		MetricKind kind = MetricKind.dissection(dissection.groupId());
		return DataTable.select(kind, DataTable.axisFor(kind, basis, dissection.group().dataAxis()));
	}
}
