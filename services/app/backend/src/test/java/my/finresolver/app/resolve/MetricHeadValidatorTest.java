package my.finresolver.app.resolve;

import my.finresolver.app.domain.DataAxis;
import my.finresolver.app.domain.HeadFamily;
import my.finresolver.app.domain.MetricKind;
import my.finresolver.app.domain.PeriodBasis;
import my.finresolver.app.domain.PeriodPhraseType;
import my.finresolver.app.domain.ResolvedPeriod;
import my.finresolver.app.domain.Term;
import my.finresolver.app.lexicon.DissectionMatch;
import my.finresolver.app.lexicon.FinancialLexicon;
import my.finresolver.app.metadata.MetadataSnapshot;
import my.finresolver.app.query.DataTable;
import my.finresolver.app.query.QueryBuilder;
import my.finresolver.app.query.QueryExecutor;
import my.finresolver.app.query.QuerySpec;
import my.finresolver.app.support.MutableClock;
import my.finresolver.app.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MetricHeadValidatorTest {
	private static final long UNCONSOLIDATED = 2;
	private static final ResolvedPeriod MARCH_2021 =
			ResolvedPeriod.periodEnd(LocalDate.of(2021, 3, 31), PeriodBasis.STANDARD, PeriodPhraseType.EXACT_DATE);

	@Mock
	private QueryExecutor queryExecutor;

	private final MetadataSnapshot snapshot = TestFixtures.snapshot();
	private final FinancialLexicon lexicon = TestFixtures.lexicon();
	private final MutableClock clock = new MutableClock(TestFixtures.LOADED_AT);
	private MetricHeadValidator validator;
	private CompanyContext ubl;

	@BeforeEach
	void setUp() {
		validator = new MetricHeadValidator(lexicon, new QueryBuilder(), queryExecutor, TestFixtures.properties());
		ubl = new CompanyResolver(TestFixtures.properties()).resolve("UBL", snapshot).context();
	}

	@Test
	void validate_skipsIndustryHeadWithoutDataAndAcceptsNextExactHead() {
		stubCountsExceptHead(480L);

		MetricValidation validation = validate(request("Depreciation and Amortisation", ubl, MARCH_2021));

		assertThat(validation.status()).isEqualTo(MetricValidation.Status.ACCEPTED);
		assertThat(validation.accepted().head().headId()).isEqualTo(89L);
		assertThat(validation.accepted().kind()).isEqualTo(MetricKind.regular());
		assertThat(validation.emptyCandidates()).extracting(candidate -> candidate.head().headId()).containsExactly(480L);
		assertThat(validation.checks()).isEqualTo(2);
	}

	@Test
	void validate_aliasResolvesToCanonicalHead() {
		stubCountsExceptHead(-1L);

		MetricValidation validation = validate(request("D&A", ubl, MARCH_2021));

		assertThat(validation.accepted().head().headId()).isEqualTo(480L);
		assertThat(validation.checks()).isEqualTo(1);
	}

	@Test
	void validate_unknownPhraseIsNotFoundWithoutQueries() {
		MetricValidation validation = validate(request("Zorblatt Index", ubl, MARCH_2021));

		assertThat(validation.status()).isEqualTo(MetricValidation.Status.METRIC_NOT_FOUND);
		assertThat(validation.suggestions()).isNotEmpty().hasSizeLessThanOrEqualTo(5);
		verify(queryExecutor, never()).count(any());
	}

	@Test
	void validate_noDataChecksEachCandidateOnce() {
		when(queryExecutor.count(any())).thenReturn(0L);

		MetricValidation validation = validate(request("Depreciation and Amortisation", ubl, MARCH_2021));

		assertThat(validation.status()).isEqualTo(MetricValidation.Status.METRIC_NO_DATA);
		assertThat(validation.emptyCandidates()).extracting(candidate -> candidate.head().headId())
				.containsExactly(480L, 89L, 124L, 139L);
		assertThat(validation.suggestions()).hasSize(4);
		verify(queryExecutor, times(4)).count(any());
	}

	@Test
	void validate_withoutIndustryContextFallsThroughToAnyIndustry() {
		stubCountsExceptHead(-1L);
		CompanyContext noIndustry = new CompanyContext(ubl.company(), null, Set.of());

		MetricValidation validation = validate(request("Depreciation and Amortisation", noIndustry, MARCH_2021));

		assertThat(validation.accepted().head().headId()).isEqualTo(89L);
		assertThat(validation.checks()).isEqualTo(1);
	}

	@Test
	void validate_stopsWhenDeadlinePasses() {
		when(queryExecutor.count(any())).thenAnswer(invocation -> {
			clock.advance(Duration.ofSeconds(10));
			return 0L;
		});

		MetricValidation validation = validator.validate(request("Depreciation and Amortisation", ubl, MARCH_2021),
				snapshot, Deadline.after(clock, Duration.ofSeconds(5)));

		assertThat(validation.status()).isEqualTo(MetricValidation.Status.TIMED_OUT);
		assertThat(validation.checks()).isEqualTo(1);
		assertThat(validation.suggestions().get(0)).contains("head 89");
	}

	@Test
	void validate_ratioIndicatorSearchesRatioHeadsFirst() {
		stubCountsExceptHead(-1L);

		MetricValidation validation = validate(new MetricValidationRequest("Return on Equity", ubl, MARCH_2021,
				UNCONSOLIDATED, true, null));

		assertThat(validation.accepted().kind()).isEqualTo(MetricKind.ratio());
		assertThat(validation.accepted().axis()).isEqualTo(DataAxis.RATIO);
		assertThat(checkedTable()).isEqualTo(DataTable.RATIO_DATA);
	}

	@Test
	void validate_dissectionUsesGroupAxisForStandardPeriods() {
		stubCountsExceptHead(-1L);

		MetricValidation validation = validate(dissectionRequest("revenue annual growth", MARCH_2021));

		assertThat(validation.accepted().kind()).isEqualTo(MetricKind.dissection(2));
		assertThat(validation.accepted().axis()).isEqualTo(DataAxis.RATIO);
		assertThat(validation.accepted().head().family()).isEqualTo(HeadFamily.REGULAR);
		assertThat(validation.accepted().head().headId()).isEqualTo(1L);
		assertThat(checkedTable()).isEqualTo(DataTable.DISSECTION_DATA_RATIO);
	}

	@Test
	void validate_dissectionBaseHeadsComeFromRegularHeadsOnly() {
		// ratio head 3 is Revenue, regular head 3 is Profit After Tax
		stubCountsOnlyForHead(3L);

		MetricValidation revenueGrowth = validate(dissectionRequest("revenue annual growth", MARCH_2021));
		MetricValidation profitGrowth = validate(dissectionRequest("profit after tax annual growth", MARCH_2021));

		assertThat(revenueGrowth.status()).isEqualTo(MetricValidation.Status.METRIC_NO_DATA);
		assertThat(revenueGrowth.emptyCandidates()).extracting(candidate -> candidate.head().family())
				.containsOnly(HeadFamily.REGULAR);
		assertThat(revenueGrowth.emptyCandidates()).extracting(candidate -> candidate.head().headId())
				.containsExactly(1L, 2L);
		assertThat(profitGrowth.status()).isEqualTo(MetricValidation.Status.ACCEPTED);
		assertThat(profitGrowth.accepted().head().name()).isEqualTo("Profit After Tax");
		assertThat(profitGrowth.accepted().head().family()).isEqualTo(HeadFamily.REGULAR);
	}

	@Test
	void validate_quarterlyPeriodForcesQuarterlyDissectionTable() {
		stubCountsExceptHead(-1L);
		ResolvedPeriod q2 = ResolvedPeriod.termYear(new Term(6, "Q2"), 2023, PeriodBasis.QUARTERLY,
				PeriodPhraseType.QUARTER_YEAR);

		MetricValidation validation = validate(dissectionRequest("revenue annual growth", q2));

		assertThat(validation.accepted().axis()).isEqualTo(DataAxis.QUARTERLY);
		assertThat(checkedTable()).isEqualTo(DataTable.DISSECTION_DATA_QUARTER);
	}

	private void stubCountsExceptHead(long emptyHeadId) {
		when(queryExecutor.count(any())).thenAnswer(invocation -> {
			QuerySpec query = invocation.getArgument(0);
			long headId = (Long) query.parameters().get("headId");
			return headId == emptyHeadId ? 0L : 3L;
		});
	}

	private void stubCountsOnlyForHead(long headId) {
		when(queryExecutor.count(any())).thenAnswer(invocation -> {
			QuerySpec query = invocation.getArgument(0);
			return query.parameters().get("headId").equals(headId) ? 3L : 0L;
		});
	}

	private DataTable checkedTable() {
		ArgumentCaptor<QuerySpec> captor = ArgumentCaptor.forClass(QuerySpec.class);
		verify(queryExecutor).count(captor.capture());
		return captor.getValue().table();
	}

	private MetricValidationRequest request(String phrase, CompanyContext company, ResolvedPeriod period) {
		return new MetricValidationRequest(phrase, company, period, UNCONSOLIDATED, false, null);
	}

	private MetricValidationRequest dissectionRequest(String phrase, ResolvedPeriod period) {
		DissectionMatch dissection = lexicon.detectDissection(phrase).orElseThrow();
		return new MetricValidationRequest(phrase, ubl, period, UNCONSOLIDATED, false, dissection);
	}

	private MetricValidation validate(MetricValidationRequest request) {
		return validator.validate(request, snapshot, Deadline.after(clock, Duration.ofSeconds(10)));
	}
}
