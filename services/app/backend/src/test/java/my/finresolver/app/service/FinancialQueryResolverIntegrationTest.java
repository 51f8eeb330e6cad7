package my.finresolver.app.service;

import my.finresolver.app.domain.HeadFamily;
import my.finresolver.app.domain.MetricKind;
import my.finresolver.app.dto.FailureType;
import my.finresolver.app.dto.ResolutionRequest;
import my.finresolver.app.dto.ResolutionResult;
import my.finresolver.app.metadata.MetadataCache;
import my.finresolver.app.query.DataTable;
import my.finresolver.app.query.QueryRows;
import my.finresolver.app.support.TestDatabaseCleaner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.math.BigDecimal;
import java.sql.Date;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class FinancialQueryResolverIntegrationTest {
	@Autowired
	private FinancialQueryResolver resolver;

	@Autowired
	private MetadataCache metadataCache;

	@Autowired
	private JdbcTemplate jdbcTemplate;

	@Autowired
	private TestDatabaseCleaner databaseCleaner;

	@DynamicPropertySource
	static void registerProperties(DynamicPropertyRegistry registry) {
		registry.add("app.resolver.max-suggestions", () -> "3");
	}

	@BeforeEach
	void setUp() {
		databaseCleaner.clean();
		insert("financial_data", 1, 89, "2021-03-31", 4, 2, 2021, "1500.50");
		insert("financial_data_quarter", 1, 1, "2024-03-31", 5, 2, 2024, "900");
		insert("financial_data_quarter", 1, 1, "2023-12-31", 8, 2, 2023, "850");
		insert("ratio_data", 1, 1, "2023-12-31", 4, 2, 2023, "15.2");
	}

	@AfterEach
	void tearDown() {
		databaseCleaner.clean();
		metadataCache.refresh();
	}

	@Test
	void resolvesHeadWithDataOutsideCompanyIndustry() {
		ResolutionResult result = resolver.resolve(
				"What was the Depreciation and Amortisation of UBL on 2021-03-31 unconsolidated?");

		assertThat(result.isResolved()).isTrue();
		assertThat(result.spec().head().headId()).isEqualTo(89L);
		assertThat(result.rows()).hasSize(1);
		assertThat((BigDecimal) result.rows().get(0).get("data_value")).isEqualByComparingTo("1500.5");
		assertThat(result.rows().get(0).get("unit_label")).isEqualTo("PKR (thousands)");
		assertThat(result.answer().periodLabel()).isEqualTo("2021-03-31");
	}

	@Test
	void latestQuarterUsesNewestQuarterlyPeriod() {
		ResolutionResult result = resolver.resolve("latest quarter revenue of UBL");

		assertThat(result.isResolved()).isTrue();
		assertThat(result.query().table()).isEqualTo(DataTable.FINANCIAL_DATA_QUARTER);
		assertThat(result.spec().period().periodEnd()).isEqualTo(LocalDate.of(2024, 3, 31));
		assertThat(QueryRows.localDate(result.rows().get(0), "period_end")).isEqualTo(LocalDate.of(2024, 3, 31));
	}

	@Test
	void previousQuarterSkipsNewestPeriod() {
		ResolutionResult result = resolver.resolve("previous quarter revenue of UBL");

		assertThat(result.spec().period().periodEnd()).isEqualTo(LocalDate.of(2023, 12, 31));
		assertThat((BigDecimal) result.rows().get(0).get("data_value")).isEqualByComparingTo("850");
	}

	@Test
	void ratioAliasReadsRatioTable() {
		ResolutionResult result = resolver.resolve("ROE of UBL for FY2023");

		assertThat(result.isResolved()).isTrue();
		assertThat(result.spec().kind()).isEqualTo(MetricKind.ratio());
		assertThat(result.query().table()).isEqualTo(DataTable.RATIO_DATA);
		assertThat(result.answer().unit()).isEqualTo("%");
	}

	@Test
	void dissectionRowsAreReadForTheirRegularHead() {
		// ratio head 3 is Revenue, regular head 3 is Profit After Tax
		insertDissection("dissection_data_ratio", 3, "2021-03-31", 4, 2021, 2, "12.5");

		ResolutionResult profitGrowth = resolver.resolve("profit after tax annual growth of UBL on 2021-03-31");
		ResolutionResult revenueGrowth = resolver.resolve("revenue annual growth of UBL on 2021-03-31");

		assertThat(profitGrowth.isResolved()).isTrue();
		assertThat(profitGrowth.spec().head().family()).isEqualTo(HeadFamily.REGULAR);
		assertThat(profitGrowth.query().table()).isEqualTo(DataTable.DISSECTION_DATA_RATIO);
		assertThat(profitGrowth.rows()).hasSize(1);
		assertThat(profitGrowth.rows().get(0).get("head_name")).isEqualTo("Profit After Tax");
		assertThat(((Number) profitGrowth.rows().get(0).get("dissection_group_id")).longValue()).isEqualTo(2L);
		assertThat((BigDecimal) profitGrowth.rows().get(0).get("data_value")).isEqualByComparingTo("12.5");
		assertThat(profitGrowth.answer().metricName()).isEqualTo("Profit After Tax (Annual Growth)");
		assertThat(revenueGrowth.failure().type()).isEqualTo(FailureType.METRIC_NO_DATA);
	}

	@Test
	void dissectionGroupFilterKeepsOtherGroupsOut() {
		insertDissection("dissection_data_ratio", 3, "2021-03-31", 4, 2021, 3, "4.1");

		ResolutionResult result = resolver.resolve("profit after tax annual growth of UBL on 2021-03-31");

		assertThat(result.failure().type()).isEqualTo(FailureType.METRIC_NO_DATA);
	}

	@Test
	void latestDissectionUsesNewestGroupPeriod() {
		insert("financial_data", 1, 1, "2024-03-31", 4, 2, 2024, "5000");
		insertDissection("dissection_data_ratio", 1, "2023-12-31", 4, 2023, 2, "8.4");

		ResolutionResult result = resolver.resolve("latest revenue annual growth of UBL");

		assertThat(result.isResolved()).isTrue();
		assertThat(result.spec().period().periodEnd()).isEqualTo(LocalDate.of(2023, 12, 31));
		assertThat(result.spec().kind()).isEqualTo(MetricKind.dissection(2));
		assertThat((BigDecimal) result.rows().get(0).get("data_value")).isEqualByComparingTo("8.4");
	}

	@Test
	void ttmReadsTrailingTable() {
		insert("financial_data_ttm", 1, 1, "2024-06-30", 9, 2, 2024, "3600");

		ResolutionResult result = resolver.resolve("TTM revenue of UBL");

		assertThat(result.isResolved()).isTrue();
		assertThat(result.query().table()).isEqualTo(DataTable.FINANCIAL_DATA_TTM);
		assertThat(result.spec().period().periodEnd()).isEqualTo(LocalDate.of(2024, 6, 30));
		assertThat(result.rows()).hasSize(1);
		assertThat(result.rows().get(0).get("term_label")).isEqualTo("TTM");
		assertThat((BigDecimal) result.rows().get(0).get("data_value")).isEqualByComparingTo("3600");
	}

	@Test
	void metricWithoutDataIsReported() {
		ResolutionResult result = resolver.resolve(new ResolutionRequest("HBL", "Profit After Tax", "FY2020", null));

		assertThat(result.failure().type()).isEqualTo(FailureType.METRIC_NO_DATA);
		assertThat(result.failure().suggestions()).hasSizeLessThanOrEqualTo(3);
	}

	@Test
	void refreshPicksUpNewCompanies() {
		ResolutionRequest request = new ResolutionRequest("ZETA", "revenue", "2023", null);
		assertThat(resolver.resolve(request).failure().type()).isEqualTo(FailureType.COMPANY_NOT_FOUND);

		jdbcTemplate.update("""
				insert into companies (company_id, company_name, ticker, sector_id, industry_id, fiscal_year_end_month)
				values (?, ?, ?, ?, ?, ?)
				""", TestDatabaseCleaner.FIRST_TEST_COMPANY_ID, "Zeta Holdings Limited", "ZETA", 1, null, 12);
		metadataCache.refresh();

		assertThat(resolver.resolve(request).failure().type()).isEqualTo(FailureType.METRIC_NO_DATA);
	}

	private void insertDissection(String table, long headId, String periodEnd, long termId, int fiscalYear,
								  long groupId, String value) {
		jdbcTemplate.update("insert into " + table
						+ " (company_id, head_id, period_end, term_id, consolidation_id, fiscal_year, data_value,"
						+ " dissection_group_id) values (?, ?, ?, ?, ?, ?, ?, ?)",
				1L, headId, Date.valueOf(periodEnd), termId, 2L, fiscalYear, new BigDecimal(value), groupId);
	}

	private void insert(String table, long companyId, long headId, String periodEnd, long termId,
						long consolidationId, int fiscalYear, String value) {
		jdbcTemplate.update("insert into " + table
						+ " (company_id, head_id, period_end, term_id, consolidation_id, fiscal_year, data_value)"
						+ " values (?, ?, ?, ?, ?, ?, ?)",
				companyId, headId, Date.valueOf(periodEnd), termId, consolidationId, fiscalYear, new BigDecimal(value));
	}
}
