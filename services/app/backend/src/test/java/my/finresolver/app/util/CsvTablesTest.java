package my.finresolver.app.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CsvTablesTest {
	@Test
	void stripBomRemovesLeadingMarker() {
		assertThat(CsvTables.stripBom("\uFEFFa,b,c")).isEqualTo("a,b,c");
	}

	@Test
	void stripBomHandlesNullAndEmpty() {
		assertThat(CsvTables.stripBom(null)).isNull();
		assertThat(CsvTables.stripBom("")).isEqualTo("");
	}

	@Test
	void sniffDelimiterPrefersSemicolonWhenItDominates() {
		assertThat(CsvTables.sniffDelimiter("a;b;c")).isEqualTo(';');
		assertThat(CsvTables.sniffDelimiter("a,b;c")).isEqualTo(',');
		assertThat(CsvTables.sniffDelimiter(null)).isEqualTo(',');
		assertThat(CsvTables.sniffDelimiter("")).isEqualTo(',');
	}

	@Test
	void parse_lowercasesHeadersAndMapsNullLiterals() throws Exception {
		String csv = "\uFEFFCompany_ID;Company_Name;Industry_ID\n1; United Bank Limited ;NULL\n2;Lucky Cement;\n";

		List<Map<String, String>> rows = CsvTables.parse(csv.getBytes(StandardCharsets.UTF_8));

		assertThat(rows).hasSize(2);
		assertThat(rows.get(0)).containsEntry("company_id", "1")
				.containsEntry("company_name", "United Bank Limited")
				.containsEntry("industry_id", null);
		assertThat(rows.get(1).get("industry_id")).isNull();
	}

	@Test
	void parse_skipsBlankRows() throws Exception {
		String csv = "term_id,term_label\n1,3M\n,\n2,6M\n";

		List<Map<String, String>> rows = CsvTables.parse(csv.getBytes(StandardCharsets.UTF_8));

		assertThat(rows).extracting(row -> row.get("term_label")).containsExactly("3M", "6M");
	}
}
