package my.finresolver.app.metadata;

import my.finresolver.app.domain.Company;
import my.finresolver.app.domain.ConsolidationType;
import my.finresolver.app.domain.DissectionGroup;
import my.finresolver.app.domain.HeadFamily;
import my.finresolver.app.domain.Industry;
import my.finresolver.app.domain.IndustrySectorMapping;
import my.finresolver.app.domain.MetricHead;
import my.finresolver.app.domain.Sector;
import my.finresolver.app.domain.Term;
import my.finresolver.app.domain.Unit;
import my.finresolver.app.util.CsvTables;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Reads reference tables from a directory of CSV exports, one {@code <table>.csv} per table with the
 * warehouse column names as header.
 */
public class CsvMetadataSource implements MetadataSource {
	private final ResourceLoader resourceLoader;
	private final String location;

	public CsvMetadataSource(ResourceLoader resourceLoader, String location) {
		this.resourceLoader = resourceLoader;
		this.location = location.endsWith("/") ? location : location + "/";
	}

	@Override
	public List<Company> companies() {
		return read("companies", row -> new Company(
				requiredLong(row, "company_id"),
				required(row, "company_name"),
				row.get("ticker"),
				requiredLong(row, "sector_id"),
				optionalLong(row, "industry_id"),
				row.get("fiscal_year_end_month") == null ? 12 : Integer.parseInt(row.get("fiscal_year_end_month"))
		));
	}

	@Override
	public List<Sector> sectors() {
		return read("sectors", row -> new Sector(requiredLong(row, "sector_id"), required(row, "sector_name")));
	}

	@Override
	public List<Industry> industries() {
		return read("industries", row -> new Industry(requiredLong(row, "industry_id"), required(row, "industry_name")));
	}

	@Override
	public List<IndustrySectorMapping> industrySectorMappings() {
		return read("industry_sector_mapping",
				row -> new IndustrySectorMapping(requiredLong(row, "industry_id"), requiredLong(row, "sector_id")));
	}

	@Override
	public List<MetricHead> heads() {
		return read("heads", row -> head(row, HeadFamily.REGULAR));
	}

	@Override
	public List<MetricHead> ratioHeads() {
		return read("ratio_heads", row -> head(row, HeadFamily.RATIO));
	}

	@Override
	public List<Term> terms() {
		return read("terms", row -> new Term(requiredLong(row, "term_id"), required(row, "term_label")));
	}

	@Override
	public List<ConsolidationType> consolidations() {
		return read("consolidations", row -> new ConsolidationType(
				requiredLong(row, "consolidation_id"), required(row, "consolidation_label")));
	}

	@Override
	public List<Unit> units() {
		return read("units", row -> new Unit(requiredLong(row, "unit_id"), required(row, "unit_label")));
	}

	@Override
	public List<DissectionGroup> dissectionGroups() {
		return read("dissection_groups", row -> new DissectionGroup(
				requiredLong(row, "group_id"), required(row, "group_label")));
	}

	@Override
	public String describe() {
		return "csv exports at " + location;
	}

	private MetricHead head(Map<String, String> row, HeadFamily family) {
		return new MetricHead(
				requiredLong(row, "head_id"),
				required(row, "head_name"),
				requiredLong(row, "industry_id"),
				optionalLong(row, "unit_id"),
				family
		);
	}

	private <T> List<T> read(String table, Function<Map<String, String>, T> mapper) {
		Resource resource = resourceLoader.getResource(location + table + ".csv");
		if (!resource.exists()) {
			throw new MetadataLoadException(table, "Missing export " + resource.getDescription());
		}
		List<Map<String, String>> rows;
		try (InputStream in = resource.getInputStream()) {
			rows = CsvTables.parse(in.readAllBytes());
		} catch (IOException ex) {
			throw new MetadataLoadException(table, "Failed to read " + resource.getDescription(), ex);
		}
		List<T> result = new ArrayList<>(rows.size());
		int line = 1;
		for (Map<String, String> row : rows) {
			line++;
			try {
				result.add(mapper.apply(row));
			} catch (IllegalArgumentException ex) {
				throw new MetadataLoadException(table,
						"Invalid row " + line + " in " + table + ".csv: " + ex.getMessage(), ex);
			}
		}
		return result;
	}

	private static String required(Map<String, String> row, String column) {
		String value = row.get(column);
		if (value == null) {
			throw new IllegalArgumentException("column " + column + " is required");
		}
		return value;
	}

	private static long requiredLong(Map<String, String> row, String column) {
		return Long.parseLong(required(row, column));
	}

	private static Long optionalLong(Map<String, String> row, String column) {
		String value = row.get(column);
		return value == null ? null : Long.valueOf(value);
	}
}
