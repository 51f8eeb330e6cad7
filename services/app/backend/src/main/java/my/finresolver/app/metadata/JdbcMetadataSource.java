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
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * Reads the warehouse lookup tables directly.
 */
public class JdbcMetadataSource implements MetadataSource {
	private final JdbcTemplate jdbcTemplate;

	public JdbcMetadataSource(JdbcTemplate jdbcTemplate) {
		this.jdbcTemplate = jdbcTemplate;
	}

	@Override
	public List<Company> companies() {
		return jdbcTemplate.query("""
				select company_id, company_name, ticker, sector_id, industry_id, fiscal_year_end_month
				from companies
				order by company_id
				""", (rs, rowNum) -> new Company(
				rs.getLong("company_id"),
				rs.getString("company_name"),
				rs.getString("ticker"),
				rs.getLong("sector_id"),
				nullableLong(rs, "industry_id"),
				rs.getInt("fiscal_year_end_month")
		));
	}

	@Override
	public List<Sector> sectors() {
		return jdbcTemplate.query("select sector_id, sector_name from sectors order by sector_id",
				(rs, rowNum) -> new Sector(rs.getLong("sector_id"), rs.getString("sector_name")));
	}

	@Override
	public List<Industry> industries() {
		return jdbcTemplate.query("select industry_id, industry_name from industries order by industry_id",
				(rs, rowNum) -> new Industry(rs.getLong("industry_id"), rs.getString("industry_name")));
	}

	@Override
	public List<IndustrySectorMapping> industrySectorMappings() {
		return jdbcTemplate.query("select industry_id, sector_id from industry_sector_mapping",
				(rs, rowNum) -> new IndustrySectorMapping(rs.getLong("industry_id"), rs.getLong("sector_id")));
	}

	@Override
	public List<MetricHead> heads() {
		return readHeads("heads", HeadFamily.REGULAR);
	}

	@Override
	public List<MetricHead> ratioHeads() {
		return readHeads("ratio_heads", HeadFamily.RATIO);
	}

	private List<MetricHead> readHeads(String table, HeadFamily family) {
		// table is one of two fixed names
		return jdbcTemplate.query(
				"select head_id, head_name, industry_id, unit_id from " + table + " order by head_id",
				(rs, rowNum) -> new MetricHead(
						rs.getLong("head_id"),
						rs.getString("head_name"),
						rs.getLong("industry_id"),
						nullableLong(rs, "unit_id"),
						family
				));
	}

	@Override
	public List<Term> terms() {
		return jdbcTemplate.query("select term_id, term_label from terms order by term_id",
				(rs, rowNum) -> new Term(rs.getLong("term_id"), rs.getString("term_label")));
	}

	@Override
	public List<ConsolidationType> consolidations() {
		return jdbcTemplate.query(
				"select consolidation_id, consolidation_label from consolidations order by consolidation_id",
				(rs, rowNum) -> new ConsolidationType(rs.getLong("consolidation_id"), rs.getString("consolidation_label")));
	}

	@Override
	public List<Unit> units() {
		return jdbcTemplate.query("select unit_id, unit_label from units order by unit_id",
				(rs, rowNum) -> new Unit(rs.getLong("unit_id"), rs.getString("unit_label")));
	}

	@Override
	public List<DissectionGroup> dissectionGroups() {
		return jdbcTemplate.query("select group_id, group_label from dissection_groups order by group_id",
				(rs, rowNum) -> new DissectionGroup(rs.getLong("group_id"), rs.getString("group_label")));
	}

	@Override
	public String describe() {
		return "warehouse database";
	}

	private static Long nullableLong(ResultSet rs, String column) throws SQLException {
		long value = rs.getLong(column);
		return rs.wasNull() ? null : value;
	}
}
