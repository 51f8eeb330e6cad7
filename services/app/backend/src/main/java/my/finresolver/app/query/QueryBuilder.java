package my.finresolver.app.query;

import my.finresolver.app.domain.HeadFamily;
import my.finresolver.app.domain.ResolvedPeriod;
import my.finresolver.app.domain.ResolvedQuerySpec;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Composes retrieval, existence and latest-period queries from resolved identifiers. User text never
 * reaches a query: table and column names come from {@link DataTable} and constants, values are bound.
 */
@Component
public class QueryBuilder {
	static final String DATA = "d";

	public QuerySpec build(ResolvedQuerySpec spec) {
		DataTable table = DataTable.select(spec.kind(), spec.axis());
		String headTable = headTable(spec);

		List<Projection> projection = new ArrayList<>();
		projection.add(new Projection(data("data_value"), "data_value"));
		if (!table.isDissection()) {
			projection.add(new Projection(new Column("u", "unit_label"), "unit_label"));
		}
		projection.add(new Projection(new Column("t", "term_label"), "term_label"));
		projection.add(new Projection(new Column("c", "company_name"), "company_name"));
		projection.add(new Projection(new Column("h", "head_name"), "head_name"));
		projection.add(new Projection(new Column("k", "consolidation_label"), "consolidation_label"));
		projection.add(new Projection(data("period_end"), "period_end"));
		projection.add(new Projection(data("fiscal_year"), "fiscal_year"));
		if (table.isDissection()) {
			projection.add(new Projection(data("dissection_group_id"), "dissection_group_id"));
		}

		List<Join> joins = new ArrayList<>(List.of(
				new Join(Join.Type.INNER, "companies", "c", new Column("c", "company_id"), data("company_id")),
				new Join(Join.Type.INNER, headTable, "h", new Column("h", "head_id"), data("head_id")),
				new Join(Join.Type.INNER, "terms", "t", new Column("t", "term_id"), data("term_id")),
				new Join(Join.Type.INNER, "consolidations", "k",
						new Column("k", "consolidation_id"), data("consolidation_id"))
		));
		// the base head's unit does not describe a dissection value
		if (!table.isDissection()) {
			joins.add(new Join(Join.Type.LEFT, "units", "u", new Column("u", "unit_id"), new Column("h", "unit_id")));
		}

		Filters filters = filters(spec, table);
		return new QuerySpec(table, DATA, false, false, projection, joins, filters.predicates, filters.parameters,
				List.of(new Ordering(data("period_end"), true)), null, null);
	}

	/**
	 * Row count for the same filters as {@link #build}, used to confirm a candidate head has data.
	 */
	public QuerySpec existence(ResolvedQuerySpec spec) {
		DataTable table = DataTable.select(spec.kind(), spec.axis());
		Filters filters = filters(spec, table);
		return new QuerySpec(table, DATA, true, false, List.of(), List.of(), filters.predicates, filters.parameters,
				List.of(), null, null);
	}

	/**
	 * Distinct period ends for a company, newest first; {@code offset} skips that many newer periods.
	 */
	public QuerySpec latestPeriod(long companyId, long consolidationId, DataTable table, int offset) {
		List<Predicate> predicates = List.of(
				new Predicate(data("company_id"), "companyId"),
				new Predicate(data("consolidation_id"), "consolidationId")
		);
		Map<String, Object> parameters = new LinkedHashMap<>();
		parameters.put("companyId", companyId);
		parameters.put("consolidationId", consolidationId);
		return new QuerySpec(table, DATA, false, true,
				List.of(new Projection(data("period_end"), "period_end")),
				List.of(), predicates, parameters,
				List.of(new Ordering(data("period_end"), true)), 1, Math.max(0, offset));
	}

	/**
	 * Like {@link #latestPeriod} but restricted to one dissection group and, when {@code termId} is given,
	 * to that term.
	 */
	public QuerySpec latestDissectionPeriod(long companyId,
											long consolidationId,
											DataTable table,
											long dissectionGroupId,
											Long termId,
											int offset) {
		if (!table.isDissection()) {
			throw new IllegalArgumentException(table.tableName() + " has no dissection groups");
		}
		Filters filters = new Filters();
		filters.add("company_id", "companyId", companyId);
		filters.add("consolidation_id", "consolidationId", consolidationId);
		filters.add("dissection_group_id", "dissectionGroupId", dissectionGroupId);
		if (termId != null) {
			filters.add("term_id", "termId", termId);
		}
		return new QuerySpec(table, DATA, false, true,
				List.of(new Projection(data("period_end"), "period_end")),
				List.of(), filters.predicates, filters.parameters,
				List.of(new Ordering(data("period_end"), true)), 1, Math.max(0, offset));
	}

	private Filters filters(ResolvedQuerySpec spec, DataTable table) {
		Filters filters = new Filters();
		filters.add("company_id", "companyId", spec.companyId());
		filters.add("head_id", "headId", spec.head().headId());
		filters.add("consolidation_id", "consolidationId", spec.consolidationId());
		if (table.isDissection()) {
			filters.add("dissection_group_id", "dissectionGroupId", spec.kind().dissectionGroupId());
		}
		ResolvedPeriod period = spec.period();
		if (period.hasPeriodEnd()) {
			filters.add("period_end", "periodEnd", period.periodEnd());
		} else {
			filters.add("term_id", "termId", period.termId());
			filters.add("fiscal_year", "fiscalYear", period.fiscalYear());
		}
		return filters;
	}

	private static String headTable(ResolvedQuerySpec spec) {
		if (spec.kind().isDissection()) {
			return "heads";
		}
		return spec.head().family() == HeadFamily.RATIO ? "ratio_heads" : "heads";
	}

	private static Column data(String name) {
		return new Column(DATA, name);
	}

	private static final class Filters {
		private final List<Predicate> predicates = new ArrayList<>();
		private final Map<String, Object> parameters = new LinkedHashMap<>();

		private void add(String column, String parameter, Object value) {
			if (value == null) {
				throw new IllegalArgumentException("Missing value for " + column);
			}
			predicates.add(new Predicate(data(column), parameter));
			parameters.put(parameter, value);
		}
	}
}
