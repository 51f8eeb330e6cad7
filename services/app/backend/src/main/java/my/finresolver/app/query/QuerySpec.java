package my.finresolver.app.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured retrieval query: table, projection, joins, equality predicates and their bound values.
 * Lowered to SQL text only by {@link SqlRenderer}.
 */
public record QuerySpec(
		DataTable table,
		String alias,
		boolean countOnly,
		boolean distinct,
		List<Projection> projection,
		List<Join> joins,
		List<Predicate> predicates,
		Map<String, Object> parameters,
		List<Ordering> order,
		Integer limit,
		Integer offset
) {
	public QuerySpec {
		SqlIdentifiers.require(alias);
		projection = projection == null ? List.of() : List.copyOf(projection);
		joins = joins == null ? List.of() : List.copyOf(joins);
		predicates = predicates == null ? List.of() : List.copyOf(predicates);
		parameters = parameters == null
				? Map.of()
				: Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
		order = order == null ? List.of() : List.copyOf(order);
	}

	public boolean hasPredicateOn(String columnName) {
		return predicates.stream().anyMatch(predicate -> predicate.column().name().equals(columnName));
	}
}
