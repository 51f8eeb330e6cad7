package my.finresolver.app.query;

import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

@Component
public class SqlRenderer {
	public RenderedQuery render(QuerySpec query) {
		StringBuilder sql = new StringBuilder("select ");
		if (query.countOnly()) {
			sql.append("count(*)");
		} else {
			if (query.projection().isEmpty()) {
				throw new IllegalArgumentException("Query on " + query.table().tableName() + " has no projection");
			}
			if (query.distinct()) {
				sql.append("distinct ");
			}
			sql.append(query.projection().stream()
					.map(item -> item.column().qualified() + " as " + item.label())
					.collect(Collectors.joining(", ")));
		}
		sql.append(" from ").append(query.table().tableName()).append(' ').append(query.alias());
		for (Join join : query.joins()) {
			sql.append(join.type() == Join.Type.LEFT ? " left join " : " join ")
					.append(join.table()).append(' ').append(join.alias())
					.append(" on ").append(join.left().qualified())
					.append(" = ").append(join.right().qualified());
		}
		if (!query.predicates().isEmpty()) {
			sql.append(" where ");
			sql.append(query.predicates().stream()
					.map(predicate -> {
						if (!query.parameters().containsKey(predicate.parameter())) {
							throw new IllegalArgumentException("Unbound parameter :" + predicate.parameter());
						}
						return predicate.column().qualified() + " = :" + predicate.parameter();
					})
					.collect(Collectors.joining(" and ")));
		}
		if (!query.order().isEmpty()) {
			sql.append(" order by ");
			sql.append(query.order().stream()
					.map(order -> order.column().qualified() + (order.descending() ? " desc" : " asc"))
					.collect(Collectors.joining(", ")));
		}
		if (query.limit() != null) {
			sql.append(" limit ").append(query.limit());
		}
		if (query.offset() != null && query.offset() > 0) {
			sql.append(" offset ").append(query.offset());
		}
		return new RenderedQuery(sql.toString(), query.parameters());
	}
}
