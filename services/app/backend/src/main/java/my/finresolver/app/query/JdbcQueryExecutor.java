package my.finresolver.app.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.List;
import java.util.Map;

import javax.sql.DataSource;

public class JdbcQueryExecutor implements QueryExecutor {
	private static final Logger logger = LoggerFactory.getLogger(JdbcQueryExecutor.class);

	private final NamedParameterJdbcTemplate jdbcTemplate;
	private final SqlRenderer renderer;

	public JdbcQueryExecutor(DataSource dataSource, SqlRenderer renderer, int queryTimeoutSeconds) {
		JdbcTemplate template = new JdbcTemplate(dataSource);
		template.setQueryTimeout(Math.max(0, queryTimeoutSeconds));
		this.jdbcTemplate = new NamedParameterJdbcTemplate(template);
		this.renderer = renderer;
	}

	@Override
	public long count(QuerySpec query) {
		if (!query.countOnly()) {
			throw new IllegalArgumentException("Not a count query on " + query.table().tableName());
		}
		RenderedQuery rendered = renderer.render(query);
		logger.debug("Count query: {} {}", rendered.sql(), rendered.parameters());
		try {
			Long count = jdbcTemplate.queryForObject(rendered.sql(), new MapSqlParameterSource(rendered.parameters()),
					Long.class);
			return count == null ? 0L : count;
		} catch (DataAccessException ex) {
			throw new QueryExecutionException("Count query on " + query.table().tableName() + " failed", rendered.sql(), ex);
		}
	}

	@Override
	public List<Map<String, Object>> fetch(QuerySpec query) {
		RenderedQuery rendered = renderer.render(query);
		logger.debug("Fetch query: {} {}", rendered.sql(), rendered.parameters());
		try {
			return jdbcTemplate.queryForList(rendered.sql(), new MapSqlParameterSource(rendered.parameters()));
		} catch (DataAccessException ex) {
			throw new QueryExecutionException("Query on " + query.table().tableName() + " failed", rendered.sql(), ex);
		}
	}
}
