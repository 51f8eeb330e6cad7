package my.finresolver.app.query;

import java.util.List;
import java.util.Map;

/**
 * Runs structured queries against the warehouse. Failures surface as {@link QueryExecutionException}.
 */
public interface QueryExecutor {
	long count(QuerySpec query);

	List<Map<String, Object>> fetch(QuerySpec query);
}
