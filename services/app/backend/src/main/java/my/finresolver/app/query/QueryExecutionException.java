package my.finresolver.app.query;

public class QueryExecutionException extends RuntimeException {
	private final String sql;

	public QueryExecutionException(String message, String sql, Throwable cause) {
		super(message, cause);
		this.sql = sql;
	}

	public String getSql() {
		return sql;
	}
}
