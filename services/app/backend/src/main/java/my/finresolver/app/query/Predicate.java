package my.finresolver.app.query;

/**
 * Equality filter against a bound parameter.
 */
public record Predicate(Column column, String parameter) {
	public Predicate {
		if (parameter == null || !parameter.matches("[A-Za-z][A-Za-z0-9]*")) {
			throw new IllegalArgumentException("Invalid parameter name: " + parameter);
		}
	}
}
