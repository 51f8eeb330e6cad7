package my.finresolver.app.query;

public record Join(Type type, String table, String alias, Column left, Column right) {
	public enum Type {
		INNER,
		LEFT
	}

	public Join {
		SqlIdentifiers.require(table);
		SqlIdentifiers.require(alias);
	}
}
