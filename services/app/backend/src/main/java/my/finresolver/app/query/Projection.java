package my.finresolver.app.query;

public record Projection(Column column, String label) {
	public Projection {
		SqlIdentifiers.require(label);
	}
}
