package my.finresolver.app.query;

public record Column(String alias, String name) {
	public Column {
		SqlIdentifiers.require(alias);
		SqlIdentifiers.require(name);
	}

	public String qualified() {
		return alias + "." + name;
	}
}
