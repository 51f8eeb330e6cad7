package my.finresolver.app.metadata;

public class MetadataLoadException extends RuntimeException {
	private final String table;

	public MetadataLoadException(String table, String message, Throwable cause) {
		super(message, cause);
		this.table = table;
	}

	public MetadataLoadException(String table, String message) {
		this(table, message, null);
	}

	public String getTable() {
		return table;
	}
}
