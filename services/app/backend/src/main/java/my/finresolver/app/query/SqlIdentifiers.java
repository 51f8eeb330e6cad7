package my.finresolver.app.query;

import java.util.regex.Pattern;

final class SqlIdentifiers {
	private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");

	private SqlIdentifiers() {
	}

	static String require(String identifier) {
		if (identifier == null || !IDENTIFIER.matcher(identifier).matches()) {
			throw new IllegalArgumentException("Invalid SQL identifier: " + identifier);
		}
		return identifier;
	}
}
