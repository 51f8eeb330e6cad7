package my.finresolver.app.query;

import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;

public final class QueryRows {
	private QueryRows() {
	}

	/**
	 * Reads a date column whatever the driver returned for it.
	 */
	public static LocalDate localDate(Map<String, Object> row, String column) {
		Object value = value(row, column);
		if (value == null) {
			return null;
		}
		if (value instanceof LocalDate date) {
			return date;
		}
		if (value instanceof java.sql.Date date) {
			return date.toLocalDate();
		}
		if (value instanceof Timestamp timestamp) {
			return timestamp.toLocalDateTime().toLocalDate();
		}
		if (value instanceof LocalDateTime dateTime) {
			return dateTime.toLocalDate();
		}
		return LocalDate.parse(value.toString().trim());
	}

	private static Object value(Map<String, Object> row, String column) {
		if (row.containsKey(column)) {
			return row.get(column);
		}
		// some drivers upper-case labels
		for (Map.Entry<String, Object> entry : row.entrySet()) {
			if (entry.getKey().equalsIgnoreCase(column)) {
				return entry.getValue();
			}
		}
		return null;
	}
}
