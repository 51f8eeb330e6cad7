package my.finresolver.app.util;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads headered CSV exports into rows keyed by lower-cased column name.
 */
public final class CsvTables {
	private CsvTables() {
	}

	public static List<Map<String, String>> parse(byte[] payload) throws IOException {
		String text = stripBom(new String(payload, StandardCharsets.UTF_8));
		char delimiter = sniffDelimiter(firstLine(text));
		List<Map<String, String>> rows = new ArrayList<>();
		try (CSVParser parser = CSVParser.parse(
				new StringReader(text),
				CSVFormat.DEFAULT.withDelimiter(delimiter).withFirstRecordAsHeader().withTrim()
		)) {
			List<String> headers = parser.getHeaderNames();
			for (CSVRecord record : parser) {
				Map<String, String> row = new LinkedHashMap<>();
				boolean blank = true;
				for (String header : headers) {
					String value = record.isMapped(header) && record.isSet(header) ? record.get(header) : null;
					String cleaned = cleanValue(value);
					if (cleaned != null) {
						blank = false;
					}
					row.put(header.trim().toLowerCase(Locale.ROOT), cleaned);
				}
				if (!blank) {
					rows.add(row);
				}
			}
		}
		return rows;
	}

	static String stripBom(String value) {
		if (value == null || value.isEmpty()) {
			return value;
		}
		return value.charAt(0) == '\uFEFF' ? value.substring(1) : value;
	}

	static char sniffDelimiter(String headerLine) {
		if (headerLine == null || headerLine.isEmpty()) {
			return ',';
		}
		int commas = count(headerLine, ',');
		int semicolons = count(headerLine, ';');
		return semicolons > commas ? ';' : ',';
	}

	private static int count(String value, char needle) {
		int count = 0;
		for (int i = 0; i < value.length(); i++) {
			if (value.charAt(i) == needle) {
				count++;
			}
		}
		return count;
	}

	private static String firstLine(String text) {
		int end = text.indexOf('\n');
		return end < 0 ? text : text.substring(0, end);
	}

	private static String cleanValue(String value) {
		String trimmed = TextNormalizer.trimToNull(value);
		if (trimmed == null || trimmed.equalsIgnoreCase("null")) {
			return null;
		}
		return trimmed;
	}
}
