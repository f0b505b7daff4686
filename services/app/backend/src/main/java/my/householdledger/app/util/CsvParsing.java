package my.householdledger.app.util;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

public final class CsvParsing {
	private static final char QUOTE = '"';
	private static final CSVFormat LINE_FORMAT = CSVFormat.DEFAULT.builder()
			.setTrim(true)
			.setIgnoreSurroundingSpaces(true)
			.setIgnoreEmptyLines(true)
			.build();

	private CsvParsing() {
	}

	public static String stripBom(String value) {
		if (value == null || value.isEmpty()) {
			return value;
		}
		if (value.charAt(0) == '\uFEFF') {
			return value.substring(1);
		}
		return value;
	}

	public static String decodeUtf8(byte[] payload) {
		String raw = new String(payload, StandardCharsets.UTF_8);
		return stripBom(raw);
	}

	/**
	 * Splits export text into logical lines: drops a leading BOM and accepts CRLF, LF and lone CR.
	 */
	public static List<String> splitLines(String text) {
		if (text == null || text.isEmpty()) {
			return List.of();
		}
		String normalized = stripBom(text).replace("\r\n", "\n").replace('\r', '\n');
		return List.of(normalized.split("\n", -1));
	}

	/**
	 * Tokenizes a single CSV line. Quoted fields may contain commas, {@code ""} is an escaped quote
	 * and every field is trimmed. Well-formed lines go through commons-csv; a line it rejects, or
	 * one where a quote survives into a field (a quote opening mid-field), is walked quote by quote
	 * instead so that its columns stay aligned. Empty only for blank lines.
	 */
	public static Optional<List<String>> splitLine(String line) {
		if (line == null || line.isBlank()) {
			return Optional.empty();
		}
		List<String> fields = parseRegular(line)
				.filter(parsed -> parsed.stream().noneMatch(field -> field.indexOf(QUOTE) >= 0))
				.orElseGet(() -> walkLine(line));
		return Optional.of(fields);
	}

	private static Optional<List<String>> parseRegular(String line) {
		try (CSVParser parser = CSVParser.parse(line, LINE_FORMAT)) {
			Iterator<CSVRecord> records = parser.iterator();
			return records.hasNext() ? Optional.of(records.next().toList()) : Optional.empty();
		} catch (IOException | UncheckedIOException | IllegalStateException exc) {
			return Optional.empty();
		}
	}

	/**
	 * Splits on commas outside quotes. Every {@code "} toggles the quoted state except {@code ""}
	 * inside quotes, which is a literal quote.
	 */
	static List<String> walkLine(String line) {
		List<String> fields = new ArrayList<>();
		StringBuilder current = new StringBuilder();
		boolean inQuotes = false;
		for (int i = 0; i < line.length(); i++) {
			char ch = line.charAt(i);
			if (ch == QUOTE) {
				if (inQuotes && i + 1 < line.length() && line.charAt(i + 1) == QUOTE) {
					current.append(QUOTE);
					i++;
				} else {
					inQuotes = !inQuotes;
				}
			} else if (ch == ',' && !inQuotes) {
				fields.add(current.toString().trim());
				current.setLength(0);
			} else {
				current.append(ch);
			}
		}
		fields.add(current.toString().trim());
		return fields;
	}

	/**
	 * Tokenizes the whole text, keeping only rows with at least {@code minColumns} fields.
	 */
	public static List<List<String>> readRows(String text, int minColumns) {
		List<List<String>> rows = new ArrayList<>();
		for (String line : splitLines(text)) {
			splitLine(line)
					.filter(fields -> fields.size() >= minColumns)
					.ifPresent(rows::add);
		}
		return rows;
	}
}
