package my.householdledger.app.importer;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Field-level conversions shared by the ledger parsers.
 */
public final class LedgerFields {
	private static final Pattern LONG_DATE = Pattern.compile("(\\d{4})年(\\d{2})月(\\d{2})日");
	private static final Pattern YEAR_PREFIX = Pattern.compile("^\\d{4}年");
	private static final Pattern LEADING_INTEGER = Pattern.compile("^[+-]?\\d+");

	private LedgerFields() {
	}

	public static boolean isDated(String raw) {
		return raw != null && YEAR_PREFIX.matcher(raw.trim()).find();
	}

	/**
	 * {@code 2026年02月01日(日)} to {@code 2026-02-01}; the empty string when the value does not
	 * carry a valid long-form date.
	 */
	public static String toIsoDate(String raw) {
		return parseDate(raw).map(LocalDate::toString).orElse("");
	}

	public static Optional<LocalDate> parseDate(String raw) {
		if (raw == null) {
			return Optional.empty();
		}
		Matcher matcher = LONG_DATE.matcher(raw);
		if (!matcher.find()) {
			return Optional.empty();
		}
		try {
			return Optional.of(LocalDate.of(
					Integer.parseInt(matcher.group(1)),
					Integer.parseInt(matcher.group(2)),
					Integer.parseInt(matcher.group(3))));
		} catch (DateTimeException exc) {
			return Optional.empty();
		}
	}

	/**
	 * Parses a possibly comma-grouped integer such as {@code 1,200}. Anything unparseable is 0.
	 */
	public static long parseAmount(String raw) {
		if (raw == null) {
			return 0L;
		}
		String value = raw.replace(",", "").trim();
		Matcher matcher = LEADING_INTEGER.matcher(value);
		if (!matcher.find()) {
			return 0L;
		}
		try {
			return Long.parseLong(matcher.group());
		} catch (NumberFormatException exc) {
			return 0L;
		}
	}

	public static String trim(String value) {
		return value == null ? "" : value.trim();
	}
}
