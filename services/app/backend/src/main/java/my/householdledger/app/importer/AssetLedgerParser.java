package my.householdledger.app.importer;

import my.householdledger.app.util.CsvParsing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses the per-account export: blocks of rows, each opened by a row whose first column holds the
 * account's display name. Rows keep file order so that per-account chronology survives.
 */
public class AssetLedgerParser implements LedgerParser<AssetLedgerEntry> {
	private static final Logger logger = LoggerFactory.getLogger(AssetLedgerParser.class);

	static final int MIN_COLUMNS = 6;
	private static final String HEADER_NAME = "名前";
	private static final String PLACEHOLDER = "-";

	@Override
	public List<AssetLedgerEntry> parse(String csvText, int minYear) {
		List<List<String>> rows = CsvParsing.readRows(csvText, MIN_COLUMNS);
		List<AssetLedgerEntry> entries = new ArrayList<>();
		Cursor cursor = Cursor.NONE;
		for (List<String> cols : rows) {
			cursor = advance(cursor, cols, minYear, entries);
		}
		logger.debug("Asset ledger: {} entries from {} rows", entries.size(), rows.size());
		return entries;
	}

	Cursor advance(Cursor cursor, List<String> cols, int minYear, List<AssetLedgerEntry> out) {
		String first = cols.get(0);
		if (HEADER_NAME.equals(first)) {
			return cursor;
		}
		Cursor next = !first.isEmpty() && !LedgerFields.isDated(first) ? new Cursor(first) : cursor;
		if (!next.hasAccount()) {
			return next;
		}

		// the account row itself may double as the initial-balance row
		if (PLACEHOLDER.equals(cols.get(1)) && PLACEHOLDER.equals(cols.get(2))) {
			out.add(AssetLedgerEntry.initialBalance(next.assetName(), LedgerFields.parseAmount(column(cols, 6))));
			return next;
		}

		toEntry(next.assetName(), cols, minYear).ifPresent(out::add);
		return next;
	}

	private Optional<AssetLedgerEntry> toEntry(String assetName, List<String> cols, int minYear) {
		String rawDate = cols.get(1);
		if (!LedgerFields.isDated(rawDate)) {
			return Optional.empty();
		}
		Optional<LocalDate> parsedDate = LedgerFields.parseDate(rawDate);
		if (parsedDate.isEmpty() || parsedDate.get().getYear() < minYear) {
			return Optional.empty();
		}
		LocalDate date = parsedDate.get();
		return Optional.of(new AssetLedgerEntry(
				assetName,
				date,
				date.getYear(),
				date.getMonthValue(),
				LedgerFields.trim(cols.get(2)),
				LedgerFields.trim(cols.get(3)),
				LedgerFields.trim(cols.get(4)),
				LedgerFields.parseAmount(cols.get(5)),
				LedgerFields.parseAmount(column(cols, 6)),
				false
		));
	}

	private String column(List<String> cols, int index) {
		return index < cols.size() ? cols.get(index) : "";
	}

	record Cursor(String assetName) {
		static final Cursor NONE = new Cursor(null);

		boolean hasAccount() {
			return assetName != null && !assetName.isEmpty();
		}
	}
}
