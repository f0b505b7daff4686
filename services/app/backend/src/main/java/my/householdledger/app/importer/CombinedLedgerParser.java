package my.householdledger.app.importer;

import my.householdledger.app.util.CsvParsing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses the full-transaction export. Columns: date, kind, category, item name, amount, expense,
 * income, account, tag, memo, exclude-from-P&amp;L.
 */
public class CombinedLedgerParser implements LedgerParser<ParsedTransaction> {
	private static final Logger logger = LoggerFactory.getLogger(CombinedLedgerParser.class);

	static final int MIN_COLUMNS = 11;
	private static final String INCLUDED_IN_PL = "-";

	@Override
	public List<ParsedTransaction> parse(String csvText, int minYear) {
		List<List<String>> rows = CsvParsing.readRows(csvText, MIN_COLUMNS);
		List<ParsedTransaction> results = new ArrayList<>();
		for (List<String> cols : rows) {
			toTransaction(cols, minYear).ifPresent(results::add);
		}
		logger.debug("Combined ledger: {} transactions from {} rows", results.size(), rows.size());
		return results;
	}

	private Optional<ParsedTransaction> toTransaction(List<String> cols, int minYear) {
		String rawDate = cols.get(0);
		if (!LedgerFields.isDated(rawDate)) {
			return Optional.empty();
		}
		Optional<LocalDate> parsedDate = LedgerFields.parseDate(rawDate);
		if (parsedDate.isEmpty()) {
			return Optional.empty();
		}
		LocalDate date = parsedDate.get();
		if (date.getYear() < minYear) {
			return Optional.empty();
		}

		long expenseAmount = LedgerFields.parseAmount(cols.get(5));
		long incomeAmount = LedgerFields.parseAmount(cols.get(6));
		long amount = expenseAmount != 0 ? expenseAmount : incomeAmount;

		// "-" in the exclude column means the row counts towards P&L; anything else, blank included, excludes it
		boolean excludeFromPl = !INCLUDED_IN_PL.equals(cols.get(10));

		return Optional.of(new ParsedTransaction(
				date,
				date.getYear(),
				date.getMonthValue(),
				LedgerFields.trim(cols.get(1)),
				LedgerFields.trim(cols.get(2)),
				LedgerFields.trim(cols.get(3)),
				amount,
				expenseAmount,
				incomeAmount,
				LedgerFields.trim(cols.get(7)),
				LedgerFields.trim(cols.get(8)),
				LedgerFields.trim(cols.get(9)),
				excludeFromPl
		));
	}
}
