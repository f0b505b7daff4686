package my.householdledger.app.importer;

import java.time.LocalDate;

/**
 * One row of the per-account export. Initial-balance markers have no date and year/month 0.
 */
public record AssetLedgerEntry(
		String assetName,
		LocalDate date,
		int year,
		int month,
		String type,
		String category,
		String itemName,
		long amount,
		long balance,
		boolean initial
) {
	static AssetLedgerEntry initialBalance(String assetName, long balance) {
		return new AssetLedgerEntry(assetName, null, 0, 0, "initial", "", "初期残高", 0L, balance, true);
	}

	public String dateText() {
		return date == null ? "" : date.toString();
	}
}
