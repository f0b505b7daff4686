package my.householdledger.app.importer;

import java.time.LocalDate;

public record ParsedTransaction(
		LocalDate date,
		int year,
		int month,
		String type,
		String category,
		String itemName,
		long amount,
		long expenseAmount,
		long incomeAmount,
		String assetName,
		String tag,
		String memo,
		boolean excludeFromPl
) {
	public static final String ASSET_REPORT_MEMO = "__asset_report__";

	public boolean isSyntheticTransfer() {
		return ASSET_REPORT_MEMO.equals(memo);
	}

	public int periodKey() {
		return year * 100 + month;
	}
}
