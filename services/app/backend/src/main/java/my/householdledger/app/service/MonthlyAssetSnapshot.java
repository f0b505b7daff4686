package my.householdledger.app.service;

public record MonthlyAssetSnapshot(
		String assetName,
		int year,
		int month,
		long openingBalance,
		long closingBalance,
		String assetType
) {
	public int periodKey() {
		return year * 100 + month;
	}

	public MonthlyAssetSnapshot withOpeningBalance(long opening) {
		return new MonthlyAssetSnapshot(assetName, year, month, opening, closingBalance, assetType);
	}
}
