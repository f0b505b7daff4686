package my.householdledger.app.dto;

/**
 * Balance of one account as of a requested month, taken from the latest snapshot at or before it.
 */
public record AccountBalanceDto(String assetName,
								String assetType,
								int snapshotYear,
								int snapshotMonth,
								long openingBalance,
								long closingBalance) {
}
