package my.householdledger.app.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ImportResultDto(boolean success,
							  TransactionCounts transactions,
							  AssetCounts assets,
							  String error) {
	public static ImportResultDto success(TransactionCounts transactions, AssetCounts assets) {
		return new ImportResultDto(true, transactions, assets, null);
	}

	public static ImportResultDto failure(String error) {
		return new ImportResultDto(false, null, null, error);
	}

	public record TransactionCounts(int inserted, int skipped) {
	}

	/**
	 * {@code inserted} counts snapshots and synthetic transfers together.
	 */
	public record AssetCounts(int inserted, int snapshots, int transfers) {
	}
}
