package my.householdledger.app.dto;

public record CostBasisDto(String productName,
						   String assetName,
						   Integer uptoYear,
						   Integer uptoMonth,
						   long costBasis) {
}
