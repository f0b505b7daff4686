package my.householdledger.app.dto;

public record AssetTypeUpdateResultDto(String assetName, String assetType, int snapshotsUpdated) {
}
