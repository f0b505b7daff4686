package my.householdledger.app.dto;

import jakarta.validation.constraints.NotBlank;

public record AssetTypeUpdateRequest(@NotBlank String assetType) {
}
