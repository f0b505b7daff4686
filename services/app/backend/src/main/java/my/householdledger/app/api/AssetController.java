package my.householdledger.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.householdledger.app.dto.AccountBalanceDto;
import my.householdledger.app.dto.AssetTypeUpdateRequest;
import my.householdledger.app.dto.AssetTypeUpdateResultDto;
import my.householdledger.app.service.AssetBalanceService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@Tag(name = "Assets", description = "Account balances and types")
@RequestMapping("/api/assets")
public class AssetController {
	private final AssetBalanceService assetBalanceService;

	public AssetController(AssetBalanceService assetBalanceService) {
		this.assetBalanceService = assetBalanceService;
	}

	@Operation(summary = "Balances as of a month")
	@GetMapping("/balances")
	public List<AccountBalanceDto> balances(@RequestParam("year") int year, @RequestParam("month") int month) {
		return assetBalanceService.balancesAsOf(year, month);
	}

	@Operation(summary = "Monthly snapshots of one account")
	@GetMapping("/{assetName}/snapshots")
	public List<AccountBalanceDto> snapshots(@PathVariable("assetName") String assetName) {
		return assetBalanceService.history(assetName);
	}

	@Operation(summary = "Override the asset type of an account")
	@PutMapping("/{assetName}/type")
	public AssetTypeUpdateResultDto overrideType(@PathVariable("assetName") String assetName,
												 @Valid @RequestBody AssetTypeUpdateRequest request) {
		return assetBalanceService.overrideAssetType(assetName, request.assetType());
	}
}
