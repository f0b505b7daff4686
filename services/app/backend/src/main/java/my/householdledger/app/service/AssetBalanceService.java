package my.householdledger.app.service;

import my.householdledger.app.domain.AssetSnapshot;
import my.householdledger.app.dto.AccountBalanceDto;
import my.householdledger.app.dto.AssetTypeUpdateResultDto;
import my.householdledger.app.repository.AssetSnapshotRepository;
import my.householdledger.app.rules.AssetType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Service
public class AssetBalanceService {
	private static final Logger logger = LoggerFactory.getLogger(AssetBalanceService.class);

	private final AssetSnapshotRepository assetSnapshotRepository;

	public AssetBalanceService(AssetSnapshotRepository assetSnapshotRepository) {
		this.assetSnapshotRepository = assetSnapshotRepository;
	}

	/**
	 * Balances per account as of the given month. Months without activity have no snapshot, so the
	 * latest snapshot at or before the month stands in; accounts with none are left out.
	 */
	@Transactional(readOnly = true)
	public List<AccountBalanceDto> balancesAsOf(int year, int month) {
		validatePeriod(year, month);
		int periodKey = year * 100 + month;
		List<AccountBalanceDto> balances = new ArrayList<>();
		for (String assetName : assetSnapshotRepository.findAssetNames()) {
			assetSnapshotRepository.findAtOrBefore(assetName, periodKey, PageRequest.of(0, 1)).stream()
					.findFirst()
					.map(this::toDto)
					.ifPresent(balances::add);
		}
		return balances;
	}

	@Transactional(readOnly = true)
	public List<AccountBalanceDto> history(String assetName) {
		return assetSnapshotRepository.findByAssetNameOrderByYearAscMonthAsc(assetName).stream()
				.map(this::toDto)
				.toList();
	}

	@Transactional
	public AssetTypeUpdateResultDto overrideAssetType(String assetName, String assetType) {
		if (assetName == null || assetName.isBlank()) {
			throw new IllegalArgumentException("Asset name is required");
		}
		AssetType type = AssetType.fromCode(assetType)
				.orElseThrow(() -> new IllegalArgumentException("Unknown asset type: " + assetType));
		int updated = assetSnapshotRepository.updateAssetType(assetName, type.code(), LocalDateTime.now());
		if (updated == 0) {
			throw new IllegalArgumentException("No snapshots for asset " + assetName);
		}
		logger.info("Asset type of {} set to {} ({} snapshots)", assetName, type.code(), updated);
		return new AssetTypeUpdateResultDto(assetName, type.code(), updated);
	}

	private AccountBalanceDto toDto(AssetSnapshot snapshot) {
		return new AccountBalanceDto(snapshot.getAssetName(), snapshot.getAssetType(), snapshot.getYear(),
				snapshot.getMonth(), snapshot.getOpeningBalance(), snapshot.getClosingBalance());
	}

	static void validatePeriod(int year, int month) {
		if (year < 1900 || month < 1 || month > 12) {
			throw new IllegalArgumentException("Invalid period: " + year + "-" + month);
		}
	}
}
