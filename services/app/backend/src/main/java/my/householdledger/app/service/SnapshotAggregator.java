package my.householdledger.app.service;

import my.householdledger.app.importer.AssetLedgerEntry;
import my.householdledger.app.rules.AssetTypeClassifier;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Folds per-account ledger entries into one closing balance per month. A month's closing balance
 * is the balance after the last entry dated in that month (file order); its opening balance is the
 * previous produced month's closing balance, or its own closing balance for the first month.
 * Months without entries produce no snapshot.
 */
public class SnapshotAggregator {
	private final AssetTypeClassifier classifier;

	public SnapshotAggregator(AssetTypeClassifier classifier) {
		this.classifier = classifier;
	}

	public List<MonthlyAssetSnapshot> aggregate(List<AssetLedgerEntry> entries) {
		Map<String, TreeMap<Integer, AssetLedgerEntry>> lastByMonth = new LinkedHashMap<>();
		for (AssetLedgerEntry entry : entries) {
			if (entry.initial() || entry.year() == 0) {
				continue;
			}
			lastByMonth.computeIfAbsent(entry.assetName(), name -> new TreeMap<>())
					.put(entry.year() * 100 + entry.month(), entry);
		}

		List<MonthlyAssetSnapshot> snapshots = new ArrayList<>();
		for (Map.Entry<String, TreeMap<Integer, AssetLedgerEntry>> account : lastByMonth.entrySet()) {
			String assetType = classifier.classify(account.getKey()).code();
			Long previousClosing = null;
			for (AssetLedgerEntry last : account.getValue().values()) {
				long closing = last.balance();
				snapshots.add(new MonthlyAssetSnapshot(
						account.getKey(),
						last.year(),
						last.month(),
						previousClosing == null ? closing : previousClosing,
						closing,
						assetType
				));
				previousClosing = closing;
			}
		}
		return snapshots;
	}
}
