package my.householdledger.app.importer;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Re-reads the per-account export for transfers into investment accounts and turns them into
 * synthetic transfer transactions marked with {@link ParsedTransaction#ASSET_REPORT_MEMO}. Older
 * full-transaction exports do not carry these transfers, yet cost basis is computed from them.
 */
public class InvestmentTransferExtractor {
	private final AssetLedgerParser assetParser;
	private final Set<String> investmentAccounts;

	/**
	 * @param investmentAccounts product name to the account display name used in the export
	 */
	public InvestmentTransferExtractor(AssetLedgerParser assetParser, Map<String, String> investmentAccounts) {
		this.assetParser = assetParser;
		this.investmentAccounts = new LinkedHashSet<>(investmentAccounts == null ? List.of() : investmentAccounts.values());
	}

	public List<ParsedTransaction> extract(String assetCsvText, int minYear) {
		return extract(assetParser.parse(assetCsvText, minYear));
	}

	public List<ParsedTransaction> extract(List<AssetLedgerEntry> entries) {
		List<ParsedTransaction> transfers = new ArrayList<>();
		String transferLabel = TransactionKind.TRANSFER.label();
		for (AssetLedgerEntry entry : entries) {
			if (entry.initial()) {
				continue;
			}
			if (!transferLabel.equals(entry.type()) || !investmentAccounts.contains(entry.assetName())) {
				continue;
			}
			long incomeAmount = entry.amount() > 0 ? entry.amount() : 0L;
			long expenseAmount = entry.amount() < 0 ? -entry.amount() : 0L;
			transfers.add(new ParsedTransaction(
					entry.date(),
					entry.year(),
					entry.month(),
					transferLabel,
					transferLabel,
					entry.itemName(),
					Math.abs(entry.amount()),
					expenseAmount,
					incomeAmount,
					entry.assetName(),
					"",
					ParsedTransaction.ASSET_REPORT_MEMO,
					true
			));
		}
		return transfers;
	}
}
