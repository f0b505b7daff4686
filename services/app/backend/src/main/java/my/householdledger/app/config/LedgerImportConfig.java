package my.householdledger.app.config;

import my.householdledger.app.importer.AssetLedgerParser;
import my.householdledger.app.importer.CombinedLedgerParser;
import my.householdledger.app.importer.InvestmentTransferExtractor;
import my.householdledger.app.rules.AssetTypeClassifier;
import my.householdledger.app.service.SnapshotAggregator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LedgerImportConfig {
	@Bean
	public CombinedLedgerParser combinedLedgerParser() {
		return new CombinedLedgerParser();
	}

	@Bean
	public AssetLedgerParser assetLedgerParser() {
		return new AssetLedgerParser();
	}

	@Bean
	public AssetTypeClassifier assetTypeClassifier() {
		return new AssetTypeClassifier();
	}

	@Bean
	public SnapshotAggregator snapshotAggregator(AssetTypeClassifier classifier) {
		return new SnapshotAggregator(classifier);
	}

	@Bean
	public InvestmentTransferExtractor investmentTransferExtractor(AssetLedgerParser assetLedgerParser,
																   AppProperties properties) {
		return new InvestmentTransferExtractor(assetLedgerParser, properties.ledgerImport().investmentAccounts());
	}
}
