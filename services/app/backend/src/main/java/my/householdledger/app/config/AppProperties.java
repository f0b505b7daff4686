package my.householdledger.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid LedgerImport ledgerImport,
		Database database
) {
	public AppProperties {
		ledgerImport = ledgerImport == null ? new LedgerImport(null, null, null, null) : ledgerImport;
		database = database == null ? new Database(null) : database;
	}

	public record LedgerImport(
			@Min(1900) Integer minYear,
			@Min(1) Integer transactionBatchSize,
			@Min(1) Integer snapshotBatchSize,
			Map<String, String> investmentAccounts
	) {
		public static final int DEFAULT_MIN_YEAR = 2019;

		public LedgerImport {
			minYear = minYear == null ? DEFAULT_MIN_YEAR : minYear;
			transactionBatchSize = transactionBatchSize == null ? 500 : transactionBatchSize;
			snapshotBatchSize = snapshotBatchSize == null ? 200 : snapshotBatchSize;
			if (investmentAccounts == null || investmentAccounts.isEmpty()) {
				Map<String, String> defaults = new LinkedHashMap<>();
				defaults.put("iDeCo", "iDeCo");
				defaults.put("SBI投資信託", "投資信託/SBI");
				investmentAccounts = defaults;
			}
		}
	}

	public record Database(
			Integer startupTimeoutSeconds
	) {
		public Database {
			startupTimeoutSeconds = startupTimeoutSeconds == null ? 60 : startupTimeoutSeconds;
		}
	}
}
