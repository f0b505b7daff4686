package my.householdledger.app.service;

import my.householdledger.app.config.AppProperties;
import my.householdledger.app.dto.CostBasisDto;
import my.householdledger.app.importer.TransactionKind;
import my.householdledger.app.repository.TransactionRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Cumulative amount transferred into each configured investment account. Synthetic transfers
 * backfilled from the per-account export count the same as real ones.
 */
@Service
public class InvestmentCostBasisService {
	private static final int ALL_PERIODS = 999_912;

	private final TransactionRepository transactionRepository;
	private final AppProperties properties;

	public InvestmentCostBasisService(TransactionRepository transactionRepository, AppProperties properties) {
		this.transactionRepository = transactionRepository;
		this.properties = properties;
	}

	@Transactional(readOnly = true)
	public List<CostBasisDto> costBasis(Integer year, Integer month) {
		if ((year == null) != (month == null)) {
			throw new IllegalArgumentException("year and month must be given together");
		}
		int periodKey = ALL_PERIODS;
		if (year != null) {
			AssetBalanceService.validatePeriod(year, month);
			periodKey = year * 100 + month;
		}
		List<CostBasisDto> result = new ArrayList<>();
		for (Map.Entry<String, String> product : properties.ledgerImport().investmentAccounts().entrySet()) {
			long total = transactionRepository.sumIncomeUpTo(TransactionKind.TRANSFER.label(), product.getValue(), periodKey);
			result.add(new CostBasisDto(product.getKey(), product.getValue(), year, month, total));
		}
		return result;
	}
}
