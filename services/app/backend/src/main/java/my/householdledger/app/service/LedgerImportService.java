package my.householdledger.app.service;

import my.householdledger.app.config.AppProperties;
import my.householdledger.app.domain.AssetSnapshot;
import my.householdledger.app.domain.ImportFile;
import my.householdledger.app.domain.Transaction;
import my.householdledger.app.dto.ImportFileDto;
import my.householdledger.app.dto.ImportResultDto;
import my.householdledger.app.importer.AssetLedgerEntry;
import my.householdledger.app.importer.AssetLedgerParser;
import my.householdledger.app.importer.CombinedLedgerParser;
import my.householdledger.app.importer.InvestmentTransferExtractor;
import my.householdledger.app.importer.ParsedTransaction;
import my.householdledger.app.importer.TransactionKind;
import my.householdledger.app.repository.AssetSnapshotRepository;
import my.householdledger.app.repository.ImportFileRepository;
import my.householdledger.app.repository.TransactionRepository;
import my.householdledger.app.util.CsvParsing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.security.MessageDigest;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Imports the full-transaction export and/or the per-account export.
 *
 * <p>Both uploads are parsed before anything is written. Transactions are replaced period by
 * period (delete then insert per year/month), snapshots are upserted by (account, year, month),
 * and transfers into investment accounts found in the per-account export are added as synthetic
 * rows unless the full-transaction export already holds the same movement.
 */
@Service
public class LedgerImportService {
	private static final Logger logger = LoggerFactory.getLogger(LedgerImportService.class);

	static final String SOURCE_COMBINED = "combined";
	static final String SOURCE_ASSET = "asset";

	private final TransactionRepository transactionRepository;
	private final AssetSnapshotRepository assetSnapshotRepository;
	private final ImportFileRepository importFileRepository;
	private final CombinedLedgerParser combinedParser;
	private final AssetLedgerParser assetParser;
	private final SnapshotAggregator snapshotAggregator;
	private final InvestmentTransferExtractor transferExtractor;
	private final AppProperties properties;

	public LedgerImportService(TransactionRepository transactionRepository,
							   AssetSnapshotRepository assetSnapshotRepository,
							   ImportFileRepository importFileRepository,
							   CombinedLedgerParser combinedParser,
							   AssetLedgerParser assetParser,
							   SnapshotAggregator snapshotAggregator,
							   InvestmentTransferExtractor transferExtractor,
							   AppProperties properties) {
		this.transactionRepository = transactionRepository;
		this.assetSnapshotRepository = assetSnapshotRepository;
		this.importFileRepository = importFileRepository;
		this.combinedParser = combinedParser;
		this.assetParser = assetParser;
		this.snapshotAggregator = snapshotAggregator;
		this.transferExtractor = transferExtractor;
		this.properties = properties;
	}

	@Transactional
	public ImportResultDto importFiles(MultipartFile combinedFile, MultipartFile assetFile) {
		Optional<Upload> combined = readUpload(combinedFile, SOURCE_COMBINED);
		Optional<Upload> asset = readUpload(assetFile, SOURCE_ASSET);
		if (combined.isEmpty() && asset.isEmpty()) {
			throw new LedgerImportException("No file supplied");
		}
		int minYear = properties.ledgerImport().minYear();

		List<ParsedTransaction> transactions = List.of();
		if (combined.isPresent()) {
			transactions = combinedParser.parse(combined.get().text(), minYear);
			if (transactions.isEmpty()) {
				throw new LedgerImportException("No transactions found in " + combined.get().filename());
			}
		}
		List<AssetLedgerEntry> entries = List.of();
		List<ParsedTransaction> transfers = List.of();
		if (asset.isPresent()) {
			entries = assetParser.parse(asset.get().text(), minYear);
			transfers = transferExtractor.extract(asset.get().text(), minYear);
		}

		int transactionsInserted = 0;
		if (combined.isPresent()) {
			transactionsInserted = replacePeriods(transactions);
			recordImport(combined.get(), transactions.size());
			logger.info("Imported {} transactions from {}", transactionsInserted, combined.get().filename());
		}

		int snapshotsUpserted = 0;
		TransferOutcome transferOutcome = new TransferOutcome(0, 0);
		if (asset.isPresent()) {
			snapshotsUpserted = upsertSnapshots(snapshotAggregator.aggregate(entries));
			transferOutcome = reconcileTransfers(transfers);
			recordImport(asset.get(), entries.size());
			logger.info("Imported {} snapshots and {} investment transfers from {} ({} transfers already present)",
					snapshotsUpserted, transferOutcome.inserted(), asset.get().filename(), transferOutcome.skipped());
		}

		return ImportResultDto.success(
				new ImportResultDto.TransactionCounts(transactionsInserted, transferOutcome.skipped()),
				new ImportResultDto.AssetCounts(snapshotsUpserted + transferOutcome.inserted(),
						snapshotsUpserted, transferOutcome.inserted())
		);
	}

	@Transactional(readOnly = true)
	public List<ImportFileDto> listRecentImports() {
		return importFileRepository.findTop20ByOrderByImportedAtDescFileIdDesc().stream()
				.map(file -> new ImportFileDto(file.getFileId(), file.getSource(), file.getFilename(),
						file.getFileHash(), file.getRowCount(), file.getImportedAt(), file.getStatus()))
				.toList();
	}

	private int replacePeriods(List<ParsedTransaction> transactions) {
		Map<Integer, List<ParsedTransaction>> byPeriod = new LinkedHashMap<>();
		for (ParsedTransaction transaction : transactions) {
			byPeriod.computeIfAbsent(transaction.periodKey(), key -> new ArrayList<>()).add(transaction);
		}
		LocalDateTime now = LocalDateTime.now();
		int batchSize = properties.ledgerImport().transactionBatchSize();
		int inserted = 0;
		for (Map.Entry<Integer, List<ParsedTransaction>> period : byPeriod.entrySet()) {
			int year = period.getKey() / 100;
			int month = period.getKey() % 100;
			int deleted = transactionRepository.deleteByPeriod(year, month);
			List<ParsedTransaction> rows = period.getValue();
			for (int start = 0; start < rows.size(); start += batchSize) {
				List<Transaction> batch = rows.subList(start, Math.min(rows.size(), start + batchSize)).stream()
						.map(row -> toEntity(row, now))
						.toList();
				transactionRepository.saveAll(batch);
				inserted += batch.size();
			}
			logger.debug("Replaced {}-{}: {} deleted, {} inserted", year, month, deleted, rows.size());
		}
		return inserted;
	}

	private int upsertSnapshots(List<MonthlyAssetSnapshot> snapshots) {
		if (snapshots.isEmpty()) {
			return 0;
		}
		Map<String, String> recordedTypes = new LinkedHashMap<>();
		LocalDateTime now = LocalDateTime.now();
		int batchSize = properties.ledgerImport().snapshotBatchSize();
		List<AssetSnapshot> pending = new ArrayList<>();
		int upserted = 0;
		for (MonthlyAssetSnapshot snapshot : snapshots) {
			String assetType = recordedTypes.computeIfAbsent(snapshot.assetName(), name ->
					assetSnapshotRepository.findFirstByAssetNameOrderByYearDescMonthDesc(name)
							.map(AssetSnapshot::getAssetType)
							.orElse(snapshot.assetType()));
			AssetSnapshot entity = assetSnapshotRepository
					.findByAssetNameAndYearAndMonth(snapshot.assetName(), snapshot.year(), snapshot.month())
					.orElseGet(AssetSnapshot::new);
			entity.setAssetName(snapshot.assetName());
			entity.setYear(snapshot.year());
			entity.setMonth(snapshot.month());
			entity.setOpeningBalance(snapshot.openingBalance());
			entity.setClosingBalance(snapshot.closingBalance());
			entity.setAssetType(assetType);
			entity.setUpdatedAt(now);
			pending.add(entity);
			if (pending.size() >= batchSize) {
				assetSnapshotRepository.saveAll(pending);
				upserted += pending.size();
				pending = new ArrayList<>();
			}
		}
		if (!pending.isEmpty()) {
			assetSnapshotRepository.saveAll(pending);
			upserted += pending.size();
		}
		rechainStored(recordedTypes.keySet(), now);
		return upserted;
	}

	/**
	 * Walks every stored month of the given accounts so that each opening balance equals the
	 * closing balance of the stored month before it, whichever import wrote either month. The
	 * earliest stored month keeps its own opening balance.
	 */
	private void rechainStored(Set<String> assetNames, LocalDateTime now) {
		for (String assetName : assetNames) {
			List<AssetSnapshot> changed = new ArrayList<>();
			Long previousClosing = null;
			for (AssetSnapshot stored : assetSnapshotRepository.findByAssetNameOrderByYearAscMonthAsc(assetName)) {
				if (previousClosing != null && !previousClosing.equals(stored.getOpeningBalance())) {
					stored.setOpeningBalance(previousClosing);
					stored.setUpdatedAt(now);
					changed.add(stored);
				}
				previousClosing = stored.getClosingBalance();
			}
			if (!changed.isEmpty()) {
				assetSnapshotRepository.saveAll(changed);
				logger.debug("Re-chained {} stored months of {}", changed.size(), assetName);
			}
		}
	}

	private TransferOutcome reconcileTransfers(List<ParsedTransaction> transfers) {
		if (transfers.isEmpty()) {
			return new TransferOutcome(0, 0);
		}
		String transferLabel = TransactionKind.TRANSFER.label();
		Set<Integer> periods = new LinkedHashSet<>();
		for (ParsedTransaction transfer : transfers) {
			periods.add(transfer.periodKey());
		}
		for (Integer period : periods) {
			transactionRepository.deleteByPeriodAndTypeAndMemo(period / 100, period % 100,
					transferLabel, ParsedTransaction.ASSET_REPORT_MEMO);
		}

		LocalDateTime now = LocalDateTime.now();
		int inserted = 0;
		int skipped = 0;
		for (ParsedTransaction transfer : transfers) {
			// best-effort natural-key match; near-equal amounts are not treated as duplicates
			boolean alreadyRecorded = transactionRepository.existsMatchingTransfer(
					transfer.date(),
					transfer.assetName(),
					transfer.incomeAmount(),
					transfer.expenseAmount(),
					transferLabel,
					ParsedTransaction.ASSET_REPORT_MEMO);
			if (alreadyRecorded) {
				skipped++;
				continue;
			}
			transactionRepository.save(toEntity(transfer, now));
			inserted++;
		}
		return new TransferOutcome(inserted, skipped);
	}

	private Transaction toEntity(ParsedTransaction parsed, LocalDateTime createdAt) {
		Transaction transaction = new Transaction();
		transaction.setDate(parsed.date());
		transaction.setYear(parsed.year());
		transaction.setMonth(parsed.month());
		transaction.setType(parsed.type());
		transaction.setCategory(parsed.category());
		transaction.setItemName(blankToNull(parsed.itemName()));
		transaction.setAmount(parsed.amount());
		transaction.setExpenseAmount(parsed.expenseAmount());
		transaction.setIncomeAmount(parsed.incomeAmount());
		transaction.setAssetName(blankToNull(parsed.assetName()));
		transaction.setTag(blankToNull(parsed.tag()));
		transaction.setMemo(blankToNull(parsed.memo()));
		transaction.setExcludeFromPl(parsed.excludeFromPl());
		transaction.setCreatedAt(createdAt);
		return transaction;
	}

	private void recordImport(Upload upload, int rowCount) {
		ImportFile importFile = new ImportFile();
		importFile.setSource(upload.source());
		importFile.setFilename(upload.filename());
		importFile.setFileHash(upload.fileHash());
		importFile.setRowCount(rowCount);
		importFile.setImportedAt(LocalDateTime.now());
		importFile.setStatus("imported");
		importFileRepository.save(importFile);
	}

	private Optional<Upload> readUpload(MultipartFile file, String source) {
		if (file == null || file.isEmpty()) {
			return Optional.empty();
		}
		String filename = file.getOriginalFilename() == null || file.getOriginalFilename().isBlank()
				? source + ".csv"
				: file.getOriginalFilename();
		byte[] payload;
		try {
			payload = file.getBytes();
		} catch (IOException exc) {
			throw new LedgerImportException("Failed to read upload " + filename + ": " + exc.getMessage(), exc);
		}
		return Optional.of(new Upload(source, filename, sha256(payload), CsvParsing.decodeUtf8(payload)));
	}

	private String sha256(byte[] payload) {
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			return HexFormat.of().formatHex(digest.digest(payload));
		} catch (Exception exc) {
			throw new IllegalStateException("Failed to hash upload: " + exc.getMessage(), exc);
		}
	}

	private static String blankToNull(String value) {
		return value == null || value.isBlank() ? null : value;
	}

	private record Upload(String source, String filename, String fileHash, String text) {
	}

	private record TransferOutcome(int inserted, int skipped) {
	}
}
