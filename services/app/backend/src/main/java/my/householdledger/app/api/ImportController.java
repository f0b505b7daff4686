package my.householdledger.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import my.householdledger.app.dto.ImportFileDto;
import my.householdledger.app.dto.ImportResultDto;
import my.householdledger.app.service.LedgerImportException;
import my.householdledger.app.service.LedgerImportService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@RestController
@Tag(name = "Imports", description = "Ledger CSV imports")
@RequestMapping("/api/imports")
public class ImportController {
	private static final Logger logger = LoggerFactory.getLogger(ImportController.class);

	private final LedgerImportService ledgerImportService;

	public ImportController(LedgerImportService ledgerImportService) {
		this.ledgerImportService = ledgerImportService;
	}

	/**
	 * Imports the combined ledger export and/or the per-account export. Either part may be omitted.
	 */
	@Operation(summary = "Import the combined and/or per-account export")
	@PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
	public ImportResultDto importLedgers(@RequestParam(value = "combined", required = false) MultipartFile combined,
										 @RequestParam(value = "asset", required = false) MultipartFile asset) {
		return ledgerImportService.importFiles(combined, asset);
	}

	@Operation(summary = "List recent imports")
	@GetMapping
	public List<ImportFileDto> listImports() {
		return ledgerImportService.listRecentImports();
	}

	@ExceptionHandler(LedgerImportException.class)
	public ResponseEntity<ImportResultDto> handleImportFailure(LedgerImportException ex) {
		logger.warn("Ledger import rejected: {}", ex.getMessage());
		return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ImportResultDto.failure(ex.getMessage()));
	}

	@ExceptionHandler(Exception.class)
	public ResponseEntity<ImportResultDto> handleUnexpected(Exception ex) {
		logger.error("Ledger import failed", ex);
		return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ImportResultDto.failure("Import failed"));
	}
}
