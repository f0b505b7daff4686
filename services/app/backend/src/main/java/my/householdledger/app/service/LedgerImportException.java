package my.householdledger.app.service;

/**
 * A user-facing import failure: nothing to import, or a file that yields no usable rows.
 */
public class LedgerImportException extends IllegalArgumentException {
	public LedgerImportException(String message) {
		super(message);
	}

	public LedgerImportException(String message, Throwable cause) {
		super(message, cause);
	}
}
