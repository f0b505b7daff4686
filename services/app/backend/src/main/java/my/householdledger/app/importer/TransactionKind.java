package my.householdledger.app.importer;

/**
 * Transaction kinds as labelled in the aggregator's exports. The label is what gets persisted.
 */
public enum TransactionKind {
	EXPENSE("支出"),
	INCOME("収入"),
	TRANSFER("振替");

	private final String label;

	TransactionKind(String label) {
		this.label = label;
	}

	public String label() {
		return label;
	}
}
