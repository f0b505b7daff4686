package my.householdledger.app.importer;

import java.util.List;

public interface LedgerParser<T> {
	List<T> parse(String csvText, int minYear);
}
