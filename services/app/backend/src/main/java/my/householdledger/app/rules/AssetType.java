package my.householdledger.app.rules;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum AssetType {
	BANK("bank"),
	CREDIT("credit"),
	INVESTMENT("investment"),
	IC_CARD("ic_card"),
	QR_PAY("qr_pay"),
	CASH("cash"),
	OTHER("other");

	private final String code;

	AssetType(String code) {
		this.code = code;
	}

	public String code() {
		return code;
	}

	public static Optional<AssetType> fromCode(String code) {
		if (code == null) {
			return Optional.empty();
		}
		String normalized = code.trim().toLowerCase(Locale.ROOT);
		return Arrays.stream(values())
				.filter(type -> type.code.equals(normalized))
				.findFirst();
	}
}
