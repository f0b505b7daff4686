package my.householdledger.app.rules;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Guesses an account category from its display name. Rules are checked top-down; the first match
 * wins, so liabilities are tested before institution names ("三菱UFJカード" is credit, not bank).
 */
public class AssetTypeClassifier {
	private static final List<Rule> RULES = List.of(
			new Rule(AssetType.CREDIT, Pattern.compile("カード|クレカ|NICOS")),
			new Rule(AssetType.CREDIT, Pattern.compile("借入|ローン|未払金")),
			new Rule(AssetType.INVESTMENT, Pattern.compile("証券|iDeCo|投資信託|MMF|株|ETF")),
			new Rule(AssetType.IC_CARD, Pattern.compile("PASMO|suica|Suica|IC")),
			new Rule(AssetType.QR_PAY, Pattern.compile("PayPay|LINE Pay|ハチペイ|メルペイ|ペイ")),
			new Rule(AssetType.CASH, Pattern.compile("現金|お財布|財布|封筒|精算用")),
			new Rule(AssetType.BANK, Pattern.compile("ゆうちょ|三菱|SBI|ろうきん|みずほ|りそな|大阪商工|銀行|金庫"))
	);

	public AssetType classify(String assetName) {
		if (assetName == null || assetName.isBlank()) {
			return AssetType.OTHER;
		}
		for (Rule rule : RULES) {
			if (rule.pattern().matcher(assetName).find()) {
				return rule.type();
			}
		}
		return AssetType.OTHER;
	}

	private record Rule(AssetType type, Pattern pattern) {
	}
}
