package my.householdledger.app.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CsvParsingTest {
	@Test
	void splitsQuotedFieldsAndUnescapesQuotes() {
		List<String> fields = CsvParsing.splitLine("a,\"b,c\",\"say \"\"hi\"\"\",d").orElseThrow();

		assertThat(fields).containsExactly("a", "b,c", "say \"hi\"", "d");
	}

	@Test
	void trimsFieldsAndKeepsEmptyOnes() {
		List<String> fields = CsvParsing.splitLine(" a , ,b ,").orElseThrow();

		assertThat(fields).containsExactly("a", "", "b", "");
	}

	@Test
	void quoteClosingMidFieldKeepsTrailingText() {
		List<String> fields = CsvParsing.splitLine("\"abc\"def,x").orElseThrow();

		assertThat(fields).containsExactly("abcdef", "x");
	}

	@Test
	void quoteOpeningMidFieldProtectsCommas() {
		List<String> fields = CsvParsing.splitLine("a\"b,c\"d,e").orElseThrow();

		assertThat(fields).containsExactly("ab,cd", "e");
	}

	@Test
	void unterminatedQuoteRunsToEndOfLine() {
		List<String> fields = CsvParsing.splitLine("x,\"open, still open").orElseThrow();

		assertThat(fields).containsExactly("x", "open, still open");
	}

	@Test
	void blankLineYieldsNothing() {
		assertThat(CsvParsing.splitLine("")).isEmpty();
		assertThat(CsvParsing.splitLine("   ")).isEmpty();
		assertThat(CsvParsing.splitLine(null)).isEmpty();
	}

	@Test
	void acceptsEveryLineEnding() {
		assertThat(CsvParsing.splitLines("a\r\nb\nc\rd")).containsExactly("a", "b", "c", "d");
	}

	@Test
	void dropsLeadingBom() {
		byte[] payload = "\uFEFF日付,内容\n".getBytes(StandardCharsets.UTF_8);

		String text = CsvParsing.decodeUtf8(payload);

		assertThat(text).startsWith("日付");
		assertThat(CsvParsing.readRows(text, 2).get(0).get(0)).isEqualTo("日付");
	}

	@Test
	void readRowsDropsShortAndBlankLines() {
		String text = "a,b,c\n\nshort\n1,2,3,4\n";

		List<List<String>> rows = CsvParsing.readRows(text, 3);

		assertThat(rows).containsExactly(List.of("a", "b", "c"), List.of("1", "2", "3", "4"));
	}

	@Test
	void emptyTextHasNoRows() {
		assertThat(CsvParsing.readRows("", 1)).isEmpty();
		assertThat(CsvParsing.readRows(null, 1)).isEmpty();
	}
}
