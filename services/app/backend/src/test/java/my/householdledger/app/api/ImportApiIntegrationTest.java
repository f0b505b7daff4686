package my.householdledger.app.api;

import my.householdledger.app.AppApplication;
import my.householdledger.app.support.TestDatabaseCleaner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = AppApplication.class)
@ActiveProfiles("test")
class ImportApiIntegrationTest {
	private MockMvc mockMvc;

	@Autowired
	private WebApplicationContext context;

	@Autowired
	private JdbcTemplate jdbcTemplate;

	@Autowired
	private TestDatabaseCleaner databaseCleaner;

	@BeforeEach
	void setUp() {
		mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
		databaseCleaner.clean();
	}

	@AfterEach
	void tearDown() {
		databaseCleaner.clean();
	}

	@Test
	void importsBothExportsAndDeduplicatesTransfers() throws Exception {
		mockMvc.perform(multipart("/api/imports")
						.file(resource("combined", "combined-sample.csv"))
						.file(resource("asset", "asset-sample.csv")))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.success").value(true))
				.andExpect(jsonPath("$.transactions.inserted").value(4))
				.andExpect(jsonPath("$.transactions.skipped").value(1))
				.andExpect(jsonPath("$.assets.snapshots").value(5))
				.andExpect(jsonPath("$.assets.transfers").value(1))
				.andExpect(jsonPath("$.assets.inserted").value(6))
				.andExpect(jsonPath("$.error").doesNotExist());

		assertThat(count("select count(*) from transactions")).isEqualTo(5);
		assertThat(count("select count(*) from transactions where memo = '__asset_report__'")).isEqualTo(1);
		assertThat(count("select count(*) from asset_snapshots")).isEqualTo(5);
		assertThat(count("select count(*) from import_files")).isEqualTo(2);
	}

	@Test
	void reimportIsIdempotent() throws Exception {
		for (int run = 0; run < 2; run++) {
			mockMvc.perform(multipart("/api/imports")
							.file(resource("combined", "combined-sample.csv"))
							.file(resource("asset", "asset-sample.csv")))
					.andExpect(status().isOk());
		}

		assertThat(count("select count(*) from transactions")).isEqualTo(5);
		assertThat(count("select count(*) from asset_snapshots")).isEqualTo(5);
		assertThat(count("select count(*) from import_files")).isEqualTo(4);
		Long closing = jdbcTemplate.queryForObject(
				"select closing_balance from asset_snapshots where asset_name = ? and year = 2024 and month = 4",
				Long.class, "三菱UFJ銀行");
		assertThat(closing).isEqualTo(700000L);
	}

	@Test
	void assetImportAloneKeepsCombinedRows() throws Exception {
		mockMvc.perform(multipart("/api/imports").file(resource("combined", "combined-sample.csv")))
				.andExpect(status().isOk());
		mockMvc.perform(multipart("/api/imports").file(resource("asset", "asset-sample.csv")))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.transactions.inserted").value(0))
				.andExpect(jsonPath("$.transactions.skipped").value(1));

		assertThat(count("select count(*) from transactions")).isEqualTo(5);
	}

	@Test
	void rejectsRequestWithoutFiles() throws Exception {
		mockMvc.perform(multipart("/api/imports"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.success").value(false))
				.andExpect(jsonPath("$.error").value("No file supplied"));
	}

	@Test
	void combinedFileWithoutRowsKeepsExistingData() throws Exception {
		mockMvc.perform(multipart("/api/imports").file(resource("combined", "combined-sample.csv")))
				.andExpect(status().isOk());
		MockMultipartFile headerOnly = new MockMultipartFile("combined", "header.csv", "text/csv",
				"日付,区分,カテゴリ,内容,金額,支出額,収入額,資産,タグ,メモ,計算対象外\n".getBytes(StandardCharsets.UTF_8));

		mockMvc.perform(multipart("/api/imports").file(headerOnly))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.success").value(false));

		assertThat(count("select count(*) from transactions")).isEqualTo(4);
	}

	@Test
	void reportsBalancesCostBasisAndImports() throws Exception {
		mockMvc.perform(multipart("/api/imports")
						.file(resource("combined", "combined-sample.csv"))
						.file(resource("asset", "asset-sample.csv")))
				.andExpect(status().isOk());

		mockMvc.perform(get("/api/assets/balances").param("year", "2024").param("month", "5"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$", hasSize(3)))
				.andExpect(jsonPath("$[?(@.assetName == '三菱UFJ銀行')].closingBalance").value(700000))
				.andExpect(jsonPath("$[?(@.assetName == '楽天カード')].snapshotMonth").value(3))
				.andExpect(jsonPath("$[?(@.assetName == 'iDeCo')].assetType").value("investment"));

		mockMvc.perform(get("/api/assets/balances").param("year", "2024").param("month", "2"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$", hasSize(0)));

		mockMvc.perform(get("/api/investments/cost-basis").param("year", "2024").param("month", "4"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$[0].productName").value("iDeCo"))
				.andExpect(jsonPath("$[0].costBasis").value(46000))
				.andExpect(jsonPath("$[1].costBasis").value(0));

		mockMvc.perform(get("/api/imports"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$", hasSize(2)))
				.andExpect(jsonPath("$[0].fileId").isNumber())
				.andExpect(jsonPath("$[0].status").value("imported"))
				.andExpect(jsonPath("$[?(@.source == 'asset')].filename").value("asset-sample.csv"))
				.andExpect(jsonPath("$[?(@.source == 'combined')].rowCount").value(4));
	}

	@Test
	void importedMonthRechainsLaterStoredMonth() throws Exception {
		mockMvc.perform(multipart("/api/imports").file(assetCsv("january-march.csv",
						"PayPay,-,-,-,-,-,0\n"
								+ ",2024年01月10日(水),収入,チャージ,チャージ,100,100\n"
								+ ",2024年03月10日(日),収入,チャージ,チャージ,50,150\n")))
				.andExpect(status().isOk());
		mockMvc.perform(multipart("/api/imports").file(assetCsv("february.csv",
						"PayPay,-,-,-,-,-,100\n"
								+ ",2024年02月10日(土),収入,チャージ,チャージ,20,120\n")))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.assets.snapshots").value(1));

		mockMvc.perform(get("/api/assets/{assetName}/snapshots", "PayPay"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$", hasSize(3)))
				.andExpect(jsonPath("$[0].openingBalance").value(100))
				.andExpect(jsonPath("$[1].snapshotMonth").value(2))
				.andExpect(jsonPath("$[1].openingBalance").value(100))
				.andExpect(jsonPath("$[1].closingBalance").value(120))
				.andExpect(jsonPath("$[2].snapshotMonth").value(3))
				.andExpect(jsonPath("$[2].openingBalance").value(120))
				.andExpect(jsonPath("$[2].closingBalance").value(150));
	}

	@Test
	void manualAssetTypeSurvivesReimport() throws Exception {
		mockMvc.perform(multipart("/api/imports").file(resource("asset", "asset-sample.csv")))
				.andExpect(status().isOk());

		mockMvc.perform(put("/api/assets/{assetName}/type", "楽天カード")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{\"assetType\":\"cash\"}"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.snapshotsUpdated").value(1));

		mockMvc.perform(multipart("/api/imports").file(resource("asset", "asset-sample.csv")))
				.andExpect(status().isOk());

		String type = jdbcTemplate.queryForObject(
				"select asset_type from asset_snapshots where asset_name = ?", String.class, "楽天カード");
		assertThat(type).isEqualTo("cash");
	}

	@Test
	void rejectsUnknownAssetType() throws Exception {
		mockMvc.perform(put("/api/assets/{assetName}/type", "楽天カード")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{\"assetType\":\"savings\"}"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.title").value("Bad Request"));

		mockMvc.perform(put("/api/assets/{assetName}/type", "楽天カード")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{\"assetType\":\"\"}"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.title").value("Validation failed"));
	}

	private int count(String sql) {
		Integer value = jdbcTemplate.queryForObject(sql, Integer.class);
		return value == null ? 0 : value;
	}

	private MockMultipartFile assetCsv(String filename, String content) {
		return new MockMultipartFile("asset", filename, "text/csv", content.getBytes(StandardCharsets.UTF_8));
	}

	private MockMultipartFile resource(String name, String filename) throws IOException {
		try (InputStream stream = getClass().getResourceAsStream("/imports/" + filename)) {
			return new MockMultipartFile(name, filename, "text/csv", Objects.requireNonNull(stream, filename).readAllBytes());
		}
	}
}
