package com.esgcredit.app;

import com.esgcredit.core.diagnostics.CauseCode;
import com.esgcredit.core.diagnostics.Outcome;
import com.esgcredit.model.CompanyProfile;
import com.esgcredit.model.HistoricalSeries;
import com.esgcredit.model.IndicatorRecord;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EsgCreditApplicationTest {
    private final ByteArrayOutputStream captured = new ByteArrayOutputStream();
    private final EsgCreditApplication app =
            new EsgCreditApplication(new PrintStream(captured, true, StandardCharsets.UTF_8));

    private static String resource(String name) throws Exception {
        return Path.of(EsgCreditApplicationTest.class.getClassLoader().getResource(name).toURI()).toString();
    }

    @Test
    void run_shouldExitZeroOnHelp() {
        assertEquals(0, app.run(new String[]{"--help"}));
    }

    @Test
    void run_shouldExitTwoWithoutProductCatalog() throws Exception {
        assertEquals(2, app.run(new String[]{"--no-log-route", "--companies", resource("companies.json")}));
    }

    @Test
    void run_shouldExitTwoOnInvalidHorizon() throws Exception {
        String[] args = {"--no-log-route", "--companies", resource("companies.json"),
                "--products", resource("products.json"), "--horizon", "0"};
        assertEquals(2, app.run(args));
    }

    @Test
    void run_shouldExitTwoWhenNoCompanyMatchesFilter() throws Exception {
        String[] args = {"--no-log-route", "--companies", resource("companies.json"),
                "--products", resource("products.json"), "--company", "Nobody Ltd"};
        assertEquals(2, app.run(args));
    }

    @Test
    void run_shouldExitOneOnMissingCatalogFile(@TempDir Path dir) throws Exception {
        String[] args = {"--no-log-route", "--companies", dir.resolve("absent.json").toString(),
                "--products", resource("products.json")};
        assertEquals(1, app.run(args));
    }

    @Test
    void run_shouldWriteResultsToOutputFile(@TempDir Path dir) throws Exception {
        Path out = dir.resolve("nested").resolve("results.json");
        String[] args = {"--no-log-route", "--companies", resource("companies.json"),
                "--products", resource("products.json"), "--horizon", "2", "--output", out.toString()};

        assertEquals(0, app.run(args));

        JSONArray results = new JSONObject(Files.readString(out, StandardCharsets.UTF_8)).getJSONArray("results");
        assertEquals(2, results.length());
        assertEquals("Green Steel Co", results.getJSONObject(0).getString("company"));
        assertEquals("HISTORY_SHORT", results.getJSONObject(1).getString("forecast_cause"));
        assertEquals(0, captured.size());
    }

    @Test
    void run_shouldPrintResultsForSelectedCompany() throws Exception {
        String[] args = {"--no-log-route", "--companies", resource("companies.json"),
                "--products", resource("products.json"), "--company", "young retail", "--horizon", "2"};

        assertEquals(0, app.run(args));

        String printed = captured.toString(StandardCharsets.UTF_8);
        assertTrue(printed.contains("Young Retail"));
        assertEquals(1, new JSONObject(printed).getJSONArray("results").length());
    }

    @Test
    void run_shouldEvaluateGoodCompaniesWhenOneEntryIsMalformed(@TempDir Path dir) throws Exception {
        JSONObject catalog = new JSONObject(Files.readString(Path.of(resource("companies.json")), StandardCharsets.UTF_8));
        catalog.getJSONArray("companies").put(new JSONObject("{\"name\":\"Bad\",\"environmental\":{\"a\":\"high\"}}"));
        Path companies = dir.resolve("companies.json");
        Files.writeString(companies, catalog.toString(), StandardCharsets.UTF_8);
        Path out = dir.resolve("results.json");
        String[] args = {"--no-log-route", "--companies", companies.toString(),
                "--products", resource("products.json"), "--horizon", "2", "--output", out.toString()};

        assertEquals(0, app.run(args));

        JSONArray results = new JSONObject(Files.readString(out, StandardCharsets.UTF_8)).getJSONArray("results");
        assertEquals(3, results.length());
        assertTrue(results.getJSONObject(0).getBoolean("success"));
        assertTrue(results.getJSONObject(1).getBoolean("success"));
        JSONObject bad = results.getJSONObject(2);
        assertEquals("Bad", bad.getString("company"));
        assertFalse(bad.getBoolean("success"));
        assertEquals("VALIDATION_FAILED", bad.getString("cause_code"));
    }

    @Test
    void filterCompany_shouldKeepAllWhenNameIsBlank() {
        List<Outcome<CompanyProfile>> companies = List.of(
                Outcome.success(company("A"), "A"),
                Outcome.failure(CauseCode.VALIDATION_FAILED, "B", "malformed company entry"));
        assertEquals(2, EsgCreditApplication.filterCompany(companies, " ").size());
        assertEquals(1, EsgCreditApplication.filterCompany(companies, "b").size());
    }

    private static CompanyProfile company(String name) {
        return CompanyProfile.builder()
                .indicators(IndicatorRecord.builder().name(name).environmental(Map.of()).social(Map.of())
                        .governance(Map.of()).build())
                .history(new HistoricalSeries(name, List.of()))
                .suppliers(List.of())
                .build();
    }
}
