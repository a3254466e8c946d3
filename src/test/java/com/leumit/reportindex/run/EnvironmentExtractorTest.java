package com.leumit.reportindex.run;

import com.leumit.reportindex.model.EnvironmentRecord;
import com.leumit.reportindex.model.EnvironmentSource;
import com.leumit.reportindex.support.Fixtures;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import static org.junit.jupiter.api.Assertions.*;

class EnvironmentExtractorTest {

    @Test
    void repairableBlobIsPreferredOverTable() {
        Document doc = Fixtures.doc("repairable-blob.html");

        EnvironmentExtraction decision = EnvironmentExtractor.fromBlob(doc);
        assertInstanceOf(EnvironmentExtraction.Parsed.class, decision);
        assertEquals(EnvironmentSource.JSON_BLOB, decision.source());

        EnvironmentRecord env = EnvironmentExtractor.extract(doc);
        assertEquals("3.12.1", env.interpreterVersion());
        assertEquals("Linux-6.8.0-x86_64", env.platform());
        assertEquals("firefox", env.platformType());
        assertEquals("", env.baseUrl());
        assertEquals("8.3.3", env.packages().pytest());
        assertEquals("1.5.0", env.packages().pluggy());
        assertEquals("2.1.0", env.plugins().baseUrl());
        assertEquals("0.5.2", env.plugins().playwright());
        assertEquals("0.24.0", env.plugins().asyncio());
        assertEquals("4.1.1", env.plugins().html());
        assertEquals("3.1.1", env.plugins().metadata());
    }

    @Test
    void unrepairableBlobFallsBackWithReason() {
        EnvironmentExtraction decision = EnvironmentExtractor.fromBlob(Fixtures.doc("broken-blob.html"));

        EnvironmentExtraction.Fallback fallback = assertInstanceOf(EnvironmentExtraction.Fallback.class, decision);
        assertTrue(fallback.reason().startsWith("blob is not JSON"), fallback.reason());
        assertTrue(fallback.blobPresent());
        assertEquals(EnvironmentSource.HTML_TABLE, fallback.source());
    }

    @Test
    @ExtendWith(OutputCaptureExtension.class)
    void unusableBlobIsLoggedAsWarning(CapturedOutput output) {
        EnvironmentExtractor.extract(Fixtures.doc("broken-blob.html"));

        assertTrue(output.getOut().contains("WARN"), output.getOut());
        assertTrue(output.getOut().contains("falling back to the environment table"), output.getOut());
    }

    @Test
    void missingContainerFallsBack() {
        EnvironmentExtraction decision = EnvironmentExtractor.fromBlob(Fixtures.doc("table-only.html"));

        EnvironmentExtraction.Fallback fallback = assertInstanceOf(EnvironmentExtraction.Fallback.class, decision);
        assertFalse(fallback.blobPresent());
    }

    @Test
    void blobWithoutEnvironmentObjectFallsBack() {
        EnvironmentExtraction decision = EnvironmentExtractor.fromBlob("{pytest:'8.3.3'}");

        EnvironmentExtraction.Fallback fallback = assertInstanceOf(EnvironmentExtraction.Fallback.class, decision);
        assertEquals("blob has no environment object", fallback.reason());
        assertTrue(fallback.blobPresent());
    }

    @Test
    void fallbackMatchesPlainTableExtraction() {
        EnvironmentRecord viaFallback = EnvironmentExtractor.extract(Fixtures.doc("broken-blob.html"));
        EnvironmentRecord viaTable = EnvironmentExtractor.fromTable(Fixtures.doc("table-only.html"));

        assertEquals(viaTable, viaFallback);
        assertEquals("3.11.9", viaFallback.interpreterVersion());
        assertEquals("Windows-10-10.0.22631-SP0", viaFallback.platform());
        assertEquals("chromium", viaFallback.platformType());
        assertEquals("8.3.3", viaFallback.packages().pytest());
        assertEquals("0.5.2", viaFallback.plugins().playwright());
        assertEquals("3.1.1", viaFallback.plugins().metadata());
    }

    @Test
    void tableListItemsAreCleaned() {
        Document doc = Jsoup.parse("""
                <table id="environment">
                  <tr><td>Packages</td><td><ul><li>marker\\npytest: '8.3.3'</li></ul></td></tr>
                  <tr><td>Plugins</td><td><ul><li>html: "4.1.1"</li><li>unknown: 9.9</li></ul></td></tr>
                </table>
                """);

        EnvironmentRecord env = EnvironmentExtractor.fromTable(doc);
        assertEquals("8.3.3", env.packages().pytest());
        assertEquals("", env.packages().pluggy());
        assertEquals("4.1.1", env.plugins().html());
        assertEquals("", env.plugins().playwright());
    }

    @Test
    void nothingAvailableGivesAllEmptyStrings() {
        EnvironmentRecord env = EnvironmentExtractor.extract(Jsoup.parse("<p>no environment</p>"));

        assertEquals(EnvironmentRecord.EMPTY, env);
        assertEquals("", env.interpreterVersion());
        assertEquals("", env.plugins().baseUrl());
        assertNotNull(env.packages());
    }

    @Test
    void nonStringJsonValuesReadAsText() {
        EnvironmentExtraction decision = EnvironmentExtractor.fromBlob(
                "{\"environment\":{\"Python\":3, \"Packages\":{\"pytest\":null}, \"plugins\":[]}}");

        EnvironmentRecord env = assertInstanceOf(EnvironmentExtraction.Parsed.class, decision).environment();
        assertEquals("3", env.interpreterVersion());
        assertEquals("", env.packages().pytest());
        assertEquals("", env.plugins().html());
    }
}
