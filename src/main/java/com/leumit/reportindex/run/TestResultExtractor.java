package com.leumit.reportindex.run;

import com.leumit.reportindex.model.Attachment;
import com.leumit.reportindex.model.TestCaseRecord;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Walks {@code table#results-table}: one {@code tbody.results-table-row} per test, holding a
 * {@code tr.collapsible} primary row and an optional {@code tr.extras-row}.
 * <p>
 * A group whose primary row lacks a result, duration or test id is dropped, not defaulted.
 */
@Slf4j
public final class TestResultExtractor {

    private TestResultExtractor() {}

    public static List<TestCaseRecord> extract(Document doc) {
        Element table = doc == null ? null : doc.selectFirst("table#results-table");
        if (table == null) return List.of();

        // keyed by test id: a repeated id replaces the earlier record in place
        Map<String, TestCaseRecord> byId = new LinkedHashMap<>();
        int skipped = 0;

        for (Element group : table.select("tbody.results-table-row")) {
            TestCaseRecord test = parseGroup(group);
            if (test == null) {
                skipped++;
                continue;
            }
            if (byId.put(test.testId(), test) != null) {
                log.debug("Duplicate test id {}, keeping the later row", test.testId());
            }
        }

        if (skipped > 0) {
            log.debug("Skipped {} result rows without result/duration/test id", skipped);
        }
        return new ArrayList<>(byId.values());
    }

    private static TestCaseRecord parseGroup(Element group) {
        Element row = group.selectFirst("tr.collapsible");
        if (row == null) return null;

        String result = textOf(row.selectFirst("td.col-result"));
        String testId = textOf(row.selectFirst("td.col-testId"));
        String duration = textOf(row.selectFirst("td.col-duration"));
        if (result.isBlank() || testId.isBlank() || duration.isBlank()) return null;

        Element logEl = group.selectFirst("div.log");
        String log = logEl == null ? TestCaseRecord.NO_LOG : logEl.wholeText().trim();

        return new TestCaseRecord(testId, result, duration, log, parseAttachments(group));
    }

    private static List<Attachment> parseAttachments(Element group) {
        Element extras = group.selectFirst("tr.extras-row");
        if (extras == null) return List.of();

        Element img = extras.selectFirst("div.media img[src]");
        if (img == null) return List.of();

        String src = img.attr("src").trim();
        return src.isEmpty() ? List.of() : List.of(Attachment.screenshot(src));
    }

    private static String textOf(Element el) {
        return el == null ? "" : el.text().trim();
    }
}
