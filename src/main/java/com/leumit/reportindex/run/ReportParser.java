package com.leumit.reportindex.run;

import com.leumit.reportindex.model.EnvironmentRecord;
import com.leumit.reportindex.model.ProcessingMetadata;
import com.leumit.reportindex.model.ReportDocument;
import com.leumit.reportindex.model.TestCaseRecord;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Turns the HTML text of one report into a {@link ReportDocument}.
 * <p>
 * Missing optional data degrades to defaults. Only input that carries no markup at all is
 * rejected, with a {@link ReportParseException} naming the report.
 */
@Slf4j
public final class ReportParser {

    public static final String DEFAULT_TITLE = "report.html";
    public static final String INLINE_SOURCE = "<inline>";

    // start tag, end tag, doctype or comment
    private static final Pattern MARKUP_TAG = Pattern.compile("<[a-zA-Z!/]");

    private final ProcessingMetadata metadata;

    public ReportParser(ProcessingMetadata metadata) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
    }

    public ReportDocument parse(String html) {
        return parse(html, INLINE_SOURCE);
    }

    public ReportDocument parse(String html, String source) {
        Document doc = toDocument(html, source);

        EnvironmentExtraction decision = EnvironmentExtractor.fromBlob(doc);
        EnvironmentRecord environment = EnvironmentExtractor.resolve(decision, doc);
        List<TestCaseRecord> tests = TestResultExtractor.extract(doc);
        String title = title(doc);

        log.debug("Parsed report source={} title={} tests={} environment={}",
                source, title, tests.size(), decision.source());
        return new ReportDocument(
                title,
                environment,
                decision.source(),
                tests,
                metadata.processedBy(),
                metadata.processedAt(),
                metadata.processorVersion()
        );
    }

    public ProcessingMetadata getMetadata() {
        return metadata;
    }

    static Document toDocument(String html, String source) {
        if (html == null || html.isBlank()) {
            throw new ReportParseException(source, "empty input");
        }
        if (!MARKUP_TAG.matcher(html).find()) {
            throw new ReportParseException(source, "no markup elements found");
        }
        return Jsoup.parse(html);
    }

    static String title(Document doc) {
        Element h1 = doc.selectFirst("h1#title");
        if (h1 != null && !h1.text().isBlank()) {
            return h1.text().trim();
        }
        return DEFAULT_TITLE;
    }
}
