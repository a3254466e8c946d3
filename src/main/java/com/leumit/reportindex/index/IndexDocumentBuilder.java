package com.leumit.reportindex.index;

import com.leumit.reportindex.model.IndexDocument;
import com.leumit.reportindex.model.ReportDocument;
import com.leumit.reportindex.model.TestCaseRecord;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

public final class IndexDocumentBuilder {

    public static final DateTimeFormatter INSTANT_FMT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'", Locale.ROOT);

    private final Supplier<String> idGenerator;

    public IndexDocumentBuilder() {
        this(() -> UUID.randomUUID().toString());
    }

    public IndexDocumentBuilder(Supplier<String> idGenerator) {
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    }

    public List<IndexDocument> build(ReportDocument report) {
        Objects.requireNonNull(report, "report");

        String processedAt = toUtcInstant(report.processedAt());
        List<IndexDocument> out = new ArrayList<>(report.tests().size());

        for (TestCaseRecord test : report.tests()) {
            out.add(new IndexDocument(
                    idGenerator.get(),
                    test.testId(),
                    test.result(),
                    test.duration(),
                    test.log(),
                    processedAt,
                    report.environment().copy(),
                    report.processedBy(),
                    processedAt,
                    report.processorVersion(),
                    report.title()
            ));
        }
        return out;
    }

    // processing time carries no zone, taken as UTC
    public static String toUtcInstant(LocalDateTime localNaive) {
        return localNaive.atOffset(ZoneOffset.UTC).format(INSTANT_FMT);
    }
}
