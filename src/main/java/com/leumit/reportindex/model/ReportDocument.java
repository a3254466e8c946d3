package com.leumit.reportindex.model;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

public record ReportDocument(
        String title,
        EnvironmentRecord environment,
        EnvironmentSource environmentSource,
        List<TestCaseRecord> tests,
        String processedBy,
        LocalDateTime processedAt,
        String processorVersion
) {

    public ReportDocument {
        title = title == null ? "" : title;
        environment = environment == null ? EnvironmentRecord.EMPTY : environment;
        environmentSource = environmentSource == null ? EnvironmentSource.HTML_TABLE : environmentSource;
        tests = tests == null ? List.of() : List.copyOf(tests);
        processedBy = processedBy == null ? "" : processedBy;
        Objects.requireNonNull(processedAt, "processedAt");
        processorVersion = processorVersion == null ? "" : processorVersion;
    }
}
