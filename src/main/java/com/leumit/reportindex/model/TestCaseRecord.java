package com.leumit.reportindex.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TestCaseRecord(
        String testId,
        String result,
        String duration,
        String log,
        List<Attachment> attachments
) {

    public static final String NO_LOG = "No log output captured.";

    public TestCaseRecord {
        log = (log == null) ? NO_LOG : log;
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }
}
