package com.leumit.reportindex.model;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;

public record ProcessingMetadata(String processorVersion, String processedBy, LocalDateTime processedAt) {

    public static final DateTimeFormatter PROCESSED_AT_FMT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT);

    public ProcessingMetadata {
        processorVersion = processorVersion == null ? "" : processorVersion.trim();
        processedBy = processedBy == null ? "" : processedBy.trim();
        Objects.requireNonNull(processedAt, "processedAt");
    }

    public static ProcessingMetadata of(String processorVersion, String processedBy, String processedAt) {
        return new ProcessingMetadata(processorVersion, processedBy, parseProcessedAt(processedAt));
    }

    public static LocalDateTime parseProcessedAt(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("processedAt is blank");
        }
        try {
            return LocalDateTime.parse(raw.trim(), PROCESSED_AT_FMT);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("processedAt must look like yyyy-MM-dd HH:mm:ss: " + raw, e);
        }
    }
}
