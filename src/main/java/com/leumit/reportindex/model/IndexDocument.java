package com.leumit.reportindex.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record IndexDocument(
        String id,
        String testId,
        String result,
        String duration,
        String log,
        String timestamp,
        EnvironmentRecord environment,
        @JsonProperty("processed_by") String processedBy,
        @JsonProperty("processed_at") String processedAt,
        @JsonProperty("processor_version") String processorVersion,
        String title
) {}
