package com.leumit.reportindex.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Attachment(
        String name,
        @JsonProperty("format_type") String formatType,
        String content
) {

    public static final String SCREENSHOT = "Screenshot";
    public static final String IMAGE = "image";

    public static Attachment screenshot(String src) {
        return new Attachment(SCREENSHOT, IMAGE, src);
    }
}
