package com.leumit.reportindex.run;

public class ReportParseException extends RuntimeException {

    private final String source;

    public ReportParseException(String source, String message) {
        this(source, message, null);
    }

    public ReportParseException(String source, String message, Throwable cause) {
        super("Cannot parse report " + source + ": " + message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
