package com.leumit.reportindex.model;

public enum EnvironmentSource {
    JSON_BLOB,
    HTML_TABLE
}
