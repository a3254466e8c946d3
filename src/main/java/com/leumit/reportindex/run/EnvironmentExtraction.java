package com.leumit.reportindex.run;

import com.leumit.reportindex.model.EnvironmentRecord;
import com.leumit.reportindex.model.EnvironmentSource;

public sealed interface EnvironmentExtraction permits EnvironmentExtraction.Parsed, EnvironmentExtraction.Fallback {

    EnvironmentSource source();

    record Parsed(EnvironmentRecord environment) implements EnvironmentExtraction {

        @Override
        public EnvironmentSource source() {
            return EnvironmentSource.JSON_BLOB;
        }
    }

    // blobPresent: a container was there but its blob could not be used
    record Fallback(String reason, boolean blobPresent) implements EnvironmentExtraction {

        @Override
        public EnvironmentSource source() {
            return EnvironmentSource.HTML_TABLE;
        }
    }
}
