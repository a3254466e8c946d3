package com.leumit.reportindex.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

// absent data is "", never null
@JsonIgnoreProperties(ignoreUnknown = true)
public record EnvironmentRecord(
        @JsonProperty("python") String interpreterVersion,
        @JsonProperty("platform") String platform,
        @JsonProperty("packages") Packages packages,
        @JsonProperty("plugins") Plugins plugins,
        @JsonProperty("platform_type") String platformType,
        @JsonProperty("base_url") String baseUrl
) {

    public static final EnvironmentRecord EMPTY = new EnvironmentRecord("", "", Packages.EMPTY, Plugins.EMPTY, "", "");

    public EnvironmentRecord {
        interpreterVersion = nz(interpreterVersion);
        platform = nz(platform);
        packages = packages == null ? Packages.EMPTY : packages;
        plugins = plugins == null ? Plugins.EMPTY : plugins;
        platformType = nz(platformType);
        baseUrl = nz(baseUrl);
    }

    public EnvironmentRecord copy() {
        return new EnvironmentRecord(
                interpreterVersion,
                platform,
                new Packages(packages.pytest(), packages.pluggy()),
                new Plugins(plugins.baseUrl(), plugins.playwright(), plugins.asyncio(), plugins.html(), plugins.metadata()),
                platformType,
                baseUrl
        );
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Packages(String pytest, String pluggy) {

        public static final Packages EMPTY = new Packages("", "");

        public Packages {
            pytest = nz(pytest);
            pluggy = nz(pluggy);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Plugins(
            @JsonProperty("base_url") String baseUrl,
            String playwright,
            String asyncio,
            String html,
            String metadata
    ) {

        public static final Plugins EMPTY = new Plugins("", "", "", "", "");

        public Plugins {
            baseUrl = nz(baseUrl);
            playwright = nz(playwright);
            asyncio = nz(asyncio);
            html = nz(html);
            metadata = nz(metadata);
        }
    }

    private static String nz(String s) {
        return s == null ? "" : s;
    }
}
