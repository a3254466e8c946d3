package com.leumit.reportindex.run;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leumit.reportindex.model.EnvironmentRecord;
import com.leumit.reportindex.model.EnvironmentRecord.Packages;
import com.leumit.reportindex.model.EnvironmentRecord.Plugins;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the environment a report ran in.
 * <p>
 * The embedded {@code data-jsonblob} is preferred. When it is missing or cannot be parsed even
 * after repair, the whole record comes from the {@code table#environment} markup instead; the
 * two sources are never mixed.
 */
@Slf4j
public final class EnvironmentExtractor {

    static final String BLOB_CONTAINER = "#data-container";
    static final String BLOB_ATTR = "data-jsonblob";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private EnvironmentExtractor() {}

    public static EnvironmentRecord extract(Document doc) {
        return resolve(fromBlob(doc), doc);
    }

    public static EnvironmentRecord resolve(EnvironmentExtraction decision, Document doc) {
        if (decision instanceof EnvironmentExtraction.Parsed parsed) {
            return parsed.environment();
        }

        EnvironmentExtraction.Fallback fallback = (EnvironmentExtraction.Fallback) decision;
        if (fallback.blobPresent()) {
            log.warn("Could not use {} ({}), falling back to the environment table", BLOB_ATTR, fallback.reason());
        } else {
            log.debug("Environment from HTML table: {}", fallback.reason());
        }
        return fromTable(doc);
    }

    public static EnvironmentExtraction fromBlob(Document doc) {
        Element container = doc == null ? null : doc.selectFirst(BLOB_CONTAINER);
        if (container == null || !container.hasAttr(BLOB_ATTR)) {
            return new EnvironmentExtraction.Fallback("no " + BLOB_ATTR + " container", false);
        }
        return fromBlob(container.attr(BLOB_ATTR));
    }

    public static EnvironmentExtraction fromBlob(String rawBlob) {
        String repaired = JsonBlobRepairer.repair(rawBlob);
        log.debug("Repaired blob: {}", repaired);

        JsonNode root;
        try {
            root = MAPPER.readTree(repaired);
        } catch (JsonProcessingException e) {
            return new EnvironmentExtraction.Fallback("blob is not JSON after repair: " + e.getOriginalMessage(), true);
        }

        JsonNode env = root == null ? null : root.get("environment");
        if (env == null || !env.isObject()) {
            return new EnvironmentExtraction.Fallback("blob has no environment object", true);
        }
        return new EnvironmentExtraction.Parsed(fromJson(env));
    }

    private static EnvironmentRecord fromJson(JsonNode env) {
        JsonNode pkg = env.path("Packages");
        JsonNode plg = env.path("plugins");

        return new EnvironmentRecord(
                text(env, "Python"),
                text(env, "Platform"),
                new Packages(
                        VersionStringCleaner.clean(text(pkg, "pytest")),
                        VersionStringCleaner.clean(text(pkg, "pluggy"))
                ),
                new Plugins(
                        VersionStringCleaner.clean(text(plg, "base-url")),
                        VersionStringCleaner.clean(text(plg, "playwright")),
                        VersionStringCleaner.clean(text(plg, "asyncio")),
                        VersionStringCleaner.clean(text(plg, "html")),
                        VersionStringCleaner.clean(text(plg, "metadata"))
                ),
                text(env, "PLATFORM"),
                text(env, "Base URL")
        );
    }

    public static EnvironmentRecord fromTable(Document doc) {
        Element table = doc == null ? null : doc.selectFirst("table#environment");
        if (table == null) return EnvironmentRecord.EMPTY;

        String python = "";
        String platform = "";
        String platformType = "";
        String baseUrl = "";
        Map<String, String> packages = named("pytest", "pluggy");
        Map<String, String> plugins = named("base-url", "playwright", "asyncio", "html", "metadata");

        for (Element row : table.select("tr")) {
            Elements cells = row.select("> td");
            if (cells.size() < 2) continue;

            String key = cells.get(0).text().trim();
            Element value = cells.get(1);

            switch (key) {
                case "Packages" -> readListItems(value, packages);
                case "Plugins" -> readListItems(value, plugins);
                case "Python" -> python = value.text().trim();
                case "Platform" -> platform = value.text().trim();
                case "PLATFORM" -> platformType = value.text().trim();
                case "Base URL" -> baseUrl = value.text().trim();
                default -> { }
            }
        }

        return new EnvironmentRecord(
                python,
                platform,
                new Packages(packages.get("pytest"), packages.get("pluggy")),
                new Plugins(
                        plugins.get("base-url"),
                        plugins.get("playwright"),
                        plugins.get("asyncio"),
                        plugins.get("html"),
                        plugins.get("metadata")
                ),
                platformType,
                baseUrl
        );
    }

    // first name (in map order) whose "name:" occurs in the item wins
    private static void readListItems(Element cell, Map<String, String> into) {
        for (Element li : cell.select("li")) {
            String text = li.text().trim();
            for (String name : into.keySet()) {
                if (text.contains(name + ":")) {
                    into.put(name, VersionStringCleaner.clean(text));
                    break;
                }
            }
        }
    }

    private static Map<String, String> named(String... names) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String n : names) out.put(n, "");
        return out;
    }

    private static String text(JsonNode node, String field) {
        if (node == null) return "";
        JsonNode v = node.get(field);
        if (v == null || v.isNull() || v.isContainerNode()) return "";
        return v.asText("");
    }
}
