package com.leumit.reportindex.run;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Best-effort rewrite of the report's embedded JSON-like blob into parseable JSON.
 * <p>
 * The rules run in the order of {@link #RULES}; later rules expect the quoting that earlier
 * ones produced. Nothing here parses JSON and nothing here throws: a rule that fails is skipped
 * and the text it was given is passed on.
 */
@Slf4j
public final class JsonBlobRepairer {

    private static final Pattern BARE_KEY = Pattern.compile("([{,]\\s*)([a-zA-Z0-9_\\-]+)\\s*:");
    private static final Pattern STRING_VALUE_SPACING = Pattern.compile(":\\s*\"([^\"]*)\"\\s*([}\\],])");

    public record RewriteRule(String name, UnaryOperator<String> rewrite) {

        public String apply(String text) {
            return rewrite.apply(text);
        }
    }

    public static final RewriteRule TRIM_SURROUNDING_QUOTES =
            new RewriteRule("trim-surrounding-quotes", JsonBlobRepairer::trimSurroundingQuotes);

    public static final RewriteRule UNESCAPE =
            new RewriteRule("unescape", s -> s.replace("\\\"", "\"")
                    .replace("\\n", " ")
                    .replace("\\t", " "));

    public static final RewriteRule QUOTE_BARE_KEYS =
            new RewriteRule("quote-bare-keys", s -> BARE_KEY.matcher(s).replaceAll("$1\"$2\":"));

    public static final RewriteRule TIGHTEN_STRING_VALUES =
            new RewriteRule("tighten-string-values", s -> STRING_VALUE_SPACING.matcher(s).replaceAll(":\"$1\"$2"));

    public static final RewriteRule SINGLE_TO_DOUBLE_QUOTES =
            new RewriteRule("single-to-double-quotes", s -> s.replace('\'', '"'));

    public static final List<RewriteRule> RULES = List.of(
            TRIM_SURROUNDING_QUOTES,
            UNESCAPE,
            QUOTE_BARE_KEYS,
            TIGHTEN_STRING_VALUES,
            SINGLE_TO_DOUBLE_QUOTES
    );

    private JsonBlobRepairer() {}

    public static String repair(String blob) {
        return repair(blob, RULES);
    }

    public static String repair(String blob, List<RewriteRule> rules) {
        if (blob == null) return "";

        String text = blob;
        for (RewriteRule rule : rules) {
            try {
                text = rule.apply(text);
            } catch (RuntimeException e) {
                log.debug("Repair rule {} skipped: {}", rule.name(), e.getMessage());
            }
        }
        return text;
    }

    private static String trimSurroundingQuotes(String s) {
        String t = s.trim();
        if (t.length() >= 2) {
            char first = t.charAt(0);
            char last = t.charAt(t.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return t.substring(1, t.length() - 1);
            }
        }
        return t;
    }
}
