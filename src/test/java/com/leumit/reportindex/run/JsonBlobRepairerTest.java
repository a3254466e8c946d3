package com.leumit.reportindex.run;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonBlobRepairerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void bareKeysAndSingleQuotesBecomeJson() throws Exception {
        String repaired = JsonBlobRepairer.repair("{pytest:\"8.3.3\", pluggy:'1.5.0'}");

        JsonNode node = MAPPER.readTree(repaired);
        assertEquals("8.3.3", node.get("pytest").asText());
        assertEquals("1.5.0", node.get("pluggy").asText());
    }

    @Test
    void wrappedAndEscapedBlob() throws Exception {
        String repaired = JsonBlobRepairer.repair("  \"{\\\"environment\\\":{\\\"Python\\\":\\\"3.11.9\\\",\\n\\t\\\"Platform\\\":\\\"Linux\\\"}}\"  ");

        JsonNode env = MAPPER.readTree(repaired).get("environment");
        assertEquals("3.11.9", env.get("Python").asText());
        assertEquals("Linux", env.get("Platform").asText());
    }

    @Test
    void trimSurroundingQuotesRemovesOnePairOnly() {
        assertEquals("\"x\"", JsonBlobRepairer.TRIM_SURROUNDING_QUOTES.apply(" \"\"x\"\" "));
        assertEquals("{a:1}", JsonBlobRepairer.TRIM_SURROUNDING_QUOTES.apply("'{a:1}'"));
        assertEquals("\"{a:1}", JsonBlobRepairer.TRIM_SURROUNDING_QUOTES.apply("\"{a:1}"));
    }

    @Test
    void unescapeCollapsesFormattingToSpaces() {
        assertEquals("{\"a\":1, \"b\":2}", JsonBlobRepairer.UNESCAPE.apply("{\\\"a\\\":1,\\n\\\"b\\\":2}"));
        assertEquals("a b", JsonBlobRepairer.UNESCAPE.apply("a\\nb"));
        assertEquals("a b", JsonBlobRepairer.UNESCAPE.apply("a\\tb"));
    }

    @Test
    void quoteBareKeysOnlyAfterBraceOrComma() {
        assertEquals("{\"base-url\":'2.1.0', \"html\":'4.1.1'}",
                JsonBlobRepairer.QUOTE_BARE_KEYS.apply("{base-url :'2.1.0', html:'4.1.1'}"));
        assertEquals("{\"already\":\"quoted\"}",
                JsonBlobRepairer.QUOTE_BARE_KEYS.apply("{\"already\":\"quoted\"}"));
        assertEquals("{\"k\":'pytest: 8.3.3'}",
                JsonBlobRepairer.QUOTE_BARE_KEYS.apply("{k:'pytest: 8.3.3'}"));
    }

    @Test
    void tightenStringValuesAroundDelimiters() {
        assertEquals("{\"a\":\"x\",\"b\":\"y\"}",
                JsonBlobRepairer.TIGHTEN_STRING_VALUES.apply("{\"a\":  \"x\" ,\"b\": \"y\"  }"));
    }

    @Test
    void singleQuotesBecomeDouble() {
        assertEquals("{\"a\":\"b\"}", JsonBlobRepairer.SINGLE_TO_DOUBLE_QUOTES.apply("{'a':'b'}"));
    }

    @Test
    void rulesRunInDeclaredOrder() {
        List<String> names = JsonBlobRepairer.RULES.stream().map(JsonBlobRepairer.RewriteRule::name).toList();
        assertEquals(List.of(
                "trim-surrounding-quotes",
                "unescape",
                "quote-bare-keys",
                "tighten-string-values",
                "single-to-double-quotes"
        ), names);
    }

    @Test
    void failingRuleIsSkipped() {
        JsonBlobRepairer.RewriteRule boom = new JsonBlobRepairer.RewriteRule("boom", s -> {
            throw new IllegalStateException("boom");
        });

        String out = JsonBlobRepairer.repair("{a:'1'}", List.of(boom, JsonBlobRepairer.QUOTE_BARE_KEYS));
        assertEquals("{\"a\":'1'}", out);
    }

    @Test
    void nullBlobGivesEmptyText() {
        assertEquals("", JsonBlobRepairer.repair(null));
    }

    @Test
    void hopelessInputStillComesBackAsText() {
        String out = JsonBlobRepairer.repair("{environment: {Python: 3.11.9 (main), Packages: ");
        assertNotNull(out);
        assertThrows(Exception.class, () -> MAPPER.readTree(out));
    }
}
