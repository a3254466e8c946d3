package com.leumit.reportindex.run;

import java.util.regex.Pattern;

/**
 * Normalizes free-text version tokens such as {@code "marker\npytest: 8.3.3"} to {@code "8.3.3"}.
 * <p>
 * Rules, in order: drop every {@code marker\n} artifact and every quote character, keep only
 * the text after the first colon, trim. A colon that opens {@code //} belongs to a URL and is
 * kept. The rules are re-applied until the value stops changing, so
 * {@code clean(clean(x)).equals(clean(x))} holds for every input.
 */
public final class VersionStringCleaner {

    // literal backslash-n as written by the reporter, and a real line break
    private static final Pattern NOISE = Pattern.compile("marker\\\\n|marker\\n|[\"']");

    private VersionStringCleaner() {}

    public static String clean(String token) {
        if (token == null || token.isEmpty()) return "";

        String current = token;
        while (true) {
            String next = cleanOnce(current);
            if (next.equals(current)) return next;
            current = next;
        }
    }

    static String cleanOnce(String token) {
        String s = NOISE.matcher(token).replaceAll("");
        int colon = s.indexOf(':');
        if (colon >= 0 && !s.startsWith("//", colon + 1)) {
            s = s.substring(colon + 1);
        }
        return s.trim();
    }
}
