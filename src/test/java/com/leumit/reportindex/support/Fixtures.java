package com.leumit.reportindex.support;

import com.leumit.reportindex.model.ProcessingMetadata;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

public final class Fixtures {

    public static final ProcessingMetadata METADATA =
            ProcessingMetadata.of("2.0.3", "sumi9876", "2025-07-30 21:01:11");

    private Fixtures() {}

    public static String html(String name) {
        String resource = "/reports/" + name;
        try (InputStream in = Fixtures.class.getResourceAsStream(resource)) {
            if (in == null) throw new IllegalArgumentException("Missing fixture " + resource);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Document doc(String name) {
        return Jsoup.parse(html(name));
    }
}
