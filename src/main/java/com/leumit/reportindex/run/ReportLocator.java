package com.leumit.reportindex.run;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

public final class ReportLocator {

    private ReportLocator() {}

    public static Optional<Path> findReportHtml(Path path) {
        if (path == null) return Optional.empty();
        if (Files.isRegularFile(path)) {
            return isHtmlFile(path) ? Optional.of(path) : Optional.empty();
        }
        if (!Files.isDirectory(path)) return Optional.empty();

        try (Stream<Path> s = Files.list(path)) {
            return s.filter(Files::isRegularFile)
                    .filter(ReportLocator::isHtmlFile)
                    .max(Comparator.comparingLong(ReportLocator::safeSize));
        } catch (IOException e) {
            return Optional.empty();
        }
    }

    public static Path requireReportHtml(Path path) {
        return findReportHtml(path)
                .orElseThrow(() -> new IllegalArgumentException("Missing HTML report in: " + path));
    }

    private static boolean isHtmlFile(Path p) {
        String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".html") || name.endsWith(".htm");
    }

    private static long safeSize(Path p) {
        try {
            return Files.size(p);
        } catch (IOException e) {
            return -1L;
        }
    }
}
