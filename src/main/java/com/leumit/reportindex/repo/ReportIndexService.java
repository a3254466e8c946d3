package com.leumit.reportindex.repo;

import com.leumit.reportindex.index.IndexDocumentBuilder;
import com.leumit.reportindex.index.IndexDocumentStore;
import com.leumit.reportindex.model.EnvironmentSource;
import com.leumit.reportindex.model.IndexDocument;
import com.leumit.reportindex.model.ReportDocument;
import com.leumit.reportindex.run.ReportLocator;
import com.leumit.reportindex.run.ReportParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs one report through parse, build and upload. A report either lands in the store as a
 * complete batch or not at all.
 */
@Service
@Slf4j
public class ReportIndexService {

  private final ReportParser parser;
  private final IndexDocumentBuilder builder;
  private final IndexDocumentStore store;

  public ReportIndexService(ReportParser parser, IndexDocumentBuilder builder, IndexDocumentStore store) {
    this.parser = parser;
    this.builder = builder;
    this.store = store;
  }

  public IndexRun index(Path reportOrRunDir) throws IOException {
    Path reportHtml = ReportLocator.requireReportHtml(reportOrRunDir);
    String html = Files.readString(reportHtml, StandardCharsets.UTF_8);
    return indexHtml(html, reportHtml.toString());
  }

  public IndexRun indexHtml(String html, String source) {
    long startNs = System.nanoTime();
    ReportDocument report = parser.parse(html, source);
    List<IndexDocument> documents = builder.build(report);
    long parseMs = (System.nanoTime() - startNs) / 1_000_000;

    int stored = store.upload(documents);
    long totalMs = (System.nanoTime() - startNs) / 1_000_000;

    log.info("ReportIndexService.index source={} title={} environment={} documents={} stored={} index={} parseMs={} totalMs={}",
            source, report.title(), report.environmentSource(), documents.size(), stored, store.getIndexName(),
            parseMs, totalMs);
    return new IndexRun(source, report.environmentSource(), documents.size(), stored, parseMs, totalMs);
  }

  public List<IndexDocument> preview(String html, String source) {
    return builder.build(parser.parse(html, source));
  }

  public List<IndexDocument> findDocuments(String testId) {
    if (testId == null || testId.isBlank()) {
      return store.findAll();
    }
    return store.findByTestId(testId.trim());
  }

  public record IndexRun(String source, EnvironmentSource environmentSource, int documents, int stored, long parseMs, long totalMs) {}
}
