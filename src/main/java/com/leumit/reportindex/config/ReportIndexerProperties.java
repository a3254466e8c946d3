package com.leumit.reportindex.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "indexer")
public class ReportIndexerProperties {

  private Metadata metadata = new Metadata();
  private Source source = new Source();
  private Store store = new Store();

  public Metadata getMetadata() { return metadata; }
  public void setMetadata(Metadata metadata) { this.metadata = metadata; }

  public Source getSource() { return source; }
  public void setSource(Source source) { this.source = source; }

  public Store getStore() { return store; }
  public void setStore(Store store) { this.store = store; }

  public static class Metadata {
    private String processorVersion = "2.0.3";
    private String processedBy = "unknown";
    // yyyy-MM-dd HH:mm:ss, blank = startup time
    private String processedAt;

    public String getProcessorVersion() { return processorVersion; }
    public void setProcessorVersion(String processorVersion) { this.processorVersion = processorVersion; }

    public String getProcessedBy() { return processedBy; }
    public void setProcessedBy(String processedBy) { this.processedBy = processedBy; }

    public String getProcessedAt() { return processedAt; }
    public void setProcessedAt(String processedAt) { this.processedAt = processedAt; }
  }

  public static class Source {
    private String baseDir;
    private String path;

    public String getBaseDir() { return baseDir; }
    public void setBaseDir(String baseDir) { this.baseDir = baseDir; }

    public String getPath() { return path; }
    public void setPath(String path) { this.path = path; }
  }

  public static class Store {
    private String dbPath = System.getProperty("user.home") + "/.report-indexer/index.sqlite";
    private String indexName = "testindex";

    public String getDbPath() { return dbPath; }
    public void setDbPath(String dbPath) { this.dbPath = dbPath; }

    public String getIndexName() { return indexName; }
    public void setIndexName(String indexName) { this.indexName = indexName; }
  }
}
