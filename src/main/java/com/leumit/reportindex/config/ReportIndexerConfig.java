package com.leumit.reportindex.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leumit.reportindex.index.IndexDocumentBuilder;
import com.leumit.reportindex.index.IndexDocumentStore;
import com.leumit.reportindex.model.ProcessingMetadata;
import com.leumit.reportindex.run.ReportParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

@Slf4j
@Configuration
@EnableConfigurationProperties(ReportIndexerProperties.class)
public class ReportIndexerConfig {

  @Bean
  public ProcessingMetadata processingMetadata(ReportIndexerProperties props) {
    ReportIndexerProperties.Metadata m = props.getMetadata();
    String at = m.getProcessedAt();
    ProcessingMetadata metadata = (at == null || at.isBlank())
            ? new ProcessingMetadata(m.getProcessorVersion(), m.getProcessedBy(),
                    LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS))
            : ProcessingMetadata.of(m.getProcessorVersion(), m.getProcessedBy(), at);
    log.info("Report indexer v{} processedBy={} processedAt={}",
            metadata.processorVersion(), metadata.processedBy(),
            metadata.processedAt().format(ProcessingMetadata.PROCESSED_AT_FMT));
    return metadata;
  }

  @Bean
  public ReportParser reportParser(ProcessingMetadata metadata) {
    return new ReportParser(metadata);
  }

  @Bean
  public IndexDocumentBuilder indexDocumentBuilder() {
    return new IndexDocumentBuilder();
  }

  @Bean(initMethod = "init")
  public IndexDocumentStore indexDocumentStore(ObjectMapper objectMapper, ReportIndexerProperties props) {
    return new IndexDocumentStore(objectMapper, props.getStore().getDbPath(), props.getStore().getIndexName());
  }
}
