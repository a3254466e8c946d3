package com.leumit.reportindex;

import com.leumit.reportindex.config.ReportIndexerProperties;
import com.leumit.reportindex.repo.ReportIndexService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Slf4j
@Component
public class ReportIndexRunner implements CommandLineRunner {

    private final ReportIndexerProperties props;
    private final ReportIndexService service;

    public ReportIndexRunner(ReportIndexerProperties props, ReportIndexService service) {
        this.props = props;
        this.service = service;
    }

    @Override
    public void run(String... args) throws Exception {
        String path = props.getSource().getPath();
        if (path == null || path.isBlank()) {
            log.info("No indexer.source.path configured, skipping startup indexing");
            return;
        }

        try {
            ReportIndexService.IndexRun run = service.index(Path.of(path));
            log.info("Startup indexing done: source={} documents={}", run.source(), run.documents());
        } catch (Exception e) {
            log.error("Startup indexing failed for {}: {}", path, e.getMessage());
            throw e;
        }
    }
}
