package com.leumit.reportindex.web;

import com.leumit.reportindex.config.ReportIndexerProperties;
import com.leumit.reportindex.index.IndexStoreException;
import com.leumit.reportindex.model.IndexDocument;
import com.leumit.reportindex.repo.ReportIndexService;
import com.leumit.reportindex.run.ReportParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
public class ReportIndexController {

    private final ReportIndexService service;
    private final ReportIndexerProperties props;

    public ReportIndexController(ReportIndexService service, ReportIndexerProperties props) {
        this.service = service;
        this.props = props;
    }

    @PostMapping(value = "/reports/preview", consumes = {MediaType.TEXT_HTML_VALUE, MediaType.TEXT_PLAIN_VALUE})
    public List<IndexDocument> preview(
            @RequestBody String html,
            @RequestParam(defaultValue = "upload") String source
    ) {
        return service.preview(html, source);
    }

    @PostMapping("/reports/index")
    public ReportIndexService.IndexRun index(@RequestParam String path) throws IOException {
        return service.index(resolveUnderBaseDir(path));
    }

    @GetMapping("/index-documents")
    public List<IndexDocument> documents(@RequestParam(required = false) String testId) {
        return service.findDocuments(testId);
    }

    @ExceptionHandler(ReportParseException.class)
    public ResponseEntity<Map<String, String>> onParseFailure(ReportParseException e) {
        log.warn("Report rejected: {}", e.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> onBadRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(IndexStoreException.class)
    public ResponseEntity<Map<String, String>> onStoreFailure(IndexStoreException e) {
        log.warn("Index store failure: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    private Path resolveUnderBaseDir(String relative) {
        String baseDir = props.getSource().getBaseDir();
        if (baseDir == null || baseDir.isBlank()) {
            throw new IllegalArgumentException("indexer.source.base-dir is not configured");
        }

        Path base = Path.of(baseDir).normalize().toAbsolutePath();
        Path target = base.resolve(relative).normalize().toAbsolutePath();

        if (!target.startsWith(base)) throw new IllegalArgumentException("Invalid report path");
        if (!Files.exists(target)) throw new IllegalArgumentException("Report not found: " + relative);

        return target;
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .body(Map.of("error", message == null ? status.getReasonPhrase() : message));
    }
}
