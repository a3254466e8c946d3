package com.leumit.reportindex.index;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leumit.reportindex.model.IndexDocument;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SQLite-backed document index. Documents are keyed by {@code id}; an upload inserts new ids
 * and replaces existing ones. A batch is written in a single transaction.
 */
@Slf4j
public class IndexDocumentStore {

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS index_documents (
                id TEXT PRIMARY KEY,
                index_name TEXT NOT NULL,
                test_id TEXT NOT NULL,
                result TEXT NOT NULL,
                title TEXT NOT NULL,
                processed_at TEXT NOT NULL,
                document_json TEXT NOT NULL,
                stored_at INTEGER NOT NULL
            )
            """;

    private static final String UPSERT_SQL = """
            INSERT INTO index_documents (id, index_name, test_id, result, title, processed_at, document_json, stored_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET
              index_name = excluded.index_name,
              test_id = excluded.test_id,
              result = excluded.result,
              title = excluded.title,
              processed_at = excluded.processed_at,
              document_json = excluded.document_json,
              stored_at = excluded.stored_at
            """;

    private static final String SELECT_ALL_SQL =
            "SELECT document_json FROM index_documents WHERE index_name = ? ORDER BY stored_at, rowid";
    private static final String SELECT_BY_TEST_SQL =
            "SELECT document_json FROM index_documents WHERE index_name = ? AND test_id = ? ORDER BY stored_at, rowid";
    private static final String COUNT_SQL =
            "SELECT COUNT(*) FROM index_documents WHERE index_name = ?";

    private final ObjectMapper objectMapper;
    private final Path dbPath;
    private final String indexName;
    private final ReentrantLock lock = new ReentrantLock();

    public IndexDocumentStore(ObjectMapper objectMapper, String dbPath, String indexName) {
        this.objectMapper = objectMapper;
        this.dbPath = Paths.get(dbPath).toAbsolutePath().normalize();
        this.indexName = indexName;
    }

    public void init() {
        try {
            Path parent = dbPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Connection conn = openConnection();
                 Statement st = conn.createStatement()) {
                st.executeUpdate(CREATE_TABLE_SQL);
            }
            log.info("Index store ready: db={} index={}", dbPath, indexName);
        } catch (Exception e) {
            log.warn("Index store init failed: {}", e.getMessage(), e);
        }
    }

    public int upload(List<IndexDocument> documents) {
        if (documents == null || documents.isEmpty()) return 0;

        lock.lock();
        try (Connection conn = openConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {
                long now = System.currentTimeMillis();
                for (IndexDocument doc : documents) {
                    ps.setString(1, doc.id());
                    ps.setString(2, indexName);
                    ps.setString(3, doc.testId());
                    ps.setString(4, doc.result());
                    ps.setString(5, doc.title());
                    ps.setString(6, doc.processedAt());
                    ps.setString(7, toJson(doc));
                    ps.setLong(8, now);
                    ps.addBatch();
                }
                ps.executeBatch();
                conn.commit();
            } catch (SQLException | JsonProcessingException e) {
                rollback(conn, e);
                throw e;
            }
            return documents.size();
        } catch (SQLException | JsonProcessingException e) {
            throw new IndexStoreException("Upload of " + documents.size() + " documents failed: " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    public List<IndexDocument> findAll() {
        return query(SELECT_ALL_SQL, null);
    }

    public List<IndexDocument> findByTestId(String testId) {
        return query(SELECT_BY_TEST_SQL, testId);
    }

    public long count() {
        lock.lock();
        try (Connection conn = openConnection();
             PreparedStatement ps = conn.prepareStatement(COUNT_SQL)) {
            ps.setString(1, indexName);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new IndexStoreException("Count failed: " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    public String getIndexName() {
        return indexName;
    }

    private List<IndexDocument> query(String sql, String testId) {
        lock.lock();
        try (Connection conn = openConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, indexName);
            if (testId != null) {
                ps.setString(2, testId);
            }
            List<IndexDocument> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(objectMapper.readValue(rs.getString("document_json"), IndexDocument.class));
                }
            }
            return out;
        } catch (SQLException | JsonProcessingException e) {
            throw new IndexStoreException("Read failed: " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    private static void rollback(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private String toJson(IndexDocument doc) throws JsonProcessingException {
        return objectMapper.writeValueAsString(doc);
    }

    private Connection openConnection() throws SQLException {
        String url = "jdbc:sqlite:" + dbPath;
        return DriverManager.getConnection(url);
    }
}
