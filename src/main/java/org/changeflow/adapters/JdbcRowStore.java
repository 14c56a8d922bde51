package org.changeflow.adapters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Row tables of shape {@code (row_id identity primary key, data json)}. PostgreSQL stores {@code data} as
 * JSONB, other databases as a character large object.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcRowStore implements RowStore {

    private static final TypeReference<LinkedHashMap<String, Object>> ROW_TYPE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    private volatile Boolean postgres;

    @Override
    public boolean tableExists(TableRef table) {
        Boolean exists = jdbcTemplate.execute((ConnectionCallback<Boolean>) connection -> {
            DatabaseMetaData metaData = connection.getMetaData();
            for (String schema : candidates(table.schema())) {
                for (String name : candidates(table.table())) {
                    try (ResultSet resultSet = metaData.getTables(connection.getCatalog(), schema, name, null)) {
                        if (resultSet.next()) {
                            return true;
                        }
                    }
                }
            }
            return false;
        });
        return Boolean.TRUE.equals(exists);
    }

    @Override
    public void createTableIfMissing(TableRef table) {
        if (tableExists(table)) {
            return;
        }
        if (table.schema() != null) {
            jdbcTemplate.execute("CREATE SCHEMA IF NOT EXISTS " + table.schema());
        }
        String dataType = isPostgres() ? "JSONB" : "CLOB";
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + table.qualified()
                + " (row_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, data " + dataType + " NOT NULL)");
        log.info("Created row table {}", table.qualified());
    }

    @Override
    public int appendRows(TableRef table, List<Map<String, Object>> rows) {
        if (rows == null || rows.isEmpty()) {
            return 0;
        }
        List<String> payloads = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            payloads.add(toJson(row));
        }
        String placeholder = isPostgres() ? "CAST(? AS JSONB)" : "?";
        String sql = "INSERT INTO " + table.qualified() + " (data) VALUES (" + placeholder + ")";
        jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
            @Override
            public void setValues(PreparedStatement ps, int i) throws SQLException {
                ps.setString(1, payloads.get(i));
            }

            @Override
            public int getBatchSize() {
                return payloads.size();
            }
        });
        log.debug("Appended {} rows to {}", payloads.size(), table.qualified());
        return payloads.size();
    }

    @Override
    public long appendFrom(TableRef source, TableRef target) {
        int copied = jdbcTemplate.update("INSERT INTO " + target.qualified() + " (data) SELECT data FROM "
                + source.qualified() + " ORDER BY row_id");
        log.debug("Copied {} rows from {} to {}", copied, source.qualified(), target.qualified());
        return copied;
    }

    @Override
    public long clearRows(TableRef table) {
        if (!tableExists(table)) {
            return 0L;
        }
        int deleted = jdbcTemplate.update("DELETE FROM " + table.qualified());
        log.debug("Deleted {} rows from {}", deleted, table.qualified());
        return deleted;
    }

    @Override
    public long countRows(TableRef table) {
        if (!tableExists(table)) {
            return 0L;
        }
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table.qualified(), Long.class);
        return count == null ? 0L : count;
    }

    @Override
    public List<Map<String, Object>> sampleRows(TableRef table, int limit) {
        if (limit <= 0 || !tableExists(table)) {
            return List.of();
        }
        List<String> payloads = jdbcTemplate.queryForList(
                "SELECT data FROM " + table.qualified() + " ORDER BY row_id FETCH FIRST " + limit + " ROWS ONLY",
                String.class);
        return fromJson(payloads);
    }

    @Override
    public List<Map<String, Object>> readRows(TableRef table) {
        if (!tableExists(table)) {
            return List.of();
        }
        return fromJson(jdbcTemplate.queryForList("SELECT data FROM " + table.qualified() + " ORDER BY row_id", String.class));
    }

    @Override
    public void dropTable(TableRef table) {
        jdbcTemplate.execute("DROP TABLE IF EXISTS " + table.qualified());
        log.info("Dropped row table {}", table.qualified());
    }

    private boolean isPostgres() {
        Boolean cached = postgres;
        if (cached == null) {
            cached = jdbcTemplate.execute((ConnectionCallback<Boolean>) connection ->
                    connection.getMetaData().getDatabaseProductName().toLowerCase(Locale.ROOT).contains("postgresql"));
            postgres = Boolean.TRUE.equals(cached);
        }
        return Boolean.TRUE.equals(cached);
    }

    private Set<String> candidates(String identifier) {
        Set<String> names = new LinkedHashSet<>();
        if (identifier == null) {
            names.add(null);
            return names;
        }
        names.add(identifier);
        names.add(identifier.toUpperCase(Locale.ROOT));
        names.add(identifier.toLowerCase(Locale.ROOT));
        return names;
    }

    private String toJson(Map<String, Object> row) {
        try {
            return objectMapper.writeValueAsString(row == null ? Map.of() : row);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Row is not serializable to JSON: " + e.getOriginalMessage(), e);
        }
    }

    private List<Map<String, Object>> fromJson(List<String> payloads) {
        List<Map<String, Object>> rows = new ArrayList<>(payloads.size());
        for (String payload : payloads) {
            try {
                rows.add(objectMapper.readValue(payload, ROW_TYPE));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Stored row is not valid JSON: " + e.getOriginalMessage(), e);
            }
        }
        return rows;
    }
}
