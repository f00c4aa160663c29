package org.iceforge.terra.gateway.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;

import java.sql.ResultSetMetaData;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link QueryEngine} over a pooled JDBC {@code DataSource}.
 */
public class JdbcQueryEngine implements QueryEngine {

    private static final Logger log = LoggerFactory.getLogger(JdbcQueryEngine.class);

    static final int MAX_LOGGED_SQL = 200;

    private static final ResultSetExtractor<List<Map<String, Object>>> ROWS = rs -> {
        ResultSetMetaData md = rs.getMetaData();
        int n = md.getColumnCount();
        String[] labels = new String[n];
        for (int i = 0; i < n; i++) {
            labels[i] = md.getColumnLabel(i + 1);
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>(n * 2);
            for (int i = 0; i < n; i++) {
                row.put(labels[i], toJsonValue(rs.getObject(i + 1)));
            }
            rows.add(row);
        }
        return rows;
    };

    private final JdbcTemplate jdbc;

    public JdbcQueryEngine(JdbcTemplate jdbc) {
        this.jdbc = Objects.requireNonNull(jdbc);
    }

    @Override
    public List<Map<String, Object>> execute(String sql, List<Object> params) {
        long start = System.nanoTime();
        try {
            List<Map<String, Object>> rows = jdbc.query(sql, ROWS, params.toArray());
            if (log.isDebugEnabled()) {
                log.debug("Query returned {} rows in {} ms", rows == null ? 0 : rows.size(), (System.nanoTime() - start) / 1_000_000);
            }
            return rows == null ? List.of() : rows;
        } catch (DataAccessException e) {
            log.error("Query failed ({} params): {} | {}", params.size(), truncate(sql), e.getMostSpecificCause().getMessage());
            throw e;
        }
    }

    static String truncate(String sql) {
        return sql.length() <= MAX_LOGGED_SQL ? sql : sql.substring(0, MAX_LOGGED_SQL) + "...";
    }

    private static Object toJsonValue(Object v) {
        if (v instanceof java.sql.Date d) {
            return d.toLocalDate().toString();
        }
        if (v instanceof Timestamp ts) {
            return ts.toLocalDateTime().toString();
        }
        return v;
    }
}
