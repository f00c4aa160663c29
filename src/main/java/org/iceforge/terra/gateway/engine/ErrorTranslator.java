package org.iceforge.terra.gateway.engine;

import org.iceforge.terra.gateway.entity.SimilarityScorer;
import org.iceforge.terra.gateway.model.DatasetDescriptor;
import org.iceforge.terra.gateway.resilience.CircuitOpenException;
import org.springframework.dao.DataAccessException;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns engine and infrastructure failures into {@link QueryException}s a caller can act on.
 * Statement text never ends up in the result.
 */
public class ErrorTranslator {

    // DuckDB: Referenced column "x" not found in FROM clause!  H2: Column "x" not found
    private static final Pattern MISSING_COLUMN =
            Pattern.compile("(?i)(?:referenced\\s+)?column\\s+(?:with\\s+name\\s+)?\"([^\"]+)\"\\s+not\\s+found");
    private static final Pattern CANDIDATES = Pattern.compile("(?i)candidate\\s+bindings:\\s*([^\\n]+)");
    private static final Pattern QUOTED = Pattern.compile("\"([^\"]+)\"");
    // DuckDB: Table with name x does not exist!  H2: Table "x" not found
    private static final Pattern MISSING_TABLE =
            Pattern.compile("(?i)table\\s+(?:with\\s+name\\s+)?\"?([A-Za-z0-9_.-]+)\"?\\s+(?:does\\s+not\\s+exist|not\\s+found)");
    private static final Pattern SQL_TAIL = Pattern.compile("(?is)(;\\s*SQL statement:.*|\\n.*)$");

    static final int MAX_SUGGESTIONS = 5;
    static final double COLUMN_SUGGESTION_MIN_SCORE = 0.6;

    private final SimilarityScorer scorer;

    public ErrorTranslator(SimilarityScorer scorer) {
        this.scorer = Objects.requireNonNull(scorer);
    }

    /**
     * @param descriptor dataset the failing call targeted, or {@code null}
     */
    public QueryException translate(Throwable error, DatasetDescriptor descriptor) {
        Throwable t = error;
        if (t instanceof QueryException qe) {
            return qe;
        }
        if (t instanceof TimeoutException) {
            return QueryException.builder(ErrorCode.TIMEOUT, "Query did not finish within the execution timeout")
                    .hint("Narrow the filters, lower the limit, or aggregate before retrying")
                    .cause(t)
                    .build();
        }
        if (t instanceof CircuitOpenException open) {
            return QueryException.builder(ErrorCode.UNAVAILABLE, open.getMessage())
                    .retryAfterSeconds(open.retryAfterSeconds())
                    .hint("The data engine is failing repeatedly; retry after the given delay")
                    .cause(t)
                    .build();
        }
        if (t instanceof DataAccessException || t instanceof SQLException) {
            return translateEngineError(t, descriptor);
        }
        return QueryException.builder(ErrorCode.EXECUTION_ERROR, "Unexpected error during query execution")
                .cause(t)
                .build();
    }

    private QueryException translateEngineError(Throwable t, DatasetDescriptor descriptor) {
        String message = rootMessage(t);
        String fileId = descriptor == null ? null : descriptor.getFileId();

        Matcher column = MISSING_COLUMN.matcher(message);
        if (column.find()) {
            String missing = column.group(1);
            List<String> suggestions = candidateBindings(message);
            if (suggestions.isEmpty() && descriptor != null) {
                suggestions = rankColumns(missing, descriptor.columnNames());
            }
            QueryException.Builder b = QueryException.builder(ErrorCode.NOT_FOUND, "Column '" + missing + "' not found")
                    .context("column", missing)
                    .context("file_id", fileId)
                    .suggestions(suggestions)
                    .cause(t);
            if (!suggestions.isEmpty()) {
                b.hint("Did you mean: " + String.join(", ", suggestions) + "?");
            } else if (fileId != null) {
                b.hint("Use /get_schema/" + fileId + " to list available columns");
            }
            return b.build();
        }

        Matcher table = MISSING_TABLE.matcher(message);
        if (table.find()) {
            return QueryException.builder(ErrorCode.NOT_FOUND, "Table '" + table.group(1) + "' not found")
                    .hint("The manifest entry points at a table that does not exist in the store; use /list_files")
                    .context("file_id", fileId)
                    .cause(t)
                    .build();
        }

        return QueryException.builder(ErrorCode.EXECUTION_ERROR, "Query execution failed: " + sanitize(message))
                .context("file_id", fileId)
                .cause(t)
                .build();
    }

    private static List<String> candidateBindings(String message) {
        List<String> out = new ArrayList<>();
        Matcher m = CANDIDATES.matcher(message);
        if (!m.find()) {
            return out;
        }
        Matcher q = QUOTED.matcher(m.group(1));
        while (q.find() && out.size() < MAX_SUGGESTIONS) {
            String name = q.group(1);
            int dot = name.lastIndexOf('.');
            String bare = dot >= 0 ? name.substring(dot + 1) : name;
            if (!out.contains(bare)) {
                out.add(bare);
            }
        }
        return out;
    }

    List<String> rankColumns(String missing, List<String> columns) {
        return columns.stream()
                .map(c -> Map.entry(c, scorer.score(missing, c)))
                .filter(e -> e.getValue() >= COLUMN_SUGGESTION_MIN_SCORE)
                .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry::getKey))
                .limit(MAX_SUGGESTIONS)
                .map(Map.Entry::getKey)
                .toList();
    }

    private static String rootMessage(Throwable t) {
        Throwable root = t;
        if (t instanceof DataAccessException dae) {
            root = dae.getMostSpecificCause();
        }
        String msg = root.getMessage();
        return msg == null ? root.getClass().getSimpleName() : msg;
    }

    static String sanitize(String message) {
        return SQL_TAIL.matcher(message).replaceFirst("").trim();
    }
}
