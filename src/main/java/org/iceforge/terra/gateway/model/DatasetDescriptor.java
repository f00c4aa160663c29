package org.iceforge.terra.gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One queryable dataset as declared in the manifest.
 */
public class DatasetDescriptor {

    /**
     * {@code <sector>-<level>-<grain>}; the sector itself may contain hyphens.
     */
    public static final Pattern FILE_ID = Pattern.compile("^([a-z0-9]+(?:-[a-z0-9]+)*)-(country|admin1|city)-(year|month)$");

    private static final String DUCKDB_SCHEME = "duckdb://";

    private String fileId;
    private String engine;

    /**
     * Storage locator, e.g. {@code duckdb://data/warehouse.duckdb#transport_country_year}.
     */
    private String path;

    /**
     * Explicit table name; wins over the fragment in {@link #path}.
     */
    private String table;

    private List<ColumnDef> columns = List.of();
    private DatasetSemantics semantics = new DatasetSemantics();

    public String getFileId() {
        return fileId;
    }

    public void setFileId(String fileId) {
        this.fileId = fileId;
    }

    public String getEngine() {
        return engine;
    }

    public void setEngine(String engine) {
        this.engine = engine;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getTable() {
        return table;
    }

    public void setTable(String table) {
        this.table = table;
    }

    public List<ColumnDef> getColumns() {
        return columns;
    }

    public void setColumns(List<ColumnDef> columns) {
        this.columns = columns == null ? List.of() : columns;
    }

    public DatasetSemantics getSemantics() {
        return semantics;
    }

    public void setSemantics(DatasetSemantics semantics) {
        this.semantics = semantics == null ? new DatasetSemantics() : semantics;
    }

    /**
     * Physical table the dataset lives in, or {@code null} if the descriptor names none.
     */
    public String tableName() {
        if (table != null && !table.isBlank()) {
            return table;
        }
        if (path != null) {
            int hash = path.indexOf('#');
            if (hash >= 0 && hash < path.length() - 1) {
                return path.substring(hash + 1);
            }
        }
        return null;
    }

    /**
     * True for descriptors backed by the columnar store, either by engine name or locator scheme.
     */
    @JsonIgnore
    public boolean isColumnar() {
        return "duckdb".equalsIgnoreCase(engine) || (path != null && path.startsWith(DUCKDB_SCHEME)) || table != null;
    }

    public List<String> columnNames() {
        return columns.stream().map(ColumnDef::getName).toList();
    }

    public boolean hasColumn(String name) {
        return columns.stream().anyMatch(c -> c.getName().equals(name));
    }

    public boolean hasValidFileId() {
        return fileId != null && FILE_ID.matcher(fileId).matches();
    }

    public String sector() {
        return part(1);
    }

    public String level() {
        return part(2);
    }

    public String grain() {
        return part(3);
    }

    private String part(int group) {
        if (fileId == null) {
            return null;
        }
        Matcher m = FILE_ID.matcher(fileId);
        return m.matches() ? m.group(group) : null;
    }
}
