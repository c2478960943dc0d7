package com.querygate.engine;

import com.querygate.model.ColumnDefinition;
import com.querygate.model.TabularResult;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Object-model reads expressed through {@link DatabaseMetaData}. Only tables, columns and
 * relationships have a JDBC counterpart; other collections are reported as unsupported.
 */
@Slf4j
public class JdbcObjectModelClient implements ObjectModelClient {
    private static final String[] TABLE_TYPES = {"TABLE", "VIEW"};

    private final DataSourceHandle dataSource;
    private final SqlFailureClassifier classifier;

    JdbcObjectModelClient(DataSourceHandle dataSource, SqlFailureClassifier classifier) {
        this.dataSource = dataSource;
        this.classifier = classifier;
    }

    @Override
    public TabularResult fetch(ObjectModelRequest request, int rowLimit) throws EngineException {
        ModelCollection collection = request.getCollection();
        if (collection != ModelCollection.TABLES && collection != ModelCollection.COLUMNS
                && collection != ModelCollection.RELATIONSHIPS) {
            throw new EngineUnsupportedException("Collection " + collection + " is not exposed by the object model");
        }
        try (Connection conn = dataSource.get().getConnection()) {
            DatabaseMetaData md = conn.getMetaData();
            RowCollector rows = new RowCollector(rowLimit);
            if (collection == ModelCollection.TABLES) {
                readTables(md, request.getTableFilter(), rows);
            } else if (collection == ModelCollection.COLUMNS) {
                readColumns(md, request.getTableFilter(), rows);
            } else {
                readRelationships(md, request.getTableFilter(), rows);
            }
            log.debug("Object model read {} returned {} rows", collection, rows.rows.size());
            return rows.toResult();
        } catch (SQLException e) {
            throw classifier.classify(e);
        }
    }

    private void readTables(DatabaseMetaData md, String tableFilter, RowCollector out) throws SQLException {
        out.columns("Name", "Schema", "Type", "Description");
        try (ResultSet rs = md.getTables(null, null, tableFilter != null ? tableFilter : "%", TABLE_TYPES)) {
            while (rs.next() && out.accepts()) {
                out.add(rs.getString("TABLE_NAME"), rs.getString("TABLE_SCHEM"),
                        rs.getString("TABLE_TYPE"), rs.getString("REMARKS"));
            }
        }
    }

    private void readColumns(DatabaseMetaData md, String tableFilter, RowCollector out) throws SQLException {
        out.columns("Table", "Name", "DataType", "Nullable", "Position");
        try (ResultSet rs = md.getColumns(null, null, tableFilter != null ? tableFilter : "%", "%")) {
            while (rs.next() && out.accepts()) {
                out.add(rs.getString("TABLE_NAME"), rs.getString("COLUMN_NAME"), rs.getString("TYPE_NAME"),
                        "YES".equalsIgnoreCase(rs.getString("IS_NULLABLE")), rs.getInt("ORDINAL_POSITION"));
            }
        }
    }

    private void readRelationships(DatabaseMetaData md, String tableFilter, RowCollector out) throws SQLException {
        out.columns("FromTable", "FromColumn", "ToTable", "ToColumn", "IsActive");
        List<String> tables = new ArrayList<>();
        if (tableFilter != null) {
            tables.add(tableFilter);
        } else {
            try (ResultSet rs = md.getTables(null, null, "%", TABLE_TYPES)) {
                while (rs.next()) {
                    tables.add(rs.getString("TABLE_NAME"));
                }
            }
        }
        for (String table : tables) {
            try (ResultSet rs = md.getImportedKeys(null, null, table)) {
                while (rs.next() && out.accepts()) {
                    out.add(rs.getString("FKTABLE_NAME"), rs.getString("FKCOLUMN_NAME"),
                            rs.getString("PKTABLE_NAME"), rs.getString("PKCOLUMN_NAME"), true);
                }
            }
            if (out.truncated) {
                return;
            }
        }
    }

    private static final class RowCollector {
        private final int limit;
        private final List<ColumnDefinition> columns = new ArrayList<>();
        private final List<Map<String, Object>> rows = new ArrayList<>();
        private boolean truncated;

        private RowCollector(int limit) {
            this.limit = limit;
        }

        private void columns(String... names) {
            for (String name : names) {
                columns.add(new ColumnDefinition(name, null));
            }
        }

        private boolean accepts() {
            if (limit > 0 && rows.size() >= limit) {
                truncated = true;
                return false;
            }
            return true;
        }

        private void add(Object... values) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < values.length; i++) {
                row.put(columns.get(i).getName(), values[i]);
            }
            rows.add(row);
        }

        private TabularResult toResult() {
            return TabularResult.builder()
                    .columns(columns)
                    .rows(rows)
                    .truncated(truncated)
                    .build();
        }
    }
}
