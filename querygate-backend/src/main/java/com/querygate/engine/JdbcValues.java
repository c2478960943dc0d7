package com.querygate.engine;

import com.querygate.model.ColumnDefinition;
import com.querygate.model.TabularResult;
import lombok.extern.slf4j.Slf4j;

import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads JDBC result sets into JSON-safe rows.
 *
 * <p>Engine drivers return bracketed column labels ({@code [Name]}, {@code Table[Column]});
 * the brackets around a whole label are stripped so rows read the same on both paths.
 */
@Slf4j
public final class JdbcValues {
    private static final int MAX_LOB_CHARS = 100_000;
    private static final int MAX_BLOB_BYTES = 100_000;
    private static final int MAX_STRING_CHARS = 100_000;
    private static final String READ_ERROR = "<read_error>";

    private JdbcValues() {
    }

    /**
     * Materialize at most {@code limit} rows; {@code truncated} is set when another row exists.
     */
    public static TabularResult readTable(ResultSet rs, int limit) throws SQLException {
        ResultSetMetaData rsmd = rs.getMetaData();
        int columnCount = rsmd.getColumnCount();

        TabularResult.TabularResultBuilder out = TabularResult.builder();
        List<String> labels = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            String label = normalizeLabel(rsmd.getColumnLabel(i));
            labels.add(label);
            out.column(new ColumnDefinition(label, rsmd.getColumnTypeName(i)));
        }

        int count = 0;
        boolean truncated = false;
        while (rs.next()) {
            if (limit > 0 && count >= limit) {
                truncated = true;
                break;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(labels.get(i - 1), readValue(rs, i));
            }
            out.row(row);
            count++;
        }
        return out.truncated(truncated).build();
    }

    static String normalizeLabel(String label) {
        if (label != null && label.length() > 2 && label.startsWith("[") && label.endsWith("]")) {
            return label.substring(1, label.length() - 1);
        }
        return label;
    }

    private static Object readValue(ResultSet rs, int columnIndex) {
        try {
            return toJsonSafe(rs.getObject(columnIndex));
        } catch (SQLException e) {
            log.warn("Error reading column {}: {}", columnIndex, e.getMessage());
            return READ_ERROR;
        }
    }

    public static Object toJsonSafe(Object v) throws SQLException {
        if (v == null) {
            return null;
        }
        if (v instanceof Number || v instanceof Boolean) {
            return v;
        }
        if (v instanceof String s) {
            return truncate(s);
        }
        if (v instanceof Clob clob) {
            long length = clob.length();
            return length <= 0 ? "" : clob.getSubString(1, (int) Math.min(length, MAX_LOB_CHARS));
        }
        if (v instanceof Blob blob) {
            long length = blob.length();
            return length <= 0 ? "" : Base64.getEncoder().encodeToString(blob.getBytes(1, (int) Math.min(length, MAX_BLOB_BYTES)));
        }
        if (v instanceof SQLXML xml) {
            return truncate(xml.getString());
        }
        if (v instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (v instanceof java.util.Date || v instanceof TemporalAccessor || v instanceof java.util.UUID) {
            return v.toString();
        }
        if (v instanceof java.sql.Array arr) {
            Object arrayValue = arr.getArray();
            if (arrayValue instanceof Object[] objects) {
                List<Object> values = new ArrayList<>(objects.length);
                for (Object element : objects) {
                    values.add(toJsonSafe(element));
                }
                return values;
            }
            return truncate(String.valueOf(arrayValue));
        }
        return truncate(String.valueOf(v));
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= MAX_STRING_CHARS) {
            return s;
        }
        return s.substring(0, MAX_STRING_CHARS);
    }
}
