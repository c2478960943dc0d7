package com.querygate.gateway;

import com.querygate.api.OperationRequest;
import com.querygate.config.GatewayProperties;
import com.querygate.engine.DmvQueries;
import com.querygate.error.ValidationFailedException;
import com.querygate.model.OperationKind;
import com.querygate.model.QueryMode;
import com.querygate.model.QueryRequest;
import com.querygate.model.TextKind;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Named operations callers may invoke, each bound to exactly one operation kind.
 */
public class OperationCatalog {
    public static final String RUN_QUERY = "run_query";
    public static final String ANALYZE_QUERY_PERFORMANCE = "analyze_query_performance";
    public static final String PREVIEW_TABLE = "preview_table";
    public static final String LIST_TABLES = "list_tables";
    public static final String LIST_COLUMNS = "list_columns";
    public static final String LIST_MEASURES = "list_measures";
    public static final String LIST_RELATIONSHIPS = "list_relationships";
    public static final String DESCRIBE_TABLE = "describe_table";
    public static final String EXPORT_SCHEMA = "export_schema";
    public static final String CONNECT = "connect";

    static final String TABLE = "table";

    private final GatewayProperties.ExecutionConfig config;
    private final Map<String, OperationSpec> operations = new LinkedHashMap<>();

    public OperationCatalog(GatewayProperties.ExecutionConfig config) {
        this.config = config;

        add(RUN_QUERY, OperationKind.QUERY_EXECUTION, OperationTarget.QUERY, true,
                "Run a query; auto mode previews unless the query looks expensive",
                p -> query(RUN_QUERY, p, p.getMode() != null ? p.getMode() : QueryMode.AUTO));
        add(ANALYZE_QUERY_PERFORMANCE, OperationKind.QUERY_EXECUTION, OperationTarget.QUERY, false,
                "Run a query repeatedly and report storage/formula engine timings",
                p -> query(ANALYZE_QUERY_PERFORMANCE, p, QueryMode.ANALYZE));
        add(PREVIEW_TABLE, OperationKind.QUERY_EXECUTION, OperationTarget.QUERY, true,
                "Return the first rows of a table",
                p -> tableRequest(PREVIEW_TABLE, OperationKind.QUERY_EXECUTION, p,
                        DmvQueries.tablePreview(requireTable(p), rowLimit(p, config.getDefaultMaxRows()))));
        add(LIST_TABLES, OperationKind.METADATA_FETCH, OperationTarget.QUERY, true,
                "List model tables",
                p -> metadata(LIST_TABLES, p, DmvQueries.infoQuery("TABLES", null, infoLimit(p))));
        add(LIST_COLUMNS, OperationKind.METADATA_FETCH, OperationTarget.QUERY, true,
                "List columns, optionally for one table",
                p -> metadata(LIST_COLUMNS, p, DmvQueries.infoQuery("VIEW.COLUMNS", tableFilter(p), infoLimit(p))));
        add(LIST_MEASURES, OperationKind.METADATA_FETCH, OperationTarget.QUERY, true,
                "List measures, optionally for one table",
                p -> metadata(LIST_MEASURES, p, DmvQueries.infoQuery("VIEW.MEASURES", tableFilter(p), infoLimit(p))));
        add(LIST_RELATIONSHIPS, OperationKind.METADATA_FETCH, OperationTarget.QUERY, true,
                "List relationships between tables",
                p -> metadata(LIST_RELATIONSHIPS, p, DmvQueries.infoQuery("VIEW.RELATIONSHIPS", null, infoLimit(p))));
        add(DESCRIBE_TABLE, OperationKind.METADATA_FETCH, OperationTarget.QUERY, true,
                "Describe the columns of one table",
                p -> tableRequest(DESCRIBE_TABLE, OperationKind.METADATA_FETCH, p,
                        DmvQueries.infoQuery("VIEW.COLUMNS", DmvQueries.equalsFilter("Table", requireTable(p)), infoLimit(p))));
        add(EXPORT_SCHEMA, OperationKind.EXPORT, OperationTarget.EXPORT, false,
                "Write a compact schema (tables, columns, measures, relationships) as JSON to an absolute path",
                p -> QueryRequest.builder()
                        .operation(EXPORT_SCHEMA)
                        .operationKind(OperationKind.EXPORT)
                        .textKind(TextKind.PATH)
                        .text(p.getExportPath() != null ? p.getExportPath() : p.getText())
                        .build());
        add(CONNECT, OperationKind.CONNECTION_ATTEMPT, OperationTarget.CONNECT, false,
                "Open the engine connection",
                p -> QueryRequest.builder()
                        .operation(CONNECT)
                        .operationKind(OperationKind.CONNECTION_ATTEMPT)
                        .build());
    }

    public Optional<OperationSpec> find(String name) {
        return Optional.ofNullable(name == null ? null : operations.get(name));
    }

    public Collection<OperationSpec> all() {
        return Collections.unmodifiableCollection(operations.values());
    }

    private void add(String name, String kind, OperationTarget target, boolean cacheable, String description,
                     OperationSpec.RequestShaper shaper) {
        operations.put(name, OperationSpec.builder()
                .name(name)
                .operationKind(kind)
                .target(target)
                .cacheable(cacheable)
                .description(description)
                .shaper(shaper)
                .build());
    }

    private static QueryRequest query(String name, OperationRequest p, QueryMode mode) {
        return QueryRequest.builder()
                .operation(name)
                .operationKind(OperationKind.QUERY_EXECUTION)
                .text(p.getText())
                .mode(mode)
                .maxRows(p.getMaxRows())
                .runs(p.getRuns())
                .bypassCache(p.isBypassCache())
                .identifiers(p.getIdentifiers() != null ? p.getIdentifiers() : Map.of())
                .build();
    }

    private static QueryRequest metadata(String name, OperationRequest p, String text) {
        return tableRequest(name, OperationKind.METADATA_FETCH, p, text);
    }

    private static QueryRequest tableRequest(String name, String kind, OperationRequest p, String text) {
        return QueryRequest.builder()
                .operation(name)
                .operationKind(kind)
                .text(text)
                .mode(QueryMode.PREVIEW)
                .maxRows(p.getMaxRows())
                .bypassCache(p.isBypassCache())
                .identifiers(p.getIdentifiers() != null ? p.getIdentifiers() : Map.of())
                .build();
    }

    private static String requireTable(OperationRequest p) {
        String table = p.getIdentifiers() != null ? p.getIdentifiers().get(TABLE) : null;
        if (table == null || table.isBlank()) {
            throw new ValidationFailedException("Identifier 'table' is required");
        }
        return table.trim();
    }

    private static String tableFilter(OperationRequest p) {
        String table = p.getIdentifiers() != null ? p.getIdentifiers().get(TABLE) : null;
        return table == null || table.isBlank() ? null : DmvQueries.equalsFilter("Table", table.trim());
    }

    private int infoLimit(OperationRequest p) {
        return rowLimit(p, config.getDefaultInfoLimit());
    }

    private int rowLimit(OperationRequest p, int fallback) {
        int requested = p.getMaxRows() != null ? p.getMaxRows() : fallback;
        return Math.max(1, Math.min(requested, config.getSafetyMaxRows()));
    }
}
