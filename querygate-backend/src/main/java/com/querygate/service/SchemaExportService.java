package com.querygate.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.querygate.api.OperationRequest;
import com.querygate.config.GatewayProperties;
import com.querygate.error.GatewayException;
import com.querygate.error.InternalFaultException;
import com.querygate.error.QueryTimeoutException;
import com.querygate.execution.QueryExecutor;
import com.querygate.gateway.OperationCatalog;
import com.querygate.gateway.PolicyGateway;
import com.querygate.model.ExecutionResult;
import com.querygate.model.QueryRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a compact schema document (tables, columns, measures, relationships) to a file.
 *
 * <p>Each section is read through the executor, so blocked DMVs fall back to the object model
 * like any metadata call. Only the tables section is mandatory; other sections that fail are
 * listed under {@code skipped}.
 */
@Slf4j
@Service
public class SchemaExportService {
    private static final List<String> SECTIONS = List.of("tables", "columns", "measures", "relationships");
    private static final Map<String, String> SECTION_OPERATIONS = Map.of(
            "tables", OperationCatalog.LIST_TABLES,
            "columns", OperationCatalog.LIST_COLUMNS,
            "measures", OperationCatalog.LIST_MEASURES,
            "relationships", OperationCatalog.LIST_RELATIONSHIPS);

    private final PolicyGateway gateway;
    private final QueryExecutor executor;
    private final OperationCatalog catalog;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int sectionRowLimit;

    public SchemaExportService(PolicyGateway gateway,
                               QueryExecutor executor,
                               OperationCatalog catalog,
                               ObjectMapper objectMapper,
                               Clock clock,
                               GatewayProperties properties) {
        this.gateway = gateway;
        this.executor = executor;
        this.catalog = catalog;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.sectionRowLimit = properties.getExecution().getSafetyMaxRows();
    }

    public ExecutionResult export(QueryRequest request) {
        return gateway.execute(request, (path, timeout) -> writeSchema(request.operationOrKind(), path, timeout), false);
    }

    private ExecutionResult writeSchema(String operation, String path, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("exported_at", OffsetDateTime.now(clock).toString());

        Map<String, Object> counts = new LinkedHashMap<>();
        List<String> skipped = new ArrayList<>();
        for (String section : SECTIONS) {
            Duration remaining = Duration.ofNanos(deadline - System.nanoTime());
            if (remaining.isNegative() || remaining.isZero()) {
                throw new QueryTimeoutException(timeout);
            }
            try {
                ExecutionResult rows = readSection(section, remaining);
                document.put(section, rows.getRows());
                counts.put(section, rows.getRowCount());
            } catch (GatewayException e) {
                if ("tables".equals(section)) {
                    throw e;
                }
                log.warn("Schema export skipped {}: {}", section, e.getMessage());
                skipped.add(section);
            }
        }

        long bytes = write(Path.of(path), document);
        log.info("Schema exported to {} ({} bytes)", path, bytes);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("path", path);
        details.put("bytes", bytes);
        details.put("counts", counts);
        details.put("skipped", skipped);
        return ExecutionResult.builder()
                .success(true)
                .operation(operation)
                .details(details)
                .build();
    }

    private ExecutionResult readSection(String section, Duration timeout) {
        OperationRequest params = new OperationRequest();
        params.setMaxRows(sectionRowLimit);
        QueryRequest request = catalog.find(SECTION_OPERATIONS.get(section))
                .orElseThrow(() -> new IllegalStateException("No catalog entry for " + section))
                .shape(params);
        return executor.run(request, request.getText(), timeout);
    }

    private long write(Path target, Map<String, Object> document) {
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            byte[] json = objectMapper.writeValueAsBytes(document);
            Files.write(target, json);
            return json.length;
        } catch (IOException e) {
            throw new InternalFaultException("Failed to write export file",
                    List.of("Check that the target directory exists and is writable"), e);
        }
    }
}
