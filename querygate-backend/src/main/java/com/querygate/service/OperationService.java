package com.querygate.service;

import com.querygate.api.OperationDescriptor;
import com.querygate.api.OperationRequest;
import com.querygate.error.ValidationFailedException;
import com.querygate.gateway.ErrorHandler;
import com.querygate.gateway.OperationCatalog;
import com.querygate.gateway.OperationSpec;
import com.querygate.gateway.PolicyGateway;
import com.querygate.model.ExecutionResult;
import com.querygate.model.QueryRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Resolves an operation name against the catalog and hands the shaped request to the gateway.
 */
@Slf4j
@Service
public class OperationService {
    private final OperationCatalog catalog;
    private final PolicyGateway gateway;
    private final SchemaExportService schemaExportService;
    private final ErrorHandler errorHandler;

    public OperationService(OperationCatalog catalog,
                            PolicyGateway gateway,
                            SchemaExportService schemaExportService,
                            ErrorHandler errorHandler) {
        this.catalog = catalog;
        this.gateway = gateway;
        this.schemaExportService = schemaExportService;
        this.errorHandler = errorHandler;
    }

    public ExecutionResult invoke(String operation, OperationRequest params) {
        log.debug("Invoking operation {}", operation);
        Optional<OperationSpec> spec = catalog.find(operation);
        if (spec.isEmpty()) {
            return errorHandler.handle(operation, new ValidationFailedException("Unknown operation: " + operation));
        }

        QueryRequest request;
        try {
            request = spec.get().shape(params);
        } catch (ValidationFailedException e) {
            return errorHandler.handle(operation, e);
        }

        switch (spec.get().getTarget()) {
            case EXPORT:
                return schemaExportService.export(request);
            case CONNECT:
                return gateway.connect();
            default:
                return gateway.execute(request, spec.get().isCacheable());
        }
    }

    public List<OperationDescriptor> describe() {
        return catalog.all().stream()
                .map(spec -> OperationDescriptor.builder()
                        .name(spec.getName())
                        .operationKind(spec.getOperationKind())
                        .description(spec.getDescription())
                        .timeoutSeconds(gateway.timeoutFor(spec.getOperationKind()).toSeconds())
                        .rateLimitPerWindow(gateway.rateLimitFor(spec.getOperationKind()))
                        .build())
                .toList();
    }
}
