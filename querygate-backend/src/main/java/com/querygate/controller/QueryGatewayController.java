package com.querygate.controller;

import com.querygate.api.CacheInvalidateRequest;
import com.querygate.api.ConnectionStatusResponse;
import com.querygate.api.OperationDescriptor;
import com.querygate.api.OperationRequest;
import com.querygate.gateway.PolicyGateway;
import com.querygate.model.ExecutionResult;
import com.querygate.service.OperationService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1")
public class QueryGatewayController {

    private static final Logger log = LoggerFactory.getLogger(QueryGatewayController.class);

    private final OperationService operationService;
    private final PolicyGateway gateway;

    public QueryGatewayController(OperationService operationService, PolicyGateway gateway) {
        this.operationService = operationService;
        this.gateway = gateway;
    }

    /**
     * Invoke one catalog operation.
     *
     * POST /v1/operations/{operation}
     *
     * <p>Gateway failures are part of the result envelope, so the status is 200 whenever the
     * request could be read.
     */
    @PostMapping("/operations/{operation}")
    public ResponseEntity<ExecutionResult> invoke(
            @PathVariable("operation") String operation,
            @RequestBody(required = false) OperationRequest request) {
        OperationRequest params = request != null ? request : new OperationRequest();
        ExecutionResult result = operationService.invoke(operation, params);
        log.info("Operation {} finished: success={}, path={}, trace_id={}",
                operation, result.isSuccess(), result.getPath(), MDC.get("trace_id"));
        return ResponseEntity.ok(result);
    }

    /**
     * GET /v1/operations
     */
    @GetMapping("/operations")
    public ResponseEntity<List<OperationDescriptor>> listOperations() {
        return ResponseEntity.ok(operationService.describe());
    }

    @PostMapping("/connect")
    public ResponseEntity<ExecutionResult> connect() {
        log.info("Connect requested: trace_id={}", MDC.get("trace_id"));
        return ResponseEntity.ok(gateway.connect());
    }

    @PostMapping("/disconnect")
    public ResponseEntity<ExecutionResult> disconnect() {
        log.info("Disconnect requested: trace_id={}", MDC.get("trace_id"));
        return ResponseEntity.ok(gateway.disconnect());
    }

    @GetMapping("/status")
    public ResponseEntity<ConnectionStatusResponse> status() {
        return ResponseEntity.ok(ConnectionStatusResponse.builder()
                .connected(gateway.isConnected())
                .engine(gateway.statusDetails())
                .traceId(MDC.get("trace_id"))
                .build());
    }

    /**
     * Cache, rate-limit, timeout and per-operation statistics.
     *
     * GET /v1/diagnostics
     */
    @GetMapping("/diagnostics")
    public ResponseEntity<Map<String, Object>> diagnostics() {
        return ResponseEntity.ok(gateway.diagnostics());
    }

    @PostMapping("/cache/invalidate")
    public ResponseEntity<Map<String, Object>> invalidate(@Valid @RequestBody CacheInvalidateRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (request.getKey() != null && !request.getKey().isBlank()) {
            body.put("key", request.getKey());
            body.put("invalidated", gateway.invalidate(request.getKey()) ? 1 : 0);
        } else {
            body.put("prefix", request.getPrefix());
            body.put("invalidated", gateway.invalidatePrefix(request.getPrefix()));
        }
        log.info("Cache invalidation: {}, trace_id={}", body, MDC.get("trace_id"));
        return ResponseEntity.ok(body);
    }

    @PostMapping("/cache/flush")
    public ResponseEntity<Map<String, Object>> flush() {
        int removed = gateway.flushCache();
        log.info("Cache flushed: {} entries, trace_id={}", removed, MDC.get("trace_id"));
        return ResponseEntity.ok(Map.of("invalidated", removed));
    }
}
