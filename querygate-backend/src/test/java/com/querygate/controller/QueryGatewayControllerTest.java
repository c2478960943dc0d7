package com.querygate.controller;

import com.querygate.api.OperationDescriptor;
import com.querygate.api.OperationRequest;
import com.querygate.gateway.PolicyGateway;
import com.querygate.model.ErrorKind;
import com.querygate.model.ExecutionPath;
import com.querygate.model.ExecutionResult;
import com.querygate.model.StructuredError;
import com.querygate.service.OperationService;
import com.querygate.web.GlobalExceptionHandler;
import com.querygate.web.TraceIdFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.MDC;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class QueryGatewayControllerTest {

    private OperationService operationService;
    private PolicyGateway gateway;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        operationService = mock(OperationService.class);
        gateway = mock(PolicyGateway.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new QueryGatewayController(operationService, gateway))
                .setControllerAdvice(new GlobalExceptionHandler())
                .addFilters(new TraceIdFilter())
                .build();
    }

    @Test
    void testInvokeOperation() throws Exception {
        when(operationService.invoke(eq("run_query"), any(OperationRequest.class))).thenReturn(ExecutionResult.builder()
                .success(true)
                .operation("run_query")
                .rows(List.of(Map.of("Region", "West")))
                .rowCount(1)
                .path(ExecutionPath.PRIMARY)
                .cached(false)
                .build());

        mockMvc.perform(post("/v1/operations/run_query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"EVALUATE Sales\",\"max_rows\":5,\"bypass_cache\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.row_count").value(1))
                .andExpect(jsonPath("$.rows[0].Region").value("West"))
                .andExpect(jsonPath("$.path").value("primary"))
                .andExpect(jsonPath("$.error").doesNotExist());

        ArgumentCaptor<OperationRequest> captor = ArgumentCaptor.forClass(OperationRequest.class);
        verify(operationService).invoke(eq("run_query"), captor.capture());
        assertEquals("EVALUATE Sales", captor.getValue().getText());
        assertEquals(5, captor.getValue().getMaxRows());
        assertTrue(captor.getValue().isBypassCache());
    }

    @Test
    void testGatewayFailureStillAnswersOk() throws Exception {
        when(operationService.invoke(anyString(), any(OperationRequest.class))).thenReturn(ExecutionResult.failure("run_query",
                StructuredError.builder().kind(ErrorKind.RATE_LIMITED).message("Rate limit exceeded").build()));

        mockMvc.perform(post("/v1/operations/run_query").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.kind").value("rate_limited"));
    }

    @Test
    void testMissingBodyUsesEmptyParameters() throws Exception {
        when(operationService.invoke(anyString(), any(OperationRequest.class)))
                .thenReturn(ExecutionResult.builder().success(true).operation("list_tables").build());

        mockMvc.perform(post("/v1/operations/list_tables"))
                .andExpect(status().isOk());

        verify(operationService).invoke(eq("list_tables"), any(OperationRequest.class));
    }

    @Test
    void testMalformedBody() throws Exception {
        mockMvc.perform(post("/v1/operations/run_query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.kind").value("validation_failed"));

        verifyNoInteractions(operationService);
    }

    @Test
    void testRequestIdIsEchoed() throws Exception {
        when(gateway.isConnected()).thenReturn(true);
        when(gateway.statusDetails()).thenReturn(Map.of("alive", true));

        mockMvc.perform(get("/v1/status").header(TraceIdFilter.TRACE_ID_HEADER, "req-42"))
                .andExpect(status().isOk())
                .andExpect(header().string(TraceIdFilter.TRACE_ID_HEADER, "req-42"))
                .andExpect(jsonPath("$.connected").value(true))
                .andExpect(jsonPath("$.engine.alive").value(true))
                .andExpect(jsonPath("$.trace_id").value("req-42"));
    }

    @Test
    void testOperationNameIsInLoggingContext() throws Exception {
        AtomicReference<String> seen = new AtomicReference<>();
        when(operationService.invoke(anyString(), any(OperationRequest.class))).thenAnswer(invocation -> {
            seen.set(MDC.get(TraceIdFilter.MDC_OPERATION));
            return ExecutionResult.builder().success(true).operation("run_query").build();
        });

        mockMvc.perform(post("/v1/operations/run_query"))
                .andExpect(status().isOk());

        assertEquals("run_query", seen.get());
        assertNull(MDC.get(TraceIdFilter.MDC_OPERATION));
        assertNull(MDC.get(TraceIdFilter.MDC_TRACE_ID));
    }

    @Test
    void testStatusCallHasNoOperationInLoggingContext() throws Exception {
        AtomicReference<String> seen = new AtomicReference<>("unset");
        when(gateway.statusDetails()).thenAnswer(invocation -> {
            seen.set(MDC.get(TraceIdFilter.MDC_OPERATION));
            return Map.of();
        });

        mockMvc.perform(get("/v1/status"))
                .andExpect(status().isOk());

        assertNull(seen.get());
    }

    @Test
    void testUnsafeRequestIdIsReplaced() throws Exception {
        when(gateway.statusDetails()).thenReturn(Map.of());

        String returned = mockMvc.perform(get("/v1/status").header(TraceIdFilter.TRACE_ID_HEADER, "bad id\r\nx"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getHeader(TraceIdFilter.TRACE_ID_HEADER);

        assertNotNull(returned);
        assertNotEquals("bad id\r\nx", returned);
        assertEquals(36, returned.length());
    }

    @Test
    void testListOperations() throws Exception {
        when(operationService.describe()).thenReturn(List.of(OperationDescriptor.builder()
                .name("run_query")
                .operationKind("query_execution")
                .timeoutSeconds(60)
                .rateLimitPerWindow(30)
                .build()));

        mockMvc.perform(get("/v1/operations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("run_query"))
                .andExpect(jsonPath("$[0].timeout_seconds").value(60))
                .andExpect(jsonPath("$[0].rate_limit_per_window").value(30));
    }

    @Test
    void testConnectAndDisconnect() throws Exception {
        when(gateway.connect()).thenReturn(ExecutionResult.builder().success(true).operation("connect").build());
        when(gateway.disconnect()).thenReturn(ExecutionResult.builder().success(true).operation("disconnect").build());

        mockMvc.perform(post("/v1/connect"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.operation").value("connect"));
        mockMvc.perform(post("/v1/disconnect"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.operation").value("disconnect"));

        verify(gateway).connect();
        verify(gateway).disconnect();
    }

    @Test
    void testDiagnostics() throws Exception {
        when(gateway.diagnostics()).thenReturn(Map.of("default_timeout_seconds", 60L));

        mockMvc.perform(get("/v1/diagnostics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.default_timeout_seconds").value(60));
    }

    @Test
    void testInvalidateByPrefix() throws Exception {
        when(gateway.invalidatePrefix("metadata_fetch")).thenReturn(3);

        mockMvc.perform(post("/v1/cache/invalidate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prefix\":\"metadata_fetch\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.prefix").value("metadata_fetch"))
                .andExpect(jsonPath("$.invalidated").value(3));
    }

    @Test
    void testInvalidateByKey() throws Exception {
        when(gateway.invalidate("abc")).thenReturn(true);

        mockMvc.perform(post("/v1/cache/invalidate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"key\":\"abc\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.invalidated").value(1));
    }

    @Test
    void testInvalidateNeedsExactlyOneTarget() throws Exception {
        mockMvc.perform(post("/v1/cache/invalidate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"key\":\"abc\",\"prefix\":\"query\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.kind").value("validation_failed"));

        verify(gateway, never()).invalidate(anyString());
        verify(gateway, never()).invalidatePrefix(anyString());
    }

    @Test
    void testFlush() throws Exception {
        when(gateway.flushCache()).thenReturn(7);

        mockMvc.perform(post("/v1/cache/flush"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.invalidated").value(7));
    }
}
