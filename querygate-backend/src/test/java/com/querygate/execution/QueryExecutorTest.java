package com.querygate.execution;

import com.querygate.config.GatewayProperties;
import com.querygate.engine.EngineBlockedException;
import com.querygate.engine.EngineConnection;
import com.querygate.engine.EngineFaultException;
import com.querygate.engine.EngineTimeoutException;
import com.querygate.engine.EngineUnsupportedException;
import com.querygate.engine.MetadataQueryClient;
import com.querygate.engine.ModelCollection;
import com.querygate.engine.ObjectModelClient;
import com.querygate.engine.ObjectModelRequest;
import com.querygate.error.FallbackExhaustedException;
import com.querygate.error.InternalFaultException;
import com.querygate.error.QueryTimeoutException;
import com.querygate.model.ColumnDefinition;
import com.querygate.model.ExecutionPath;
import com.querygate.model.ExecutionResult;
import com.querygate.model.OperationKind;
import com.querygate.model.QueryMode;
import com.querygate.model.QueryRequest;
import com.querygate.model.TabularResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class QueryExecutorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private GatewayProperties.ExecutionConfig config;
    private EngineConnection connection;
    private MetadataQueryClient metadata;
    private ObjectModelClient objectModel;
    private DeadlineRunner deadlineRunner;
    private QueryExecutor executor;

    @BeforeEach
    void setUp() {
        config = new GatewayProperties().getExecution();
        connection = mock(EngineConnection.class);
        metadata = mock(MetadataQueryClient.class);
        objectModel = mock(ObjectModelClient.class);
        when(connection.metadataClient()).thenReturn(metadata);
        when(connection.objectModelClient()).thenReturn(objectModel);
        when(connection.traceSession()).thenReturn(Optional.empty());
        deadlineRunner = new DeadlineRunner();
        executor = newExecutor();
    }

    @AfterEach
    void tearDown() {
        deadlineRunner.close();
    }

    private QueryExecutor newExecutor() {
        return new QueryExecutor(connection, new PerformanceTracer(), deadlineRunner,
                new ModeHandlers(config, ExpensiveQueryClassifier.never()), new ObjectModelTranslator(), config);
    }

    private static QueryRequest request(String text, QueryMode mode) {
        return QueryRequest.builder()
                .operation("run_query")
                .operationKind(OperationKind.QUERY_EXECUTION)
                .text(text)
                .mode(mode)
                .build();
    }

    private static TabularResult table(String... names) {
        TabularResult.TabularResultBuilder builder = TabularResult.builder()
                .column(new ColumnDefinition("Name", "WSTRING"));
        for (String name : names) {
            builder.row(Map.of("Name", name));
        }
        return builder.build();
    }

    @Test
    void testPrimaryPathSuccess() throws Exception {
        QueryRequest request = request("EVALUATE Sales", QueryMode.PREVIEW).toBuilder().maxRows(5).build();
        when(metadata.query(eq("EVALUATE Sales"), eq(5), any(Duration.class))).thenReturn(table("a", "b"));

        ExecutionResult result = executor.run(request, "EVALUATE Sales", TIMEOUT);

        assertTrue(result.isSuccess());
        assertEquals(ExecutionPath.PRIMARY, result.getPath());
        assertEquals(2, result.getRowCount());
        assertEquals("run_query", result.getOperation());
        assertNotNull(result.getTrace());
        assertNull(result.getPerformance());
        verifyNoInteractions(objectModel);
    }

    @Test
    void testBlockedDmvFallsBackOnce() throws Exception {
        String text = "EVALUATE INFO.TABLES()";
        when(metadata.query(anyString(), anyInt(), any(Duration.class)))
                .thenThrow(new EngineBlockedException("DMV access blocked", null));
        when(objectModel.fetch(any(ObjectModelRequest.class), anyInt())).thenReturn(table("Sales", "Customers"));

        ExecutionResult result = executor.run(request(text, QueryMode.PREVIEW), text, TIMEOUT);

        assertTrue(result.isSuccess());
        assertEquals(ExecutionPath.FALLBACK, result.getPath());
        assertEquals(2, result.getRowCount());
        assertTrue(result.getTrace().isPartial());
        verify(metadata, times(1)).query(anyString(), anyInt(), any(Duration.class));
        verify(objectModel, times(1)).fetch(ObjectModelRequest.of(ModelCollection.TABLES), 1000);
    }

    @Test
    void testBlockedQueryWithoutTranslationIsExhausted() throws Exception {
        when(metadata.query(anyString(), anyInt(), any(Duration.class)))
                .thenThrow(new EngineBlockedException("blocked", null));

        assertThrows(FallbackExhaustedException.class,
                () -> executor.run(request("EVALUATE Sales", QueryMode.PREVIEW), "EVALUATE Sales", TIMEOUT));
        verifyNoInteractions(objectModel);
    }

    @Test
    void testFallbackFailureIsExhausted() throws Exception {
        String text = "EVALUATE INFO.VIEW.MEASURES()";
        when(metadata.query(anyString(), anyInt(), any(Duration.class)))
                .thenThrow(new EngineUnsupportedException("unsupported"));
        when(objectModel.fetch(any(ObjectModelRequest.class), anyInt()))
                .thenThrow(new EngineUnsupportedException("no measures collection"));

        assertThrows(FallbackExhaustedException.class,
                () -> executor.run(request(text, QueryMode.PREVIEW), text, TIMEOUT));
        verify(objectModel, times(1)).fetch(any(ObjectModelRequest.class), anyInt());
        verify(metadata, times(1)).query(anyString(), anyInt(), any(Duration.class));
    }

    @Test
    void testGenericFaultDoesNotFallBackByDefault() throws Exception {
        String text = "EVALUATE INFO.TABLES()";
        when(metadata.query(anyString(), anyInt(), any(Duration.class)))
                .thenThrow(new EngineFaultException("Table 'Salez' not found"));

        InternalFaultException e = assertThrows(InternalFaultException.class,
                () -> executor.run(request(text, QueryMode.PREVIEW), text, TIMEOUT));

        assertTrue(e.getSuggestions().contains("Verify table exists with list_tables"));
        assertFalse(e.getMessage().contains("Salez"));
        verifyNoInteractions(objectModel);
    }

    @Test
    void testGenericFaultFallsBackWhenConfigured() throws Exception {
        config.setFallbackOnFaultKinds(List.of(OperationKind.QUERY_EXECUTION));
        executor = newExecutor();
        String text = "EVALUATE INFO.TABLES()";
        when(metadata.query(anyString(), anyInt(), any(Duration.class)))
                .thenThrow(new EngineFaultException("transport error"));
        when(objectModel.fetch(any(ObjectModelRequest.class), anyInt())).thenReturn(table("Sales"));

        ExecutionResult result = executor.run(request(text, QueryMode.PREVIEW), text, TIMEOUT);

        assertEquals(ExecutionPath.FALLBACK, result.getPath());
    }

    @Test
    void testPrimaryTimeoutWithoutTranslationIsQueryTimeout() throws Exception {
        when(metadata.query(anyString(), anyInt(), any(Duration.class))).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return table();
        });

        long started = System.nanoTime();
        assertThrows(QueryTimeoutException.class,
                () -> executor.run(request("EVALUATE Sales", QueryMode.PREVIEW), "EVALUATE Sales", Duration.ofMillis(200)));
        long elapsedMillis = (System.nanoTime() - started) / 1_000_000;

        assertTrue(elapsedMillis < 2_000, "took " + elapsedMillis + " ms");
        verifyNoInteractions(objectModel);
    }

    @Test
    void testPrimaryTimeoutFallsBackWhenTranslatable() throws Exception {
        String text = "EVALUATE INFO.VIEW.COLUMNS()";
        when(metadata.query(anyString(), anyInt(), any(Duration.class))).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return table();
        });
        when(objectModel.fetch(any(ObjectModelRequest.class), anyInt())).thenReturn(table("Amount"));

        ExecutionResult result = executor.run(request(text, QueryMode.PREVIEW), text, Duration.ofMillis(200));

        assertEquals(ExecutionPath.FALLBACK, result.getPath());
        verify(objectModel).fetch(ObjectModelRequest.of(ModelCollection.COLUMNS), 1000);
    }

    @Test
    void testDriverTimeoutWithoutTranslationIsQueryTimeout() throws Exception {
        when(metadata.query(anyString(), anyInt(), any(Duration.class)))
                .thenThrow(new EngineTimeoutException("statement timeout", null));

        assertThrows(QueryTimeoutException.class,
                () -> executor.run(request("EVALUATE Sales", QueryMode.PREVIEW), "EVALUATE Sales", TIMEOUT));
    }

    @Test
    void testFallbackTimeoutIsExhausted() throws Exception {
        String text = "EVALUATE INFO.TABLES()";
        when(metadata.query(anyString(), anyInt(), any(Duration.class)))
                .thenThrow(new EngineBlockedException("blocked", null));
        when(objectModel.fetch(any(ObjectModelRequest.class), anyInt())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return table();
        });

        assertThrows(FallbackExhaustedException.class,
                () -> executor.run(request(text, QueryMode.PREVIEW), text, Duration.ofMillis(200)));
    }

    @Test
    void testAnalyzeRunsRepeatedlyAndSummarizes() throws Exception {
        QueryRequest request = request("EVALUATE Sales", QueryMode.ANALYZE).toBuilder().runs(3).build();
        when(metadata.query(anyString(), anyInt(), any(Duration.class))).thenReturn(table("a"));

        ExecutionResult result = executor.run(request, "EVALUATE Sales", TIMEOUT);

        assertTrue(result.isSuccess());
        assertEquals(ExecutionPath.PRIMARY, result.getPath());
        assertNotNull(result.getPerformance());
        assertEquals(3, result.getPerformance().getRuns());
        assertEquals(3, result.getPerformance().getRunMillis().size());
        assertEquals(result.getPerformance().getFastestMillis(), result.getTrace().getTotalMillis());
        verify(metadata, times(3)).query(anyString(), anyInt(), any(Duration.class));
    }

    @Test
    void testAnalyzeUsesDefaultRuns() throws Exception {
        when(metadata.query(anyString(), anyInt(), any(Duration.class))).thenReturn(table("a"));

        executor.run(request("EVALUATE Sales", QueryMode.ANALYZE), "EVALUATE Sales", TIMEOUT);

        verify(metadata, times(config.getDefaultRuns())).query(anyString(), anyInt(), any(Duration.class));
    }

    @Test
    void testBareExpressionsAreWrapped() throws Exception {
        when(metadata.query(anyString(), anyInt(), any(Duration.class))).thenReturn(table("a"));

        executor.run(request("[Total Sales]", QueryMode.PREVIEW), "[Total Sales]", TIMEOUT);
        verify(metadata).query(eq("EVALUATE ROW(\"Value\", [Total Sales])"), eq(1000), any(Duration.class));

        QueryRequest capped = request("FILTER(Sales, Sales[Amount] > 0)", QueryMode.PREVIEW).toBuilder().maxRows(10).build();
        executor.run(capped, "FILTER(Sales, Sales[Amount] > 0)", TIMEOUT);
        verify(metadata).query(eq("EVALUATE TOPN(10, FILTER(Sales, Sales[Amount] > 0))"), eq(10), any(Duration.class));
    }

    @Test
    void testAutoEvaluateCanBeDisabled() throws Exception {
        config.setAutoEvaluate(false);
        executor = newExecutor();
        when(metadata.query(anyString(), anyInt(), any(Duration.class))).thenReturn(table("a"));

        executor.run(request("[Total Sales]", QueryMode.PREVIEW), "[Total Sales]", TIMEOUT);

        verify(metadata).query(eq("[Total Sales]"), eq(1000), any(Duration.class));
    }
}
