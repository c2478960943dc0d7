package com.querygate.registry;

import com.querygate.config.GatewayProperties;
import com.querygate.engine.EngineConnection;
import com.querygate.execution.DeadlineRunner;
import com.querygate.execution.QueryExecutor;
import com.querygate.gateway.GatewayContext;
import com.querygate.gateway.PolicyGateway;
import com.querygate.model.ExecutionPath;
import com.querygate.model.ExecutionResult;
import com.querygate.model.OperationKind;
import com.querygate.model.QueryMode;
import com.querygate.model.QueryRequest;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ComponentRegistryTest {

    private GatewayContext context;

    @BeforeEach
    void setUp() {
        EngineConnection connection = mock(EngineConnection.class);
        when(connection.isAlive()).thenReturn(true);
        context = new GatewayContext(connection, new GatewayProperties(), Clock.systemUTC(), new SimpleMeterRegistry());
    }

    @Test
    void testDependenciesAreBuiltFirst() {
        ComponentRegistry registry = new ComponentRegistry(context)
                .register("gateway", String.class, List.of("executor", "cache"),
                        (ctx, deps) -> "gateway(" + deps.get("executor", String.class) + "," + deps.get("cache", String.class) + ")")
                .register("executor", String.class, List.of("tracer"),
                        (ctx, deps) -> "executor(" + deps.get("tracer", String.class) + ")")
                .register("tracer", String.class, List.of(), (ctx, deps) -> "tracer")
                .register("cache", String.class, List.of(), (ctx, deps) -> "cache")
                .resolve();

        assertEquals(List.of("tracer", "executor", "cache", "gateway"), registry.resolutionOrder());
        assertEquals("gateway(executor(tracer),cache)", registry.get("gateway", String.class));
    }

    @Test
    void testEachFactoryRunsOnce() {
        AtomicInteger builds = new AtomicInteger();
        ComponentRegistry registry = new ComponentRegistry(context)
                .register("shared", Object.class, List.of(), (ctx, deps) -> {
                    builds.incrementAndGet();
                    return new Object();
                })
                .register("a", Object.class, List.of("shared"), (ctx, deps) -> deps.get("shared", Object.class))
                .register("b", Object.class, List.of("shared"), (ctx, deps) -> deps.get("shared", Object.class));

        registry.resolve();
        registry.resolve();

        assertEquals(1, builds.get());
        assertSame(registry.get("a", Object.class), registry.get("b", Object.class));
    }

    @Test
    void testCycleFailsFastWithPath() {
        AtomicInteger builds = new AtomicInteger();
        ComponentRegistry registry = new ComponentRegistry(context)
                .register("a", Object.class, List.of("b"), (ctx, deps) -> {
                    builds.incrementAndGet();
                    return new Object();
                })
                .register("b", Object.class, List.of("c"), (ctx, deps) -> new Object())
                .register("c", Object.class, List.of("a"), (ctx, deps) -> new Object());

        ComponentCycleException e = assertThrows(ComponentCycleException.class, registry::resolve);

        assertEquals(List.of("a", "b", "c", "a"), e.getCycle());
        assertTrue(e.getMessage().contains("a -> b -> c -> a"));
        assertEquals(0, builds.get());
    }

    @Test
    void testUnknownDependencyFailsFast() {
        ComponentRegistry registry = new ComponentRegistry(context)
                .register("executor", Object.class, List.of("tracer"), (ctx, deps) -> new Object());

        IllegalStateException e = assertThrows(IllegalStateException.class, registry::resolve);
        assertTrue(e.getMessage().contains("tracer"));
    }

    @Test
    void testUndeclaredDependencyIsNotReachable() {
        ComponentRegistry registry = new ComponentRegistry(context)
                .register("tracer", Object.class, List.of(), (ctx, deps) -> new Object())
                .register("executor", Object.class, List.of(), (ctx, deps) -> deps.get("tracer", Object.class));

        assertThrows(IllegalStateException.class, registry::resolve);
    }

    @Test
    void testNoRegistrationAfterResolve() {
        ComponentRegistry registry = new ComponentRegistry(context).resolve();

        assertThrows(IllegalStateException.class,
                () -> registry.register("late", Object.class, List.of(), (ctx, deps) -> new Object()));
    }

    @Test
    void testStandardAssemblyHasNoCycles() {
        ComponentRegistry registry = GatewayAssembly.build(context);
        try {
            List<String> order = registry.resolutionOrder();
            assertEquals(order.size() - 1, order.indexOf(GatewayAssembly.POLICY_GATEWAY));
            assertTrue(order.indexOf(GatewayAssembly.MODE_HANDLERS) > order.indexOf(GatewayAssembly.EXPENSIVE_CLASSIFIER));
            assertTrue(order.indexOf(GatewayAssembly.QUERY_EXECUTOR) > order.indexOf(GatewayAssembly.TRACER));
        } finally {
            registry.get(GatewayAssembly.DEADLINE_RUNNER, DeadlineRunner.class).close();
        }
    }

    @Test
    void testExecutorCanBeSubstituted() {
        QueryExecutor executor = mock(QueryExecutor.class);
        ExecutionResult canned = ExecutionResult.builder()
                .success(true)
                .operation("run_query")
                .path(ExecutionPath.PRIMARY)
                .build();
        when(executor.run(any(QueryRequest.class), anyString(), any(Duration.class))).thenReturn(canned);

        ComponentRegistry registry = GatewayAssembly.build(context,
                r -> r.override(GatewayAssembly.QUERY_EXECUTOR, QueryExecutor.class, executor));
        try {
            PolicyGateway gateway = registry.get(GatewayAssembly.POLICY_GATEWAY, PolicyGateway.class);
            ExecutionResult result = gateway.execute(QueryRequest.builder()
                    .operation("run_query")
                    .operationKind(OperationKind.QUERY_EXECUTION)
                    .text("EVALUATE Sales")
                    .mode(QueryMode.PREVIEW)
                    .build());

            assertTrue(result.isSuccess());
            verify(executor).run(any(QueryRequest.class), anyString(), any(Duration.class));
        } finally {
            registry.get(GatewayAssembly.DEADLINE_RUNNER, DeadlineRunner.class).close();
        }
    }

    @Test
    void testOverrideRequiresExistingRegistration() {
        ComponentRegistry registry = new ComponentRegistry(context);

        assertThrows(IllegalArgumentException.class, () -> registry.override("missing", Object.class, new Object()));
    }
}
