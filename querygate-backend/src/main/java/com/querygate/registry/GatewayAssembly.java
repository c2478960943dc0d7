package com.querygate.registry;

import com.querygate.config.GatewayProperties;
import com.querygate.engine.SqlFailureClassifier;
import com.querygate.execution.DeadlineRunner;
import com.querygate.execution.ExpensiveQueryClassifier;
import com.querygate.execution.ModeHandlers;
import com.querygate.execution.ObjectModelTranslator;
import com.querygate.execution.PerformanceTracer;
import com.querygate.execution.QueryExecutor;
import com.querygate.gateway.ErrorHandler;
import com.querygate.gateway.GatewayContext;
import com.querygate.gateway.OperationCatalog;
import com.querygate.gateway.OperationMetrics;
import com.querygate.gateway.PolicyGateway;
import com.querygate.policy.InputValidator;
import com.querygate.policy.QueryCache;
import com.querygate.policy.RateLimiter;
import com.querygate.policy.ToolTimeoutRegistry;

import java.util.List;
import java.util.function.Consumer;

/**
 * Standard wiring of a gateway and its components.
 */
public final class GatewayAssembly {
    public static final String INPUT_VALIDATOR = "inputValidator";
    public static final String RATE_LIMITER = "rateLimiter";
    public static final String QUERY_CACHE = "queryCache";
    public static final String TIMEOUTS = "toolTimeouts";
    public static final String TRACER = "performanceTracer";
    public static final String DEADLINE_RUNNER = "deadlineRunner";
    public static final String EXPENSIVE_CLASSIFIER = "expensiveQueryClassifier";
    public static final String MODE_HANDLERS = "modeHandlers";
    public static final String TRANSLATOR = "objectModelTranslator";
    public static final String QUERY_EXECUTOR = "queryExecutor";
    public static final String ERROR_HANDLER = "errorHandler";
    public static final String METRICS = "operationMetrics";
    public static final String CATALOG = "operationCatalog";
    public static final String POLICY_GATEWAY = "policyGateway";

    private GatewayAssembly() {
    }

    public static ComponentRegistry build(GatewayContext context) {
        return build(context, registry -> { });
    }

    /**
     * @param overrides applied after the standard registrations and before resolution
     */
    public static ComponentRegistry build(GatewayContext context, Consumer<ComponentRegistry> overrides) {
        ComponentRegistry registry = new ComponentRegistry(context);
        registerStandard(registry);
        overrides.accept(registry);
        return registry.resolve();
    }

    /**
     * Builds a {@link SqlFailureClassifier} from the execution settings of {@code properties}.
     */
    public static SqlFailureClassifier failureClassifier(GatewayProperties properties) {
        return new SqlFailureClassifier(properties.getExecution().getBlockedSignatures());
    }

    static void registerStandard(ComponentRegistry registry) {
        registry.register(INPUT_VALIDATOR, InputValidator.class, List.of(),
                (ctx, deps) -> new InputValidator(ctx.getProperties()));
        registry.register(RATE_LIMITER, RateLimiter.class, List.of(),
                (ctx, deps) -> new RateLimiter(ctx.getProperties(), ctx.getClock()));
        registry.register(QUERY_CACHE, QueryCache.class, List.of(),
                (ctx, deps) -> new QueryCache(ctx.getProperties().getCache().getTtlSeconds(),
                        ctx.getProperties().getCache().getMaxSize(), ctx.getClock()));
        registry.register(TIMEOUTS, ToolTimeoutRegistry.class, List.of(),
                (ctx, deps) -> new ToolTimeoutRegistry(ctx.getProperties()));
        registry.register(TRACER, PerformanceTracer.class, List.of(),
                (ctx, deps) -> new PerformanceTracer());
        registry.register(DEADLINE_RUNNER, DeadlineRunner.class, List.of(),
                (ctx, deps) -> new DeadlineRunner());
        registry.register(EXPENSIVE_CLASSIFIER, ExpensiveQueryClassifier.class, List.of(),
                (ctx, deps) -> ExpensiveQueryClassifier.matchingAny(ctx.getProperties().getExecution().getExpensivePatterns()));
        registry.register(MODE_HANDLERS, ModeHandlers.class, List.of(EXPENSIVE_CLASSIFIER),
                (ctx, deps) -> new ModeHandlers(ctx.getProperties().getExecution(),
                        deps.get(EXPENSIVE_CLASSIFIER, ExpensiveQueryClassifier.class)));
        registry.register(TRANSLATOR, ObjectModelTranslator.class, List.of(),
                (ctx, deps) -> new ObjectModelTranslator());
        registry.register(QUERY_EXECUTOR, QueryExecutor.class, List.of(TRACER, DEADLINE_RUNNER, MODE_HANDLERS, TRANSLATOR),
                (ctx, deps) -> new QueryExecutor(ctx.getConnection(),
                        deps.get(TRACER, PerformanceTracer.class),
                        deps.get(DEADLINE_RUNNER, DeadlineRunner.class),
                        deps.get(MODE_HANDLERS, ModeHandlers.class),
                        deps.get(TRANSLATOR, ObjectModelTranslator.class),
                        ctx.getProperties().getExecution()));
        registry.register(ERROR_HANDLER, ErrorHandler.class, List.of(),
                (ctx, deps) -> new ErrorHandler());
        registry.register(METRICS, OperationMetrics.class, List.of(),
                (ctx, deps) -> new OperationMetrics(ctx.getMeterRegistry()));
        registry.register(CATALOG, OperationCatalog.class, List.of(),
                (ctx, deps) -> new OperationCatalog(ctx.getProperties().getExecution()));
        registry.register(POLICY_GATEWAY, PolicyGateway.class,
                List.of(INPUT_VALIDATOR, RATE_LIMITER, QUERY_CACHE, TIMEOUTS, QUERY_EXECUTOR, DEADLINE_RUNNER, ERROR_HANDLER, METRICS),
                GatewayAssembly::policyGateway);
    }

    private static PolicyGateway policyGateway(GatewayContext ctx, ComponentRegistry.Dependencies deps) {
        return new PolicyGateway(ctx,
                deps.get(INPUT_VALIDATOR, InputValidator.class),
                deps.get(RATE_LIMITER, RateLimiter.class),
                deps.get(QUERY_CACHE, QueryCache.class),
                deps.get(TIMEOUTS, ToolTimeoutRegistry.class),
                deps.get(QUERY_EXECUTOR, QueryExecutor.class),
                deps.get(DEADLINE_RUNNER, DeadlineRunner.class),
                deps.get(ERROR_HANDLER, ErrorHandler.class),
                deps.get(METRICS, OperationMetrics.class));
    }
}
