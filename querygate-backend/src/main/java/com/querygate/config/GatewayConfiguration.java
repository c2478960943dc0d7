package com.querygate.config;

import com.querygate.engine.EngineConnection;
import com.querygate.engine.JdbcEngineConnection;
import com.querygate.execution.DeadlineRunner;
import com.querygate.execution.QueryExecutor;
import com.querygate.gateway.ErrorHandler;
import com.querygate.gateway.GatewayContext;
import com.querygate.gateway.OperationCatalog;
import com.querygate.gateway.PolicyGateway;
import com.querygate.model.ExecutionResult;
import com.querygate.registry.ComponentRegistry;
import com.querygate.registry.GatewayAssembly;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Exposes the gateway components, assembled by {@link GatewayAssembly}, as Spring beans.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(GatewayProperties.class)
public class GatewayConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "disconnect")
    public EngineConnection engineConnection(GatewayProperties properties) {
        return new JdbcEngineConnection(properties.getEngine(), GatewayAssembly.failureClassifier(properties));
    }

    @Bean
    public GatewayContext gatewayContext(EngineConnection engineConnection, GatewayProperties properties, Clock clock,
                                         MeterRegistry meterRegistry) {
        return new GatewayContext(engineConnection, properties, clock, meterRegistry);
    }

    @Bean
    public ComponentRegistry gatewayComponents(GatewayContext gatewayContext) {
        return GatewayAssembly.build(gatewayContext);
    }

    @Bean
    public PolicyGateway policyGateway(ComponentRegistry gatewayComponents) {
        return gatewayComponents.get(GatewayAssembly.POLICY_GATEWAY, PolicyGateway.class);
    }

    @Bean
    public QueryExecutor queryExecutor(ComponentRegistry gatewayComponents) {
        return gatewayComponents.get(GatewayAssembly.QUERY_EXECUTOR, QueryExecutor.class);
    }

    @Bean
    public OperationCatalog operationCatalog(ComponentRegistry gatewayComponents) {
        return gatewayComponents.get(GatewayAssembly.CATALOG, OperationCatalog.class);
    }

    @Bean
    public ErrorHandler errorHandler(ComponentRegistry gatewayComponents) {
        return gatewayComponents.get(GatewayAssembly.ERROR_HANDLER, ErrorHandler.class);
    }

    @Bean(destroyMethod = "close")
    public DeadlineRunner deadlineRunner(ComponentRegistry gatewayComponents) {
        return gatewayComponents.get(GatewayAssembly.DEADLINE_RUNNER, DeadlineRunner.class);
    }

    @Bean
    public ApplicationRunner connectOnStartup(GatewayProperties properties, PolicyGateway policyGateway) {
        return args -> {
            if (!properties.getEngine().isConnectOnStartup()) {
                return;
            }
            ExecutionResult result = policyGateway.connect();
            if (result.isSuccess()) {
                log.info("Connected to engine on startup");
            } else {
                log.warn("Engine not reachable on startup: {}", result.getError().getMessage());
            }
        };
    }
}
