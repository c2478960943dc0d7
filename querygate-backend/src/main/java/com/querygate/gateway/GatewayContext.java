package com.querygate.gateway;

import com.querygate.config.GatewayProperties;
import com.querygate.engine.EngineConnection;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.time.Clock;

/**
 * Everything a gateway instance shares with its components. Each gateway gets its own context,
 * so two gateways never share a connection, cache or limiter. Operation meters go to
 * {@code meterRegistry}.
 */
@Getter
@RequiredArgsConstructor
public class GatewayContext {
    @NonNull
    private final EngineConnection connection;
    @NonNull
    private final GatewayProperties properties;
    @NonNull
    private final Clock clock;
    @NonNull
    private final MeterRegistry meterRegistry;
}
