package com.querygate.engine;

import com.querygate.config.GatewayProperties;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Engine connection over a JDBC driver, pooled by HikariCP.
 *
 * <p>Plain JDBC exposes no engine event stream, so by default {@link #traceSession()} is empty and
 * execution traces carry client-side timings only. Drivers that can subscribe to engine events
 * plug in through {@link #openTraceSession(DataSource)}.
 */
@Slf4j
public class JdbcEngineConnection implements EngineConnection {
    private final GatewayProperties.EngineConfig config;
    private final SqlFailureClassifier classifier;
    private final MetadataQueryClient metadataClient;
    private final ObjectModelClient objectModelClient;

    private volatile HikariDataSource dataSource;

    public JdbcEngineConnection(GatewayProperties.EngineConfig config, SqlFailureClassifier classifier) {
        this.config = config;
        this.classifier = classifier;
        this.metadataClient = new JdbcMetadataQueryClient(this::requireDataSource, classifier, config.isReadOnly());
        this.objectModelClient = new JdbcObjectModelClient(this::requireDataSource, classifier);
    }

    @Override
    public synchronized void connect() throws EngineException {
        if (config.getJdbcUrl() == null || config.getJdbcUrl().isBlank()) {
            throw new EngineFaultException("No engine JDBC URL configured (querygate.engine.jdbc-url)");
        }
        disconnect();

        HikariDataSource ds;
        try {
            ds = new HikariDataSource(buildHikariConfig());
        } catch (RuntimeException e) {
            throw new EngineFaultException("Failed to open engine connection pool", null, e);
        }
        try (Connection conn = ds.getConnection()) {
            if (!conn.isValid(config.getValidationTimeoutSeconds())) {
                throw new EngineFaultException("Engine connection failed validation");
            }
        } catch (SQLException e) {
            ds.close();
            throw classifier.classify(e);
        } catch (EngineException e) {
            ds.close();
            throw e;
        }
        this.dataSource = ds;
        log.info("Engine connection established: {}", ds.getPoolName());
    }

    @Override
    public synchronized void disconnect() {
        HikariDataSource ds = this.dataSource;
        this.dataSource = null;
        if (ds != null) {
            ds.close();
            log.info("Engine connection closed");
        }
    }

    @Override
    public boolean isAlive() {
        HikariDataSource ds = this.dataSource;
        if (ds == null || ds.isClosed()) {
            return false;
        }
        try (Connection conn = ds.getConnection()) {
            return conn.isValid(config.getValidationTimeoutSeconds());
        } catch (SQLException e) {
            log.debug("Engine liveness check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public MetadataQueryClient metadataClient() {
        return metadataClient;
    }

    @Override
    public ObjectModelClient objectModelClient() {
        return objectModelClient;
    }

    @Override
    public Optional<EngineTraceSession> traceSession() {
        HikariDataSource ds = this.dataSource;
        if (ds == null || ds.isClosed()) {
            return Optional.empty();
        }
        return traceSession(ds);
    }

    Optional<EngineTraceSession> traceSession(DataSource ds) {
        try {
            return openTraceSession(ds);
        } catch (RuntimeException e) {
            log.warn("Engine trace session unavailable, tracing client-side: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Opens an engine-side event capture over the pool. Returns empty unless overridden.
     */
    protected Optional<EngineTraceSession> openTraceSession(DataSource ds) {
        return Optional.empty();
    }

    @Override
    public Map<String, Object> describe() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("transport", "jdbc");
        out.put("connected", dataSource != null);
        out.put("read_only", config.isReadOnly());
        out.put("pool_size", config.getMaximumPoolSize());
        return out;
    }

    DataSource requireDataSource() throws EngineException {
        HikariDataSource ds = this.dataSource;
        if (ds == null || ds.isClosed()) {
            throw new EngineFaultException("Engine connection is not open");
        }
        return ds;
    }

    private HikariConfig buildHikariConfig() {
        HikariConfig hikari = new HikariConfig();
        hikari.setExceptionOverrideClassName(HikariSqlExceptionOverride.class.getName());
        hikari.setJdbcUrl(config.getJdbcUrl());
        hikari.setUsername(config.getUsername());
        hikari.setPassword(config.getPassword());
        if (config.getDriverClassName() != null && !config.getDriverClassName().isBlank()) {
            hikari.setDriverClassName(config.getDriverClassName());
        }
        hikari.setReadOnly(config.isReadOnly());
        hikari.setConnectionTimeout(config.getConnectionTimeoutMs());
        hikari.setMaximumPoolSize(config.getMaximumPoolSize());
        hikari.setMinimumIdle(1);
        hikari.setPoolName("QueryGate-Engine");
        return hikari;
    }
}
