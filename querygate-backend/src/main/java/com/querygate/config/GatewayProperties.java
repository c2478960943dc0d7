package com.querygate.config;

import com.querygate.model.OperationKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the query gateway.
 */
@Data
@ConfigurationProperties(prefix = "querygate")
public class GatewayProperties {

    private CacheConfig cache = new CacheConfig();
    private RateLimitConfig rateLimit = new RateLimitConfig();
    private TimeoutConfig timeouts = new TimeoutConfig();
    private ValidationConfig validation = new ValidationConfig();
    private ExecutionConfig execution = new ExecutionConfig();
    private EngineConfig engine = new EngineConfig();

    @Data
    public static class CacheConfig {
        private long ttlSeconds = 300;
        private int maxSize = 200;
    }

    @Data
    public static class RateLimitConfig {
        private boolean enabled = true;
        private WindowStrategy strategy = WindowStrategy.FIXED;
        private int windowSeconds = 60;
        private int defaultLimit = 30;
        private Map<String, Integer> limits = defaultLimits();

        private static Map<String, Integer> defaultLimits() {
            Map<String, Integer> limits = new LinkedHashMap<>();
            limits.put(OperationKind.QUERY_EXECUTION, 30);
            limits.put(OperationKind.METADATA_FETCH, 60);
            limits.put(OperationKind.EXPORT, 10);
            limits.put(OperationKind.CONNECTION_ATTEMPT, 10);
            return limits;
        }
    }

    public enum WindowStrategy {
        FIXED,
        SLIDING
    }

    @Data
    public static class TimeoutConfig {
        private Duration defaultTimeout = Duration.ofSeconds(60);
        private Map<String, Duration> perKind = defaultTimeouts();

        private static Map<String, Duration> defaultTimeouts() {
            Map<String, Duration> timeouts = new LinkedHashMap<>();
            timeouts.put(OperationKind.QUERY_EXECUTION, Duration.ofSeconds(60));
            timeouts.put(OperationKind.METADATA_FETCH, Duration.ofSeconds(15));
            timeouts.put(OperationKind.EXPORT, Duration.ofSeconds(60));
            timeouts.put(OperationKind.CONNECTION_ATTEMPT, Duration.ofSeconds(15));
            return timeouts;
        }
    }

    @Data
    public static class ValidationConfig {
        private int maxQueryLength = 1_000_000;
        private int maxIdentifierLength = 128;
        private int maxPathLength = 260;
        private List<String> denylist = new ArrayList<>(List.of(
                ";\\s*DROP\\s+TABLE",
                ";\\s*DELETE\\s+FROM",
                ";\\s*TRUNCATE\\s+TABLE",
                "xp_cmdshell",
                "sp_executesql",
                "OPENROWSET",
                "OPENDATASOURCE",
                "File\\.Contents\\s*\\(",
                "Web\\.Contents\\s*\\(",
                "Sql\\.Database\\s*\\(",
                "#shared"
        ));
        private List<String> allowedExportExtensions = new ArrayList<>(List.of(
                ".json", ".csv", ".txt", ".xlsx", ".xml", ".graphml", ".yaml", ".yml"));
    }

    @Data
    public static class ExecutionConfig {
        private int defaultRuns = 3;
        private int maxRuns = 50;
        private int defaultMaxRows = 1000;
        private int safetyMaxRows = 10_000;
        private int defaultInfoLimit = 100;
        private boolean autoEvaluate = true;
        private List<String> fallbackOnFaultKinds = new ArrayList<>();
        private List<String> expensivePatterns = new ArrayList<>();
        private List<String> blockedSignatures = new ArrayList<>(List.of(
                "not supported",
                "is not allowed",
                "blocked",
                "permission",
                "access denied",
                "restricted"));
    }

    @Data
    public static class EngineConfig {
        private String jdbcUrl;
        private String username;
        private String password;
        private String driverClassName;
        private int connectionTimeoutMs = 5000;
        private int maximumPoolSize = 2;
        private int validationTimeoutSeconds = 2;
        private boolean readOnly = true;
        private boolean connectOnStartup = false;
    }
}
