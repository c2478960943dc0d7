package com.querygate.engine;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLInvalidAuthorizationSpecException;
import java.sql.SQLTimeoutException;
import java.util.List;
import java.util.Locale;

/**
 * Maps driver exceptions onto the engine failure signatures the executor acts on.
 */
public class SqlFailureClassifier {
    private final List<String> blockedSignatures;

    public SqlFailureClassifier(List<String> blockedSignatures) {
        this.blockedSignatures = blockedSignatures == null ? List.of()
                : blockedSignatures.stream().map(s -> s.toLowerCase(Locale.ROOT)).toList();
    }

    public EngineException classify(SQLException e) {
        String sqlState = e.getSQLState();
        if (e instanceof SQLTimeoutException) {
            return new EngineTimeoutException("Engine statement timed out", e);
        }
        if (e instanceof SQLFeatureNotSupportedException || (sqlState != null && sqlState.startsWith("0A"))) {
            return new EngineUnsupportedException("Operation not supported by the query interface", e);
        }
        if (e instanceof SQLInvalidAuthorizationSpecException || "42501".equals(sqlState)) {
            return new EngineBlockedException("Operation blocked by the engine", e);
        }
        String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        for (String signature : blockedSignatures) {
            if (message.contains(signature)) {
                return new EngineBlockedException("Operation blocked by the engine", e);
            }
        }
        return new EngineFaultException(e.getMessage(), sqlState, e);
    }
}
