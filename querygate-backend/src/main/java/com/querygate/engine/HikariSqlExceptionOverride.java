package com.querygate.engine;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLTimeoutException;

/**
 * Keeps the pooled engine connection alive for errors that say nothing about its health.
 *
 * <p>Blocked DMVs, unsupported statements and statement timeouts leave the connection in the
 * pool.
 */
public class HikariSqlExceptionOverride implements SQLExceptionOverride {

    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }

        if (sqlException instanceof SQLFeatureNotSupportedException || sqlException instanceof SQLTimeoutException) {
            return Override.DO_NOT_EVICT;
        }

        String sqlState = sqlException.getSQLState();
        if (sqlState != null && (sqlState.startsWith("0A") || sqlState.startsWith("42") || sqlState.startsWith("28"))) {
            // 0A: feature not supported, 42: syntax or access rule violation, 28: authorization
            return Override.DO_NOT_EVICT;
        }

        return Override.CONTINUE_EVICT;
    }
}
