package com.querygate.engine;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLInvalidAuthorizationSpecException;
import java.sql.SQLTimeoutException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlFailureClassifierTest {

    private final SqlFailureClassifier classifier = new SqlFailureClassifier(List.of("DMV access", "blocked"));

    @Test
    void testTimeout() {
        assertInstanceOf(EngineTimeoutException.class, classifier.classify(new SQLTimeoutException("timed out")));
    }

    @Test
    void testUnsupported() {
        assertInstanceOf(EngineUnsupportedException.class,
                classifier.classify(new SQLFeatureNotSupportedException("no")));
        assertInstanceOf(EngineUnsupportedException.class,
                classifier.classify(new SQLException("not here", "0A000")));
    }

    @Test
    void testBlocked() {
        assertInstanceOf(EngineBlockedException.class,
                classifier.classify(new SQLInvalidAuthorizationSpecException("denied")));
        assertInstanceOf(EngineBlockedException.class,
                classifier.classify(new SQLException("insufficient privilege", "42501")));
        assertInstanceOf(EngineBlockedException.class,
                classifier.classify(new SQLException("dmv ACCESS is disabled on this server", "HY000")));
    }

    @Test
    void testEverythingElseIsAFault() {
        EngineException e = classifier.classify(new SQLException("Syntax error near EVALUATE", "42000"));

        EngineFaultException fault = assertInstanceOf(EngineFaultException.class, e);
        assertEquals("42000", fault.getSqlState());
        assertEquals("Syntax error near EVALUATE", fault.getMessage());
    }

    @Test
    void testNoSignatures() {
        SqlFailureClassifier plain = new SqlFailureClassifier(null);

        assertInstanceOf(EngineFaultException.class, plain.classify(new SQLException("blocked", "HY000")));
    }
}
