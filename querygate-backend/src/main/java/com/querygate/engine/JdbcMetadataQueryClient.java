package com.querygate.engine;

import com.querygate.model.TabularResult;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;

@Slf4j
public class JdbcMetadataQueryClient implements MetadataQueryClient {
    private final DataSourceHandle dataSource;
    private final SqlFailureClassifier classifier;
    private final boolean readOnly;

    JdbcMetadataQueryClient(DataSourceHandle dataSource, SqlFailureClassifier classifier, boolean readOnly) {
        this.dataSource = dataSource;
        this.classifier = classifier;
        this.readOnly = readOnly;
    }

    @Override
    public TabularResult query(String text, int rowLimit, Duration timeout) throws EngineException {
        try (Connection conn = dataSource.get().getConnection()) {
            if (readOnly) {
                conn.setReadOnly(true);
            }
            try (Statement stmt = conn.createStatement()) {
                if (timeout != null && !timeout.isZero()) {
                    stmt.setQueryTimeout((int) Math.max(1, (timeout.toMillis() + 999) / 1000));
                }
                if (rowLimit > 0) {
                    // one extra row tells us whether the result was cut
                    stmt.setMaxRows(rowLimit + 1);
                }
                boolean isResultSet = stmt.execute(text);
                if (!isResultSet) {
                    return TabularResult.builder().build();
                }
                try (ResultSet rs = stmt.getResultSet()) {
                    return JdbcValues.readTable(rs, rowLimit);
                }
            }
        } catch (SQLException e) {
            log.debug("Primary query failed: sqlState={}, message={}", e.getSQLState(), e.getMessage());
            throw classifier.classify(e);
        }
    }
}
