package com.querygate.engine;

import com.querygate.model.TabularResult;

import java.time.Duration;

/**
 * Fast path: query text submitted as-is to the engine's query interface.
 */
public interface MetadataQueryClient {

    /**
     * Run {@code text} and return at most {@code rowLimit} rows.
     *
     * @param text prepared query text
     * @param rowLimit maximum number of rows to materialize
     * @param timeout hint passed to the driver; the caller enforces the real deadline
     * @return the rows, with {@code truncated} set when more were available
     * @throws EngineException on any engine failure, classified by signature
     */
    TabularResult query(String text, int rowLimit, Duration timeout) throws EngineException;
}
