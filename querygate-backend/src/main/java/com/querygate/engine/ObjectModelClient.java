package com.querygate.engine;

import com.querygate.model.TabularResult;

/**
 * Slower fallback path that reads model objects directly.
 */
public interface ObjectModelClient {

    TabularResult fetch(ObjectModelRequest request, int rowLimit) throws EngineException;
}
