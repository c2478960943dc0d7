package com.querygate.execution;

import com.querygate.model.QueryRequest;

/**
 * Turns a request's mode into a concrete {@link ExecutionPlan}.
 */
public interface ModeHandler {

    ExecutionPlan plan(QueryRequest request, String text);
}
