package com.querygate.execution;

import lombok.Value;

/**
 * What a mode resolves to for one request.
 */
@Value
public class ExecutionPlan {
    int rowLimit;
    int runs;
    boolean analyzing;
}
