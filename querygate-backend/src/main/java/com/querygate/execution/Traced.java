package com.querygate.execution;

import com.querygate.model.ExecutionTrace;
import lombok.Value;

@Value
public class Traced<T> {
    T value;
    ExecutionTrace trace;
}
