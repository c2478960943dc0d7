package com.querygate.gateway;

/**
 * Which gateway entry point serves an operation.
 */
public enum OperationTarget {
    QUERY,
    EXPORT,
    CONNECT
}
