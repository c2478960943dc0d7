package com.querygate.model;

import java.util.List;

/**
 * Well-known rate-limit and timeout buckets.
 *
 * <p>Kinds are plain strings on the wire so that configuration may introduce new buckets
 * without a code change.
 */
public final class OperationKind {
    public static final String QUERY_EXECUTION = "query_execution";
    public static final String METADATA_FETCH = "metadata_fetch";
    public static final String EXPORT = "export";
    public static final String CONNECTION_ATTEMPT = "connection_attempt";

    public static final List<String> ALL = List.of(QUERY_EXECUTION, METADATA_FETCH, EXPORT, CONNECTION_ATTEMPT);

    private OperationKind() {
    }
}
