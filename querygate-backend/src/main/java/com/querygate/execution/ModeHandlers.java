package com.querygate.execution;

import com.querygate.config.GatewayProperties;
import com.querygate.model.QueryMode;
import com.querygate.model.QueryRequest;

/**
 * The three supported modes.
 *
 * <ul>
 *   <li>preview: one run, rows capped at {@code maxRows}.</li>
 *   <li>analyze: {@code runs} timed repetitions.</li>
 *   <li>auto: preview, unless the classifier flags the text as expensive; then a single timed run.</li>
 * </ul>
 */
public class ModeHandlers {
    private final ModeHandler preview;
    private final ModeHandler analyze;
    private final ModeHandler auto;

    public ModeHandlers(GatewayProperties.ExecutionConfig config, ExpensiveQueryClassifier classifier) {
        this.preview = (request, text) -> new ExecutionPlan(rowLimit(config, request), 1, false);
        this.analyze = (request, text) -> new ExecutionPlan(rowLimit(config, request),
                request.getRuns() != null ? request.getRuns() : config.getDefaultRuns(), true);
        this.auto = (request, text) -> classifier.isExpensive(text)
                ? new ExecutionPlan(rowLimit(config, request), 1, true)
                : preview.plan(request, text);
    }

    public ModeHandler forMode(QueryMode mode) {
        if (mode == QueryMode.PREVIEW) {
            return preview;
        }
        if (mode == QueryMode.ANALYZE) {
            return analyze;
        }
        return auto;
    }

    public ExecutionPlan plan(QueryRequest request, String text) {
        return forMode(request.getMode()).plan(request, text);
    }

    private static int rowLimit(GatewayProperties.ExecutionConfig config, QueryRequest request) {
        int requested = request.getMaxRows() != null ? request.getMaxRows() : config.getDefaultMaxRows();
        return Math.min(requested, config.getSafetyMaxRows());
    }
}
