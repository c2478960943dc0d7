package com.querygate.execution;

import com.querygate.model.ExecutionTrace;
import com.querygate.model.TraceEvent;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a captured engine event stream into storage-engine and formula-engine time.
 *
 * <ul>
 *   <li>{@code QueryEnd} carries the engine's total duration.</li>
 *   <li>{@code VertiPaqSEQuery*} and {@code DirectQueryEnd} are storage-engine work.</li>
 *   <li>{@code ExecutionStatistics} XML, when present, overrides both figures.</li>
 *   <li>Otherwise formula-engine time is the engine total minus storage-engine time.</li>
 * </ul>
 */
public final class TraceEventDecomposer {
    static final String QUERY_END = "QueryEnd";
    static final String EXECUTION_STATISTICS = "ExecutionStatistics";
    static final String SE_QUERY_PREFIX = "VertiPaqSEQuery";
    static final String DIRECT_QUERY_END = "DirectQueryEnd";

    private static final Pattern FE_DURATION = Pattern.compile(
            "<(\\w*(?:FormulaEngineDuration|FEDuration))[^>]*>\\s*([0-9.]+)\\s*</\\1>", Pattern.CASE_INSENSITIVE);
    private static final Pattern SE_DURATION = Pattern.compile(
            "<(\\w*(?:StorageEngineDuration|SEDuration))[^>]*>\\s*([0-9.]+)\\s*</\\1>", Pattern.CASE_INSENSITIVE);

    private TraceEventDecomposer() {
    }

    /**
     * @param wallMillis client-observed duration
     * @param events captured events, or {@code null} when no capture happened
     * @param method tracing method label
     */
    public static ExecutionTrace decompose(double wallMillis, List<TraceEvent> events, String method) {
        double total = round(wallMillis);
        ExecutionTrace.ExecutionTraceBuilder trace = ExecutionTrace.builder()
                .totalMillis(total)
                .tracingMethod(method);

        if (events == null) {
            return trace.clientMillis(total).build();
        }
        trace.events(events);

        Double queryEnd = null;
        double storage = 0;
        int storageQueries = 0;
        Double statsFormula = null;
        Double statsStorage = null;

        for (TraceEvent event : events) {
            String name = event.getName() == null ? "" : event.getName();
            if (QUERY_END.equals(name)) {
                queryEnd = event.getDurationMillis();
            } else if (EXECUTION_STATISTICS.equals(name)) {
                statsFormula = extract(FE_DURATION, event.getText());
                statsStorage = extract(SE_DURATION, event.getText());
            } else if (name.startsWith(SE_QUERY_PREFIX) || DIRECT_QUERY_END.equals(name)) {
                storage += event.getDurationMillis();
                storageQueries++;
            }
        }
        trace.storageEngineQueries(storageQueries);

        if (queryEnd == null) {
            // storage figures without an engine total cannot be split against wall time
            return trace.clientMillis(total).build();
        }

        // engine and wall clocks differ; never report more engine time than was observed
        double engine = round(Math.min(Math.max(queryEnd, 0), total));
        double formula;
        if (statsFormula != null || statsStorage != null) {
            storage = statsStorage != null ? statsStorage : Math.max(engine - statsFormula, 0);
            formula = statsFormula != null ? statsFormula : Math.max(engine - storage, 0);
        } else {
            storage = Math.min(storage, engine);
            formula = Math.max(engine - storage, 0);
        }

        return trace
                .engineMillis(engine)
                .clientMillis(round(total - engine))
                .storageEngineMillis(round(storage))
                .formulaEngineMillis(round(formula))
                .build();
    }

    private static Double extract(Pattern pattern, String xml) {
        if (xml == null || xml.isBlank()) {
            return null;
        }
        Matcher m = pattern.matcher(xml);
        if (!m.find()) {
            return null;
        }
        try {
            return Double.parseDouble(m.group(2).trim().toLowerCase(Locale.ROOT));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static double round(double v) {
        return Math.round(v * 1000.0) / 1000.0;
    }
}
