package com.querygate.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Distribution of repeated runs in analyze mode. The fastest run is the headline figure.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PerformanceSummary {
    int runs;
    double fastestMillis;
    double slowestMillis;
    double meanMillis;
    double medianMillis;
    Double averageStorageEngineMillis;
    Double averageFormulaEngineMillis;
    Double storageEnginePercent;
    Double formulaEnginePercent;
    List<Double> runMillis;

    public static PerformanceSummary of(List<ExecutionTrace> traces) {
        if (traces == null || traces.isEmpty()) {
            throw new IllegalArgumentException("at least one trace is required");
        }
        List<Double> totals = traces.stream().map(ExecutionTrace::getTotalMillis).toList();
        List<Double> sorted = totals.stream().sorted().toList();
        double mean = totals.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        int n = sorted.size();
        double median = n % 2 == 1 ? sorted.get(n / 2) : (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;

        Double avgSe = averageOf(traces, true);
        Double avgFe = averageOf(traces, false);
        Double sePct = null;
        Double fePct = null;
        if (avgSe != null && avgFe != null && avgSe + avgFe > 0) {
            sePct = round(avgSe / (avgSe + avgFe) * 100.0);
            fePct = round(avgFe / (avgSe + avgFe) * 100.0);
        }

        return PerformanceSummary.builder()
                .runs(n)
                .fastestMillis(sorted.get(0))
                .slowestMillis(sorted.get(n - 1))
                .meanMillis(round(mean))
                .medianMillis(round(median))
                .averageStorageEngineMillis(avgSe)
                .averageFormulaEngineMillis(avgFe)
                .storageEnginePercent(sePct)
                .formulaEnginePercent(fePct)
                .runMillis(totals)
                .build();
    }

    private static Double averageOf(List<ExecutionTrace> traces, boolean storage) {
        double sum = 0;
        int count = 0;
        for (ExecutionTrace t : traces) {
            Double v = storage ? t.getStorageEngineMillis() : t.getFormulaEngineMillis();
            if (v != null) {
                sum += v;
                count++;
            }
        }
        return count == 0 ? null : round(sum / count);
    }

    private static double round(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
