package com.testinsight.analyzer;

/**
 * Folds reports into a KPI result. Each job owns its accumulators.
 *
 * <p>Implementations must produce the same result whatever order reports are folded in.
 *
 * @param <R> the finalized result, serialized as JSON into the job
 */
public interface KpiAccumulator<R> {

    void fold(ReportData report);

    R finish();
}
