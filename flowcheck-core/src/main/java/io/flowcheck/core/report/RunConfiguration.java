package io.flowcheck.core.report;

import io.flowcheck.core.FlowConfig;

/// The configuration options echoed into a report.
///
/// @param scope `FULL` or `QUICK`
/// @param includePerformance whether the performance node was allowed to run
/// @param parallel whether layers ran concurrently
/// @param workerPoolSize bound on concurrently executing checks
/// @param projectId project filter, may be null
/// @param sprintId sprint filter, may be null
public record RunConfiguration(
        String scope,
        boolean includePerformance,
        boolean parallel,
        int workerPoolSize,
        String projectId,
        String sprintId) {

    /// Captures the reportable options of a configuration.
    public static RunConfiguration of(FlowConfig config) {
        return new RunConfiguration(
                config.getScope().name(),
                config.isIncludePerformance(),
                config.isParallel(),
                config.getWorkerPoolSize(),
                config.getFilter().projectId(),
                config.getFilter().sprintId());
    }
}
