package io.flowcheck.core;

import java.time.Duration;

/// Time budgets applied by the performance check. Exceeding one is a warning.
///
/// @param bulkCreate budget for creating {@code bulkCreateCount} tasks through the service
/// @param bulkCreateCount number of tasks in the bulk create benchmark
/// @param listAll budget for listing every task
/// @param singleUpdate budget for one status update
/// @param filteredQuery budget for a status-filtered query
/// @param concurrentCreate budget for {@code concurrentCreateCount} parallel creates
/// @param concurrentCreateCount number of tasks in the concurrent create benchmark
public record PerformanceThresholds(
        Duration bulkCreate,
        int bulkCreateCount,
        Duration listAll,
        Duration singleUpdate,
        Duration filteredQuery,
        Duration concurrentCreate,
        int concurrentCreateCount) {

    /// Returns the default budgets: 100 creates in 5 s, list in 1 s, update in
    /// 100 ms, filtered query in 500 ms, 10 concurrent creates in 10 s.
    public static PerformanceThresholds defaults() {
        return new PerformanceThresholds(
                Duration.ofSeconds(5),
                100,
                Duration.ofSeconds(1),
                Duration.ofMillis(100),
                Duration.ofMillis(500),
                Duration.ofSeconds(10),
                10);
    }
}
