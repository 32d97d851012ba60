package io.flowcheck.core.check.builtin;

import io.flowcheck.core.PerformanceThresholds;
import io.flowcheck.core.check.Check;
import io.flowcheck.core.check.CheckContext;
import io.flowcheck.core.check.CheckOutcome;
import io.flowcheck.core.check.FindingCategory;
import io.flowcheck.core.check.OutcomeRecorder;
import io.flowcheck.core.check.Severity;
import io.flowcheck.core.service.ServiceResponse;
import io.flowcheck.core.service.TaskServiceClient;
import io.flowcheck.core.store.StoreFilter;
import io.flowcheck.core.store.TaskStore;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Logger;

/// Times store queries and task service operations against the configured
/// {@link PerformanceThresholds}.
///
/// A breached budget is a warning, never critical. Measured durations are
/// reported in the outcome details in milliseconds. Service benchmarks run only
/// when a task service is configured; their probe tasks are deleted afterwards.
///
/// @implNote The concurrent create benchmark uses its own short-lived pool,
/// sized to the number of concurrent creates.
public final class PerformanceCheck implements Check {

    private static final Logger logger = Logger.getLogger(PerformanceCheck.class.getName());

    public static final String NAME = "Performance Validator";

    @Override
    public CheckOutcome validate(CheckContext context) throws InterruptedException {
        OutcomeRecorder recorder = new OutcomeRecorder(NAME);
        PerformanceThresholds budgets = context.getConfig().getPerformanceThresholds();

        benchmarkStore(recorder, context.getStore(), context.getFilter(), budgets);

        Optional<TaskServiceClient> service = context.getTaskService();
        if (service.isEmpty()) {
            recorder.detail("serviceBenchmarks", "skipped: no task service configured");
            return recorder.toOutcome();
        }
        ServiceProbe probe = new ServiceProbe(service.get(), "flowcheck-perf");
        try {
            benchmarkService(recorder, probe, budgets);
        } finally {
            probe.cleanup();
        }
        return recorder.toOutcome();
    }

    private void benchmarkStore(
            OutcomeRecorder recorder,
            TaskStore store,
            StoreFilter filter,
            PerformanceThresholds budgets) {
        measure(recorder, "storeListAll", budgets.listAll(), () -> store.findTasks(filter));
        measure(
                recorder,
                "storeFilteredQuery",
                budgets.filteredQuery(),
                () -> store.findTasks(filter.withStatus(TaskLifecycle.IN_PROGRESS)));
    }

    private void benchmarkService(
            OutcomeRecorder recorder, ServiceProbe probe, PerformanceThresholds budgets)
            throws InterruptedException {
        TaskServiceClient client = probe.client();

        int bulkCount = budgets.bulkCreateCount();
        List<String> ids =
                measure(
                        recorder,
                        "serviceBulkCreate",
                        budgets.bulkCreate(),
                        () -> {
                            List<String> created = new ArrayList<>();
                            for (int i = 0; i < bulkCount; i++) {
                                probe.createTask("bulk-" + i).ifPresent(created::add);
                            }
                            return created;
                        });
        recorder.expect(
                ids.size() == bulkCount,
                Severity.WARNING,
                FindingCategory.PERFORMANCE_THRESHOLD,
                "tasks",
                null,
                "Bulk create stored " + ids.size() + " of " + bulkCount + " tasks");

        measure(
                recorder,
                "serviceListAll",
                budgets.listAll(),
                () -> client.listTasks(Map.of("per_page", "1000")));

        if (!ids.isEmpty()) {
            ServiceResponse update =
                    measure(
                            recorder,
                            "serviceSingleUpdate",
                            budgets.singleUpdate(),
                            () ->
                                    client.updateTask(
                                            ids.get(0),
                                            ServiceProbe.transitionTo(TaskLifecycle.IN_PROGRESS)));
            if (!update.isSuccess()) {
                logger.fine("Benchmark update answered HTTP " + update.statusCode());
            }
        }

        measure(
                recorder,
                "serviceFilteredQuery",
                budgets.filteredQuery(),
                () -> client.listTasks(Map.of("status", TaskLifecycle.IN_PROGRESS)));

        concurrentCreates(recorder, probe, budgets);
    }

    private void concurrentCreates(
            OutcomeRecorder recorder, ServiceProbe probe, PerformanceThresholds budgets)
            throws InterruptedException {
        int count = budgets.concurrentCreateCount();
        ExecutorService pool = Executors.newFixedThreadPool(count);
        try {
            long start = System.nanoTime();
            List<Future<Optional<String>>> futures = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                String label = "concurrent-" + i;
                futures.add(pool.submit(() -> probe.createTask(label)));
            }
            int stored = 0;
            for (Future<Optional<String>> future : futures) {
                try {
                    if (future.get().isPresent()) {
                        stored++;
                    }
                } catch (ExecutionException e) {
                    logger.warning("Concurrent create failed: " + e.getCause());
                }
            }
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            recordTiming(recorder, "serviceConcurrentCreate", budgets.concurrentCreate(), elapsed);
            recorder.expect(
                    stored == count,
                    Severity.WARNING,
                    FindingCategory.PERFORMANCE_THRESHOLD,
                    "tasks",
                    null,
                    "Concurrent create stored " + stored + " of " + count + " tasks");
        } finally {
            pool.shutdownNow();
            pool.awaitTermination(5, TimeUnit.SECONDS);
        }
    }

    private static <T> T measure(
            OutcomeRecorder recorder, String metric, Duration budget, Supplier<T> action) {
        long start = System.nanoTime();
        T result = action.get();
        recordTiming(recorder, metric, budget, Duration.ofNanos(System.nanoTime() - start));
        return result;
    }

    private static void recordTiming(
            OutcomeRecorder recorder, String metric, Duration budget, Duration elapsed) {
        recorder.detail(metric + "Ms", elapsed.toMillis());
        recorder.expect(
                elapsed.compareTo(budget) <= 0,
                Severity.WARNING,
                FindingCategory.PERFORMANCE_THRESHOLD,
                "tasks",
                metric,
                String.format(
                        "%s took %d ms, budget %d ms", metric, elapsed.toMillis(), budget.toMillis()));
    }
}
