package io.flowcheck.core.execution;

import io.flowcheck.core.check.Check;
import io.flowcheck.core.check.CheckContext;
import io.flowcheck.core.check.CheckOutcome;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/// Runs one check under a time budget and turns every failure mode into a value.
///
/// The check runs on a separate runner thread so that the budget counts from the
/// moment the check starts, not from when its node was queued. On timeout the
/// runner thread is interrupted and the invocation reports a fault; sibling
/// checks are unaffected.
///
/// ### Contracts
/// - **Postcondition**: {@link #invoke} never throws; faults come back as
///   {@link NodeExecution#faulted}
/// - An interrupt of the calling worker cancels the check and restores the
///   interrupt flag
///
/// @implNote Thread-safe. Holds no per-invocation state.
final class CheckInvoker {

    private static final Logger logger = Logger.getLogger(CheckInvoker.class.getName());

    private final ExecutorService checkRunner;
    private final Duration checkTimeout;
    private final Clock clock;

    /// @param checkRunner executor the check bodies run on, unbounded or at least
    /// as large as the worker pool, not null
    /// @param checkTimeout budget of one check, positive, not null
    /// @param clock time source for start and finish stamps, not null
    CheckInvoker(ExecutorService checkRunner, Duration checkTimeout, Clock clock) {
        this.checkRunner = checkRunner;
        this.checkTimeout = checkTimeout;
        this.clock = clock;
    }

    /// Invokes a check and waits for it within the budget.
    ///
    /// @param nodeId id of the node owning the check, not null
    /// @param check the check, not null
    /// @param context shared run context, not null
    /// @return the outcome or fault, never null
    NodeExecution invoke(String nodeId, Check check, CheckContext context) {
        Instant started = clock.instant();
        Future<CheckOutcome> future;
        try {
            future = checkRunner.submit(() -> check.validate(context));
        } catch (RejectedExecutionException e) {
            return NodeExecution.faulted(
                    nodeId, started, clock.instant(), "Check could not be scheduled: " + e.getMessage());
        }

        try {
            CheckOutcome outcome = future.get(checkTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (outcome == null) {
                return NodeExecution.faulted(
                        nodeId, started, clock.instant(), "Check returned no outcome");
            }
            return NodeExecution.completed(nodeId, started, clock.instant(), outcome);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warning("Check timed out after " + describe(checkTimeout) + ": " + nodeId);
            return NodeExecution.faulted(
                    nodeId, started, clock.instant(), "Check timed out after " + describe(checkTimeout));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.warning("Check faulted: " + nodeId + " - " + describe(cause));
            return NodeExecution.faulted(nodeId, started, clock.instant(), describe(cause));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return NodeExecution.faulted(nodeId, started, clock.instant(), "Check interrupted");
        }
    }

    static String describe(Throwable error) {
        String message = error.getMessage();
        String type = error.getClass().getSimpleName();
        return message == null || message.isBlank() ? type : type + ": " + message;
    }

    static String describe(Duration duration) {
        long millis = duration.toMillis();
        if (millis % 1000 == 0) {
            return (millis / 1000) + "s";
        }
        return millis + "ms";
    }
}
