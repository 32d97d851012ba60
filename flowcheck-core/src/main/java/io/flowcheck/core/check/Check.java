package io.flowcheck.core.check;

/// One validation unit scheduled by the flow.
///
/// A check reads the store (and, for behavior checks, the task service) and
/// reports what it found. It never mutates the records it inspects and never
/// retries internally.
///
/// ### Contracts
/// - **Postcondition**: returns a non-null outcome, or throws
/// - Any exception is a fault. The engine records the node as `FAILED` with the
///   exception message and carries on with unrelated nodes.
/// - Running longer than the configured check timeout is also a fault. The
///   running thread is interrupted.
///
/// @implNote Implementations must be stateless or otherwise safe to invoke from
/// a worker thread.
/// @see OutcomeRecorder
/// @see CheckRegistry
@FunctionalInterface
public interface Check {

    /// Runs the check.
    ///
    /// @param context store, service client and configuration for this run, not null
    /// @return the structured outcome, never null
    /// @throws Exception on any unexpected failure
    CheckOutcome validate(CheckContext context) throws Exception;
}
