package io.flowcheck.core.check;

/// Severity of a {@link Finding}.
///
/// A critical finding fails the outcome that carries it and blocks every node
/// that depends on the reporting node. A warning only degrades the outcome.
public enum Severity {
    CRITICAL,
    WARNING
}
