package io.flowcheck.core.exception;

import java.io.Serial;

/// Thrown when a flow graph cannot be built.
///
/// Raised for duplicate or blank node ids, self dependencies, unknown dependency
/// ids, unknown check ids and dependency cycles. It is always raised before any
/// node runs, so no report exists for a run that fails this way.
///
/// @see io.flowcheck.core.flow.FlowGraph#build
public class FlowGraphException extends IllegalStateException {

    @Serial private static final long serialVersionUID = 6032617720994811354L;

    public FlowGraphException(String message) {
        super(message);
    }

    public FlowGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
