package io.flowcheck.core.exception;

import java.io.Serial;

/// Thrown when a check id has no registered factory.
///
/// @see io.flowcheck.core.check.CheckRegistry#createCheck(String)
public class CheckNotFoundException extends Exception {

    @Serial private static final long serialVersionUID = -2748133019573618845L;

    public CheckNotFoundException(String message) {
        super(message);
    }
}
