package io.flowcheck.core.exception;

import java.io.Serial;

/// Thrown when an embedded-structure column does not hold the expected list or object.
///
/// @see io.flowcheck.core.check.StructuredFieldParser
public class MalformedStructureException extends Exception {

    @Serial private static final long serialVersionUID = 1740315629012884731L;

    public MalformedStructureException(String message) {
        super(message);
    }

    public MalformedStructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
