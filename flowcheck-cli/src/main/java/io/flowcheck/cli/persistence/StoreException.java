package io.flowcheck.cli.persistence;

import java.io.Serial;

/// Unchecked exception for failures while reading the task store over JDBC.
///
/// Thrown from inside a check, it ends that check's node as a fault.
public class StoreException extends RuntimeException {

    @Serial private static final long serialVersionUID = -2907145318460023377L;

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
