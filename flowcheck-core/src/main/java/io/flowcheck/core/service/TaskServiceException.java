package io.flowcheck.core.service;

import java.io.Serial;

/// Unchecked exception for transport failures while talking to the task service.
///
/// HTTP error statuses are not transport failures; they come back as
/// {@link ServiceResponse} values.
public class TaskServiceException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4186470112937501552L;

    public TaskServiceException(String message) {
        super(message);
    }

    public TaskServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
