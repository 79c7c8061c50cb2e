package io.conclave.core.exception;

import java.io.Serial;

/// Thrown when a discussion is started with an unusable configuration.
///
/// Raised before any round runs, so no worker has been invoked when it surfaces.
public class ControllerFaultException extends RuntimeException {
    @Serial private static final long serialVersionUID = 4127093386155927410L;

    public ControllerFaultException(String message) {
        super(message);
    }
}
