package com.mcr.core.error;

import java.time.Duration;

public class BackendTimeoutException extends BackendException {

    private final String backend;

    public BackendTimeoutException(String backend, Duration timeout) {
        super("BACKEND_TIMEOUT", backend + " call timed out after " + timeout.toMillis() + "ms", null);
        this.backend = backend;
    }

    public String getBackend() {
        return backend;
    }
}
