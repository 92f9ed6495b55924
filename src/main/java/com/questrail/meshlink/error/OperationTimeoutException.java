package com.questrail.meshlink.error;

import java.time.Duration;

/**
 * A transport operation did not complete within its timeout.
 */
public final class OperationTimeoutException extends MeshLinkException
{
    private final String operation;
    private final Duration timeout;

    public OperationTimeoutException(String operation, Duration timeout) {
        super(operation + " timed out after " + timeout.toMillis() + " ms");
        this.operation = operation;
        this.timeout = timeout;
    }

    public String operation() {
        return operation;
    }

    public Duration timeout() {
        return timeout;
    }
}
