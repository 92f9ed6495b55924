package com.questrail.meshlink.error;

/**
 * A transport operation completed with a failure status.
 *
 * <p>{@link #code()} is the transport's status code, or {@link #NO_CODE} when the
 * transport only supplied an exception.</p>
 */
public final class OperationFailedException extends MeshLinkException
{
    public static final int NO_CODE = -1;

    private final int code;

    public OperationFailedException(String message, int code) {
        super(message + (code == NO_CODE ? "" : " (status " + code + ")"));
        this.code = code;
    }

    public OperationFailedException(String message, Throwable cause) {
        super(message, cause);
        this.code = NO_CODE;
    }

    public int code() {
        return code;
    }
}
