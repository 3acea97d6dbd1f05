package org.pgstudio.kernel;

/** Base type for failures the kernel surfaces to its callers. */
public class KernelException extends RuntimeException {

    public KernelException(String message) {
        super(message);
    }

    public KernelException(String message, Throwable cause) {
        super(message, cause);
    }
}
