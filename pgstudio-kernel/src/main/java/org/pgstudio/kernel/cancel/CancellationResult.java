package org.pgstudio.kernel.cancel;

/**
 * Outcome of a cancel or terminate request.
 *
 * <p>{@code success} means the server accepted the signal. The target statement may still have
 * finished on its own first.
 */
public record CancellationResult(CancellationRequest request, boolean success, String message) {

    static CancellationResult ok(CancellationRequest request) {
        String verb = request.mode() == CancelMode.CANCEL ? "Query cancelled" : "Backend terminated";
        return new CancellationResult(request, true, verb + " (PID: " + request.backendPid() + ")");
    }

    static CancellationResult failed(CancellationRequest request, String message) {
        return new CancellationResult(request, false, message);
    }
}
