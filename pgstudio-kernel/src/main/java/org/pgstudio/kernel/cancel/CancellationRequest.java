package org.pgstudio.kernel.cancel;

import org.pgstudio.kernel.connection.ConnectionKey;

import java.util.Objects;

public record CancellationRequest(int backendPid, ConnectionKey key, CancelMode mode) {

    public CancellationRequest {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(mode, "mode");
    }
}
