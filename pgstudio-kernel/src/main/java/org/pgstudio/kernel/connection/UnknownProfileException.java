package org.pgstudio.kernel.connection;

import org.pgstudio.kernel.KernelException;

public class UnknownProfileException extends KernelException {

    public UnknownProfileException(String profileId) {
        super("Unknown connection profile '" + profileId + "'");
    }
}
