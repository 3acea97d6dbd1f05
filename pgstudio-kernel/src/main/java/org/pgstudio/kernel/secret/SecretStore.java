package org.pgstudio.kernel.secret;

import java.util.Optional;

/** Password lookup by connection profile id. Implementations must never log the value. */
public interface SecretStore {

    Optional<String> password(String profileId);
}
