package org.pgstudio.kernel.secret;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Secret store backed by {@code pgstudio.secrets.passwords.<profileId>}.
 *
 * <p>Fine for local use. Deployments should feed these through environment variables or register
 * their own {@link SecretStore} bean.
 */
public class ConfiguredSecretStore implements SecretStore {

    private final Map<String, String> passwords = new ConcurrentHashMap<>();

    public ConfiguredSecretStore(Map<String, String> passwords) {
        if (passwords != null) {
            passwords.forEach((k, v) -> {
                if (k != null && v != null) this.passwords.put(k, v);
            });
        }
    }

    @Override
    public Optional<String> password(String profileId) {
        if (profileId == null) return Optional.empty();
        return Optional.ofNullable(passwords.get(profileId));
    }

    public void store(String profileId, String password) {
        passwords.put(profileId, password);
    }

    public void delete(String profileId) {
        passwords.remove(profileId);
    }
}
