package org.pgstudio.kernel.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The connection profiles the kernel knows about, by id.
 *
 * <p>Replacing or removing a profile closes every pool, session and tunnel opened for it, so the
 * next use reconnects with the new settings.
 */
public class ConnectionProfileRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConnectionProfileRegistry.class);

    private final ConcurrentHashMap<String, ConnectionProfile> profiles = new ConcurrentHashMap<>();
    private final ConnectionMultiplexer multiplexer;

    public ConnectionProfileRegistry(ConnectionMultiplexer multiplexer, Collection<ConnectionProfile> initial) {
        this.multiplexer = Objects.requireNonNull(multiplexer, "multiplexer");
        if (initial != null) {
            initial.forEach(p -> profiles.put(p.id(), p));
        }
        log.info("Loaded {} connection profiles", profiles.size());
    }

    public Optional<ConnectionProfile> find(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(profiles.get(id));
    }

    /** @throws UnknownProfileException if no profile has that id */
    public ConnectionProfile require(String id) {
        return find(id).orElseThrow(() -> new UnknownProfileException(id));
    }

    public List<ConnectionProfile> all() {
        return profiles.values().stream()
                .sorted(Comparator.comparing(ConnectionProfile::id))
                .toList();
    }

    public void register(ConnectionProfile profile) {
        Objects.requireNonNull(profile, "profile");
        ConnectionProfile previous = profiles.put(profile.id(), profile);
        if (previous != null && !previous.equals(profile)) {
            log.info("Profile {} changed; closing its connections", profile.id());
            multiplexer.closeAllForProfileId(profile.id());
        }
    }

    public boolean remove(String id) {
        ConnectionProfile removed = profiles.remove(id);
        if (removed == null) return false;
        multiplexer.closeAllForProfileId(id);
        log.info("Removed profile {}", id);
        return true;
    }
}
