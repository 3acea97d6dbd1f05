package org.pgstudio.kernel.connection;

import java.util.Objects;

/**
 * Identifies one pool and the namespace for its session leases: profile id plus target database.
 */
public record ConnectionKey(String profileId, String database) {

    public ConnectionKey {
        Objects.requireNonNull(profileId, "profileId");
        Objects.requireNonNull(database, "database");
    }

    public boolean belongsTo(String id) {
        return profileId.equals(id);
    }

    @Override
    public String toString() {
        return profileId + ":" + database;
    }
}
