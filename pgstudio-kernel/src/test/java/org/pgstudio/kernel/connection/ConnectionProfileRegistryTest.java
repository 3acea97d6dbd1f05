package org.pgstudio.kernel.connection;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class ConnectionProfileRegistryTest {

    private final ConnectionMultiplexer mux = mock(ConnectionMultiplexer.class);

    @Test
    void findsInitialProfiles() {
        ConnectionProfileRegistry registry = new ConnectionProfileRegistry(mux, List.of(
                ConnectionProfile.of("b", "h", 5432, "u", "db"),
                ConnectionProfile.of("a", "h", 5432, "u", "db")));

        assertThat(registry.find("a")).isPresent();
        assertThat(registry.find("zzz")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
        assertThat(registry.all()).extracting(ConnectionProfile::id).containsExactly("a", "b");
    }

    @Test
    void requireThrowsForUnknownIds() {
        ConnectionProfileRegistry registry = new ConnectionProfileRegistry(mux, null);

        assertThatThrownBy(() -> registry.require("nope"))
                .isInstanceOf(UnknownProfileException.class)
                .hasMessageContaining("nope");
    }

    @Test
    void replacingAProfileClosesItsConnections() {
        ConnectionProfileRegistry registry = new ConnectionProfileRegistry(mux,
                List.of(ConnectionProfile.of("a", "old-host", 5432, "u", "db")));

        registry.register(ConnectionProfile.of("a", "old-host", 5432, "u", "db"));
        verify(mux, never()).closeAllForProfileId(anyString());

        registry.register(ConnectionProfile.of("a", "new-host", 5432, "u", "db"));
        verify(mux).closeAllForProfileId("a");
        assertThat(registry.require("a").host()).isEqualTo("new-host");
    }

    @Test
    void removingAProfileClosesItsConnections() {
        ConnectionProfileRegistry registry = new ConnectionProfileRegistry(mux,
                List.of(ConnectionProfile.of("a", "h", 5432, "u", "db")));

        assertThat(registry.remove("a")).isTrue();
        assertThat(registry.remove("a")).isFalse();
        verify(mux).closeAllForProfileId("a");
        assertThat(registry.find("a")).isEmpty();
    }
}
