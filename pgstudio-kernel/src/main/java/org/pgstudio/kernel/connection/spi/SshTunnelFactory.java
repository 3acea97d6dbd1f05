package org.pgstudio.kernel.connection.spi;

import org.pgstudio.kernel.connection.ConnectionException;
import org.pgstudio.kernel.connection.SshTunnelDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Resolves an {@link SshTunnelProvider} and opens tunnels through it.
 *
 * <p>Providers come from Spring beans and from {@link ServiceLoader}; Spring wins if IDs collide.
 * Without a forced provider ID the lexicographically first provider is used.
 */
public final class SshTunnelFactory {
    private static final Logger log = LoggerFactory.getLogger(SshTunnelFactory.class);

    private final List<SshTunnelProvider> providers;
    private final String forcedProviderId;

    public SshTunnelFactory(Collection<SshTunnelProvider> springProviders, String forcedProviderId) {
        this(springProviders, forcedProviderId, true);
    }

    SshTunnelFactory(Collection<SshTunnelProvider> springProviders, String forcedProviderId, boolean useServiceLoader) {
        List<SshTunnelProvider> fromSpring = springProviders == null ? List.of() : List.copyOf(springProviders);
        List<SshTunnelProvider> fromServiceLoader = useServiceLoader
                ? ServiceLoader.load(SshTunnelProvider.class).stream().map(ServiceLoader.Provider::get).toList()
                : List.of();

        Map<String, SshTunnelProvider> merged = new LinkedHashMap<>();
        for (SshTunnelProvider p : fromServiceLoader) merged.put(p.id(), p);
        for (SshTunnelProvider p : fromSpring) merged.put(p.id(), p);

        this.providers = merged.values().stream()
                .sorted(Comparator.comparing(SshTunnelProvider::id))
                .toList();
        this.forcedProviderId = forcedProviderId == null || forcedProviderId.isBlank() ? null : forcedProviderId;

        log.info("Discovered SshTunnelProviders: {}", ids());
    }

    public List<String> ids() {
        return providers.stream().map(SshTunnelProvider::id).toList();
    }

    /**
     * Opens a tunnel to {@code targetHost:targetPort}.
     *
     * @throws ConnectionException wrapping whatever the provider failed with
     */
    public SshTunnel open(SshTunnelDescriptor ssh, String targetHost, int targetPort) {
        Objects.requireNonNull(ssh, "ssh");
        SshTunnelProvider provider = resolveProvider();
        try {
            SshTunnel tunnel = provider.open(ssh, targetHost, targetPort);
            if (tunnel == null) {
                throw new IllegalStateException("provider '" + provider.id() + "' returned no tunnel");
            }
            log.info("Opened SSH tunnel via provider '{}' {} -> {}:{} on {}:{}",
                    provider.id(), ssh, targetHost, targetPort, tunnel.localHost(), tunnel.localPort());
            return tunnel;
        } catch (Exception e) {
            throw new ConnectionException("SSH connection failed: " + e.getMessage(), e);
        }
    }

    private SshTunnelProvider resolveProvider() {
        if (forcedProviderId != null) {
            return providers.stream()
                    .filter(p -> forcedProviderId.equals(p.id()))
                    .findFirst()
                    .orElseThrow(() -> new ConnectionException(
                            "SSH connection failed: forced SshTunnelProvider '" + forcedProviderId
                                    + "' not found. Available: " + ids()));
        }
        if (providers.isEmpty()) {
            throw new ConnectionException("SSH connection failed: no SshTunnelProvider is registered");
        }
        return providers.get(0);
    }
}
