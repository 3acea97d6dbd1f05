package org.pgstudio.kernel.config;

import org.pgstudio.cursor.StreamingCursorReader;
import org.pgstudio.cursor.StreamingPolicy;
import org.pgstudio.kernel.cancel.CancellationController;
import org.pgstudio.kernel.connection.ConnectionMultiplexer;
import org.pgstudio.kernel.connection.ConnectionPoolFactory;
import org.pgstudio.kernel.connection.ConnectionProfileRegistry;
import org.pgstudio.kernel.connection.ConnectionSettingsResolver;
import org.pgstudio.kernel.connection.DriverManagerSessionConnector;
import org.pgstudio.kernel.connection.HikariConnectionPoolFactory;
import org.pgstudio.kernel.connection.SessionConnector;
import org.pgstudio.kernel.connection.spi.SshTunnelFactory;
import org.pgstudio.kernel.connection.spi.SshTunnelProvider;
import org.pgstudio.kernel.executor.ScriptExecutor;
import org.pgstudio.kernel.history.InMemoryQueryHistory;
import org.pgstudio.kernel.history.QueryHistorySink;
import org.pgstudio.kernel.secret.ConfiguredSecretStore;
import org.pgstudio.kernel.secret.SecretStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class KernelConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService scriptWorkers(KernelProperties props) {
        AtomicInteger n = new AtomicInteger();
        ThreadFactory threads = r -> {
            Thread t = new Thread(r, "pgstudio-script-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        int size = props.execution().workerThreads();
        return size > 0 ? Executors.newFixedThreadPool(size, threads) : Executors.newCachedThreadPool(threads);
    }

    @Bean
    @ConditionalOnMissingBean(SecretStore.class)
    public SecretStore secretStore(ConnectionProfilesProperties profiles) {
        return new ConfiguredSecretStore(profiles.getSecrets() == null ? null : profiles.getSecrets().getPasswords());
    }

    @Bean
    public SshTunnelFactory sshTunnelFactory(ObjectProvider<SshTunnelProvider> providers, KernelProperties props) {
        return new SshTunnelFactory(providers.orderedStream().toList(), props.ssh().provider());
    }

    @Bean
    public ConnectionSettingsResolver connectionSettingsResolver(SecretStore secrets, SshTunnelFactory tunnels) {
        return new ConnectionSettingsResolver(secrets, tunnels);
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionPoolFactory.class)
    public ConnectionPoolFactory connectionPoolFactory() {
        return new HikariConnectionPoolFactory();
    }

    @Bean
    @ConditionalOnMissingBean(SessionConnector.class)
    public SessionConnector sessionConnector() {
        return new DriverManagerSessionConnector();
    }

    @Bean
    public ConnectionMultiplexer connectionMultiplexer(ConnectionSettingsResolver resolver,
                                                       ConnectionPoolFactory poolFactory,
                                                       SessionConnector sessionConnector,
                                                       KernelProperties props) {
        return new ConnectionMultiplexer(resolver, poolFactory, sessionConnector, props);
    }

    @Bean
    public ConnectionProfileRegistry connectionProfileRegistry(ConnectionMultiplexer multiplexer,
                                                               ConnectionProfilesProperties profiles) {
        return new ConnectionProfileRegistry(multiplexer, profiles.toProfiles());
    }

    @Bean
    public InMemoryQueryHistory queryHistory(KernelProperties props) {
        return new InMemoryQueryHistory(props.history().maxEntries(), props.history().maxQueryLength());
    }

    @Bean
    public StreamingCursorReader streamingCursorReader(KernelProperties props) {
        return new StreamingCursorReader(props.streaming().batchSize());
    }

    @Bean
    public StreamingPolicy streamingPolicy(KernelProperties props) {
        return new StreamingPolicy(props.streaming().limitThreshold());
    }

    @Bean
    public CancellationController cancellationController(ConnectionMultiplexer multiplexer) {
        return new CancellationController(multiplexer);
    }

    @Bean
    public ScriptExecutor scriptExecutor(ConnectionMultiplexer multiplexer,
                                         QueryHistorySink history,
                                         StreamingCursorReader cursorReader,
                                         StreamingPolicy streamingPolicy,
                                         CancellationController cancellation,
                                         ExecutorService scriptWorkers,
                                         KernelProperties props) {
        return new ScriptExecutor(multiplexer, history, cursorReader, streamingPolicy, cancellation,
                scriptWorkers, props);
    }
}
