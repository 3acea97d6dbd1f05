package org.pgstudio.kernel.connection.spi;

import org.junit.jupiter.api.Test;
import org.pgstudio.kernel.connection.ConnectionException;
import org.pgstudio.kernel.connection.SshTunnelDescriptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SshTunnelFactoryTest {

    private static final SshTunnelDescriptor SSH = new SshTunnelDescriptor(true, "bastion", 22, "ops", null);

    @Test
    void firstProviderByIdIsDefault() {
        SshTunnelFactory f = new SshTunnelFactory(List.of(provider("zeta", 2), provider("alpha", 1)), null, false);

        assertEquals(List.of("alpha", "zeta"), f.ids());
        assertEquals(1, f.open(SSH, "db", 5432).localPort());
    }

    @Test
    void forcedProviderIsUsed() {
        SshTunnelFactory f = new SshTunnelFactory(List.of(provider("zeta", 2), provider("alpha", 1)), "zeta", false);

        assertEquals(2, f.open(SSH, "db", 5432).localPort());
    }

    @Test
    void missingForcedProviderFails() {
        SshTunnelFactory f = new SshTunnelFactory(List.of(provider("alpha", 1)), "nope", false);

        ConnectionException e = assertThrows(ConnectionException.class, () -> f.open(SSH, "db", 5432));
        assertTrue(e.getMessage().contains("nope"));
    }

    @Test
    void noProvidersFails() {
        SshTunnelFactory f = new SshTunnelFactory(List.of(), null, false);

        ConnectionException e = assertThrows(ConnectionException.class, () -> f.open(SSH, "db", 5432));
        assertTrue(e.getMessage().startsWith("SSH connection failed"));
    }

    @Test
    void providerReturningNothingFails() {
        SshTunnelProvider empty = new SshTunnelProvider() {
            @Override
            public String id() {
                return "empty";
            }

            @Override
            public SshTunnel open(SshTunnelDescriptor ssh, String targetHost, int targetPort) {
                return null;
            }
        };
        SshTunnelFactory f = new SshTunnelFactory(List.of(empty), null, false);

        assertThrows(ConnectionException.class, () -> f.open(SSH, "db", 5432));
    }

    private static SshTunnelProvider provider(String id, int port) {
        return new SshTunnelProvider() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public SshTunnel open(SshTunnelDescriptor ssh, String targetHost, int targetPort) {
                return new SshTunnel() {
                    @Override
                    public String localHost() {
                        return "127.0.0.1";
                    }

                    @Override
                    public int localPort() {
                        return port;
                    }

                    @Override
                    public boolean isOpen() {
                        return true;
                    }

                    @Override
                    public void close() {
                    }
                };
            }
        };
    }
}
