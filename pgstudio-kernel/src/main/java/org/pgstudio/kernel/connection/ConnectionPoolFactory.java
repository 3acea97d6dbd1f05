package org.pgstudio.kernel.connection;

import org.pgstudio.kernel.config.KernelProperties;

@FunctionalInterface
public interface ConnectionPoolFactory {

    ConnectionPool create(ConnectionKey key, JdbcTarget target, KernelProperties.Pool settings);
}
