package org.pgstudio.kernel.connection;

import java.util.Locale;

/** libpq-style TLS modes, passed to the driver as {@code sslmode}. */
public enum SslMode {
    DISABLE,
    ALLOW,
    PREFER,
    REQUIRE,
    VERIFY_CA,
    VERIFY_FULL;

    public String driverValue() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    public boolean encrypted() {
        return this != DISABLE;
    }
}
