package dev.mars.pgcast.db.config;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable configuration consumed by {@code PgBroadcast.init(...)}.
 *
 * <p>The endpoint is either a {@code postgresql://} connection string or the discrete
 * host/port/database/username/password fields. When a connection string is present it wins.
 * Transport security always comes from {@link SslSettings}, never from the connection string.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public final class BroadcastConfig {
    private final String connectionString;
    private final String host;
    private final int port;
    private final String database;
    private final String username;
    private final String password;
    private final SslSettings ssl;
    private final int maxPoolSize;
    private final int maxWaitQueueSize;
    private final Duration connectionTimeout;
    private final Duration idleTimeout;
    private final Duration lockTimeout;
    private final boolean isolateCallbackFailures;

    private BroadcastConfig(Builder builder) {
        this.connectionString = blankToNull(builder.connectionString);
        if (connectionString == null) {
            this.host = Objects.requireNonNull(builder.host, "Host cannot be null");
            this.database = Objects.requireNonNull(builder.database, "Database cannot be null");
            this.username = Objects.requireNonNull(builder.username, "Username cannot be null");
        } else {
            this.host = builder.host;
            this.database = builder.database;
            this.username = builder.username;
        }
        this.port = builder.port;
        this.password = builder.password;
        this.ssl = Objects.requireNonNull(builder.ssl, "ssl");
        this.maxPoolSize = builder.maxPoolSize;
        this.maxWaitQueueSize = builder.maxWaitQueueSize;
        this.connectionTimeout = builder.connectionTimeout;
        this.idleTimeout = builder.idleTimeout;
        this.lockTimeout = builder.lockTimeout;
        this.isolateCallbackFailures = builder.isolateCallbackFailures;

        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Database port must be between 1 and 65535");
        }
        if (maxPoolSize < 1) {
            throw new IllegalArgumentException("Pool max size must be at least 1");
        }
        if (lockTimeout.isNegative() || lockTimeout.isZero()) {
            throw new IllegalArgumentException("Lock timeout must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public String getConnectionString() {
        return connectionString;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getDatabase() {
        return database;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public SslSettings getSsl() {
        return ssl;
    }

    public int getMaxPoolSize() {
        return maxPoolSize;
    }

    public int getMaxWaitQueueSize() {
        return maxWaitQueueSize;
    }

    public Duration getConnectionTimeout() {
        return connectionTimeout;
    }

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    /**
     * Maximum time a subscribe/unsubscribe call waits for the in-process lock of its channel.
     */
    public Duration getLockTimeout() {
        return lockTimeout;
    }

    /**
     * When true a failing handler is logged and the remaining handlers still receive the
     * notification. When false (the default) the failure stops the fan-out.
     */
    public boolean isIsolateCallbackFailures() {
        return isolateCallbackFailures;
    }

    @Override
    public String toString() {
        return "BroadcastConfig{" +
            (connectionString != null
                ? "connectionString=<redacted>"
                : "host=" + host + ", port=" + port + ", database=" + database + ", username=" + username) +
            ", ssl=" + ssl +
            ", maxPoolSize=" + maxPoolSize +
            ", maxWaitQueueSize=" + maxWaitQueueSize +
            ", connectionTimeout=" + connectionTimeout +
            ", idleTimeout=" + idleTimeout +
            ", lockTimeout=" + lockTimeout +
            ", isolateCallbackFailures=" + isolateCallbackFailures +
            '}';
    }

    /**
     * Builder for BroadcastConfig.
     */
    public static class Builder {
        private String connectionString;
        private String host = "localhost";
        private int port = 5432;
        private String database;
        private String username;
        private String password;
        private SslSettings ssl = SslSettings.prefer();
        private int maxPoolSize = 16;
        private int maxWaitQueueSize = 128;
        private Duration connectionTimeout = Duration.ofSeconds(30);
        private Duration idleTimeout = Duration.ofMinutes(10);
        private Duration lockTimeout = Duration.ofSeconds(30);
        private boolean isolateCallbackFailures = false;

        public Builder connectionString(String connectionString) {
            this.connectionString = connectionString;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder database(String database) {
            this.database = database;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder ssl(SslSettings ssl) {
            this.ssl = ssl;
            return this;
        }

        public Builder maxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
            return this;
        }

        public Builder maxWaitQueueSize(int maxWaitQueueSize) {
            this.maxWaitQueueSize = maxWaitQueueSize;
            return this;
        }

        public Builder connectionTimeout(Duration connectionTimeout) {
            this.connectionTimeout = Objects.requireNonNull(connectionTimeout, "connectionTimeout");
            return this;
        }

        public Builder idleTimeout(Duration idleTimeout) {
            this.idleTimeout = Objects.requireNonNull(idleTimeout, "idleTimeout");
            return this;
        }

        public Builder lockTimeout(Duration lockTimeout) {
            this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
            return this;
        }

        public Builder isolateCallbackFailures(boolean isolateCallbackFailures) {
            this.isolateCallbackFailures = isolateCallbackFailures;
            return this;
        }

        public BroadcastConfig build() {
            return new BroadcastConfig(this);
        }
    }
}
