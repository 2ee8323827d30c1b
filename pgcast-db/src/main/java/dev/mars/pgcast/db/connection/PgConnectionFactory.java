package dev.mars.pgcast.db.connection;

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

import dev.mars.pgcast.api.error.ConnectionFailureException;
import dev.mars.pgcast.api.error.NotInitializedException;
import dev.mars.pgcast.api.error.PgCastErrorCodes;
import dev.mars.pgcast.api.error.PgCastException;
import dev.mars.pgcast.api.metrics.BroadcastMetrics;
import dev.mars.pgcast.db.config.BroadcastConfig;
import dev.mars.pgcast.db.config.SslSettings;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.net.ClientSSLOptions;
import io.vertx.core.net.PemTrustOptions;
import io.vertx.pgclient.PgBuilder;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.PgConnection;
import io.vertx.pgclient.PgNotification;
import io.vertx.pgclient.SslMode;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.PoolOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Lazily builds and memoizes the {@link ConnectionHandle} for one broadcast context.
 *
 * <p>{@link #getConnection()} is safe under concurrent first callers: only one construction is
 * ever in flight and every caller shares its outcome. A failed construction is forgotten so the
 * next call retries; a successful one is kept until {@link #closeAsync()}.</p>
 *
 * <p>Transport security follows {@link SslSettings}:</p>
 * <ul>
 *   <li>PREFER: TLS without certificate verification. If the server answers that it does not
 *       support SSL, the connection is retried once in plain text and the pool is built the
 *       same way. Any other failure propagates.</li>
 *   <li>REQUIRED: TLS, verifying the server against the supplied CA (or the JVM trust store)
 *       unless verification is switched off. Never downgraded.</li>
 *   <li>DISABLED: plain text.</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class PgConnectionFactory {
    private static final Logger logger = LoggerFactory.getLogger(PgConnectionFactory.class);

    private final Vertx vertx;
    private final Handler<PgNotification> notificationHandler;
    private final BroadcastMetrics metrics;
    private final AtomicReference<Future<ConnectionHandle>> handle = new AtomicReference<>();

    private volatile BroadcastConfig config;
    private volatile boolean closed;

    public PgConnectionFactory(Vertx vertx, Handler<PgNotification> notificationHandler, BroadcastMetrics metrics) {
        this.vertx = Objects.requireNonNull(vertx, "vertx");
        this.notificationHandler = Objects.requireNonNull(notificationHandler, "notificationHandler");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Binds the configuration used by the next connection attempt. An existing handle is kept.
     */
    public void init(BroadcastConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        if (handle.get() != null) {
            logger.info("Configuration rebound; the existing connection handle is kept: {}", config);
        } else {
            logger.info("Connection factory initialized: {}", config);
        }
    }

    public boolean isInitialized() {
        return config != null;
    }

    /**
     * @return the memoized handle, connecting on first use
     */
    public Future<ConnectionHandle> getConnection() {
        if (closed) {
            return Future.failedFuture(new PgCastException(PgCastErrorCodes.CLOSED, "Connection factory is closed"));
        }
        BroadcastConfig current = config;
        if (current == null) {
            return Future.failedFuture(new NotInitializedException("get a connection"));
        }

        while (true) {
            Future<ConnectionHandle> existing = handle.get();
            if (existing != null && !existing.failed()) {
                return existing;
            }
            Promise<ConnectionHandle> promise = Promise.promise();
            if (handle.compareAndSet(existing, promise.future())) {
                createHandle(current).onComplete(ar -> {
                    if (ar.succeeded()) {
                        promise.complete(ar.result());
                    } else {
                        promise.fail(ar.cause());
                    }
                });
                return promise.future();
            }
        }
    }

    /**
     * @return the handle if one has been established, otherwise null
     */
    public ConnectionHandle currentHandle() {
        Future<ConnectionHandle> current = handle.get();
        return current != null && current.succeeded() ? current.result() : null;
    }

    /**
     * Closes the handle, waiting for an in-flight construction first. The factory cannot be used
     * afterwards.
     */
    public Future<Void> closeAsync() {
        closed = true;
        Future<ConnectionHandle> current = handle.getAndSet(null);
        if (current == null) {
            return Future.succeededFuture();
        }
        return current.transform(ar -> ar.succeeded() ? ar.result().close() : Future.<Void>succeededFuture());
    }

    private Future<ConnectionHandle> createHandle(BroadcastConfig cfg) {
        SslSettings ssl = cfg.getSsl();
        PgConnectOptions options;
        try {
            options = applySsl(baseOptions(cfg), ssl);
        } catch (RuntimeException e) {
            return Future.failedFuture(new ConnectionFailureException("Invalid connection settings: " + e.getMessage(), e));
        }

        Future<ConnectionHandle> attempt = connect(cfg, options);
        if (ssl.getMode() == SslSettings.Mode.PREFER) {
            attempt = attempt.recover(err -> {
                if (!isSslUnsupported(err)) {
                    return Future.failedFuture(err);
                }
                logger.info("Server {}:{} does not support SSL, connecting without SSL",
                    options.getHost(), options.getPort());
                metrics.recordSslDowngrade();
                return connect(cfg, baseOptions(cfg).setSslMode(SslMode.DISABLE));
            });
        }

        return attempt
            .onSuccess(h -> logger.info("Notification connection established to {}:{}/{} (ssl={})",
                options.getHost(), options.getPort(), options.getDatabase(), h.isSsl()))
            .recover(err -> {
                logger.error("Failed to establish notification connection to {}:{}/{}: {}",
                    options.getHost(), options.getPort(), options.getDatabase(), err.getMessage());
                return Future.failedFuture(err instanceof ConnectionFailureException ? err
                    : new ConnectionFailureException("Failed to establish notification connection to "
                        + options.getHost() + ":" + options.getPort() + "/" + options.getDatabase(), err));
            });
    }

    private Future<ConnectionHandle> connect(BroadcastConfig cfg, PgConnectOptions options) {
        Future<PgConnection> connecting;
        try {
            connecting = PgConnection.connect(vertx, options);
        } catch (RuntimeException e) {
            connecting = Future.failedFuture(e);
        }
        return connecting.compose(conn -> {
            try {
                return Future.succeededFuture(new ConnectionHandle(createPool(cfg, options), conn, notificationHandler));
            } catch (RuntimeException e) {
                conn.close();
                return Future.failedFuture(e);
            }
        });
    }

    private Pool createPool(BroadcastConfig cfg, PgConnectOptions options) {
        Pool pool = PgBuilder.pool()
            .with(poolOptions(cfg))
            .connectingTo(options)
            .using(vertx)
            .build();

        logger.debug("Created reactive pool for {}:{}/{} (max size {})",
            options.getHost(), options.getPort(), options.getDatabase(), cfg.getMaxPoolSize());
        return pool;
    }

    static PoolOptions poolOptions(BroadcastConfig cfg) {
        return new PoolOptions()
            .setMaxSize(cfg.getMaxPoolSize())
            .setMaxWaitQueueSize(cfg.getMaxWaitQueueSize())
            .setConnectionTimeout((int) cfg.getConnectionTimeout().toMillis())
            .setConnectionTimeoutUnit(TimeUnit.MILLISECONDS)
            .setIdleTimeout((int) cfg.getIdleTimeout().toMillis())
            .setIdleTimeoutUnit(TimeUnit.MILLISECONDS);
    }

    static PgConnectOptions baseOptions(BroadcastConfig cfg) {
        String uri = cfg.getConnectionString();
        if (uri != null && !uri.isBlank()) {
            return PgConnectOptions.fromUri(uri);
        }
        return new PgConnectOptions()
            .setHost(cfg.getHost())
            .setPort(cfg.getPort())
            .setDatabase(cfg.getDatabase())
            .setUser(cfg.getUsername())
            .setPassword(cfg.getPassword());
    }

    static PgConnectOptions applySsl(PgConnectOptions options, SslSettings ssl) {
        switch (ssl.getMode()) {
            case DISABLED -> options.setSslMode(SslMode.DISABLE);
            case PREFER -> {
                options.setSslMode(SslMode.REQUIRE);
                options.setSslOptions(new ClientSSLOptions().setTrustAll(true));
            }
            case REQUIRED -> {
                ClientSSLOptions sslOptions = new ClientSSLOptions();
                if (!ssl.isRejectUnauthorized()) {
                    options.setSslMode(SslMode.REQUIRE);
                    sslOptions.setTrustAll(true);
                } else {
                    // certificate chain and server host name are both checked
                    options.setSslMode(SslMode.VERIFY_FULL);
                    sslOptions.setHostnameVerificationAlgorithm("HTTPS");
                    if (ssl.getCaPem() != null) {
                        sslOptions.setTrustOptions(new PemTrustOptions().addCertValue(Buffer.buffer(ssl.getCaPem())));
                    }
                }
                options.setSslOptions(sslOptions);
            }
        }
        return options;
    }

    /**
     * True if the failure, or any of its causes, is the server declining the SSL request.
     */
    static boolean isSslUnsupported(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 16) {
            String message = current.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                if (lower.contains("does not support ssl") || lower.contains("does not handle ssl")) {
                    return true;
                }
            }
            current = current.getCause();
        }
        return false;
    }
}
