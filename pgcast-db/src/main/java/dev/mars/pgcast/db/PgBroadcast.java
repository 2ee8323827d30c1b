package dev.mars.pgcast.db;

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

import dev.mars.pgcast.api.BroadcastService;
import dev.mars.pgcast.api.NotificationHandler;
import dev.mars.pgcast.api.Subscription;
import dev.mars.pgcast.api.metrics.BroadcastMetrics;
import dev.mars.pgcast.db.config.BroadcastConfig;
import dev.mars.pgcast.db.config.PgCastConfiguration;
import dev.mars.pgcast.db.connection.ConnectionHandle;
import dev.mars.pgcast.db.connection.PgConnectionFactory;
import dev.mars.pgcast.db.metrics.MicrometerBroadcastMetrics;
import dev.mars.pgcast.db.metrics.NoOpBroadcastMetrics;
import dev.mars.pgcast.db.pubsub.ChannelRegistry;
import dev.mars.pgcast.db.pubsub.NotificationDispatcher;
import dev.mars.pgcast.db.pubsub.NotificationPublisher;
import dev.mars.pgcast.db.pubsub.SubscriptionCoordinator;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.sqlclient.Pool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;

/**
 * PostgreSQL LISTEN/NOTIFY broadcast context.
 *
 * <p>Owns the channel registry, the connection factory and the components built on them. There
 * is no global instance: create one per application (or per database) and hand it to whatever
 * needs pub/sub.</p>
 *
 * <pre>{@code
 * PgBroadcast broadcast = new PgBroadcast(vertx);
 * broadcast.init(new PgCastConfiguration().getBroadcastConfig());
 *
 * broadcast.subscribe("docs:42", payload -> reload(payload))
 *     .compose(sub -> broadcast.publish("docs:42", "updated"));
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class PgBroadcast implements BroadcastService, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PgBroadcast.class);

    private final ChannelRegistry registry = new ChannelRegistry();
    private final NotificationDispatcher dispatcher;
    private final PgConnectionFactory connectionFactory;
    private final SubscriptionCoordinator coordinator;
    private final NotificationPublisher publisher;

    public PgBroadcast(Vertx vertx) {
        this(vertx, NoOpBroadcastMetrics.INSTANCE);
    }

    public PgBroadcast(Vertx vertx, MeterRegistry meterRegistry) {
        this(vertx, new MicrometerBroadcastMetrics(meterRegistry));
        Gauge.builder("pgcast.channels.active", registry, ChannelRegistry::channelCount)
            .description("Channels this process is listening on")
            .register(meterRegistry);
    }

    public PgBroadcast(Vertx vertx, BroadcastMetrics metrics) {
        Objects.requireNonNull(vertx, "vertx");
        Objects.requireNonNull(metrics, "metrics");
        this.dispatcher = new NotificationDispatcher(registry, metrics);
        this.connectionFactory = new PgConnectionFactory(vertx, dispatcher, metrics);
        this.coordinator = new SubscriptionCoordinator(vertx, registry,
            () -> connectionFactory.getConnection().map(ConnectionHandle::channelCommands), metrics);
        this.publisher = new NotificationPublisher(this::getPooledConnection, metrics);
    }

    /**
     * Creates an initialized context from layered configuration. Micrometer metrics are recorded
     * in the given registry unless {@code pgcast.metrics.enabled} is false or the registry is null.
     */
    public static PgBroadcast create(Vertx vertx, PgCastConfiguration configuration, MeterRegistry meterRegistry) {
        Objects.requireNonNull(configuration, "configuration");
        PgBroadcast broadcast = configuration.isMetricsEnabled() && meterRegistry != null
            ? new PgBroadcast(vertx, meterRegistry)
            : new PgBroadcast(vertx);
        broadcast.init(configuration.getBroadcastConfig());
        return broadcast;
    }

    /**
     * Supplies the connection settings. Nothing connects until the first operation needs the
     * database. Calling it again rebinds the settings for later connection attempts; an
     * established connection is kept.
     */
    public void init(BroadcastConfig config) {
        Objects.requireNonNull(config, "config");
        dispatcher.setIsolateFailures(config.isIsolateCallbackFailures());
        coordinator.setLockTimeout(config.getLockTimeout());
        connectionFactory.init(config);
    }

    public boolean isInitialized() {
        return connectionFactory.isInitialized();
    }

    @Override
    public Future<Subscription> subscribe(String channel, NotificationHandler handler) {
        return coordinator.subscribe(channel, handler);
    }

    @Override
    public Future<Void> publish(String channel, String message) {
        return publisher.publish(channel, message);
    }

    @Override
    public Future<Pool> getPooledConnection() {
        return connectionFactory.getConnection().map(ConnectionHandle::pool);
    }

    public Future<ConnectionHandle> getConnection() {
        return connectionFactory.getConnection();
    }

    /**
     * @return channels with at least one subscriber (or an UNLISTEN in flight)
     */
    public Set<String> activeChannels() {
        return registry.channels();
    }

    public int subscriberCount(String channel) {
        return registry.subscriberCount(channel);
    }

    /**
     * Healthy when the dedicated connection is open and the pool answers {@code SELECT 1}.
     * Never fails; problems complete the Future with false.
     */
    public Future<Boolean> checkHealth() {
        ConnectionHandle handle = connectionFactory.currentHandle();
        if (handle == null || handle.isClosed()) {
            return Future.succeededFuture(false);
        }
        return handle.pool().query("SELECT 1").execute()
            .map(rs -> true)
            .recover(err -> {
                logger.warn("Health check failed: {}", err.getMessage());
                return Future.succeededFuture(false);
            });
    }

    public Future<Void> closeAsync() {
        logger.info("Closing broadcast context ({} active channels)", registry.channelCount());
        return connectionFactory.closeAsync()
            .onComplete(ar -> {
                registry.clear();
                if (ar.succeeded()) {
                    logger.info("Broadcast context closed");
                } else {
                    logger.warn("Broadcast context closed with errors: {}", ar.cause().getMessage());
                }
            });
    }

    /**
     * Synchronous wrapper for AutoCloseable. Prefer {@link #closeAsync()} on an event loop.
     */
    @Override
    public void close() {
        try {
            closeAsync().toCompletionStage().toCompletableFuture().get();
        } catch (Exception e) {
            logger.error("Error during synchronous close", e);
        }
    }
}
