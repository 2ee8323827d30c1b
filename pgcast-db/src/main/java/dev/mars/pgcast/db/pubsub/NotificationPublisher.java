package dev.mars.pgcast.db.pubsub;

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

import dev.mars.pgcast.api.metrics.BroadcastMetrics;
import io.vertx.core.Future;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Sends notifications through the pool with {@code pg_notify}. There is no acknowledgment from
 * subscribers and no retry; the returned Future only reports whether the server accepted it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class NotificationPublisher {
    private static final Logger logger = LoggerFactory.getLogger(NotificationPublisher.class);

    static final String NOTIFY_SQL = "SELECT pg_notify($1, $2)";

    private final Supplier<Future<Pool>> poolSupplier;
    private final BroadcastMetrics metrics;

    public NotificationPublisher(Supplier<Future<Pool>> poolSupplier, BroadcastMetrics metrics) {
        this.poolSupplier = Objects.requireNonNull(poolSupplier, "poolSupplier");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * @throws NullPointerException if channel or message is null
     * @throws IllegalArgumentException if the channel name cannot be listened on
     */
    public Future<Void> publish(String channel, String message) {
        ChannelNames.validate(channel);
        Objects.requireNonNull(message, "message");
        return poolSupplier.get()
            .compose(pool -> pool.preparedQuery(NOTIFY_SQL).execute(Tuple.of(channel, message)))
            .onSuccess(rows -> {
                metrics.recordPublish();
                logger.trace("Published notification on channel {}: {}", channel, message);
            })
            .onFailure(err -> logger.debug("Failed to publish notification on channel {}: {}", channel, err.getMessage()))
            .mapEmpty();
    }
}
