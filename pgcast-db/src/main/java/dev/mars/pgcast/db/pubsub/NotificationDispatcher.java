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

import dev.mars.pgcast.api.NotificationHandler;
import dev.mars.pgcast.api.error.CallbackFailureException;
import dev.mars.pgcast.api.metrics.BroadcastMetrics;
import io.vertx.core.Handler;
import io.vertx.pgclient.PgNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Standing notification handler of the dedicated connection. Fans each notification out to the
 * channel's handlers, synchronously and in registration order.
 *
 * <p>By default a handler that throws stops the fan-out: the failure is rethrown as a
 * {@link CallbackFailureException} to the connection's context. With failure isolation enabled
 * the failure is logged and the remaining handlers still run.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class NotificationDispatcher implements Handler<PgNotification> {
    private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final ChannelRegistry registry;
    private final BroadcastMetrics metrics;
    private volatile boolean isolateFailures;

    public NotificationDispatcher(ChannelRegistry registry, BroadcastMetrics metrics) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public void setIsolateFailures(boolean isolateFailures) {
        this.isolateFailures = isolateFailures;
    }

    public boolean isIsolateFailures() {
        return isolateFailures;
    }

    @Override
    public void handle(PgNotification notification) {
        dispatch(notification.getChannel(), notification.getPayload());
    }

    /**
     * @return the number of handlers that completed normally
     * @throws CallbackFailureException if a handler throws and failures are not isolated
     */
    public int dispatch(String channel, String payload) {
        metrics.recordNotificationReceived();
        List<NotificationHandler> handlers = registry.snapshot(channel);
        if (handlers.isEmpty()) {
            metrics.recordNotificationDropped();
            logger.debug("No subscribers for channel {}, notification dropped", channel);
            return 0;
        }

        logger.trace("Dispatching notification on channel {} to {} handler(s): {}", channel, handlers.size(), payload);
        int delivered = 0;
        for (NotificationHandler handler : handlers) {
            try {
                handler.onNotification(payload);
                delivered++;
                metrics.recordDelivery();
            } catch (RuntimeException e) {
                metrics.recordCallbackFailure();
                if (!isolateFailures) {
                    throw new CallbackFailureException(channel, e);
                }
                logger.error("Notification handler failed on channel {}, continuing with remaining handlers", channel, e);
            }
        }
        return delivered;
    }
}
