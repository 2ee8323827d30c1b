package dev.mars.pgcast.db.metrics;

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
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Objects;

/**
 * Micrometer-based implementation of BroadcastMetrics.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class MicrometerBroadcastMetrics implements BroadcastMetrics {

    private final Counter listenCommands;
    private final Counter unlistenCommands;
    private final Counter listenFailures;
    private final Counter notificationsReceived;
    private final Counter notificationsDropped;
    private final Counter notificationsDelivered;
    private final Counter callbacksFailed;
    private final Counter published;
    private final Counter sslDowngrades;

    public MicrometerBroadcastMetrics(MeterRegistry registry) {
        Objects.requireNonNull(registry, "registry");
        this.listenCommands = Counter.builder("pgcast.listen.commands")
            .description("LISTEN commands issued on the dedicated connection")
            .register(registry);
        this.unlistenCommands = Counter.builder("pgcast.unlisten.commands")
            .description("UNLISTEN commands issued on the dedicated connection")
            .register(registry);
        this.listenFailures = Counter.builder("pgcast.listen.failures")
            .description("Failed LISTEN/UNLISTEN round trips")
            .register(registry);
        this.notificationsReceived = Counter.builder("pgcast.notifications.received")
            .description("Notifications received on the dedicated connection")
            .register(registry);
        this.notificationsDropped = Counter.builder("pgcast.notifications.dropped")
            .description("Notifications received for channels without subscribers")
            .register(registry);
        this.notificationsDelivered = Counter.builder("pgcast.notifications.delivered")
            .description("Notifications handed to a subscriber handler")
            .register(registry);
        this.callbacksFailed = Counter.builder("pgcast.callbacks.failed")
            .description("Subscriber handlers that threw during dispatch")
            .register(registry);
        this.published = Counter.builder("pgcast.publish")
            .description("Notifications published through pg_notify")
            .register(registry);
        this.sslDowngrades = Counter.builder("pgcast.connection.ssl.downgrade")
            .description("Connections that fell back to plaintext under ssl mode 'prefer'")
            .register(registry);
    }

    @Override
    public void recordListen() {
        listenCommands.increment();
    }

    @Override
    public void recordUnlisten() {
        unlistenCommands.increment();
    }

    @Override
    public void recordListenFailure() {
        listenFailures.increment();
    }

    @Override
    public void recordNotificationReceived() {
        notificationsReceived.increment();
    }

    @Override
    public void recordNotificationDropped() {
        notificationsDropped.increment();
    }

    @Override
    public void recordDelivery() {
        notificationsDelivered.increment();
    }

    @Override
    public void recordCallbackFailure() {
        callbacksFailed.increment();
    }

    @Override
    public void recordPublish() {
        published.increment();
    }

    @Override
    public void recordSslDowngrade() {
        sslDowngrades.increment();
    }
}
