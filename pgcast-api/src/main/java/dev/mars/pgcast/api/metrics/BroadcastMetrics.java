package dev.mars.pgcast.api.metrics;

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

/**
 * Metrics hooks for the broadcast layer.
 *
 * Channel names are caller-defined and unbounded, so none of these metrics are tagged by channel.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public interface BroadcastMetrics {

    /**
     * A LISTEN command completed on the dedicated connection.
     *
     * Metric name: pgcast.listen.commands
     */
    void recordListen();

    /**
     * An UNLISTEN command completed on the dedicated connection.
     *
     * Metric name: pgcast.unlisten.commands
     */
    void recordUnlisten();

    /**
     * A LISTEN or UNLISTEN command failed.
     *
     * Metric name: pgcast.listen.failures
     */
    void recordListenFailure();

    /**
     * A notification arrived on the dedicated connection.
     *
     * Metric name: pgcast.notifications.received
     */
    void recordNotificationReceived();

    /**
     * A notification arrived for a channel without subscribers.
     *
     * Metric name: pgcast.notifications.dropped
     */
    void recordNotificationDropped();

    /**
     * A notification was handed to one handler.
     *
     * Metric name: pgcast.notifications.delivered
     */
    void recordDelivery();

    /**
     * A handler threw while processing a notification.
     *
     * Metric name: pgcast.callbacks.failed
     */
    void recordCallbackFailure();

    /**
     * A notification was published.
     *
     * Metric name: pgcast.publish
     */
    void recordPublish();

    /**
     * The dedicated connection fell back to a plaintext connection.
     *
     * Metric name: pgcast.connection.ssl.downgrade
     */
    void recordSslDowngrade();
}
