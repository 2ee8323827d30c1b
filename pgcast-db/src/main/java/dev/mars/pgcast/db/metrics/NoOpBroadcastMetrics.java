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

/**
 * No-op implementation of BroadcastMetrics.
 *
 * Used when metrics collection is disabled or when no MeterRegistry is available.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class NoOpBroadcastMetrics implements BroadcastMetrics {

    public static final NoOpBroadcastMetrics INSTANCE = new NoOpBroadcastMetrics();

    @Override
    public void recordListen() {
        // No-op
    }

    @Override
    public void recordUnlisten() {
        // No-op
    }

    @Override
    public void recordListenFailure() {
        // No-op
    }

    @Override
    public void recordNotificationReceived() {
        // No-op
    }

    @Override
    public void recordNotificationDropped() {
        // No-op
    }

    @Override
    public void recordDelivery() {
        // No-op
    }

    @Override
    public void recordCallbackFailure() {
        // No-op
    }

    @Override
    public void recordPublish() {
        // No-op
    }

    @Override
    public void recordSslDowngrade() {
        // No-op
    }
}
