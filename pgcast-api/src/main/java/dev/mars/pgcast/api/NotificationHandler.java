package dev.mars.pgcast.api;

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
 * Callback invoked for every notification delivered on a subscribed channel.
 *
 * <p>Handlers are registered by reference identity: registering the same instance twice on one
 * channel results in a single delivery per notification. Handlers run synchronously on the
 * event loop that owns the dedicated notification connection, so they must not block.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
@FunctionalInterface
public interface NotificationHandler {

    /**
     * Handles a notification payload.
     *
     * @param payload the payload sent with the notification, may be null or empty
     */
    void onNotification(String payload);
}
