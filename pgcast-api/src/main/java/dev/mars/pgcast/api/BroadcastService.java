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

import io.vertx.core.Future;
import io.vertx.sqlclient.Pool;

/**
 * Publish/subscribe broadcast over PostgreSQL LISTEN/NOTIFY.
 *
 * <p>Implementations own a single dedicated notification connection and a pool for ordinary
 * queries. All operations are asynchronous and report failures through the returned Future.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public interface BroadcastService {

    /**
     * Registers a handler on a channel. The first handler on a channel triggers a LISTEN.
     *
     * @param channel the channel name
     * @param handler the handler to invoke for each notification
     * @return Future completing with the subscription handle
     */
    Future<Subscription> subscribe(String channel, NotificationHandler handler);

    /**
     * Sends a notification to every connection listening on the channel.
     * Fire-and-forget: delivery to subscribers is not acknowledged.
     *
     * @param channel the channel name
     * @param message the payload
     * @return Future completing when the server accepted the notification
     */
    Future<Void> publish(String channel, String message);

    /**
     * Gives access to the pool used for ordinary queries.
     *
     * @return Future completing with the shared pool
     */
    Future<Pool> getPooledConnection();
}
