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

import io.vertx.core.Future;

/**
 * Server round trips issued on the dedicated notification connection.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public interface ChannelCommands {

    /**
     * {@code SELECT pg_try_advisory_lock(token)}. Never waits on the server: completes with
     * {@code false} when another session holds the lock, so commands queued behind it on the
     * shared connection are not stalled.
     */
    Future<Boolean> tryAcquireLock(int token);

    /**
     * {@code SELECT pg_advisory_unlock(token)}.
     */
    Future<Void> releaseLock(int token);

    Future<Void> listen(String channel);

    Future<Void> unlisten(String channel);
}
