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

/**
 * Handle returned by a successful subscribe call.
 *
 * <p>Unsubscribing removes exactly the paired handler from exactly the paired channel. The first
 * successful call does the work; later calls complete with the same result.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public interface Subscription {

    /**
     * @return the channel this subscription listens on
     */
    String channel();

    /**
     * Removes the handler from the channel, issuing UNLISTEN when it was the last one.
     *
     * @return Future that completes once the registry and the server agree on the new state
     */
    Future<Void> unsubscribe();

    /**
     * @return true once {@link #unsubscribe()} has completed successfully
     */
    boolean isCancelled();
}
