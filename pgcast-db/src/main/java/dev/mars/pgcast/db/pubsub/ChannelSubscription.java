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
import dev.mars.pgcast.api.Subscription;
import io.vertx.core.Future;
import io.vertx.core.Promise;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Handle pairing one handler with one channel. The first unsubscribe attempt that is in flight
 * or has succeeded is shared by every later call; after a failed attempt the next call retries.
 */
final class ChannelSubscription implements Subscription {

    private final SubscriptionCoordinator coordinator;
    private final String channel;
    private final NotificationHandler handler;
    private final AtomicReference<Future<Void>> unsubscribed = new AtomicReference<>();

    ChannelSubscription(SubscriptionCoordinator coordinator, String channel, NotificationHandler handler) {
        this.coordinator = coordinator;
        this.channel = channel;
        this.handler = handler;
    }

    @Override
    public String channel() {
        return channel;
    }

    @Override
    public Future<Void> unsubscribe() {
        while (true) {
            Future<Void> current = unsubscribed.get();
            if (current != null && !current.failed()) {
                return current;
            }
            Promise<Void> promise = Promise.promise();
            if (unsubscribed.compareAndSet(current, promise.future())) {
                coordinator.unsubscribe(channel, handler).onComplete(ar -> {
                    if (ar.succeeded()) {
                        promise.complete();
                    } else {
                        promise.fail(ar.cause());
                    }
                });
                return promise.future();
            }
        }
    }

    @Override
    public boolean isCancelled() {
        Future<Void> current = unsubscribed.get();
        return current != null && current.succeeded();
    }

    @Override
    public String toString() {
        return "ChannelSubscription{channel='" + channel + "', cancelled=" + isCancelled() + "}";
    }
}
