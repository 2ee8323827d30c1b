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
import dev.mars.pgcast.api.error.ListenCommandException;
import dev.mars.pgcast.api.error.PgCastErrorCodes;
import dev.mars.pgcast.api.error.PgCastException;
import dev.mars.pgcast.api.metrics.BroadcastMetrics;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.shareddata.Lock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Serializes subscribe and unsubscribe per channel so that each transition between "no
 * subscribers" and "some subscribers" issues exactly one LISTEN or UNLISTEN.
 *
 * <p>Every operation on a channel runs under two locks, taken in this order:</p>
 * <ol>
 *   <li>a Vert.x local lock named after the channel, serializing callers in this process. The
 *       advisory lock alone cannot do this because session-level advisory locks are re-entrant
 *       and every caller shares the one notification session.</li>
 *   <li>{@code pg_try_advisory_lock} on the channel's lock token, serializing against other
 *       processes sharing the database. A busy lock is retried on a Vert.x timer with capped
 *       exponential backoff rather than waited on in the server, since a blocked query would
 *       hold up every command queued behind it on the notification connection.</li>
 * </ol>
 * <p>Both are released whatever the outcome of the guarded operation. Operations on different
 * channels never wait on each other unless their lock tokens collide.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class SubscriptionCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(SubscriptionCoordinator.class);

    public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(30);

    static final String LOCAL_LOCK_PREFIX = "pgcast.channel.";

    static final long INITIAL_LOCK_BACKOFF_MS = 10L;
    static final long MAX_LOCK_BACKOFF_MS = 500L;

    private final Vertx vertx;
    private final ChannelRegistry registry;
    private final Supplier<Future<ChannelCommands>> commandsSupplier;
    private final BroadcastMetrics metrics;

    private volatile Duration lockTimeout = DEFAULT_LOCK_TIMEOUT;

    public SubscriptionCoordinator(Vertx vertx, ChannelRegistry registry,
                                   Supplier<Future<ChannelCommands>> commandsSupplier,
                                   BroadcastMetrics metrics) {
        this.vertx = Objects.requireNonNull(vertx, "vertx");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.commandsSupplier = Objects.requireNonNull(commandsSupplier, "commandsSupplier");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Bounds how long a caller waits for the in-process channel lock, and separately for the
     * advisory lock.
     */
    public void setLockTimeout(Duration lockTimeout) {
        Objects.requireNonNull(lockTimeout, "lockTimeout");
        if (lockTimeout.isZero() || lockTimeout.isNegative()) {
            throw new IllegalArgumentException("Lock timeout must be positive: " + lockTimeout);
        }
        this.lockTimeout = lockTimeout;
    }

    public Duration getLockTimeout() {
        return lockTimeout;
    }

    /**
     * Registers a handler on a channel, issuing LISTEN if it is the channel's first handler.
     *
     * @throws NullPointerException if channel or handler is null
     * @throws IllegalArgumentException if the channel name cannot be listened on
     */
    public Future<Subscription> subscribe(String channel, NotificationHandler handler) {
        ChannelNames.validate(channel);
        Objects.requireNonNull(handler, "handler");
        return withChannelLock(channel, commands -> register(commands, channel, handler))
            .<Subscription>map(v -> new ChannelSubscription(this, channel, handler));
    }

    /**
     * Removes a handler from a channel, issuing UNLISTEN if it was the channel's last handler.
     * A handler that is not registered on the channel is a no-op.
     */
    public Future<Void> unsubscribe(String channel, NotificationHandler handler) {
        ChannelNames.validate(channel);
        Objects.requireNonNull(handler, "handler");
        return withChannelLock(channel, commands -> deregister(commands, channel, handler));
    }

    private Future<Void> register(ChannelCommands commands, String channel, NotificationHandler handler) {
        ChannelRegistry.AddResult result = registry.add(channel, handler);
        if (result != ChannelRegistry.AddResult.CREATED) {
            logger.debug("Handler {} on channel {}: {}", handler, channel, result);
            return Future.succeededFuture();
        }

        return commands.listen(channel).transform(ar -> {
            if (ar.succeeded()) {
                metrics.recordListen();
                return Future.<Void>succeededFuture();
            }
            registry.remove(channel, handler);
            registry.removeChannelIfEmpty(channel);
            metrics.recordListenFailure();
            logger.error("LISTEN failed for channel {}, subscription rolled back", channel, ar.cause());
            return Future.<Void>failedFuture(new ListenCommandException("LISTEN", channel, ar.cause()));
        });
    }

    private Future<Void> deregister(ChannelCommands commands, String channel, NotificationHandler handler) {
        ChannelRegistry.RemoveResult result = registry.remove(channel, handler);
        if (result == ChannelRegistry.RemoveResult.NOT_REGISTERED) {
            logger.debug("Handler {} is not registered on channel {}, nothing to unsubscribe", handler, channel);
            return Future.succeededFuture();
        }
        if (result == ChannelRegistry.RemoveResult.REMOVED) {
            return Future.succeededFuture();
        }

        return commands.unlisten(channel).transform(ar -> {
            if (ar.succeeded()) {
                registry.removeChannelIfEmpty(channel);
                metrics.recordUnlisten();
                return Future.<Void>succeededFuture();
            }
            // the server is still listening, keep the registry in step with it
            registry.add(channel, handler);
            metrics.recordListenFailure();
            logger.error("UNLISTEN failed for channel {}, handler restored", channel, ar.cause());
            return Future.<Void>failedFuture(new ListenCommandException("UNLISTEN", channel, ar.cause()));
        });
    }

    private <T> Future<T> withChannelLock(String channel, Function<ChannelCommands, Future<T>> body) {
        int token = ChannelNames.lockToken(channel);
        long timeoutMs = lockTimeout.toMillis();

        return commandsSupplier.get().compose(commands ->
            vertx.sharedData().getLocalLockWithTimeout(LOCAL_LOCK_PREFIX + channel, timeoutMs)
                .recover(err -> Future.failedFuture(new PgCastException(PgCastErrorCodes.LOCK_FAILED,
                    "Timed out after " + timeoutMs + "ms waiting for channel lock '" + channel + "'", err)))
                .compose(localLock -> underAdvisoryLock(commands, channel, token, timeoutMs, body)
                    .onComplete(ar -> release(localLock, channel))));
    }

    private <T> Future<T> underAdvisoryLock(ChannelCommands commands, String channel, int token, long timeoutMs,
                                            Function<ChannelCommands, Future<T>> body) {
        Promise<Void> acquired = Promise.promise();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        tryAdvisoryLock(commands, channel, token, deadline, INITIAL_LOCK_BACKOFF_MS, acquired);

        return acquired.future()
            .compose(locked -> {
                Future<T> outcome;
                try {
                    outcome = body.apply(commands);
                } catch (RuntimeException e) {
                    outcome = Future.failedFuture(e);
                }
                return outcome.transform(result -> commands.releaseLock(token)
                    .transform(unlock -> afterUnlock(result, unlock, channel, token)));
            });
    }

    private void tryAdvisoryLock(ChannelCommands commands, String channel, int token, long deadline,
                                 long backoffMs, Promise<Void> acquired) {
        commands.tryAcquireLock(token).onComplete(ar -> {
            if (ar.failed()) {
                acquired.fail(new PgCastException(PgCastErrorCodes.LOCK_FAILED,
                    "Failed to acquire advisory lock " + token + " for channel '" + channel + "'", ar.cause()));
            } else if (Boolean.TRUE.equals(ar.result())) {
                acquired.complete();
            } else if (System.nanoTime() - deadline >= 0) {
                acquired.fail(new PgCastException(PgCastErrorCodes.LOCK_FAILED,
                    "Timed out waiting for advisory lock " + token + " for channel '" + channel
                        + "', held by another session"));
            } else {
                logger.debug("Advisory lock {} for channel {} is busy, retrying in {}ms", token, channel, backoffMs);
                long nextBackoff = Math.min(backoffMs * 2, MAX_LOCK_BACKOFF_MS);
                vertx.setTimer(backoffMs,
                    id -> tryAdvisoryLock(commands, channel, token, deadline, nextBackoff, acquired));
            }
        });
    }

    private <T> Future<T> afterUnlock(AsyncResult<T> result, AsyncResult<Void> unlock, String channel, int token) {
        if (unlock.failed()) {
            if (result.succeeded()) {
                return Future.failedFuture(new PgCastException(PgCastErrorCodes.LOCK_FAILED,
                    "Failed to release advisory lock " + token + " for channel '" + channel + "'", unlock.cause()));
            }
            logger.warn("Failed to release advisory lock {} for channel {}", token, channel, unlock.cause());
        }
        return result.succeeded() ? Future.succeededFuture(result.result()) : Future.failedFuture(result.cause());
    }

    private void release(Lock localLock, String channel) {
        localLock.release();
        logger.trace("Released local lock for channel {}", channel);
    }
}
