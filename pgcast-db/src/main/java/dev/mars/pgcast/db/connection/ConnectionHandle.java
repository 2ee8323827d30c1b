package dev.mars.pgcast.db.connection;

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

import dev.mars.pgcast.db.pubsub.ChannelCommands;
import dev.mars.pgcast.db.pubsub.PgChannelCommands;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.pgclient.PgConnection;
import io.vertx.pgclient.PgNotification;
import io.vertx.sqlclient.Pool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * A pool for ordinary queries and publishes, plus the one long-lived connection that holds
 * LISTEN registrations and advisory locks. The dedicated connection is never lent out.
 *
 * <p>Created once by {@link PgConnectionFactory} and never recreated: if the dedicated
 * connection drops, the handle stays closed and the loss is logged.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class ConnectionHandle {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionHandle.class);

    private final Pool pool;
    private final PgConnection notificationConnection;
    private final ChannelCommands channelCommands;

    private volatile boolean closing;
    private volatile boolean closed;

    ConnectionHandle(Pool pool, PgConnection notificationConnection, Handler<PgNotification> notificationHandler) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.notificationConnection = Objects.requireNonNull(notificationConnection, "notificationConnection");
        this.channelCommands = new PgChannelCommands(notificationConnection);

        notificationConnection.notificationHandler(Objects.requireNonNull(notificationHandler, "notificationHandler"));
        notificationConnection.exceptionHandler(err ->
            logger.error("Error on notification connection: {}", err.getMessage(), err));
        notificationConnection.closeHandler(v -> {
            closed = true;
            if (!closing) {
                logger.warn("Notification connection closed unexpectedly; subscribers will receive no further notifications");
            }
        });
    }

    public Pool pool() {
        return pool;
    }

    /**
     * The dedicated notification connection. Use {@link #channelCommands()} for LISTEN and
     * locking; running ordinary queries on it would delay notification delivery.
     */
    public PgConnection notificationConnection() {
        return notificationConnection;
    }

    public ChannelCommands channelCommands() {
        return channelCommands;
    }

    /**
     * @return true if the dedicated connection negotiated TLS
     */
    public boolean isSsl() {
        return notificationConnection.isSSL();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes the dedicated connection, then the pool. A failure closing the dedicated
     * connection is logged and does not prevent the pool from closing.
     */
    public Future<Void> close() {
        if (closing) {
            return Future.succeededFuture();
        }
        closing = true;
        logger.debug("Closing notification connection and pool");
        return notificationConnection.close()
            .recover(err -> {
                logger.warn("Failed to close notification connection: {}", err.getMessage());
                return Future.succeededFuture();
            })
            .compose(v -> pool.close())
            .onComplete(ar -> closed = true);
    }
}
