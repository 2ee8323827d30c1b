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
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * {@link ChannelCommands} over a Vert.x connection. Lock keys and payloads are always bound
 * parameters; only LISTEN/UNLISTEN embed the channel, as a quoted identifier, because those
 * commands do not accept parameters.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class PgChannelCommands implements ChannelCommands {
    private static final Logger logger = LoggerFactory.getLogger(PgChannelCommands.class);

    static final String ADVISORY_LOCK_SQL = "SELECT pg_try_advisory_lock($1)";
    static final String ADVISORY_UNLOCK_SQL = "SELECT pg_advisory_unlock($1)";

    private final SqlConnection connection;

    public PgChannelCommands(SqlConnection connection) {
        this.connection = Objects.requireNonNull(connection, "connection");
    }

    @Override
    public Future<Boolean> tryAcquireLock(int token) {
        // pg_try_advisory_lock takes bigint
        return connection.preparedQuery(ADVISORY_LOCK_SQL)
            .execute(Tuple.of((long) token))
            .map(rows -> {
                boolean acquired = firstBoolean(rows);
                logger.trace("Advisory lock {} {}", token, acquired ? "acquired" : "busy");
                return acquired;
            });
    }

    @Override
    public Future<Void> releaseLock(int token) {
        return connection.preparedQuery(ADVISORY_UNLOCK_SQL)
            .execute(Tuple.of((long) token))
            .compose(rows -> {
                if (!firstBoolean(rows)) {
                    logger.warn("Advisory lock {} was not held by the notification connection", token);
                } else {
                    logger.trace("Advisory lock {} released", token);
                }
                return Future.<Void>succeededFuture();
            });
    }

    @Override
    public Future<Void> listen(String channel) {
        return connection.query("LISTEN " + ChannelNames.quoteIdentifier(channel))
            .execute()
            .onSuccess(rs -> logger.debug("Started listening on channel: {}", channel))
            .mapEmpty();
    }

    @Override
    public Future<Void> unlisten(String channel) {
        return connection.query("UNLISTEN " + ChannelNames.quoteIdentifier(channel))
            .execute()
            .onSuccess(rs -> logger.debug("Stopped listening on channel: {}", channel))
            .mapEmpty();
    }

    private static boolean firstBoolean(RowSet<Row> rows) {
        var it = rows.iterator();
        if (!it.hasNext()) {
            return false;
        }
        return Boolean.TRUE.equals(it.next().getBoolean(0));
    }
}
