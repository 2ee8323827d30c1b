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

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Validation, quoting and lock-token derivation for notification channel names.
 *
 * <p>Channel names are opaque: any text PostgreSQL accepts as a quoted identifier is a valid
 * channel. That excludes:</p>
 * <ul>
 *   <li>the empty string (zero-length delimited identifiers are rejected by the server)</li>
 *   <li>names containing a NUL character</li>
 *   <li>names longer than {@value #MAX_CHANNEL_BYTES} bytes in UTF-8; LISTEN would silently
 *       truncate them while {@code pg_notify} rejects them, so they could never be delivered</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public final class ChannelNames {

    /**
     * NAMEDATALEN - 1 in a default PostgreSQL build.
     */
    public static final int MAX_CHANNEL_BYTES = 63;

    private ChannelNames() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @throws NullPointerException if the channel is null
     * @throws IllegalArgumentException if PostgreSQL cannot listen on the channel as given
     */
    public static String validate(String channel) {
        Objects.requireNonNull(channel, "channel");
        if (channel.isEmpty()) {
            throw new IllegalArgumentException("Channel name cannot be empty");
        }
        if (channel.indexOf('\u0000') >= 0) {
            throw new IllegalArgumentException("Channel name cannot contain NUL characters");
        }
        int bytes = channel.getBytes(StandardCharsets.UTF_8).length;
        if (bytes > MAX_CHANNEL_BYTES) {
            throw new IllegalArgumentException(String.format(
                "Channel name '%s' exceeds PostgreSQL maximum identifier length of %d bytes (length: %d)",
                channel, MAX_CHANNEL_BYTES, bytes));
        }
        return channel;
    }

    /**
     * Quotes a channel for use in LISTEN/UNLISTEN: wraps it in double quotes and doubles
     * any embedded double quote. Case and every other character are preserved.
     */
    public static String quoteIdentifier(String channel) {
        return '"' + validate(channel).replace("\"", "\"\"") + '"';
    }

    /**
     * Derives the advisory lock key for a channel.
     *
     * <p>{@code Math.abs(channel.hashCode())}: the 31-multiplier rolling hash over UTF-16 code
     * units, kept in signed 32-bit range. Identical names always map to the same token. Distinct
     * names may collide, which only serializes their subscribe/unsubscribe calls.</p>
     */
    public static int lockToken(String channel) {
        return Math.abs(Objects.requireNonNull(channel, "channel").hashCode());
    }
}
