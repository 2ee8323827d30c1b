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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.pgcast.api.BroadcastService;
import dev.mars.pgcast.api.Subscription;
import dev.mars.pgcast.api.error.PgCastErrorCodes;
import dev.mars.pgcast.api.error.PgCastException;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Typed view of a channel whose payloads are JSON documents.
 *
 * <p>Publishing serializes the value with Jackson. Subscribers receive deserialized values;
 * payloads that do not parse as {@code T} are logged and skipped, so one malformed message
 * does not break the fan-out for the other handlers on the channel.</p>
 *
 * <pre>{@code
 * JsonChannel<DocumentChanged> docs = JsonChannel.of(broadcast, "docs:42", DocumentChanged.class);
 * docs.subscribe(event -> refresh(event.id()));
 * docs.publish(new DocumentChanged(42L, Instant.now()));
 * }</pre>
 *
 * @param <T> the payload type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class JsonChannel<T> {
    private static final Logger logger = LoggerFactory.getLogger(JsonChannel.class);

    private final BroadcastService service;
    private final String channel;
    private final Class<T> type;
    private final ObjectMapper objectMapper;

    public JsonChannel(BroadcastService service, String channel, Class<T> type, ObjectMapper objectMapper) {
        this.service = Objects.requireNonNull(service, "service");
        this.channel = ChannelNames.validate(channel);
        this.type = Objects.requireNonNull(type, "type");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public static <T> JsonChannel<T> of(BroadcastService service, String channel, Class<T> type) {
        return new JsonChannel<>(service, channel, type, defaultObjectMapper());
    }

    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    public String channel() {
        return channel;
    }

    public Future<Void> publish(T value) {
        Objects.requireNonNull(value, "value");
        String payload;
        try {
            payload = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return Future.failedFuture(new PgCastException(PgCastErrorCodes.PAYLOAD_CODEC_FAILED,
                "Failed to serialize " + type.getSimpleName() + " for channel '" + channel + "'", e));
        }
        return service.publish(channel, payload);
    }

    public Future<Subscription> subscribe(Consumer<? super T> consumer) {
        Objects.requireNonNull(consumer, "consumer");
        return service.subscribe(channel, payload -> {
            T value = decode(payload);
            if (value != null) {
                consumer.accept(value);
            }
        });
    }

    private T decode(String payload) {
        if (payload == null || payload.isEmpty()) {
            logger.warn("Skipping empty payload on channel {}", channel);
            return null;
        }
        try {
            T value = objectMapper.readValue(payload, type);
            if (value == null) {
                logger.warn("Skipping null {} payload on channel {}", type.getSimpleName(), channel);
            }
            return value;
        } catch (JsonProcessingException e) {
            logger.warn("Skipping payload on channel {} that is not a valid {}: {}",
                channel, type.getSimpleName(), e.getOriginalMessage());
            return null;
        }
    }
}
