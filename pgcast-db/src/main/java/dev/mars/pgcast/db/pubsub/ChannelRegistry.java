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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide mapping from channel name to its subscriber handlers.
 *
 * <p>Handlers are kept in registration order and compared by reference identity, never by
 * {@code equals}. Every read and write goes through a single in-process mutex so the dispatcher
 * never observes a half-applied mutation; the dispatcher works on snapshots and never holds the
 * mutex while handlers run.</p>
 *
 * <p>An entry may briefly exist with no handlers while an UNLISTEN is in flight; callers drop it
 * with {@link #removeChannelIfEmpty(String)} once the server acknowledged the command.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class ChannelRegistry {

    public enum AddResult {
        /** First handler on the channel, the caller must LISTEN. */
        CREATED,
        ADDED,
        /** The same handler instance was already registered. */
        ALREADY_REGISTERED
    }

    public enum RemoveResult {
        NOT_REGISTERED,
        REMOVED,
        /** The channel has no handlers left, the caller must UNLISTEN. */
        REMOVED_LAST
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, List<NotificationHandler>> channels = new HashMap<>();

    public AddResult add(String channel, NotificationHandler handler) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(handler, "handler");
        lock.lock();
        try {
            List<NotificationHandler> handlers = channels.get(channel);
            if (handlers == null) {
                handlers = new ArrayList<>(2);
                handlers.add(handler);
                channels.put(channel, handlers);
                return AddResult.CREATED;
            }
            if (indexOf(handlers, handler) >= 0) {
                return AddResult.ALREADY_REGISTERED;
            }
            boolean wasEmpty = handlers.isEmpty();
            handlers.add(handler);
            return wasEmpty ? AddResult.CREATED : AddResult.ADDED;
        } finally {
            lock.unlock();
        }
    }

    public RemoveResult remove(String channel, NotificationHandler handler) {
        lock.lock();
        try {
            List<NotificationHandler> handlers = channels.get(channel);
            if (handlers == null) {
                return RemoveResult.NOT_REGISTERED;
            }
            int index = indexOf(handlers, handler);
            if (index < 0) {
                return RemoveResult.NOT_REGISTERED;
            }
            handlers.remove(index);
            return handlers.isEmpty() ? RemoveResult.REMOVED_LAST : RemoveResult.REMOVED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Deletes the channel entry if it has no handlers.
     *
     * @return true if the entry was deleted
     */
    public boolean removeChannelIfEmpty(String channel) {
        lock.lock();
        try {
            List<NotificationHandler> handlers = channels.get(channel);
            if (handlers != null && handlers.isEmpty()) {
                channels.remove(channel);
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return an immutable copy of the channel's handlers in registration order, empty if none
     */
    public List<NotificationHandler> snapshot(String channel) {
        lock.lock();
        try {
            List<NotificationHandler> handlers = channels.get(channel);
            return handlers == null ? List.of() : List.copyOf(handlers);
        } finally {
            lock.unlock();
        }
    }

    public boolean hasChannel(String channel) {
        lock.lock();
        try {
            return channels.containsKey(channel);
        } finally {
            lock.unlock();
        }
    }

    public int subscriberCount(String channel) {
        lock.lock();
        try {
            List<NotificationHandler> handlers = channels.get(channel);
            return handlers == null ? 0 : handlers.size();
        } finally {
            lock.unlock();
        }
    }

    public Set<String> channels() {
        lock.lock();
        try {
            return Set.copyOf(channels.keySet());
        } finally {
            lock.unlock();
        }
    }

    public int channelCount() {
        lock.lock();
        try {
            return channels.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            channels.clear();
        } finally {
            lock.unlock();
        }
    }

    private static int indexOf(List<NotificationHandler> handlers, NotificationHandler handler) {
        for (int i = 0; i < handlers.size(); i++) {
            if (handlers.get(i) == handler) {
                return i;
            }
        }
        return -1;
    }
}
