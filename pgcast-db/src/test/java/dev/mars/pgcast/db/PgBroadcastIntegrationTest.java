package dev.mars.pgcast.db;

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
import dev.mars.pgcast.api.error.NotInitializedException;
import dev.mars.pgcast.db.config.BroadcastConfig;
import dev.mars.pgcast.db.config.PgCastConfiguration;
import dev.mars.pgcast.db.pubsub.ChannelNames;
import dev.mars.pgcast.test.categories.TestCategories;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.testcontainers.containers.PostgreSQLContainer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * INTEGRATION tests for PgBroadcast: subscribe, publish and unsubscribe through a real
 * PostgreSQL LISTEN/NOTIFY channel.
 *
 * <p>Every test uses its own channel names because the container is shared.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
@Tag(TestCategories.INTEGRATION)
@ExtendWith(SharedPostgresExtension.class)
public class PgBroadcastIntegrationTest {

    private Vertx vertx;
    private SimpleMeterRegistry meterRegistry;
    private PgBroadcast broadcast;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        meterRegistry = new SimpleMeterRegistry();
        broadcast = new PgBroadcast(vertx, meterRegistry);
        broadcast.init(SharedPostgresExtension.broadcastConfig().build());
    }

    @AfterEach
    void tearDown() throws Exception {
        if (broadcast != null) {
            broadcast.close();
        }
        if (vertx != null) {
            await(vertx.close());
        }
    }

    @Test
    void testPublishReachesSubscriber() throws Exception {
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> received = new AtomicReference<>();

        await(broadcast.subscribe("docs:42", payload -> {
            received.set(payload);
            latch.countDown();
        }));
        await(broadcast.publish("docs:42", "updated"));

        assertTrue(latch.await(10, TimeUnit.SECONDS), "Notification not received within timeout");
        assertEquals("updated", received.get());
    }

    @Test
    void testDuplicateHandlerInvokedOncePerPublish() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        NotificationHandler handler = payload -> calls.incrementAndGet();
        CountDownLatch sentinel = new CountDownLatch(1);

        await(broadcast.subscribe("dup", handler));
        await(broadcast.subscribe("dup", handler));
        await(broadcast.subscribe("dup", payload -> sentinel.countDown()));
        await(broadcast.publish("dup", "once"));

        // handlers run in registration order, so the sentinel fires after the duplicate
        assertTrue(sentinel.await(10, TimeUnit.SECONDS));
        assertEquals(1, calls.get());
        assertEquals(2, broadcast.subscriberCount("dup"));
    }

    @Test
    void testUnsubscribedHandlerReceivesNothing() throws Exception {
        AtomicInteger removedCalls = new AtomicInteger();
        CountDownLatch sentinel = new CountDownLatch(1);

        Subscription removed = await(broadcast.subscribe("partial", payload -> removedCalls.incrementAndGet()));
        await(broadcast.subscribe("partial", payload -> sentinel.countDown()));
        await(removed.unsubscribe());
        await(broadcast.publish("partial", "after"));

        assertTrue(sentinel.await(10, TimeUnit.SECONDS));
        assertEquals(0, removedCalls.get());
        assertTrue(removed.isCancelled());
    }

    @Test
    void testConcurrentFirstSubscribersIssueOneListen() throws Exception {
        int subscribers = 50;
        CountDownLatch delivered = new CountDownLatch(subscribers);
        List<Future<Subscription>> futures = new ArrayList<>();
        for (int i = 0; i < subscribers; i++) {
            futures.add(broadcast.subscribe("storm", payload -> delivered.countDown()));
        }
        await(Future.all(futures));

        assertEquals(1.0, meterRegistry.counter("pgcast.listen.commands").count());
        assertEquals(subscribers, broadcast.subscriberCount("storm"));
        assertTrue(listeningChannels().contains("storm"));

        await(broadcast.publish("storm", "hello"));
        assertTrue(delivered.await(10, TimeUnit.SECONDS), "Not every subscriber was notified");
    }

    @Test
    void testLastUnsubscribeStopsListening() throws Exception {
        Set<Integer> seen = ConcurrentHashMap.newKeySet();
        List<Subscription> subscriptions = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            int n = i;
            subscriptions.add(await(broadcast.subscribe("drain", payload -> seen.add(n))));
        }
        assertEquals(10, broadcast.subscriberCount("drain"));

        List<Future<Void>> unsubscribes = new ArrayList<>();
        for (Subscription subscription : subscriptions) {
            unsubscribes.add(subscription.unsubscribe());
        }
        await(Future.all(unsubscribes));

        assertEquals(1.0, meterRegistry.counter("pgcast.unlisten.commands").count());
        assertFalse(broadcast.activeChannels().contains("drain"));
        assertFalse(listeningChannels().contains("drain"));
    }

    @Test
    void testTwoChannelStormsProceedIndependently() throws Exception {
        CountDownLatch delivered = new CountDownLatch(50);
        List<Future<Subscription>> futures = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            futures.add(broadcast.subscribe("left", payload -> delivered.countDown()));
            futures.add(broadcast.subscribe("right", payload -> delivered.countDown()));
        }
        await(Future.all(futures));

        assertEquals(2.0, meterRegistry.counter("pgcast.listen.commands").count());
        assertEquals(25, broadcast.subscriberCount("left"));
        assertEquals(25, broadcast.subscriberCount("right"));
        assertTrue(listeningChannels().containsAll(Set.of("left", "right")));

        await(broadcast.publish("left", "l"));
        await(broadcast.publish("right", "r"));
        assertTrue(delivered.await(10, TimeUnit.SECONDS), "Not every subscriber was notified");
    }

    @Test
    void testQuotedChannelNames() throws Exception {
        String channel = "Mixed \"Quoted\" Name";
        CountDownLatch latch = new CountDownLatch(1);
        List<String> received = Collections.synchronizedList(new ArrayList<>());

        await(broadcast.subscribe(channel, payload -> {
            received.add(payload);
            latch.countDown();
        }));
        await(broadcast.publish(channel, "it's \"quoted\" too"));

        assertTrue(latch.await(10, TimeUnit.SECONDS));
        assertEquals(List.of("it's \"quoted\" too"), received);
        assertTrue(listeningChannels().contains(channel));
    }

    @Test
    void testSeparateContextsShareTheDatabase() throws Exception {
        // a second Vert.x instance has its own local locks, so only the advisory lock serializes the two
        Vertx otherVertx = Vertx.vertx();
        PgBroadcast other = new PgBroadcast(otherVertx);
        other.init(SharedPostgresExtension.broadcastConfig().build());
        try {
            CountDownLatch local = new CountDownLatch(10);
            CountDownLatch remote = new CountDownLatch(10);

            List<Future<Subscription>> futures = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                futures.add(broadcast.subscribe("shared", payload -> local.countDown()));
                futures.add(other.subscribe("shared", payload -> remote.countDown()));
            }
            await(Future.all(futures));

            await(other.publish("shared", "cross-process"));

            assertTrue(local.await(10, TimeUnit.SECONDS), "Other session's notification not received");
            assertTrue(remote.await(10, TimeUnit.SECONDS));
            assertEquals(10, broadcast.subscriberCount("shared"));
            assertEquals(10, other.subscriberCount("shared"));
        } finally {
            other.close();
            await(otherVertx.close());
        }
    }

    @Test
    void testIsolatedHandlerFailureDoesNotStopDelivery() throws Exception {
        BroadcastConfig config = SharedPostgresExtension.broadcastConfig().isolateCallbackFailures(true).build();
        broadcast.init(config);
        CountDownLatch latch = new CountDownLatch(1);

        await(broadcast.subscribe("isolated", payload -> {
            throw new IllegalStateException("handler failure");
        }));
        await(broadcast.subscribe("isolated", payload -> latch.countDown()));
        await(broadcast.publish("isolated", "payload"));

        assertTrue(latch.await(10, TimeUnit.SECONDS));
        assertEquals(1.0, meterRegistry.counter("pgcast.callbacks.failed").count());
    }

    @Test
    void testPooledConnectionServesQueries() throws Exception {
        Row row = await(await(broadcast.getPooledConnection()).query("SELECT 41 + 1 AS answer").execute())
            .iterator().next();

        assertEquals(42, row.getInteger("answer"));
    }

    @Test
    void testActiveChannelsGauge() throws Exception {
        await(broadcast.subscribe("gauge-a", payload -> { }));
        await(broadcast.subscribe("gauge-b", payload -> { }));

        assertEquals(Set.of("gauge-a", "gauge-b"), broadcast.activeChannels());
        assertEquals(2.0, meterRegistry.get("pgcast.channels.active").gauge().value());
    }

    @Test
    void testAdvisoryLockHeldByAnotherSessionDoesNotStallOtherChannels() throws Exception {
        SqlConnection otherSession = await(await(broadcast.getPooledConnection()).getConnection());
        Tuple token = Tuple.of((long) ChannelNames.lockToken("held"));
        try {
            await(otherSession.preparedQuery("SELECT pg_advisory_lock($1)").execute(token));

            CountDownLatch delivered = new CountDownLatch(1);
            Future<Subscription> waiting = broadcast.subscribe("held", payload -> { });
            await(broadcast.subscribe("open", payload -> delivered.countDown()));
            await(broadcast.publish("open", "still flowing"));

            assertTrue(delivered.await(10, TimeUnit.SECONDS), "Notification connection stalled");
            assertFalse(waiting.isComplete());

            await(otherSession.preparedQuery("SELECT pg_advisory_unlock($1)").execute(token));
            await(waiting);
            assertTrue(listeningChannels().containsAll(Set.of("held", "open")));
        } finally {
            await(otherSession.close());
        }
    }

    @Test
    void testHealthCheck() throws Exception {
        assertFalse(await(broadcast.checkHealth()));

        await(broadcast.getConnection());
        assertTrue(await(broadcast.checkHealth()));

        await(broadcast.closeAsync());
        assertFalse(await(broadcast.checkHealth()));
    }

    @Test
    void testCreateFromLayeredConfiguration() throws Exception {
        PostgreSQLContainer<?> postgres = SharedPostgresExtension.getContainer();
        System.setProperty("pgcast.database.host", postgres.getHost());
        System.setProperty("pgcast.database.port", String.valueOf(postgres.getFirstMappedPort()));
        System.setProperty("pgcast.database.name", postgres.getDatabaseName());
        System.setProperty("pgcast.database.username", postgres.getUsername());
        System.setProperty("pgcast.database.password", postgres.getPassword());
        PgBroadcast configured;
        try {
            configured = PgBroadcast.create(vertx, new PgCastConfiguration("default"), meterRegistry);
        } finally {
            for (String key : List.of("host", "port", "name", "username", "password")) {
                System.clearProperty("pgcast.database." + key);
            }
        }

        try {
            assertTrue(configured.isInitialized());
            assertEquals(1, await(await(configured.getConnection()).pool().query("SELECT 1").execute()).size());
        } finally {
            configured.close();
        }
    }

    @Test
    void testOperationsBeforeInitFail() {
        PgBroadcast uninitialized = new PgBroadcast(vertx);

        assertFalse(uninitialized.isInitialized());
        assertInstanceOf(NotInitializedException.class, awaitFailure(uninitialized.subscribe("early", payload -> { })));
        assertInstanceOf(NotInitializedException.class, awaitFailure(uninitialized.publish("early", "message")));
        assertInstanceOf(NotInitializedException.class, awaitFailure(uninitialized.getPooledConnection()));
        assertTrue(uninitialized.activeChannels().isEmpty());
    }

    @Test
    void testInvalidArgumentsAreRejected() {
        assertThrows(NullPointerException.class, () -> broadcast.publish("c", null));
        assertThrows(IllegalArgumentException.class, () -> broadcast.publish("x".repeat(64), "m"));
        assertThrows(NullPointerException.class, () -> broadcast.subscribe("c", null));
    }

    private Set<String> listeningChannels() throws Exception {
        List<String> channels = new ArrayList<>();
        await(broadcast.getConnection()).notificationConnection()
            .query("SELECT pg_listening_channels()").execute()
            .toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS)
            .forEach(row -> channels.add(row.getString(0)));
        return Set.copyOf(channels);
    }

    private static <T> T await(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(30, TimeUnit.SECONDS);
    }

    private static Throwable awaitFailure(Future<?> future) {
        ExecutionException ex = assertThrows(ExecutionException.class, () -> await(future));
        return ex.getCause();
    }
}
