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

import dev.mars.pgcast.api.error.ConnectionFailureException;
import dev.mars.pgcast.api.error.NotInitializedException;
import dev.mars.pgcast.api.error.PgCastErrorCodes;
import dev.mars.pgcast.api.error.PgCastException;
import dev.mars.pgcast.db.SharedPostgresExtension;
import dev.mars.pgcast.db.config.BroadcastConfig;
import dev.mars.pgcast.db.config.SslSettings;
import dev.mars.pgcast.db.metrics.MicrometerBroadcastMetrics;
import dev.mars.pgcast.test.categories.TestCategories;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.SslMode;
import io.vertx.sqlclient.PoolOptions;
import io.vertx.sqlclient.Row;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.testcontainers.containers.PostgreSQLContainer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * INTEGRATION tests for PgConnectionFactory against a real PostgreSQL without SSL support.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
@Tag(TestCategories.INTEGRATION)
@ExtendWith(SharedPostgresExtension.class)
public class PgConnectionFactoryTest {

    private Vertx vertx;
    private SimpleMeterRegistry meterRegistry;
    private PgConnectionFactory factory;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        meterRegistry = new SimpleMeterRegistry();
        factory = new PgConnectionFactory(vertx, notification -> { }, new MicrometerBroadcastMetrics(meterRegistry));
    }

    @AfterEach
    void tearDown() throws Exception {
        if (factory != null) {
            await(factory.closeAsync());
        }
        if (vertx != null) {
            await(vertx.close());
        }
    }

    @Test
    void testGetConnectionBeforeInitFails() {
        assertFalse(factory.isInitialized());

        Throwable cause = awaitFailure(factory.getConnection());

        NotInitializedException ex = assertInstanceOf(NotInitializedException.class, cause);
        assertEquals(PgCastErrorCodes.NOT_INITIALIZED, ex.getCode());
    }

    @Test
    void testPreferFallsBackToPlainTextWhenServerHasNoSsl() throws Exception {
        factory.init(SharedPostgresExtension.broadcastConfig().ssl(SslSettings.prefer()).build());

        ConnectionHandle handle = await(factory.getConnection());

        assertFalse(handle.isSsl());
        assertEquals(1.0, meterRegistry.counter("pgcast.connection.ssl.downgrade").count());
        Row row = await(handle.pool().query("SELECT 1 AS one").execute()).iterator().next();
        assertEquals(1, row.getInteger("one"));
    }

    @Test
    void testDisabledConnectsWithoutDowngrade() throws Exception {
        factory.init(SharedPostgresExtension.broadcastConfig().ssl(SslSettings.disabled()).build());

        ConnectionHandle handle = await(factory.getConnection());

        assertFalse(handle.isSsl());
        assertEquals(0.0, meterRegistry.counter("pgcast.connection.ssl.downgrade").count());
    }

    @Test
    void testRequiredNeverDowngrades() {
        factory.init(SharedPostgresExtension.broadcastConfig().ssl(SslSettings.required(false, null)).build());

        Throwable cause = awaitFailure(factory.getConnection());

        ConnectionFailureException ex = assertInstanceOf(ConnectionFailureException.class, cause);
        assertEquals(PgCastErrorCodes.CONNECTION_FAILED, ex.getCode());
        assertTrue(PgConnectionFactory.isSslUnsupported(ex));
        assertEquals(0.0, meterRegistry.counter("pgcast.connection.ssl.downgrade").count());
        assertNull(factory.currentHandle());
    }

    @Test
    void testFailedConnectionIsRetriedAfterReinit() throws Exception {
        factory.init(SharedPostgresExtension.broadcastConfig().ssl(SslSettings.required(false, null)).build());
        awaitFailure(factory.getConnection());

        factory.init(SharedPostgresExtension.broadcastConfig().ssl(SslSettings.disabled()).build());
        ConnectionHandle handle = await(factory.getConnection());

        assertNotNull(handle);
        assertSame(handle, factory.currentHandle());
    }

    @Test
    void testHandleIsMemoized() throws Exception {
        factory.init(SharedPostgresExtension.broadcastConfig().build());

        ConnectionHandle first = await(factory.getConnection());
        ConnectionHandle second = await(factory.getConnection());

        assertSame(first, second);
        assertSame(first.pool(), second.pool());
    }

    @Test
    void testReinitKeepsExistingHandle() throws Exception {
        factory.init(SharedPostgresExtension.broadcastConfig().build());
        ConnectionHandle first = await(factory.getConnection());

        factory.init(SharedPostgresExtension.broadcastConfig().maxPoolSize(2).build());

        assertSame(first, await(factory.getConnection()));
    }

    @Test
    void testConcurrentFirstCallersShareOneHandle() throws Exception {
        factory.init(SharedPostgresExtension.broadcastConfig().build());

        List<Future<ConnectionHandle>> futures = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            futures.add(factory.getConnection());
        }
        await(Future.all(futures));

        ConnectionHandle handle = futures.get(0).result();
        for (Future<ConnectionHandle> future : futures) {
            assertSame(handle, future.result());
        }
        assertEquals(1.0, meterRegistry.counter("pgcast.connection.ssl.downgrade").count());
    }

    @Test
    void testConnectionStringIsUsed() throws Exception {
        PostgreSQLContainer<?> postgres = SharedPostgresExtension.getContainer();
        String uri = String.format("postgresql://%s:%s@%s:%d/%s",
            postgres.getUsername(), postgres.getPassword(),
            postgres.getHost(), postgres.getFirstMappedPort(), postgres.getDatabaseName());
        factory.init(BroadcastConfig.builder().connectionString(uri).ssl(SslSettings.disabled()).build());

        ConnectionHandle handle = await(factory.getConnection());

        String database = await(handle.pool().query("SELECT current_database()").execute())
            .iterator().next().getString(0);
        assertEquals(postgres.getDatabaseName(), database);
    }

    @Test
    void testUnreachableServerFailsWithConnectionFailure() {
        factory.init(BroadcastConfig.builder()
            .host("127.0.0.1")
            .port(1)
            .database("nowhere")
            .username("nobody")
            .ssl(SslSettings.disabled())
            .build());

        assertInstanceOf(ConnectionFailureException.class, awaitFailure(factory.getConnection()));
    }

    @Test
    void testClosedFactoryRefusesConnections() throws Exception {
        factory.init(SharedPostgresExtension.broadcastConfig().build());
        ConnectionHandle handle = await(factory.getConnection());

        await(factory.closeAsync());

        assertTrue(handle.isClosed());
        PgCastException ex = assertInstanceOf(PgCastException.class, awaitFailure(factory.getConnection()));
        assertEquals(PgCastErrorCodes.CLOSED, ex.getCode());
    }

    @Test
    void testSslModeMapping() {
        assertEquals(SslMode.DISABLE, PgConnectionFactory.applySsl(new PgConnectOptions(), SslSettings.disabled()).getSslMode());
        assertEquals(SslMode.REQUIRE, PgConnectionFactory.applySsl(new PgConnectOptions(), SslSettings.prefer()).getSslMode());
        assertEquals(SslMode.REQUIRE,
            PgConnectionFactory.applySsl(new PgConnectOptions(), SslSettings.required(false, null)).getSslMode());
        PgConnectOptions verified = PgConnectionFactory.applySsl(new PgConnectOptions(), SslSettings.required(true, null));
        assertEquals(SslMode.VERIFY_FULL, verified.getSslMode());
        assertEquals("HTTPS", verified.getSslOptions().getHostnameVerificationAlgorithm());
        PgConnectOptions withCa = PgConnectionFactory.applySsl(new PgConnectOptions(),
            SslSettings.required(true, "-----BEGIN CERTIFICATE-----"));
        assertEquals(SslMode.VERIFY_FULL, withCa.getSslMode());
        assertEquals("HTTPS", withCa.getSslOptions().getHostnameVerificationAlgorithm());
        assertNotNull(withCa.getSslOptions().getTrustOptions());
    }

    @Test
    void testSubSecondIdleTimeoutIsKept() {
        BroadcastConfig config = SharedPostgresExtension.broadcastConfig().idleTimeout(Duration.ofMillis(500)).build();

        PoolOptions options = PgConnectionFactory.poolOptions(config);

        assertEquals(500, options.getIdleTimeout());
        assertEquals(TimeUnit.MILLISECONDS, options.getIdleTimeoutUnit());
    }

    @Test
    void testSslUnsupportedDetection() {
        assertTrue(PgConnectionFactory.isSslUnsupported(new RuntimeException("Postgres Server does not handle SSL connection")));
        assertTrue(PgConnectionFactory.isSslUnsupported(
            new RuntimeException("wrapper", new IllegalStateException("The server does not support SSL connections"))));
        assertFalse(PgConnectionFactory.isSslUnsupported(new RuntimeException("password authentication failed")));
        assertFalse(PgConnectionFactory.isSslUnsupported(new RuntimeException((String) null)));
    }

    private static <T> T await(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(30, TimeUnit.SECONDS);
    }

    private static Throwable awaitFailure(Future<?> future) {
        ExecutionException ex = assertThrows(ExecutionException.class, () -> await(future));
        return ex.getCause();
    }
}
