package com.iksanov.querycache.cache.durable;

import com.iksanov.querycache.cache.core.CacheCoordinator;
import com.iksanov.querycache.cache.fast.InMemoryFastStore;
import com.iksanov.querycache.cache.metrics.CacheMetrics;
import com.iksanov.querycache.cache.support.MutableClock;
import com.iksanov.querycache.common.codec.JsonValueCodec;
import com.iksanov.querycache.common.exception.InvalidTtlException;
import com.iksanov.querycache.common.exception.PersistenceUnavailableException;
import com.iksanov.querycache.common.key.KeyDeriver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link PostgresDurableStore} against mocked JDBC objects.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("PostgresDurableStore Tests")
class PostgresDurableStoreTest {

    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");

    @Mock
    private DataSource dataSource;

    @Mock
    private Connection connection;

    @Mock
    private PreparedStatement statement;

    @Mock
    private ResultSet resultSet;

    private PostgresDurableStore store;

    @BeforeEach
    void setUp() throws SQLException {
        lenient().when(dataSource.getConnection()).thenReturn(connection);
        lenient().when(connection.prepareStatement(anyString())).thenReturn(statement);
        store = new PostgresDurableStore(dataSource, "query_cache", new JsonValueCodec(), new MutableClock(NOW));
    }

    private void givenRow(Instant createdAt, Instant expiresAt) throws SQLException {
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true);
        when(resultSet.getString(1)).thenReturn("prices:abc");
        when(resultSet.getString(2)).thenReturn("prices");
        when(resultSet.getString(3)).thenReturn("42");
        when(resultSet.getTimestamp(4)).thenReturn(Timestamp.from(createdAt));
        when(resultSet.getTimestamp(5)).thenReturn(Timestamp.from(expiresAt));
    }

    @Test
    @DisplayName("get() should return live row")
    void shouldReturnLiveRow() throws SQLException {
        givenRow(NOW.minusSeconds(10), NOW.plusSeconds(50));

        CacheEntry entry = store.get("prices:abc");

        assertThat(entry).isNotNull();
        assertThat(entry.namespace()).isEqualTo("prices");
        assertThat(entry.payload()).isEqualTo("42");
        assertThat(entry.expiresAt()).isEqualTo(NOW.plusSeconds(50));
        verify(statement).setString(1, "prices:abc");
        verify(statement, never()).executeUpdate();
        verify(connection).close();
    }

    @Test
    @DisplayName("get() should return null when no row exists")
    void shouldReturnNullForMissingRow() throws SQLException {
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(false);

        assertThat(store.get("prices:abc")).isNull();
    }

    @Test
    @DisplayName("get() should report expired row absent and reap it conditionally")
    void shouldReapExpiredRowOnRead() throws SQLException {
        givenRow(NOW.minusSeconds(60), NOW);

        assertThat(store.get("prices:abc")).isNull();

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(connection, times(2)).prepareStatement(sql.capture());
        assertThat(sql.getAllValues().get(1)).isEqualTo("DELETE FROM query_cache WHERE cache_key = ? AND (expires_at <= ? OR expires_at <= created_at)");
        verify(statement).setTimestamp(2, Timestamp.from(NOW));
        verify(statement).executeUpdate();
    }

    @Test
    @DisplayName("get() should treat a row expiring at its creation instant as absent")
    void shouldReapRowWithCollapsedTimestamps() throws SQLException {
        Instant truncated = NOW.plusSeconds(5);
        givenRow(truncated, truncated);

        assertThat(store.get("prices:abc")).isNull();

        verify(connection).prepareStatement("DELETE FROM query_cache WHERE cache_key = ? AND (expires_at <= ? OR expires_at <= created_at)");
        verify(statement).executeUpdate();
    }

    @Test
    @DisplayName("Coordinator should miss instead of failing on a row with collapsed timestamps")
    void shouldMissThroughCoordinatorOnCollapsedRow() throws SQLException {
        givenRow(NOW, NOW);
        MutableClock clock = new MutableClock(NOW.minusMillis(1));
        CacheMetrics metrics = new CacheMetrics();
        PostgresDurableStore durable = new PostgresDurableStore(dataSource, "query_cache", new JsonValueCodec(), clock);
        CacheCoordinator coordinator = new CacheCoordinator(new KeyDeriver(), new InMemoryFastStore(60_000, clock, metrics),
                durable, new JsonValueCodec(), clock, Duration.ofMinutes(5), metrics);

        assertThat(coordinator.get("prices", "sku-1", String.class)).isEmpty();
        assertThat(metrics.misses()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("put() should round sub-millisecond TTL up to one millisecond")
    void shouldRoundTinyTtlUp() throws SQLException {
        store.put("prices:abc", 42, "prices", Duration.ofNanos(1));

        verify(statement).setTimestamp(4, Timestamp.from(NOW));
        verify(statement).setTimestamp(5, Timestamp.from(NOW.plusMillis(1)));
    }

    @Test
    @DisplayName("put() should upsert JSON payload with absolute expiry")
    void shouldUpsertWithExpiry() throws SQLException {
        store.put("prices:abc", Map.of("price", 42), "prices", Duration.ofSeconds(30));

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(connection).prepareStatement(sql.capture());
        assertThat(sql.getValue())
                .startsWith("INSERT INTO query_cache")
                .contains("ON CONFLICT (cache_key) DO UPDATE SET");
        verify(statement).setString(1, "prices:abc");
        verify(statement).setString(2, "prices");
        verify(statement).setString(3, "{\"price\":42}");
        verify(statement).setTimestamp(4, Timestamp.from(NOW));
        verify(statement).setTimestamp(5, Timestamp.from(NOW.plusSeconds(30)));
        verify(statement).executeUpdate();
    }

    @Test
    @DisplayName("put() should reject non-positive TTL before touching the database")
    void shouldRejectInvalidTtl() throws SQLException {
        assertThatThrownBy(() -> store.put("k", 1, "ns", Duration.ZERO)).isInstanceOf(InvalidTtlException.class);
        verify(dataSource, never()).getConnection();
    }

    @Test
    @DisplayName("SQL failures should surface as PersistenceUnavailableException")
    void shouldWrapSqlFailures() throws SQLException {
        when(dataSource.getConnection()).thenThrow(new SQLTransientConnectionException("pool exhausted"));

        assertThatThrownBy(() -> store.get("k")).isInstanceOf(PersistenceUnavailableException.class)
                .hasCauseInstanceOf(SQLTransientConnectionException.class);
        assertThatThrownBy(() -> store.put("k", 1, "ns", Duration.ofSeconds(1))).isInstanceOf(PersistenceUnavailableException.class);
        assertThatThrownBy(() -> store.deleteByKey("k")).isInstanceOf(PersistenceUnavailableException.class);
        assertThatThrownBy(() -> store.deleteByNamespace("ns")).isInstanceOf(PersistenceUnavailableException.class);
        assertThatThrownBy(() -> store.deleteAll()).isInstanceOf(PersistenceUnavailableException.class);
        assertThatThrownBy(() -> store.deleteExpired()).isInstanceOf(PersistenceUnavailableException.class);
        assertThatThrownBy(() -> store.stats()).isInstanceOf(PersistenceUnavailableException.class);
    }

    @Test
    @DisplayName("deleteByNamespace() should delete by namespace column")
    void shouldDeleteByNamespace() throws SQLException {
        store.deleteByNamespace("prices");

        verify(connection).prepareStatement("DELETE FROM query_cache WHERE namespace = ?");
        verify(statement).setString(1, "prices");
        verify(statement).executeUpdate();
    }

    @Test
    @DisplayName("deleteExpired() should purge rows at or before now and report the count")
    void shouldPurgeExpiredRows() throws SQLException {
        when(statement.executeUpdate()).thenReturn(3);

        assertThat(store.deleteExpired()).isEqualTo(3);

        verify(connection).prepareStatement("DELETE FROM query_cache WHERE expires_at <= ?");
        verify(statement).setTimestamp(1, Timestamp.from(NOW));
    }

    @Test
    @DisplayName("stats() should aggregate per-namespace rows")
    void shouldAggregateStats() throws SQLException {
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true, true, false);
        when(resultSet.getString(1)).thenReturn("prices", "stock");
        when(resultSet.getLong(2)).thenReturn(5L, 2L);
        when(resultSet.getTimestamp(3)).thenReturn(Timestamp.from(NOW.minusSeconds(100)), Timestamp.from(NOW.minusSeconds(300)));
        when(resultSet.getTimestamp(4)).thenReturn(Timestamp.from(NOW.minusSeconds(5)), Timestamp.from(NOW.minusSeconds(50)));

        CacheStats stats = store.stats();

        assertThat(stats.totalEntries()).isEqualTo(7);
        assertThat(stats.entriesByNamespace()).containsOnly(Map.entry("prices", 5L), Map.entry("stock", 2L));
        assertThat(stats.oldestEntry()).isEqualTo(NOW.minusSeconds(300));
        assertThat(stats.newestEntry()).isEqualTo(NOW.minusSeconds(5));
    }

    @Test
    @DisplayName("initSchema() should create table and indexes")
    void shouldCreateSchema() throws SQLException {
        Statement ddl = mock(Statement.class);
        when(connection.createStatement()).thenReturn(ddl);

        store.initSchema();

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(ddl, times(3)).execute(sql.capture());
        List<String> statements = sql.getAllValues();
        assertThat(statements.get(0)).startsWith("CREATE TABLE IF NOT EXISTS query_cache");
        assertThat(statements.get(1)).contains("query_cache_namespace_idx");
        assertThat(statements.get(2)).contains("query_cache_expires_idx");
    }
}
