package com.my.dispatch.adapter.in.idempotency;

import com.my.dispatch.domain.port.out.ClockPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class SqliteIdempotencyStoreTest {

    private static final OffsetDateTime T0 = OffsetDateTime.of(2026, 2, 20, 8, 0, 0, 0, ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private final AtomicReference<OffsetDateTime> now = new AtomicReference<>(T0);
    private final ClockPort clock = now::get;
    private SQLiteDataSource dataSource;

    @BeforeEach
    void setUp() {
        dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + tempDir.resolve("dispatch.db").toAbsolutePath());
    }

    @Test
    void storesCommandTypeAndExpiresWithTtl() {
        SqliteIdempotencyStore store = open();

        assertThat(store.isProcessed("cmd-1")).isFalse();

        store.markProcessed("cmd-1", "COMMIT");
        store.markProcessed("cmd-1", "REMOVE");
        assertThat(store.processedType("cmd-1")).contains("COMMIT");

        now.set(T0.plusMinutes(60));
        assertThat(store.isProcessed("cmd-1")).isTrue();

        now.set(T0.plusMinutes(61));
        assertThat(store.isProcessed("cmd-1")).isFalse();
    }

    @Test
    void expiredRowsAreDeleted() throws Exception {
        SqliteIdempotencyStore store = open();
        store.markProcessed("cmd-old", "GET");
        now.set(T0.plusHours(2));
        store.markProcessed("cmd-new", "LIST");

        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT command_id, command_type, processed_at FROM command_log")) {
            assertThat(rs.next()).isTrue();
            assertThat(rs.getString("command_id")).isEqualTo("cmd-new");
            assertThat(rs.getString("command_type")).isEqualTo("LIST");
            assertThat(rs.getLong("processed_at")).isEqualTo(T0.plusHours(2).toInstant().toEpochMilli());
            assertThat(rs.next()).isFalse();
        }
    }

    @Test
    void survivesReopeningTheDatabase() {
        open().markProcessed("cmd-7", "RESET_TO_DRAFT");

        SqliteIdempotencyStore reopened = open();

        assertThat(reopened.processedType("cmd-7")).contains("RESET_TO_DRAFT");
    }

    private SqliteIdempotencyStore open() {
        SqliteIdempotencyStore store = new SqliteIdempotencyStore(dataSource, Duration.ofHours(1), clock);
        store.init();
        return store;
    }
}
