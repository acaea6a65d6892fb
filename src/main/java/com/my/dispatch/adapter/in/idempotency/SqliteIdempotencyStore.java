package com.my.dispatch.adapter.in.idempotency;

import com.my.dispatch.config.AppConfig;
import com.my.dispatch.domain.port.out.ClockPort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Optional;

/**
 * 왜: 재시작 후에도 같은 명령이 두 번 실행되지 않도록 일정 저장소와 같은 SQLite 파일에 명령 로그를 남긴다.
 * <p>
 * 만료 기준 시각은 {@link ClockPort} 에서 얻는다.
 */
@IfBuildProperty(name = "app.idempotency.backend", stringValue = "sqlite", enableIfMissing = true)
@ApplicationScoped
public class SqliteIdempotencyStore implements IdempotencyStore {

    private static final String TABLE_DDL = """
            CREATE TABLE IF NOT EXISTS command_log (
                command_id TEXT PRIMARY KEY,
                command_type TEXT NOT NULL,
                processed_at INTEGER NOT NULL
            )
            """;

    private static final String INSERT_SQL =
            "INSERT OR IGNORE INTO command_log(command_id, command_type, processed_at) VALUES (?, ?, ?)";
    private static final String SELECT_SQL = "SELECT command_type FROM command_log WHERE command_id = ? AND processed_at >= ?";
    private static final String EVICT_SQL = "DELETE FROM command_log WHERE processed_at < ?";

    private final DataSource dataSource;
    private final Duration ttl;
    private final ClockPort clockPort;

    @Inject
    public SqliteIdempotencyStore(DataSource dataSource, AppConfig appConfig, ClockPort clockPort) {
        this(dataSource, Duration.ofHours(appConfig.idempotency().ttlHours()), clockPort);
    }

    SqliteIdempotencyStore(DataSource dataSource, Duration ttl, ClockPort clockPort) {
        this.dataSource = dataSource;
        this.ttl = ttl;
        this.clockPort = clockPort;
    }

    @PostConstruct
    void init() {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(TABLE_DDL);
        } catch (SQLException e) {
            throw new IllegalStateException("명령 로그 테이블 초기화 실패", e);
        }
    }

    @Override
    public Optional<String> processedType(String commandId) {
        long cutoff = evictExpired();
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_SQL)) {
            ps.setString(1, commandId);
            ps.setLong(2, cutoff);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getString(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IllegalStateException("명령 로그 조회 실패: " + commandId, e);
        }
    }

    @Override
    public void markProcessed(String commandId, String commandType) {
        evictExpired();
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
            ps.setString(1, commandId);
            ps.setString(2, commandType);
            ps.setLong(3, clockPort.instant().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("명령 로그 기록 실패: " + commandId, e);
        }
    }

    private long evictExpired() {
        long cutoff = clockPort.instant().minus(ttl).toEpochMilli();
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(EVICT_SQL)) {
            ps.setLong(1, cutoff);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("명령 로그 정리 실패", e);
        }
        return cutoff;
    }
}
