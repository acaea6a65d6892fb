package com.my.dispatch.adapter.out.persistence;

import com.my.dispatch.domain.exception.ScheduleNotFoundException;
import com.my.dispatch.domain.exception.StaleWriteException;
import com.my.dispatch.domain.model.AttendeeResponse;
import com.my.dispatch.domain.model.AwaitingCursor;
import com.my.dispatch.domain.model.CancellationReason;
import com.my.dispatch.domain.model.Confirmation;
import com.my.dispatch.domain.model.ConfirmationMethod;
import com.my.dispatch.domain.model.ConfirmationState;
import com.my.dispatch.domain.model.DateRange;
import com.my.dispatch.domain.model.Schedule;
import com.my.dispatch.domain.model.Technician;
import com.my.dispatch.domain.model.TimeWindow;
import com.my.dispatch.domain.model.WorkStatus;
import com.my.dispatch.domain.port.out.ScheduleStore;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 왜: 재시작 후에도 승인 상태가 남도록 일정을 SQLite 에 저장하고, version 조건부 UPDATE 로 동시 쓰기를 하나만 통과시키기 위함.
 */
@IfBuildProperty(name = "app.store.backend", stringValue = "sqlite", enableIfMissing = true)
@ApplicationScoped
public class SqliteScheduleStore implements ScheduleStore {

    private static final DateTimeFormatter LOCAL_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private static final String TABLE_DDL = """
            CREATE TABLE IF NOT EXISTS schedules (
                id TEXT PRIMARY KEY,
                ticket_id TEXT NOT NULL,
                technician_id TEXT NOT NULL,
                technician_name TEXT,
                technician_email TEXT NOT NULL,
                window_start TEXT NOT NULL,
                window_end TEXT NOT NULL,
                work_status TEXT NOT NULL,
                confirmation_state TEXT NOT NULL,
                external_event_ref TEXT,
                self_assigned INTEGER NOT NULL DEFAULT 0,
                confirmed_at INTEGER,
                confirmed_by TEXT,
                confirmation_method TEXT,
                customer_invite_sent_at INTEGER,
                technician_response TEXT NOT NULL,
                customer_response TEXT NOT NULL,
                technician_accepted_at INTEGER,
                customer_accepted_at INTEGER,
                last_response_check_at INTEGER,
                cancellation_reason TEXT,
                created_at INTEGER NOT NULL,
                updated_at INTEGER NOT NULL,
                version INTEGER NOT NULL,
                lease_owner TEXT,
                lease_until INTEGER
            )
            """;
    private static final String TECH_WINDOW_INDEX = "CREATE INDEX IF NOT EXISTS idx_schedules_tech_window ON schedules(technician_id, window_start)";
    private static final String STATE_INDEX = "CREATE INDEX IF NOT EXISTS idx_schedules_state ON schedules(confirmation_state, created_at)";

    private static final String COLUMNS = "id, ticket_id, technician_id, technician_name, technician_email, window_start, window_end, "
            + "work_status, confirmation_state, external_event_ref, self_assigned, confirmed_at, confirmed_by, confirmation_method, "
            + "customer_invite_sent_at, technician_response, customer_response, technician_accepted_at, customer_accepted_at, "
            + "last_response_check_at, cancellation_reason, created_at, updated_at, version";

    private static final String INSERT_SQL = "INSERT INTO schedules(" + COLUMNS + ") "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
    private static final String UPDATE_SQL = """
            UPDATE schedules SET ticket_id = ?, technician_id = ?, technician_name = ?, technician_email = ?,
                window_start = ?, window_end = ?, work_status = ?, confirmation_state = ?, external_event_ref = ?,
                self_assigned = ?, confirmed_at = ?, confirmed_by = ?, confirmation_method = ?, customer_invite_sent_at = ?,
                technician_response = ?, customer_response = ?, technician_accepted_at = ?, customer_accepted_at = ?,
                last_response_check_at = ?, cancellation_reason = ?, created_at = ?, updated_at = ?, version = ?
            WHERE id = ? AND version = ?
            """;
    private static final String SELECT_BY_ID = "SELECT " + COLUMNS + " FROM schedules WHERE id = ?";
    private static final String SELECT_VERSION = "SELECT version FROM schedules WHERE id = ?";
    private static final String DELETE_SQL = "DELETE FROM schedules WHERE id = ? AND version = ?";
    private static final String SELECT_RANGE = "SELECT " + COLUMNS + " FROM schedules "
            + "WHERE window_start >= ? AND window_start < ? ORDER BY window_start, id";
    private static final String SELECT_RANGE_FOR_TECH = "SELECT " + COLUMNS + " FROM schedules "
            + "WHERE technician_id = ? AND window_start >= ? AND window_start < ? ORDER BY window_start, id";
    private static final String SELECT_AWAITING = "SELECT " + COLUMNS + " FROM schedules "
            + "WHERE confirmation_state IN ('pending_tech', 'pending_customer') ORDER BY created_at, id LIMIT ?";
    private static final String SELECT_AWAITING_AFTER = "SELECT " + COLUMNS + " FROM schedules "
            + "WHERE confirmation_state IN ('pending_tech', 'pending_customer') "
            + "AND (created_at > ? OR (created_at = ? AND id > ?)) ORDER BY created_at, id LIMIT ?";
    private static final String LEASE_SQL = """
            UPDATE schedules SET lease_owner = ?, lease_until = ?
            WHERE id = ? AND (lease_owner IS NULL OR lease_owner = ? OR lease_until IS NULL OR lease_until <= ?)
            """;
    private static final String RELEASE_SQL = "UPDATE schedules SET lease_owner = NULL, lease_until = NULL WHERE id = ? AND lease_owner = ?";

    private final DataSource dataSource;

    public SqliteScheduleStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @PostConstruct
    void init() {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(TABLE_DDL);
            stmt.execute(TECH_WINDOW_INDEX);
            stmt.execute(STATE_INDEX);
        } catch (SQLException e) {
            throw new IllegalStateException("일정 테이블 초기화 실패", e);
        }
    }

    @Override
    public Schedule insert(Schedule schedule) {
        Schedule stored = schedule.toBuilder().version(1).build();
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
            ps.setString(1, stored.id());
            int next = bindFields(ps, 2, stored);
            ps.setLong(next, stored.version());
            ps.executeUpdate();
            return stored;
        } catch (SQLException e) {
            throw new IllegalStateException("일정 저장 실패: " + schedule.id(), e);
        }
    }

    @Override
    public Optional<Schedule> findById(String scheduleId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_BY_ID)) {
            ps.setString(1, scheduleId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IllegalStateException("일정 조회 실패: " + scheduleId, e);
        }
    }

    @Override
    public Schedule update(Schedule schedule, long expectedVersion) {
        Schedule stored = schedule.toBuilder().version(expectedVersion + 1).build();
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(UPDATE_SQL)) {
            int next = bindFields(ps, 1, stored);
            ps.setLong(next++, stored.version());
            ps.setString(next++, stored.id());
            ps.setLong(next, expectedVersion);
            if (ps.executeUpdate() == 0) {
                throw missOrStale(conn, stored.id(), expectedVersion);
            }
            return stored;
        } catch (SQLException e) {
            throw new IllegalStateException("일정 갱신 실패: " + schedule.id(), e);
        }
    }

    @Override
    public void delete(String scheduleId, long expectedVersion) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(DELETE_SQL)) {
            ps.setString(1, scheduleId);
            ps.setLong(2, expectedVersion);
            if (ps.executeUpdate() == 0) {
                throw missOrStale(conn, scheduleId, expectedVersion);
            }
        } catch (SQLException e) {
            throw new IllegalStateException("일정 삭제 실패: " + scheduleId, e);
        }
    }

    @Override
    public List<Schedule> findInRange(Optional<String> technicianId, DateRange range) {
        String sql = technicianId.isPresent() ? SELECT_RANGE_FOR_TECH : SELECT_RANGE;
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            int index = 1;
            if (technicianId.isPresent()) {
                ps.setString(index++, technicianId.get());
            }
            ps.setString(index++, format(range.startInclusive()));
            ps.setString(index, format(range.endExclusive()));
            return mapAll(ps);
        } catch (SQLException e) {
            throw new IllegalStateException("기간 일정 조회 실패: " + range, e);
        }
    }

    @Override
    public List<Schedule> findAwaitingResponse(Optional<AwaitingCursor> after, int limit) {
        String sql = after.isPresent() ? SELECT_AWAITING_AFTER : SELECT_AWAITING;
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            int i = 1;
            if (after.isPresent()) {
                long createdAt = after.get().createdAt().toEpochMilli();
                ps.setLong(i++, createdAt);
                ps.setLong(i++, createdAt);
                ps.setString(i++, after.get().id());
            }
            ps.setInt(i, limit);
            return mapAll(ps);
        } catch (SQLException e) {
            throw new IllegalStateException("응답 대기 일정 조회 실패", e);
        }
    }

    @Override
    public boolean tryLease(String scheduleId, String owner, Instant now, Duration ttl) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(LEASE_SQL)) {
            ps.setString(1, owner);
            ps.setLong(2, now.plus(ttl).toEpochMilli());
            ps.setString(3, scheduleId);
            ps.setString(4, owner);
            ps.setLong(5, now.toEpochMilli());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new IllegalStateException("일정 임대 실패: " + scheduleId, e);
        }
    }

    @Override
    public void releaseLease(String scheduleId, String owner) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(RELEASE_SQL)) {
            ps.setString(1, scheduleId);
            ps.setString(2, owner);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("일정 임대 해제 실패: " + scheduleId, e);
        }
    }

    private RuntimeException missOrStale(Connection conn, String scheduleId, long expectedVersion) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SELECT_VERSION)) {
            ps.setString(1, scheduleId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return new ScheduleNotFoundException(scheduleId);
                }
                return new StaleWriteException(scheduleId, expectedVersion, rs.getLong(1));
            }
        }
    }

    /**
     * id 와 version 을 제외한 컬럼을 COLUMNS 순서대로 바인딩하고 다음 파라미터 위치를 돌려준다.
     */
    private int bindFields(PreparedStatement ps, int start, Schedule schedule) throws SQLException {
        int i = start;
        ps.setString(i++, schedule.ticketId());
        ps.setString(i++, schedule.technicianId());
        ps.setString(i++, schedule.technicianName());
        ps.setString(i++, schedule.technician().email());
        ps.setString(i++, format(schedule.window().start()));
        ps.setString(i++, format(schedule.window().end()));
        ps.setString(i++, schedule.status().name());
        ps.setString(i++, schedule.confirmationState().wireName());
        ps.setString(i++, schedule.externalEventRef());
        ps.setInt(i++, schedule.selfAssigned() ? 1 : 0);
        Confirmation confirmation = schedule.confirmation();
        setInstant(ps, i++, confirmation == null ? null : confirmation.at());
        ps.setString(i++, confirmation == null ? null : confirmation.by());
        ps.setString(i++, confirmation == null ? null : confirmation.method().wireName());
        setInstant(ps, i++, schedule.customerInviteSentAt());
        ps.setString(i++, schedule.technicianResponse().wireName());
        ps.setString(i++, schedule.customerResponse().wireName());
        setInstant(ps, i++, schedule.technicianAcceptedAt());
        setInstant(ps, i++, schedule.customerAcceptedAt());
        setInstant(ps, i++, schedule.lastResponseCheckAt());
        ps.setString(i++, schedule.cancellationReason() == null ? null : schedule.cancellationReason().name());
        setInstant(ps, i++, schedule.createdAt());
        setInstant(ps, i++, schedule.updatedAt());
        return i;
    }

    private List<Schedule> mapAll(PreparedStatement ps) throws SQLException {
        List<Schedule> schedules = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                schedules.add(map(rs));
            }
        }
        return schedules;
    }

    private Schedule map(ResultSet rs) throws SQLException {
        Instant confirmedAt = getInstant(rs, "confirmed_at");
        Confirmation confirmation = confirmedAt == null
                ? null
                : new Confirmation(confirmedAt, rs.getString("confirmed_by"), ConfirmationMethod.fromWire(rs.getString("confirmation_method")));
        String cancellationReason = rs.getString("cancellation_reason");
        return Schedule.builder()
                .id(rs.getString("id"))
                .ticketId(rs.getString("ticket_id"))
                .technician(new Technician(rs.getString("technician_id"), rs.getString("technician_name"), rs.getString("technician_email")))
                .window(new TimeWindow(parse(rs.getString("window_start")), parse(rs.getString("window_end"))))
                .status(WorkStatus.valueOf(rs.getString("work_status")))
                .confirmationState(ConfirmationState.fromWire(rs.getString("confirmation_state")))
                .externalEventRef(rs.getString("external_event_ref"))
                .selfAssigned(rs.getInt("self_assigned") == 1)
                .confirmation(confirmation)
                .customerInviteSentAt(getInstant(rs, "customer_invite_sent_at"))
                .technicianResponse(AttendeeResponse.fromWire(rs.getString("technician_response")))
                .customerResponse(AttendeeResponse.fromWire(rs.getString("customer_response")))
                .technicianAcceptedAt(getInstant(rs, "technician_accepted_at"))
                .customerAcceptedAt(getInstant(rs, "customer_accepted_at"))
                .lastResponseCheckAt(getInstant(rs, "last_response_check_at"))
                .cancellationReason(cancellationReason == null ? null : CancellationReason.valueOf(cancellationReason))
                .createdAt(getInstant(rs, "created_at"))
                .updatedAt(getInstant(rs, "updated_at"))
                .version(rs.getLong("version"))
                .build();
    }

    private static void setInstant(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, value.toEpochMilli());
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        long millis = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(millis);
    }

    private static String format(LocalDateTime value) {
        return value.format(LOCAL_FORMAT);
    }

    private static LocalDateTime parse(String value) {
        return LocalDateTime.parse(value, LOCAL_FORMAT);
    }
}
