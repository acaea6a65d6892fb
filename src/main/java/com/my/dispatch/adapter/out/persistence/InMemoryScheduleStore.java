package com.my.dispatch.adapter.out.persistence;

import com.my.dispatch.domain.exception.ScheduleNotFoundException;
import com.my.dispatch.domain.exception.StaleWriteException;
import com.my.dispatch.domain.model.AwaitingCursor;
import com.my.dispatch.domain.model.DateRange;
import com.my.dispatch.domain.model.Schedule;
import com.my.dispatch.domain.port.out.ScheduleStore;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 단일 프로세스 개발 실행과 테스트용 저장소. 모든 연산을 하나의 모니터로 직렬화한다.
 */
@IfBuildProperty(name = "app.store.backend", stringValue = "memory")
@ApplicationScoped
public class InMemoryScheduleStore implements ScheduleStore {

    private final Map<String, Schedule> schedules = new HashMap<>();
    private final Map<String, Lease> leases = new HashMap<>();

    @Override
    public synchronized Schedule insert(Schedule schedule) {
        if (schedules.containsKey(schedule.id())) {
            throw new IllegalStateException("이미 존재하는 일정입니다: " + schedule.id());
        }
        Schedule stored = schedule.toBuilder().version(1).build();
        schedules.put(stored.id(), stored);
        return stored;
    }

    @Override
    public synchronized Optional<Schedule> findById(String scheduleId) {
        return Optional.ofNullable(schedules.get(scheduleId));
    }

    @Override
    public synchronized Schedule update(Schedule schedule, long expectedVersion) {
        checkVersion(schedule.id(), expectedVersion);
        Schedule stored = schedule.toBuilder().version(expectedVersion + 1).build();
        schedules.put(stored.id(), stored);
        return stored;
    }

    @Override
    public synchronized void delete(String scheduleId, long expectedVersion) {
        checkVersion(scheduleId, expectedVersion);
        schedules.remove(scheduleId);
        leases.remove(scheduleId);
    }

    @Override
    public synchronized List<Schedule> findInRange(Optional<String> technicianId, DateRange range) {
        LocalDateTime from = range.startInclusive();
        LocalDateTime to = range.endExclusive();
        return schedules.values().stream()
                .filter(schedule -> technicianId.map(id -> id.equals(schedule.technicianId())).orElse(true))
                .filter(schedule -> !schedule.window().start().isBefore(from) && schedule.window().start().isBefore(to))
                .sorted(Comparator.comparing((Schedule schedule) -> schedule.window().start()).thenComparing(Schedule::id))
                .toList();
    }

    @Override
    public synchronized List<Schedule> findAwaitingResponse(Optional<AwaitingCursor> after, int limit) {
        return schedules.values().stream()
                .filter(schedule -> schedule.confirmationState().awaitingResponse())
                .filter(schedule -> after.map(cursor -> cursor.isBefore(schedule)).orElse(true))
                .sorted(Comparator.comparing(Schedule::createdAt).thenComparing(Schedule::id))
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized boolean tryLease(String scheduleId, String owner, Instant now, Duration ttl) {
        if (!schedules.containsKey(scheduleId)) {
            return false;
        }
        Lease current = leases.get(scheduleId);
        if (current != null && !current.owner().equals(owner) && current.until().isAfter(now)) {
            return false;
        }
        leases.put(scheduleId, new Lease(owner, now.plus(ttl)));
        return true;
    }

    @Override
    public synchronized void releaseLease(String scheduleId, String owner) {
        Lease current = leases.get(scheduleId);
        if (current != null && current.owner().equals(owner)) {
            leases.remove(scheduleId);
        }
    }

    private void checkVersion(String scheduleId, long expectedVersion) {
        Schedule current = schedules.get(scheduleId);
        if (current == null) {
            throw new ScheduleNotFoundException(scheduleId);
        }
        if (current.version() != expectedVersion) {
            throw new StaleWriteException(scheduleId, expectedVersion, current.version());
        }
    }

    private record Lease(String owner, Instant until) {
    }
}
