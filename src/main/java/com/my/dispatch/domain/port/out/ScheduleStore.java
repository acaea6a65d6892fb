package com.my.dispatch.domain.port.out;

import com.my.dispatch.domain.model.AwaitingCursor;
import com.my.dispatch.domain.model.DateRange;
import com.my.dispatch.domain.model.Schedule;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 왜: 승인 상태의 단일 진실 공급원인 일정 저장소를 낙관적 동시성 계약과 함께 추상화하기 위함.
 */
public interface ScheduleStore {

    /**
     * 버전 1로 저장한다.
     */
    Schedule insert(Schedule schedule);

    Optional<Schedule> findById(String scheduleId);

    /**
     * 저장된 버전이 {@code expectedVersion} 과 같을 때만 갱신하고, 버전을 하나 올린 결과를 돌려준다.
     *
     * @throws com.my.dispatch.domain.exception.StaleWriteException 버전이 앞서 있을 때
     * @throws com.my.dispatch.domain.exception.ScheduleNotFoundException 일정이 없을 때
     */
    Schedule update(Schedule schedule, long expectedVersion);

    void delete(String scheduleId, long expectedVersion);

    List<Schedule> findInRange(Optional<String> technicianId, DateRange range);

    /**
     * pending_tech/pending_customer 일정을 (createdAt, id) 순으로 {@code after} 다음부터 최대 {@code limit} 건.
     * 비어 있으면 처음부터 읽는다.
     */
    List<Schedule> findAwaitingResponse(Optional<AwaitingCursor> after, int limit);

    /**
     * 다른 소유자의 유효한 임대가 없을 때만 임대를 잡는다.
     */
    boolean tryLease(String scheduleId, String owner, Instant now, Duration ttl);

    void releaseLease(String scheduleId, String owner);
}
