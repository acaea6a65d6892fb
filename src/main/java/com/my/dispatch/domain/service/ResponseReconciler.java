package com.my.dispatch.domain.service;

import com.my.dispatch.domain.exception.GatewayException;
import com.my.dispatch.domain.exception.ScheduleNotFoundException;
import com.my.dispatch.domain.exception.StaleWriteException;
import com.my.dispatch.domain.model.AttendeeResponse;
import com.my.dispatch.domain.model.AttendeeRole;
import com.my.dispatch.domain.model.AwaitingCursor;
import com.my.dispatch.domain.model.CalendarEventSnapshot;
import com.my.dispatch.domain.model.ConfirmationState;
import com.my.dispatch.domain.model.Conflict;
import com.my.dispatch.domain.model.DateRange;
import com.my.dispatch.domain.model.ReconciliationOutcome;
import com.my.dispatch.domain.model.ReconciliationReport;
import com.my.dispatch.domain.model.Schedule;
import com.my.dispatch.domain.port.in.ReconcileResponsesUseCase;
import com.my.dispatch.domain.port.out.CalendarGateway;
import com.my.dispatch.domain.port.out.ClockPort;
import com.my.dispatch.domain.port.out.ScheduleStore;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 왜: 외부 캘린더의 참석자 응답을 주기적으로 읽어 승인 상태 전이로 옮기고, 일정 하나의 실패가 회차 전체를 멈추지 않도록 하기 위함.
 * <p>
 * 한 회차는 응답 대기 일정 전체를 {@code batchSize} 단위 페이지로 끝까지 훑는다.
 * 외부 캘린더는 응답 사실만 알려줄 뿐 일정의 존재를 결정하지 않는다. 일정은 저장소 임대를 잡은 뒤 최신 상태로 다시 읽어 처리하며,
 * 같은 응답을 다시 관찰하면 아무 것도 쓰지 않는다.
 */
public class ResponseReconciler implements ReconcileResponsesUseCase {

    private static final Logger log = Logger.getLogger(ResponseReconciler.class);

    private final ScheduleStore scheduleStore;
    private final CalendarGateway calendarGateway;
    private final ConfirmationStateMachine stateMachine;
    private final BufferConflictChecker conflictChecker;
    private final ClockPort clockPort;
    private final int batchSize;
    private final Duration leaseTtl;
    private final int alertAfterFailures;
    private final int bufferMinutes;
    private final String leaseOwner;
    private final Map<String, Integer> consecutiveFailures = new ConcurrentHashMap<>();

    public ResponseReconciler(ScheduleStore scheduleStore,
                              CalendarGateway calendarGateway,
                              ConfirmationStateMachine stateMachine,
                              BufferConflictChecker conflictChecker,
                              ClockPort clockPort,
                              int batchSize,
                              Duration leaseTtl,
                              int alertAfterFailures,
                              int bufferMinutes) {
        this.scheduleStore = scheduleStore;
        this.calendarGateway = calendarGateway;
        this.stateMachine = stateMachine;
        this.conflictChecker = conflictChecker;
        this.clockPort = clockPort;
        this.batchSize = batchSize;
        this.leaseTtl = leaseTtl;
        this.alertAfterFailures = alertAfterFailures;
        this.bufferMinutes = bufferMinutes;
        this.leaseOwner = "reconciler-" + UUID.randomUUID();
    }

    @Override
    public ReconciliationReport runReconciliationPass() {
        ReconciliationReport.Tally tally = new ReconciliationReport.Tally();
        Optional<AwaitingCursor> cursor = Optional.empty();
        List<Schedule> page;
        do {
            page = scheduleStore.findAwaitingResponse(cursor, batchSize);
            for (Schedule schedule : page) {
                tally.add(reconcileSafely(schedule));
            }
            if (!page.isEmpty()) {
                cursor = Optional.of(AwaitingCursor.after(page.get(page.size() - 1)));
            }
        } while (page.size() == batchSize);
        pruneFailures();
        ReconciliationReport report = tally.toReport();
        log.infof("응답 리컨실 완료: checked=%d, techAccepted=%d, customerAccepted=%d, declined=%d, deleted=%d, held=%d, failed=%d",
                report.checked(),
                report.count(ReconciliationOutcome.TECHNICIAN_ACCEPTED),
                report.count(ReconciliationOutcome.CUSTOMER_ACCEPTED),
                report.count(ReconciliationOutcome.TECHNICIAN_DECLINED) + report.count(ReconciliationOutcome.CUSTOMER_DECLINED),
                report.count(ReconciliationOutcome.EVENT_DELETED),
                report.count(ReconciliationOutcome.HELD_BY_CONFLICT),
                report.failed());
        return report;
    }

    /**
     * 단건 리컨실. 푸시 알림이나 운영 점검에서 일정 하나만 다시 확인할 때 쓴다.
     */
    @Override
    public ReconciliationOutcome reconcileSchedule(String scheduleId) {
        Schedule schedule = scheduleStore.findById(scheduleId)
                .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
        return reconcileSafely(schedule);
    }

    @Override
    public Set<String> stuckScheduleIds() {
        return consecutiveFailures.entrySet().stream()
                .filter(entry -> entry.getValue() >= alertAfterFailures)
                .map(Map.Entry::getKey)
                .collect(Collectors.toUnmodifiableSet());
    }

    private ReconciliationOutcome reconcileSafely(Schedule schedule) {
        try {
            ReconciliationOutcome outcome = reconcileClaimed(schedule.id());
            consecutiveFailures.remove(schedule.id());
            return outcome;
        } catch (StaleWriteException e) {
            log.infof("일정 %s 이(가) 처리 중 다른 쓰기에 밀렸습니다. 다음 회차에 다시 확인합니다.", schedule.id());
            return ReconciliationOutcome.SUPERSEDED;
        } catch (GatewayException e) {
            recordFailure(schedule, e);
            return ReconciliationOutcome.FAILED;
        } catch (RuntimeException e) {
            log.errorf(e, "일정 %s 리컨실 중 예외", schedule.id());
            recordFailure(schedule, e);
            return ReconciliationOutcome.FAILED;
        }
    }

    private ReconciliationOutcome reconcileClaimed(String scheduleId) {
        if (!scheduleStore.tryLease(scheduleId, leaseOwner, clockPort.instant(), leaseTtl)) {
            return ReconciliationOutcome.LEASED_ELSEWHERE;
        }
        try {
            return reconcileFresh(scheduleId);
        } finally {
            scheduleStore.releaseLease(scheduleId, leaseOwner);
        }
    }

    private ReconciliationOutcome reconcileFresh(String scheduleId) {
        Optional<Schedule> fresh = scheduleStore.findById(scheduleId);
        if (fresh.isEmpty() || !fresh.get().confirmationState().awaitingResponse() || fresh.get().externalEventRef() == null) {
            return ReconciliationOutcome.NOT_AWAITING;
        }
        Schedule schedule = fresh.get();
        CalendarEventSnapshot snapshot = calendarGateway.getEvent(schedule.externalEventRef());
        if (!snapshot.exists()) {
            log.infof("외부 이벤트 %s 가 삭제되었습니다. 일정 %s 을(를) 취소합니다.", schedule.externalEventRef(), schedule.id());
            stateMachine.eventDeleted(schedule);
            return ReconciliationOutcome.EVENT_DELETED;
        }
        boolean awaitingTechnician = schedule.confirmationState() == ConfirmationState.PENDING_TECH;
        AttendeeRole role = awaitingTechnician ? AttendeeRole.TECHNICIAN : AttendeeRole.CUSTOMER;
        AttendeeResponse response = awaitingTechnician && schedule.selfAssigned()
                ? AttendeeResponse.ACCEPTED
                : snapshot.responseOf(role);
        return switch (response) {
            case ACCEPTED -> onAccepted(schedule);
            case DECLINED -> onDeclined(schedule, role);
            case TENTATIVE, NONE -> {
                noteResponse(schedule, role, response);
                yield ReconciliationOutcome.UNCHANGED;
            }
        };
    }

    private ReconciliationOutcome onAccepted(Schedule schedule) {
        if (schedule.confirmationState() == ConfirmationState.PENDING_CUSTOMER) {
            stateMachine.customerAccepted(schedule);
            return ReconciliationOutcome.CUSTOMER_ACCEPTED;
        }
        List<Schedule> sameTechnician = scheduleStore.findInRange(
                Optional.of(schedule.technicianId()), DateRange.around(schedule.window().date()));
        Optional<Conflict> conflict = conflictChecker.findConflict(
                schedule.technicianId(), schedule.window(), bufferMinutes, sameTechnician, schedule.id());
        if (conflict.isPresent()) {
            log.warnf("기사 %s 가 일정 %s 을(를) 승인했지만 확정된 일정 %s 과(와) 겹쳐 pending_tech 로 유지합니다.",
                    schedule.technicianId(), schedule.id(), conflict.get().scheduleId());
            noteResponse(schedule, AttendeeRole.TECHNICIAN, AttendeeResponse.ACCEPTED);
            return ReconciliationOutcome.HELD_BY_CONFLICT;
        }
        stateMachine.technicianAccepted(schedule);
        return ReconciliationOutcome.TECHNICIAN_ACCEPTED;
    }

    private ReconciliationOutcome onDeclined(Schedule schedule, AttendeeRole role) {
        if (role == AttendeeRole.TECHNICIAN) {
            stateMachine.technicianDeclined(schedule);
            return ReconciliationOutcome.TECHNICIAN_DECLINED;
        }
        stateMachine.customerDeclined(schedule);
        return ReconciliationOutcome.CUSTOMER_DECLINED;
    }

    private void noteResponse(Schedule schedule, AttendeeRole role, AttendeeResponse response) {
        if (schedule.recordedResponse(role) != response) {
            stateMachine.recordResponse(schedule, role, response);
        }
    }

    private void recordFailure(Schedule schedule, RuntimeException cause) {
        int failures = consecutiveFailures.merge(schedule.id(), 1, Integer::sum);
        if (failures >= alertAfterFailures) {
            log.errorf("일정 %s 리컨실이 %d회 연속 실패했습니다: %s", schedule.id(), failures, cause.getMessage());
        } else {
            log.warnf("일정 %s 리컨실 실패(%d회째), 다음 회차에 재시도: %s", schedule.id(), failures, cause.getMessage());
        }
    }

    private void pruneFailures() {
        consecutiveFailures.keySet().removeIf(id -> scheduleStore.findById(id)
                .map(schedule -> !schedule.confirmationState().awaitingResponse())
                .orElse(true));
    }
}
