package com.my.dispatch.domain.service;

import com.my.dispatch.domain.exception.ConflictException;
import com.my.dispatch.domain.exception.InvalidStateException;
import com.my.dispatch.domain.exception.ScheduleNotFoundException;
import com.my.dispatch.domain.exception.StaleWriteException;
import com.my.dispatch.domain.exception.ValidationException;
import com.my.dispatch.domain.model.ConfirmationState;
import com.my.dispatch.domain.model.DateRange;
import com.my.dispatch.domain.model.Schedule;
import com.my.dispatch.domain.model.Technician;
import com.my.dispatch.domain.model.Ticket;
import com.my.dispatch.domain.model.TimeWindow;
import com.my.dispatch.domain.model.WindowRequest;
import com.my.dispatch.domain.port.in.SchedulingUseCase;
import com.my.dispatch.domain.port.out.ClockPort;
import com.my.dispatch.domain.port.out.ScheduleStore;
import com.my.dispatch.domain.port.out.TicketPort;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * 왜: 디스패처 요청을 검증, 버퍼 충돌 검사, 상태 전이 순서로 조율하는 유스케이스 구현.
 */
public class SchedulerService implements SchedulingUseCase {

    private final ScheduleStore scheduleStore;
    private final BufferConflictChecker conflictChecker;
    private final ConfirmationStateMachine stateMachine;
    private final TicketPort ticketPort;
    private final ClockPort clockPort;
    private final int bufferMinutes;
    private final int defaultDurationMinutes;

    public SchedulerService(ScheduleStore scheduleStore,
                            BufferConflictChecker conflictChecker,
                            ConfirmationStateMachine stateMachine,
                            TicketPort ticketPort,
                            ClockPort clockPort,
                            int bufferMinutes,
                            int defaultDurationMinutes) {
        this.scheduleStore = scheduleStore;
        this.conflictChecker = conflictChecker;
        this.stateMachine = stateMachine;
        this.ticketPort = ticketPort;
        this.clockPort = clockPort;
        this.bufferMinutes = bufferMinutes;
        this.defaultDurationMinutes = defaultDurationMinutes;
    }

    /**
     * draft 는 잠정 옵션이므로 충돌 검사를 하지 않는다.
     */
    @Override
    public Schedule createDraft(String ticketId, Technician technician, WindowRequest window) {
        if (ticketId == null || ticketId.isBlank()) {
            throw new ValidationException("일정은 티켓 참조가 필요합니다.");
        }
        if (technician == null) {
            throw new ValidationException("일정은 배정 기사가 필요합니다.");
        }
        TimeWindow resolved = resolveWindow(ticketId, window);
        Schedule draft = Schedule.newDraft(UUID.randomUUID().toString(), ticketId, technician, resolved, clockPort.instant());
        return scheduleStore.insert(draft);
    }

    @Override
    public Schedule moveDraft(String scheduleId, long expectedVersion, WindowRequest newWindow, Technician newTechnician) {
        Schedule current = loadCurrent(scheduleId, expectedVersion);
        if (current.confirmationState() != ConfirmationState.DRAFT) {
            throw new InvalidStateException(scheduleId, current.confirmationState(), "moveDraft");
        }
        TimeWindow resolved = newWindow == null ? current.window() : resolveWindow(current.ticketId(), newWindow);
        Schedule moved = current.toBuilder()
                .window(resolved)
                .technician(newTechnician == null ? current.technician() : newTechnician)
                .updatedAt(clockPort.instant())
                .build();
        return scheduleStore.update(moved, expectedVersion);
    }

    @Override
    public Schedule commit(String scheduleId, long expectedVersion) {
        Schedule current = loadCurrent(scheduleId, expectedVersion);
        if (current.confirmationState() != ConfirmationState.DRAFT) {
            throw new InvalidStateException(scheduleId, current.confirmationState(), "commit");
        }
        List<Schedule> sameTechnician = scheduleStore.findInRange(
                Optional.of(current.technicianId()), DateRange.around(current.window().date()));
        conflictChecker.findConflict(current.technicianId(), current.window(), bufferMinutes, sameTechnician, current.id())
                .ifPresent(conflict -> {
                    throw new ConflictException(conflict);
                });
        return stateMachine.commit(current);
    }

    @Override
    public Schedule sendCustomerInvite(String scheduleId, long expectedVersion) {
        return stateMachine.sendCustomerInvite(loadCurrent(scheduleId, expectedVersion));
    }

    @Override
    public Schedule markConfirmedManually(String scheduleId, long expectedVersion, String dispatcherId) {
        return stateMachine.markConfirmedManually(loadCurrent(scheduleId, expectedVersion), dispatcherId);
    }

    @Override
    public Schedule resetToDraft(String scheduleId, long expectedVersion) {
        return stateMachine.resetToDraft(loadCurrent(scheduleId, expectedVersion));
    }

    @Override
    public void remove(String scheduleId, long expectedVersion) {
        stateMachine.remove(loadCurrent(scheduleId, expectedVersion));
    }

    @Override
    public Schedule getSchedule(String scheduleId) {
        return scheduleStore.findById(scheduleId)
                .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
    }

    @Override
    public List<Schedule> listSchedulesForRange(Optional<String> technicianId, DateRange range) {
        Objects.requireNonNull(range, "range");
        return scheduleStore.findInRange(technicianId == null ? Optional.empty() : technicianId, range);
    }

    /**
     * 외부 호출 전에 호출자의 버전이 최신인지 먼저 확인해, 낡은 요청이 외부 시스템을 건드리지 않도록 한다.
     */
    private Schedule loadCurrent(String scheduleId, long expectedVersion) {
        Schedule current = getSchedule(scheduleId);
        if (current.version() != expectedVersion) {
            throw new StaleWriteException(scheduleId, expectedVersion, current.version());
        }
        return current;
    }

    private TimeWindow resolveWindow(String ticketId, WindowRequest window) {
        if (window == null) {
            throw new ValidationException("일정 시간 범위가 필요합니다.");
        }
        Integer ticketEstimate = null;
        if (!window.hasExplicitLength()) {
            ticketEstimate = ticketPort.getTicket(ticketId)
                    .flatMap(Ticket::estimatedDuration)
                    .orElse(null);
        }
        return window.resolve(ticketEstimate, defaultDurationMinutes);
    }
}
