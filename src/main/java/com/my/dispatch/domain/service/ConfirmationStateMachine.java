package com.my.dispatch.domain.service;

import com.my.dispatch.domain.exception.GatewayException;
import com.my.dispatch.domain.exception.ScheduleNotFoundException;
import com.my.dispatch.domain.exception.StaleWriteException;
import com.my.dispatch.domain.exception.ValidationException;
import com.my.dispatch.domain.model.Attendee;
import com.my.dispatch.domain.model.AttendeeResponse;
import com.my.dispatch.domain.model.AttendeeRole;
import com.my.dispatch.domain.model.CalendarEventRequest;
import com.my.dispatch.domain.model.CancellationReason;
import com.my.dispatch.domain.model.Confirmation;
import com.my.dispatch.domain.model.ConfirmationEvent;
import com.my.dispatch.domain.model.ConfirmationMethod;
import com.my.dispatch.domain.model.ConfirmationState;
import com.my.dispatch.domain.model.EventUpdate;
import com.my.dispatch.domain.model.Schedule;
import com.my.dispatch.domain.model.Ticket;
import com.my.dispatch.domain.model.WorkStatus;
import com.my.dispatch.domain.port.out.CalendarGateway;
import com.my.dispatch.domain.port.out.ClockPort;
import com.my.dispatch.domain.port.out.ScheduleStore;
import com.my.dispatch.domain.port.out.TicketNotificationPort;
import com.my.dispatch.domain.port.out.TicketPort;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 왜: 승인 상태 전이와 그에 딸린 외부 부수효과(초대 발송, 이벤트 취소, 티켓 알림)를 한 곳에서 순서대로 수행하기 위함.
 * <p>
 * 디스패처 전이는 외부 호출이 성공한 뒤에만 저장한다. 외부 호출이 실패하면 저장된 상태는 그대로 남는다.
 * 리컨실러가 관찰한 거절/삭제는 저장을 먼저 하고, 이벤트 취소와 티켓 알림은 그 뒤에 최선 노력으로 수행한다.
 */
public class ConfirmationStateMachine {

    private static final Logger log = Logger.getLogger(ConfirmationStateMachine.class);
    private static final int MAX_RESET_ATTEMPTS = 3;

    private final CalendarGateway calendarGateway;
    private final ScheduleStore scheduleStore;
    private final TicketPort ticketPort;
    private final TicketNotificationPort ticketNotificationPort;
    private final ClockPort clockPort;
    private final InviteComposer inviteComposer;
    private final String organizerEmail;

    public ConfirmationStateMachine(CalendarGateway calendarGateway,
                                    ScheduleStore scheduleStore,
                                    TicketPort ticketPort,
                                    TicketNotificationPort ticketNotificationPort,
                                    ClockPort clockPort,
                                    InviteComposer inviteComposer,
                                    String organizerEmail) {
        this.calendarGateway = calendarGateway;
        this.scheduleStore = scheduleStore;
        this.ticketPort = ticketPort;
        this.ticketNotificationPort = ticketNotificationPort;
        this.clockPort = clockPort;
        this.inviteComposer = inviteComposer;
        this.organizerEmail = organizerEmail;
    }

    /**
     * draft → pending_tech. 기사가 이벤트 소유 계정 본인이면 초대 없이 이벤트만 만든다.
     */
    public Schedule commit(Schedule draft) {
        ConfirmationState target = ConfirmationTransitions.require(draft.id(), draft.confirmationState(), ConfirmationEvent.COMMIT);
        Optional<Ticket> ticket = ticketPort.getTicket(draft.ticketId());
        boolean selfAssigned = draft.technician().isSameAccount(organizerEmail);
        List<Attendee> attendees = selfAssigned
                ? List.of()
                : List.of(new Attendee(AttendeeRole.TECHNICIAN, draft.technician().email(), draft.technicianName()));
        CalendarEventRequest request = new CalendarEventRequest(
                inviteComposer.subject(draft, ticket, InviteComposer.Stage.PENDING),
                inviteComposer.body(draft, ticket, true),
                inviteComposer.location(ticket),
                attendees,
                draft.window(),
                true
        );
        String eventRef = calendarGateway.createEvent(request);
        if (eventRef == null || eventRef.isBlank()) {
            throw new GatewayException("캘린더가 이벤트 참조를 돌려주지 않았습니다: " + draft.id());
        }
        Schedule next = draft.toBuilder()
                .confirmationState(target)
                .externalEventRef(eventRef)
                .selfAssigned(selfAssigned)
                .updatedAt(now())
                .build();
        Schedule saved;
        try {
            saved = scheduleStore.update(next, draft.version());
        } catch (StaleWriteException e) {
            cancelQuietly(eventRef);
            throw e;
        }
        log.infof("일정 커밋: id=%s, tech=%s, event=%s, self=%s", saved.id(), saved.technicianId(), eventRef, selfAssigned);
        return saved;
    }

    public Schedule technicianAccepted(Schedule schedule) {
        ConfirmationState target = ConfirmationTransitions.require(schedule.id(), schedule.confirmationState(), ConfirmationEvent.TECHNICIAN_ACCEPTED);
        Instant now = now();
        Schedule next = schedule.toBuilder()
                .confirmationState(target)
                .technicianResponse(AttendeeResponse.ACCEPTED)
                .technicianAcceptedAt(now)
                .lastResponseCheckAt(now)
                .updatedAt(now)
                .build();
        Schedule saved = scheduleStore.update(next, schedule.version());
        log.infof("기사 승인 반영: id=%s, tech=%s", saved.id(), saved.technicianId());
        return saved;
    }

    public Schedule technicianDeclined(Schedule schedule) {
        return cancel(schedule, ConfirmationEvent.TECHNICIAN_DECLINED, CancellationReason.TECHNICIAN_DECLINED, AttendeeRole.TECHNICIAN);
    }

    /**
     * tech_accepted → pending_customer. 항상 디스패처가 직접 호출하며 리컨실러는 이 전이를 일으키지 않는다.
     */
    public Schedule sendCustomerInvite(Schedule schedule) {
        ConfirmationState target = ConfirmationTransitions.require(schedule.id(), schedule.confirmationState(), ConfirmationEvent.CUSTOMER_INVITE_SENT);
        Ticket ticket = ticketPort.getTicket(schedule.ticketId())
                .orElseThrow(() -> new ValidationException("티켓을 찾을 수 없습니다: " + schedule.ticketId()));
        String contact = ticket.customerContact()
                .orElseThrow(() -> new ValidationException("티켓 " + ticket.id() + " 에 고객 이메일이 없습니다. 수동 확정을 사용하세요."));
        calendarGateway.addAttendee(schedule.externalEventRef(),
                new Attendee(AttendeeRole.CUSTOMER, contact, ticket.customerDisplayName()));
        updateQuietly(schedule.externalEventRef(), new EventUpdate(
                inviteComposer.subject(schedule, Optional.of(ticket), InviteComposer.Stage.AWAITING_CUSTOMER),
                inviteComposer.customerInviteBody(schedule, ticket),
                true));
        Instant now = now();
        Schedule next = schedule.toBuilder()
                .confirmationState(target)
                .customerInviteSentAt(now)
                .updatedAt(now)
                .build();
        Schedule saved = scheduleStore.update(next, schedule.version());
        log.infof("고객 초대 발송: id=%s, event=%s", saved.id(), saved.externalEventRef());
        return saved;
    }

    public Schedule markConfirmedManually(Schedule schedule, String dispatcherId) {
        if (dispatcherId == null || dispatcherId.isBlank()) {
            throw new ValidationException("수동 확정에는 디스패처 ID가 필요합니다.");
        }
        return confirm(schedule, ConfirmationEvent.MANUAL_CONFIRM, dispatcherId, ConfirmationMethod.MANUAL_OVERRIDE);
    }

    public Schedule customerAccepted(Schedule schedule) {
        return confirm(schedule, ConfirmationEvent.CUSTOMER_ACCEPTED, "customer", ConfirmationMethod.CALENDAR_ACCEPT);
    }

    public Schedule customerAcceptedByLink(Schedule schedule) {
        return confirm(schedule, ConfirmationEvent.CUSTOMER_ACCEPTED, "customer", ConfirmationMethod.EMAIL_LINK);
    }

    public Schedule customerDeclined(Schedule schedule) {
        return cancel(schedule, ConfirmationEvent.CUSTOMER_DECLINED, CancellationReason.CUSTOMER_DECLINED, AttendeeRole.CUSTOMER);
    }

    public Schedule eventDeleted(Schedule schedule) {
        return cancel(schedule, ConfirmationEvent.EVENT_DELETED, CancellationReason.EVENT_DELETED, null);
    }

    /**
     * 상태 변화 없이 새로 관찰된 응답 값(tentative 등)만 기록한다.
     */
    public Schedule recordResponse(Schedule schedule, AttendeeRole role, AttendeeResponse response) {
        Instant now = now();
        Schedule next = schedule.toBuilder()
                .response(role, response)
                .lastResponseCheckAt(now)
                .updatedAt(now)
                .build();
        return scheduleStore.update(next, schedule.version());
    }

    /**
     * draft 가 아닌 일정을 draft 로 되돌린다. 외부 이벤트 취소가 실패하면 되돌리지 않는다.
     * <p>
     * 취소 후 저장이 경합으로 실패하면 최신 행을 다시 읽는다. 같은 이벤트를 가리키고 아직 되돌릴 수 있는 상태면
     * 최신 버전 위에 복귀를 다시 적용한다. 이벤트는 이미 취소됐으므로 행이 그 이벤트를 계속 가리키게 두지 않는다.
     */
    public Schedule resetToDraft(Schedule schedule) {
        ConfirmationTransitions.require(schedule.id(), schedule.confirmationState(), ConfirmationEvent.RESET);
        String eventRef = schedule.externalEventRef();
        calendarGateway.cancelEvent(eventRef);
        Schedule current = schedule;
        for (int attempt = 1; ; attempt++) {
            try {
                Schedule saved = scheduleStore.update(cleared(current), current.version());
                log.infof("일정 draft 복귀: id=%s, cancelledEvent=%s", saved.id(), eventRef);
                return saved;
            } catch (StaleWriteException e) {
                Schedule fresh = scheduleStore.findById(schedule.id())
                        .orElseThrow(() -> new ScheduleNotFoundException(schedule.id()));
                boolean sameEvent = eventRef != null && eventRef.equals(fresh.externalEventRef());
                if (attempt >= MAX_RESET_ATTEMPTS || !sameEvent
                        || !ConfirmationTransitions.isAllowed(fresh.confirmationState(), ConfirmationEvent.RESET)) {
                    log.errorf("이벤트 %s 취소 후 일정 %s 저장이 경합으로 실패했습니다. 현재 상태=%s",
                            eventRef, schedule.id(), fresh.confirmationState().wireName());
                    throw e;
                }
                log.infof("경합 감지: 일정 %s 를 버전 %d 기준으로 다시 draft 복귀합니다.", schedule.id(), fresh.version());
                current = fresh;
            }
        }
    }

    private Schedule cleared(Schedule schedule) {
        return schedule.toBuilder()
                .confirmationState(ConfirmationState.DRAFT)
                .status(WorkStatus.SCHEDULED)
                .externalEventRef(null)
                .selfAssigned(false)
                .confirmation(null)
                .customerInviteSentAt(null)
                .technicianResponse(AttendeeResponse.NONE)
                .customerResponse(AttendeeResponse.NONE)
                .technicianAcceptedAt(null)
                .customerAcceptedAt(null)
                .lastResponseCheckAt(null)
                .cancellationReason(null)
                .updatedAt(now())
                .build();
    }

    /**
     * 일정 행을 삭제하고 외부 이벤트 취소와 티켓 반환은 최선 노력으로 수행한다. 티켓 자체는 건드리지 않는다.
     */
    public void remove(Schedule schedule) {
        scheduleStore.delete(schedule.id(), schedule.version());
        if (schedule.externalEventRef() != null && schedule.confirmationState() != ConfirmationState.CANCELLED) {
            cancelQuietly(schedule.externalEventRef());
        }
        notifyUnscheduledQuietly(schedule);
        log.infof("일정 삭제: id=%s, ticket=%s", schedule.id(), schedule.ticketId());
    }

    private Schedule confirm(Schedule schedule, ConfirmationEvent event, String confirmedBy, ConfirmationMethod method) {
        ConfirmationState target = ConfirmationTransitions.require(schedule.id(), schedule.confirmationState(), event);
        Instant now = now();
        Schedule.Builder builder = schedule.toBuilder()
                .confirmationState(target)
                .confirmation(new Confirmation(now, confirmedBy, method))
                .updatedAt(now);
        if (event == ConfirmationEvent.CUSTOMER_ACCEPTED) {
            builder.customerResponse(AttendeeResponse.ACCEPTED)
                    .customerAcceptedAt(now)
                    .lastResponseCheckAt(now);
        }
        Schedule saved = scheduleStore.update(builder.build(), schedule.version());
        finalizeQuietly(saved);
        try {
            ticketNotificationPort.notifyTicketScheduleConfirmed(saved.ticketId(), saved.id());
        } catch (RuntimeException e) {
            log.errorf(e, "티켓 확정 알림 실패: ticket=%s, schedule=%s", saved.ticketId(), saved.id());
        }
        log.infof("일정 확정: id=%s, by=%s, method=%s", saved.id(), confirmedBy, method.wireName());
        return saved;
    }

    private Schedule cancel(Schedule schedule, ConfirmationEvent event, CancellationReason reason, AttendeeRole decliningRole) {
        ConfirmationState target = ConfirmationTransitions.require(schedule.id(), schedule.confirmationState(), event);
        Instant now = now();
        Schedule.Builder builder = schedule.toBuilder()
                .confirmationState(target)
                .status(WorkStatus.CANCELLED)
                .cancellationReason(reason)
                .lastResponseCheckAt(now)
                .updatedAt(now);
        if (decliningRole != null) {
            builder.response(decliningRole, AttendeeResponse.DECLINED);
        }
        Schedule saved = scheduleStore.update(builder.build(), schedule.version());
        if (reason != CancellationReason.EVENT_DELETED) {
            cancelQuietly(saved.externalEventRef());
        }
        notifyUnscheduledQuietly(saved);
        log.infof("일정 취소: id=%s, reason=%s", saved.id(), reason);
        return saved;
    }

    private void finalizeQuietly(Schedule schedule) {
        try {
            Optional<Ticket> ticket = ticketPort.getTicket(schedule.ticketId());
            calendarGateway.updateEvent(schedule.externalEventRef(),
                    new EventUpdate(inviteComposer.subject(schedule, ticket, InviteComposer.Stage.FINAL), false));
        } catch (GatewayException e) {
            log.warnf("확정 이벤트 갱신 실패(무시): event=%s, cause=%s", schedule.externalEventRef(), e.getMessage());
        }
    }

    private void updateQuietly(String eventRef, EventUpdate update) {
        try {
            calendarGateway.updateEvent(eventRef, update);
        } catch (GatewayException e) {
            log.warnf("이벤트 제목 갱신 실패(무시): event=%s, cause=%s", eventRef, e.getMessage());
        }
    }

    private void cancelQuietly(String eventRef) {
        try {
            calendarGateway.cancelEvent(eventRef);
        } catch (GatewayException e) {
            log.warnf("외부 이벤트 취소 실패(무시): event=%s, cause=%s", eventRef, e.getMessage());
        }
    }

    private void notifyUnscheduledQuietly(Schedule schedule) {
        try {
            ticketNotificationPort.notifyTicketUnscheduled(schedule.ticketId());
        } catch (RuntimeException e) {
            log.errorf(e, "티켓 미배정 알림 실패: ticket=%s, schedule=%s", schedule.ticketId(), schedule.id());
        }
    }

    private Instant now() {
        return clockPort.instant();
    }
}
