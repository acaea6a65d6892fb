package com.my.dispatch.domain.service;

import com.my.dispatch.domain.exception.InvalidLinkException;
import com.my.dispatch.domain.exception.InvalidStateException;
import com.my.dispatch.domain.exception.ScheduleNotFoundException;
import com.my.dispatch.domain.model.CancellationReason;
import com.my.dispatch.domain.model.ConfirmationState;
import com.my.dispatch.domain.model.CustomerLinkAction;
import com.my.dispatch.domain.model.Schedule;
import com.my.dispatch.domain.port.in.CustomerResponseUseCase;
import com.my.dispatch.domain.port.out.ScheduleStore;
import org.jboss.logging.Logger;

/**
 * 서명 링크로 들어온 고객 응답을 pending_customer 일정의 확정/취소로 옮긴다.
 * 같은 링크를 다시 눌러 이미 같은 결과에 도달한 일정이면 아무 것도 쓰지 않고 현재 일정을 돌려준다.
 */
public class CustomerLinkResponder implements CustomerResponseUseCase {

    private static final Logger log = Logger.getLogger(CustomerLinkResponder.class);

    private final ScheduleStore scheduleStore;
    private final ConfirmationStateMachine stateMachine;
    private final CustomerResponseLinks links;

    public CustomerLinkResponder(ScheduleStore scheduleStore,
                                 ConfirmationStateMachine stateMachine,
                                 CustomerResponseLinks links) {
        this.scheduleStore = scheduleStore;
        this.stateMachine = stateMachine;
        this.links = links;
    }

    @Override
    public Schedule respondByLink(String scheduleId, String action, String token) {
        CustomerLinkAction linkAction = CustomerLinkAction.fromWire(action);
        if (scheduleId == null || !links.verify(scheduleId, linkAction, token)) {
            log.warnf("고객 응답 링크 검증 실패: schedule=%s, action=%s", scheduleId, action);
            throw new InvalidLinkException(scheduleId);
        }
        Schedule schedule = scheduleStore.findById(scheduleId)
                .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
        if (schedule.confirmationState() != ConfirmationState.PENDING_CUSTOMER) {
            if (alreadyApplied(schedule, linkAction)) {
                log.infof("이미 반영된 고객 응답 링크입니다: schedule=%s, action=%s", scheduleId, action);
                return schedule;
            }
            throw new InvalidStateException(scheduleId, schedule.confirmationState(), "고객 링크 응답(" + action + ")");
        }
        Schedule saved = linkAction == CustomerLinkAction.ACCEPT
                ? stateMachine.customerAcceptedByLink(schedule)
                : stateMachine.customerDeclined(schedule);
        log.infof("고객 링크 응답 반영: schedule=%s, action=%s, state=%s",
                scheduleId, action, saved.confirmationState().wireName());
        return saved;
    }

    private static boolean alreadyApplied(Schedule schedule, CustomerLinkAction action) {
        return switch (action) {
            case ACCEPT -> schedule.confirmationState() == ConfirmationState.CONFIRMED
                    && schedule.customerAcceptedAt() != null;
            case DECLINE -> schedule.confirmationState() == ConfirmationState.CANCELLED
                    && schedule.cancellationReason() == CancellationReason.CUSTOMER_DECLINED;
        };
    }
}
