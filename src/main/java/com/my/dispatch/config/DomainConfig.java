package com.my.dispatch.config;

import com.my.dispatch.adapter.out.clock.OffsetClockAdapter;
import com.my.dispatch.domain.port.in.CustomerResponseUseCase;
import com.my.dispatch.domain.port.in.ReconcileResponsesUseCase;
import com.my.dispatch.domain.port.in.SchedulingUseCase;
import com.my.dispatch.domain.port.out.CalendarGateway;
import com.my.dispatch.domain.port.out.ClockPort;
import com.my.dispatch.domain.port.out.ScheduleStore;
import com.my.dispatch.domain.port.out.TicketNotificationPort;
import com.my.dispatch.domain.port.out.TicketPort;
import com.my.dispatch.domain.service.BufferConflictChecker;
import com.my.dispatch.domain.service.ConfirmationStateMachine;
import com.my.dispatch.domain.service.CustomerLinkResponder;
import com.my.dispatch.domain.service.CustomerResponseLinks;
import com.my.dispatch.domain.service.InviteComposer;
import com.my.dispatch.domain.service.ResponseReconciler;
import com.my.dispatch.domain.service.SchedulerService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

import java.time.Duration;
import java.time.ZoneId;

/**
 * 왜: 도메인 서비스와 포트 구현을 명시적으로 연결하여 헥사고날 구조를 보장하기 위함.
 */
@ApplicationScoped
public class DomainConfig {

    @Produces
    @ApplicationScoped
    public BufferConflictChecker bufferConflictChecker() {
        return new BufferConflictChecker();
    }

    @Produces
    @ApplicationScoped
    public ConfirmationStateMachine confirmationStateMachine(CalendarGateway calendarGateway,
                                                             ScheduleStore scheduleStore,
                                                             TicketPort ticketPort,
                                                             TicketNotificationPort ticketNotificationPort,
                                                             ClockPort clockPort,
                                                             CustomerResponseLinks customerResponseLinks,
                                                             AppConfig appConfig) {
        return new ConfirmationStateMachine(calendarGateway, scheduleStore, ticketPort, ticketNotificationPort,
                clockPort, new InviteComposer(customerResponseLinks), appConfig.calendar().organizerEmail());
    }

    @Produces
    @ApplicationScoped
    public CustomerResponseLinks customerResponseLinks(AppConfig appConfig) {
        AppConfig.CustomerLinkConfig customerLink = appConfig.customerLink();
        return new CustomerResponseLinks(customerLink.secret(), customerLink.baseUrl());
    }

    @Produces
    @ApplicationScoped
    public CustomerResponseUseCase customerResponseUseCase(ScheduleStore scheduleStore,
                                                           ConfirmationStateMachine confirmationStateMachine,
                                                           CustomerResponseLinks customerResponseLinks) {
        return new CustomerLinkResponder(scheduleStore, confirmationStateMachine, customerResponseLinks);
    }

    @Produces
    @ApplicationScoped
    public SchedulingUseCase schedulingUseCase(ScheduleStore scheduleStore,
                                               BufferConflictChecker bufferConflictChecker,
                                               ConfirmationStateMachine confirmationStateMachine,
                                               TicketPort ticketPort,
                                               ClockPort clockPort,
                                               AppConfig appConfig) {
        return new SchedulerService(scheduleStore, bufferConflictChecker, confirmationStateMachine, ticketPort, clockPort,
                appConfig.schedule().bufferMinutes(), appConfig.schedule().defaultDurationMinutes());
    }

    @Produces
    @ApplicationScoped
    public ReconcileResponsesUseCase reconcileResponsesUseCase(ScheduleStore scheduleStore,
                                                               CalendarGateway calendarGateway,
                                                               ConfirmationStateMachine confirmationStateMachine,
                                                               BufferConflictChecker bufferConflictChecker,
                                                               ClockPort clockPort,
                                                               AppConfig appConfig) {
        AppConfig.ReconcilerConfig reconciler = appConfig.reconciler();
        return new ResponseReconciler(scheduleStore, calendarGateway, confirmationStateMachine, bufferConflictChecker, clockPort,
                reconciler.batchSize(), Duration.ofSeconds(reconciler.leaseSeconds()), reconciler.alertAfterFailures(),
                appConfig.schedule().bufferMinutes());
    }

    @Produces
    @ApplicationScoped
    public ClockPort clockPort(AppConfig appConfig) {
        return OffsetClockAdapter.of(ZoneId.of(appConfig.schedule().zone()));
    }
}
