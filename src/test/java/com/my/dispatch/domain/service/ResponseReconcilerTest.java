package com.my.dispatch.domain.service;

import com.my.dispatch.adapter.out.calendar.InMemoryCalendarGateway;
import com.my.dispatch.adapter.out.persistence.InMemoryScheduleStore;
import com.my.dispatch.domain.exception.GatewayException;
import com.my.dispatch.domain.exception.ScheduleNotFoundException;
import com.my.dispatch.domain.exception.StaleWriteException;
import com.my.dispatch.domain.model.AttendeeResponse;
import com.my.dispatch.domain.model.AttendeeRole;
import com.my.dispatch.domain.model.CancellationReason;
import com.my.dispatch.domain.model.ConfirmationMethod;
import com.my.dispatch.domain.model.ConfirmationState;
import com.my.dispatch.domain.model.ReconciliationOutcome;
import com.my.dispatch.domain.model.ReconciliationReport;
import com.my.dispatch.domain.model.Schedule;
import com.my.dispatch.domain.model.Technician;
import com.my.dispatch.domain.model.Ticket;
import com.my.dispatch.domain.model.WindowRequest;
import com.my.dispatch.domain.port.out.ClockPort;
import com.my.dispatch.domain.port.out.TicketNotificationPort;
import com.my.dispatch.domain.port.out.TicketPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ResponseReconcilerTest {

    private static final LocalDate DAY = LocalDate.of(2026, 3, 1);
    private static final OffsetDateTime NOW = OffsetDateTime.of(2026, 2, 20, 8, 0, 0, 0, ZoneOffset.UTC);
    private static final String ORGANIZER = "dispatch@example.com";
    private static final Technician ALEX = new Technician("tech-a", "Alex", "alex@example.com");
    private static final Technician BEA = new Technician("tech-b", "Bea", "bea@example.com");
    private static final Technician CARL = new Technician("tech-c", "Carl", "carl@example.com");

    private InMemoryScheduleStore store;
    private InMemoryCalendarGateway gateway;
    private TicketNotificationPort notifications;
    private SchedulerService scheduler;
    private ConfirmationStateMachine stateMachine;
    private BufferConflictChecker checker;
    private ClockPort clock;
    private ResponseReconciler reconciler;

    @BeforeEach
    void setUp() {
        store = new InMemoryScheduleStore();
        gateway = spy(new InMemoryCalendarGateway());
        TicketPort ticketPort = mock(TicketPort.class);
        notifications = mock(TicketNotificationPort.class);
        when(ticketPort.getTicket(anyString())).thenAnswer(invocation -> Optional.of(new Ticket(invocation.getArgument(0),
                "1042", "Boiler service", null, "Jordan Lee", "jordan@example.com", null, "12 Elm St", 60)));
        clock = () -> NOW;
        checker = new BufferConflictChecker();
        stateMachine = new ConfirmationStateMachine(gateway, store, ticketPort, notifications,
                clock, new InviteComposer(), ORGANIZER);
        scheduler = new SchedulerService(store, checker, stateMachine, ticketPort, clock, 30, 120);
        reconciler = new ResponseReconciler(store, gateway, stateMachine, checker, clock, 20, Duration.ofMinutes(2), 3, 30);
    }

    @Test
    void technicianAcceptanceMovesToTechAccepted() {
        Schedule committed = commit("ticket-1", ALEX, 9, 0);
        gateway.respond(committed.externalEventRef(), AttendeeRole.TECHNICIAN, AttendeeResponse.ACCEPTED);

        ReconciliationReport report = reconciler.runReconciliationPass();

        Schedule accepted = store.findById(committed.id()).orElseThrow();
        assertThat(report.count(ReconciliationOutcome.TECHNICIAN_ACCEPTED)).isEqualTo(1);
        assertThat(accepted.confirmationState()).isEqualTo(ConfirmationState.TECH_ACCEPTED);
        assertThat(accepted.technicianAcceptedAt()).isEqualTo(NOW.toInstant());
    }

    @Test
    void repeatedObservationWritesNothing() {
        Schedule committed = commit("ticket-1", ALEX, 9, 0);
        gateway.respond(committed.externalEventRef(), AttendeeRole.TECHNICIAN, AttendeeResponse.TENTATIVE);

        reconciler.runReconciliationPass();
        Schedule afterFirst = store.findById(committed.id()).orElseThrow();
        clearInvocations(gateway);
        ReconciliationReport second = reconciler.runReconciliationPass();
        Schedule afterSecond = store.findById(committed.id()).orElseThrow();

        assertThat(afterFirst.technicianResponse()).isEqualTo(AttendeeResponse.TENTATIVE);
        assertThat(afterFirst.confirmationState()).isEqualTo(ConfirmationState.PENDING_TECH);
        assertThat(afterSecond.version()).isEqualTo(afterFirst.version());
        assertThat(second.count(ReconciliationOutcome.UNCHANGED)).isEqualTo(1);
        assertThat(second.count(ReconciliationOutcome.TECHNICIAN_ACCEPTED)).isZero();
        verify(gateway).getEvent(committed.externalEventRef());
        verifyNoCalendarWrites();
    }

    @Test
    void passAfterAcceptanceMakesNoFurtherCalendarCalls() {
        Schedule committed = commit("ticket-1", ALEX, 9, 0);
        gateway.respond(committed.externalEventRef(), AttendeeRole.TECHNICIAN, AttendeeResponse.ACCEPTED);
        reconciler.runReconciliationPass();
        Schedule accepted = store.findById(committed.id()).orElseThrow();
        clearInvocations(gateway, notifications);

        ReconciliationReport second = reconciler.runReconciliationPass();

        assertThat(second.checked()).isZero();
        assertThat(store.findById(committed.id()).orElseThrow().version()).isEqualTo(accepted.version());
        verify(gateway, never()).getEvent(anyString());
        verifyNoCalendarWrites();
        verifyNoInteractions(notifications);
    }

    @Test
    void noResponseLeavesScheduleUntouched() {
        Schedule committed = commit("ticket-1", ALEX, 9, 0);

        reconciler.runReconciliationPass();

        assertThat(store.findById(committed.id()).orElseThrow().version()).isEqualTo(committed.version());
    }

    @Test
    void technicianDeclineCancelsEventAndReleasesTicket() {
        Schedule committed = commit("ticket-1", ALEX, 9, 0);
        gateway.respond(committed.externalEventRef(), AttendeeRole.TECHNICIAN, AttendeeResponse.DECLINED);

        reconciler.runReconciliationPass();

        Schedule cancelled = store.findById(committed.id()).orElseThrow();
        assertThat(cancelled.confirmationState()).isEqualTo(ConfirmationState.CANCELLED);
        assertThat(cancelled.cancellationReason()).isEqualTo(CancellationReason.TECHNICIAN_DECLINED);
        assertThat(gateway.event(committed.externalEventRef())).hasValueSatisfying(view -> assertThat(view.cancelled()).isTrue());
        verify(notifications, times(1)).notifyTicketUnscheduled("ticket-1");
    }

    @Test
    void deletedEventCancelsWithoutCallingCancel() {
        Schedule committed = commit("ticket-1", ALEX, 9, 0);
        gateway.deleteExternally(committed.externalEventRef());

        ReconciliationReport report = reconciler.runReconciliationPass();

        Schedule cancelled = store.findById(committed.id()).orElseThrow();
        assertThat(report.count(ReconciliationOutcome.EVENT_DELETED)).isEqualTo(1);
        assertThat(cancelled.cancellationReason()).isEqualTo(CancellationReason.EVENT_DELETED);
        verify(gateway, never()).cancelEvent(committed.externalEventRef());
        verify(notifications).notifyTicketUnscheduled("ticket-1");
    }

    @Test
    void customerAcceptanceConfirmsAndNotifiesTicket() {
        Schedule committed = commit("ticket-1", ALEX, 9, 0);
        gateway.respond(committed.externalEventRef(), AttendeeRole.TECHNICIAN, AttendeeResponse.ACCEPTED);
        reconciler.runReconciliationPass();
        Schedule accepted = store.findById(committed.id()).orElseThrow();
        scheduler.sendCustomerInvite(accepted.id(), accepted.version());
        gateway.respond(committed.externalEventRef(), AttendeeRole.CUSTOMER, AttendeeResponse.ACCEPTED);

        ReconciliationReport report = reconciler.runReconciliationPass();

        Schedule confirmed = store.findById(committed.id()).orElseThrow();
        assertThat(report.count(ReconciliationOutcome.CUSTOMER_ACCEPTED)).isEqualTo(1);
        assertThat(confirmed.confirmationState()).isEqualTo(ConfirmationState.CONFIRMED);
        assertThat(confirmed.confirmation().method()).isEqualTo(ConfirmationMethod.CALENDAR_ACCEPT);
        assertThat(gateway.event(committed.externalEventRef())).hasValueSatisfying(view -> assertThat(view.tentative()).isFalse());
        verify(notifications).notifyTicketScheduleConfirmed("ticket-1", committed.id());
    }

    @Test
    void acceptanceOverlappingAcceptedScheduleIsHeld() {
        Schedule first = commit("ticket-1", ALEX, 9, 0);
        Schedule second = commit("ticket-2", ALEX, 9, 30);
        gateway.respond(first.externalEventRef(), AttendeeRole.TECHNICIAN, AttendeeResponse.ACCEPTED);
        reconciler.runReconciliationPass();

        gateway.respond(second.externalEventRef(), AttendeeRole.TECHNICIAN, AttendeeResponse.ACCEPTED);
        ReconciliationReport report = reconciler.runReconciliationPass();
        Schedule held = store.findById(second.id()).orElseThrow();
        reconciler.runReconciliationPass();

        assertThat(report.count(ReconciliationOutcome.HELD_BY_CONFLICT)).isEqualTo(1);
        assertThat(held.confirmationState()).isEqualTo(ConfirmationState.PENDING_TECH);
        assertThat(held.technicianResponse()).isEqualTo(AttendeeResponse.ACCEPTED);
        assertThat(store.findById(second.id()).orElseThrow().version()).isEqualTo(held.version());
    }

    @Test
    void selfAssignedScheduleIsAcceptedWithoutInvite() {
        Technician owner = new Technician("tech-owner", "Owner", ORGANIZER);
        Schedule committed = commit("ticket-1", owner, 9, 0);
        assertThat(committed.selfAssigned()).isTrue();
        assertThat(gateway.event(committed.externalEventRef()))
                .hasValueSatisfying(view -> assertThat(view.attendees()).isEmpty());

        reconciler.runReconciliationPass();

        assertThat(store.findById(committed.id()).orElseThrow().confirmationState()).isEqualTo(ConfirmationState.TECH_ACCEPTED);
    }

    @Test
    void failingScheduleDoesNotBlockOthers() {
        Schedule a = commit("ticket-a", ALEX, 9, 0);
        Schedule b = commit("ticket-b", BEA, 9, 0);
        Schedule c = commit("ticket-c", CARL, 9, 0);
        for (Schedule schedule : new Schedule[]{a, b, c}) {
            gateway.respond(schedule.externalEventRef(), AttendeeRole.TECHNICIAN, AttendeeResponse.ACCEPTED);
        }
        doThrow(new GatewayException("timeout")).when(gateway).getEvent(b.externalEventRef());

        ReconciliationReport report = reconciler.runReconciliationPass();

        assertThat(report.failed()).isEqualTo(1);
        assertThat(report.count(ReconciliationOutcome.TECHNICIAN_ACCEPTED)).isEqualTo(2);
        assertThat(store.findById(a.id()).orElseThrow().confirmationState()).isEqualTo(ConfirmationState.TECH_ACCEPTED);
        assertThat(store.findById(c.id()).orElseThrow().confirmationState()).isEqualTo(ConfirmationState.TECH_ACCEPTED);
        Schedule untouched = store.findById(b.id()).orElseThrow();
        assertThat(untouched.confirmationState()).isEqualTo(ConfirmationState.PENDING_TECH);
        assertThat(untouched.version()).isEqualTo(b.version());
    }

    @Test
    void repeatedFailuresAreReportedAsStuckUntilRecovered() {
        Schedule failing = commit("ticket-1", ALEX, 9, 0);
        doThrow(new GatewayException("timeout")).when(gateway).getEvent(failing.externalEventRef());

        reconciler.runReconciliationPass();
        reconciler.runReconciliationPass();
        assertThat(reconciler.stuckScheduleIds()).isEmpty();
        reconciler.runReconciliationPass();
        assertThat(reconciler.stuckScheduleIds()).containsExactly(failing.id());

        doCallRealMethod().when(gateway).getEvent(failing.externalEventRef());
        reconciler.runReconciliationPass();
        assertThat(reconciler.stuckScheduleIds()).isEmpty();
    }

    @Test
    void leasedScheduleIsSkipped() {
        Schedule committed = commit("ticket-1", ALEX, 9, 0);
        gateway.respond(committed.externalEventRef(), AttendeeRole.TECHNICIAN, AttendeeResponse.ACCEPTED);
        store.tryLease(committed.id(), "another-worker", NOW.toInstant(), Duration.ofMinutes(5));

        ReconciliationOutcome outcome = reconciler.reconcileSchedule(committed.id());

        assertThat(outcome).isEqualTo(ReconciliationOutcome.LEASED_ELSEWHERE);
        assertThat(store.findById(committed.id()).orElseThrow().confirmationState()).isEqualTo(ConfirmationState.PENDING_TECH);
    }

    @Test
    void singleReconcileOfDraftIsNotAwaiting() {
        Schedule draft = scheduler.createDraft("ticket-1", ALEX, WindowRequest.lasting(DAY, LocalTime.of(9, 0), 60));

        assertThat(reconciler.reconcileSchedule(draft.id())).isEqualTo(ReconciliationOutcome.NOT_AWAITING);
        assertThatThrownBy(() -> reconciler.reconcileSchedule("missing"))
                .isInstanceOf(ScheduleNotFoundException.class);
    }

    @Test
    void passReachesEverySchedulePastThePageSize() {
        ResponseReconciler smallPages = new ResponseReconciler(store, gateway, stateMachine, checker, clock,
                5, Duration.ofMinutes(2), 3, 30);
        for (int i = 0; i < 12; i++) {
            Technician technician = new Technician("tech-" + i, "Tech " + i, "tech" + i + "@example.com");
            commit("ticket-" + i, technician, 9, 0);
        }
        List<Schedule> awaiting = store.findAwaitingResponse(Optional.empty(), 100);
        Schedule newest = awaiting.get(awaiting.size() - 1);
        gateway.respond(newest.externalEventRef(), AttendeeRole.TECHNICIAN, AttendeeResponse.ACCEPTED);

        ReconciliationReport report = smallPages.runReconciliationPass();

        assertThat(awaiting).hasSize(12);
        assertThat(report.checked()).isEqualTo(12);
        assertThat(report.count(ReconciliationOutcome.TECHNICIAN_ACCEPTED)).isEqualTo(1);
        assertThat(store.findById(newest.id()).orElseThrow().confirmationState()).isEqualTo(ConfirmationState.TECH_ACCEPTED);
        verify(gateway, times(12)).getEvent(anyString());
    }

    @Test
    void resetWinsOverAcceptanceWrittenWhileEventIsBeingCancelled() {
        Schedule committed = commit("ticket-1", ALEX, 9, 0);
        String eventRef = committed.externalEventRef();
        gateway.respond(eventRef, AttendeeRole.TECHNICIAN, AttendeeResponse.ACCEPTED);
        doAnswer(invocation -> {
            assertThat(reconciler.reconcileSchedule(committed.id())).isEqualTo(ReconciliationOutcome.TECHNICIAN_ACCEPTED);
            return invocation.callRealMethod();
        }).when(gateway).cancelEvent(eventRef);

        Schedule reset = scheduler.resetToDraft(committed.id(), committed.version());

        Schedule stored = store.findById(committed.id()).orElseThrow();
        assertThat(reset.confirmationState()).isEqualTo(ConfirmationState.DRAFT);
        assertThat(stored.confirmationState()).isEqualTo(ConfirmationState.DRAFT);
        assertThat(stored.externalEventRef()).isNull();
        assertThat(stored.technicianResponse()).isEqualTo(AttendeeResponse.NONE);
        assertThat(stored.technicianAcceptedAt()).isNull();
        assertThat(stored.version()).isEqualTo(committed.version() + 2);
        assertThat(gateway.event(eventRef)).hasValueSatisfying(view -> assertThat(view.cancelled()).isTrue());
        verify(gateway, times(1)).cancelEvent(eventRef);
    }

    @Test
    void resetLosesToDeclineWrittenWhileEventIsBeingCancelled() {
        Schedule committed = commit("ticket-1", ALEX, 9, 0);
        String eventRef = committed.externalEventRef();
        gateway.respond(eventRef, AttendeeRole.TECHNICIAN, AttendeeResponse.DECLINED);
        AtomicBoolean raced = new AtomicBoolean();
        doAnswer(invocation -> {
            if (raced.compareAndSet(false, true)) {
                reconciler.reconcileSchedule(committed.id());
            }
            return invocation.callRealMethod();
        }).when(gateway).cancelEvent(eventRef);

        assertThatThrownBy(() -> scheduler.resetToDraft(committed.id(), committed.version()))
                .isInstanceOf(StaleWriteException.class);

        Schedule stored = store.findById(committed.id()).orElseThrow();
        assertThat(stored.confirmationState()).isEqualTo(ConfirmationState.CANCELLED);
        assertThat(stored.cancellationReason()).isEqualTo(CancellationReason.TECHNICIAN_DECLINED);
        assertThat(gateway.event(eventRef)).hasValueSatisfying(view -> assertThat(view.cancelled()).isTrue());
    }

    private void verifyNoCalendarWrites() {
        verify(gateway, never()).createEvent(any());
        verify(gateway, never()).updateEvent(anyString(), any());
        verify(gateway, never()).addAttendee(anyString(), any());
        verify(gateway, never()).cancelEvent(anyString());
    }

    private Schedule commit(String ticketId, Technician technician, int hour, int minute) {
        Schedule draft = scheduler.createDraft(ticketId, technician, WindowRequest.lasting(DAY, LocalTime.of(hour, minute), 60));
        return scheduler.commit(draft.id(), draft.version());
    }
}
