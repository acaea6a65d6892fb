package com.my.dispatch.adapter.out.calendar;

import com.my.dispatch.domain.exception.GatewayException;
import com.my.dispatch.domain.model.Attendee;
import com.my.dispatch.domain.model.AttendeeResponse;
import com.my.dispatch.domain.model.AttendeeRole;
import com.my.dispatch.domain.model.CalendarEventRequest;
import com.my.dispatch.domain.model.EventUpdate;
import com.my.dispatch.domain.model.TimeWindow;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryCalendarGatewayTest {

    private static final LocalDate DAY = LocalDate.of(2026, 3, 1);

    private final InMemoryCalendarGateway gateway = new InMemoryCalendarGateway();

    @Test
    void tracksAttendeesAndResponses() {
        String ref = create();

        gateway.addAttendee(ref, new Attendee(AttendeeRole.CUSTOMER, "jordan@example.com", "Jordan"));
        gateway.addAttendee(ref, new Attendee(AttendeeRole.CUSTOMER, "JORDAN@example.com", "Jordan"));
        gateway.respond(ref, AttendeeRole.CUSTOMER, AttendeeResponse.TENTATIVE);
        gateway.updateEvent(ref, new EventUpdate("Confirmed", false));

        assertThat(gateway.getEvent(ref).responseOf(AttendeeRole.CUSTOMER)).isEqualTo(AttendeeResponse.TENTATIVE);
        assertThat(gateway.event(ref)).hasValueSatisfying(view -> {
            assertThat(view.attendees()).hasSize(2);
            assertThat(view.subject()).isEqualTo("Confirmed");
            assertThat(view.tentative()).isFalse();
        });
    }

    @Test
    void cancelledOrDeletedEventLooksMissing() {
        String cancelled = create();
        String deleted = create();

        gateway.cancelEvent(cancelled);
        gateway.cancelEvent(cancelled);
        gateway.deleteExternally(deleted);

        assertThat(gateway.getEvent(cancelled).exists()).isFalse();
        assertThat(gateway.getEvent(deleted).exists()).isFalse();
        assertThatThrownBy(() -> gateway.updateEvent(cancelled, new EventUpdate("x", true)))
                .isInstanceOf(GatewayException.class);
    }

    private String create() {
        return gateway.createEvent(new CalendarEventRequest("[Tentative] Boiler service", "body", "12 Elm St",
                List.of(new Attendee(AttendeeRole.TECHNICIAN, "alex@example.com", "Alex")),
                new TimeWindow(DAY.atTime(9, 0), DAY.atTime(10, 0)), true));
    }
}
