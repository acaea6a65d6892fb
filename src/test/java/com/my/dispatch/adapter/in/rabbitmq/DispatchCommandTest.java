package com.my.dispatch.adapter.in.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.my.dispatch.domain.exception.ValidationException;
import com.my.dispatch.domain.model.DateRange;
import com.my.dispatch.domain.model.WindowRequest;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DispatchCommandTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void mapsCreateDraftPayload() throws Exception {
        String payload = "{" +
                "\"commandId\":\"cmd-1\"," +
                "\"type\":\"CREATE_DRAFT\"," +
                "\"ticketId\":\"ticket-9\"," +
                "\"technician\":{\"id\":\"tech-a\",\"name\":\"Alex\",\"email\":\"alex@example.com\"}," +
                "\"date\":\"2026-03-01\"," +
                "\"start\":\"09:00\"," +
                "\"durationMinutes\":90," +
                "\"unknownField\":true" +
                "}";

        DispatchCommand command = objectMapper.readValue(payload, DispatchCommand.class);

        assertThat(command.commandType()).isEqualTo(DispatchCommand.Type.CREATE_DRAFT);
        assertThat(command.technicianOrNull().email()).isEqualTo("alex@example.com");
        assertThat(command.windowOrNull())
                .isEqualTo(new WindowRequest(LocalDate.of(2026, 3, 1), LocalTime.of(9, 0), null, 90));
    }

    @Test
    void mapsListPayload() throws Exception {
        String payload = "{\"commandId\":\"cmd-2\",\"type\":\"LIST\",\"from\":\"2026-03-01\",\"to\":\"2026-03-07\",\"technicianId\":\" \"}";

        DispatchCommand command = objectMapper.readValue(payload, DispatchCommand.class);

        assertThat(command.range()).isEqualTo(new DateRange(LocalDate.of(2026, 3, 1), LocalDate.of(2026, 3, 7)));
        assertThat(command.technicianFilter()).isEmpty();
        assertThat(command.windowOrNull()).isNull();
    }

    @Test
    void rejectsMissingCommandId() {
        String payload = "{\"type\":\"COMMIT\",\"scheduleId\":\"s-1\",\"expectedVersion\":1}";

        assertThrows(ValueInstantiationException.class,
                () -> objectMapper.readValue(payload, DispatchCommand.class));
    }

    @Test
    void rejectsUnknownTypeAndMissingVersion() throws Exception {
        DispatchCommand unknown = objectMapper.readValue("{\"commandId\":\"cmd-3\",\"type\":\"TELEPORT\"}", DispatchCommand.class);
        DispatchCommand commit = objectMapper.readValue("{\"commandId\":\"cmd-4\",\"type\":\"COMMIT\",\"scheduleId\":\"s-1\"}", DispatchCommand.class);

        assertThatThrownBy(unknown::commandType).isInstanceOf(ValidationException.class);
        assertThatThrownBy(commit::requireExpectedVersion).isInstanceOf(ValidationException.class);
    }

    @Test
    void rejectsMalformedTime() throws Exception {
        DispatchCommand command = objectMapper.readValue(
                "{\"commandId\":\"cmd-5\",\"type\":\"MOVE_DRAFT\",\"date\":\"2026-03-01\",\"start\":\"9am\"}", DispatchCommand.class);

        assertThatThrownBy(command::windowOrNull).isInstanceOf(ValidationException.class);
    }
}
