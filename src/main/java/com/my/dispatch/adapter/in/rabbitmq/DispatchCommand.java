package com.my.dispatch.adapter.in.rabbitmq;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.my.dispatch.domain.exception.ValidationException;
import com.my.dispatch.domain.model.DateRange;
import com.my.dispatch.domain.model.Technician;
import com.my.dispatch.domain.model.WindowRequest;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;

/**
 * dispatch-commands 채널로 들어오는 디스패처 명령. 명령 종류마다 필요한 필드만 채워진다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DispatchCommand(String commandId,
                              String type,
                              String dispatcherId,
                              String scheduleId,
                              Long expectedVersion,
                              String ticketId,
                              TechnicianPayload technician,
                              String date,
                              String start,
                              String end,
                              Integer durationMinutes,
                              String technicianId,
                              String from,
                              String to,
                              String action,
                              String token) {

    public enum Type {
        CREATE_DRAFT,
        MOVE_DRAFT,
        COMMIT,
        SEND_CUSTOMER_INVITE,
        MARK_CONFIRMED,
        RESET_TO_DRAFT,
        REMOVE,
        GET,
        LIST,
        RECONCILE,
        RECONCILE_ONE,
        CUSTOMER_RESPONSE
    }

    public DispatchCommand {
        Objects.requireNonNull(commandId, "commandId");
        Objects.requireNonNull(type, "type");
        if (commandId.isBlank()) {
            throw new ValidationException("commandId가 비어 있습니다.");
        }
    }

    public Type commandType() {
        try {
            return Type.valueOf(type);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("알 수 없는 명령 종류입니다: " + type);
        }
    }

    public String requireScheduleId() {
        if (scheduleId == null || scheduleId.isBlank()) {
            throw new ValidationException(type + " 명령에는 scheduleId가 필요합니다.");
        }
        return scheduleId;
    }

    public long requireExpectedVersion() {
        if (expectedVersion == null) {
            throw new ValidationException(type + " 명령에는 expectedVersion이 필요합니다.");
        }
        return expectedVersion;
    }

    public String requireAction() {
        if (action == null || action.isBlank()) {
            throw new ValidationException(type + " 명령에는 action이 필요합니다.");
        }
        return action;
    }

    public Technician technicianOrNull() {
        return technician == null ? null : technician.toTechnician();
    }

    /**
     * date 가 없으면 시간 변경이 없는 것으로 보고 null 을 돌려준다.
     */
    public WindowRequest windowOrNull() {
        if (date == null && start == null) {
            return null;
        }
        try {
            return new WindowRequest(
                    date == null ? null : LocalDate.parse(date),
                    start == null ? null : LocalTime.parse(start),
                    end == null ? null : LocalTime.parse(end),
                    durationMinutes);
        } catch (DateTimeParseException e) {
            throw new ValidationException("일정 날짜/시간 형식이 올바르지 않습니다: " + e.getParsedString());
        }
    }

    public DateRange range() {
        if (from == null || to == null) {
            throw new ValidationException("조회 명령에는 from/to 날짜가 필요합니다.");
        }
        try {
            return new DateRange(LocalDate.parse(from), LocalDate.parse(to));
        } catch (DateTimeParseException e) {
            throw new ValidationException("조회 날짜 형식이 올바르지 않습니다: " + e.getParsedString());
        }
    }

    public Optional<String> technicianFilter() {
        return Optional.ofNullable(technicianId).filter(id -> !id.isBlank());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TechnicianPayload(String id, String name, String email) {
        Technician toTechnician() {
            return new Technician(id, name, email);
        }
    }
}
