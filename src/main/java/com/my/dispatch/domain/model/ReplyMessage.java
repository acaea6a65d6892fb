package com.my.dispatch.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * 왜: 디스패처 명령 처리 결과의 계약을 고정하여 어댑터가 일관된 포맷으로 전송하도록 하기 위함.
 */
public record ReplyMessage(String commandId,
                           String status,
                           String message,
                           List<Schedule> schedules,
                           ReconciliationReport report) {

    public static final String OK = "OK";

    public ReplyMessage {
        Objects.requireNonNull(commandId, "commandId");
        Objects.requireNonNull(status, "status");
        if (commandId.isBlank()) {
            throw new IllegalArgumentException("commandId는 비어 있을 수 없습니다.");
        }
        schedules = schedules == null ? List.of() : List.copyOf(schedules);
    }

    public static ReplyMessage ok(String commandId, List<Schedule> schedules) {
        return new ReplyMessage(commandId, OK, null, schedules, null);
    }

    public static ReplyMessage ok(String commandId, ReconciliationReport report) {
        return new ReplyMessage(commandId, OK, null, List.of(), report);
    }

    public static ReplyMessage error(String commandId, String code, String message) {
        return new ReplyMessage(commandId, code, message, List.of(), null);
    }

    public boolean success() {
        return OK.equals(status);
    }
}
