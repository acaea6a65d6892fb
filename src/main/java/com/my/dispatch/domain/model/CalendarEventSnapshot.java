package com.my.dispatch.domain.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * 외부 캘린더에서 조회한 이벤트의 존재 여부와 역할별 참석자 응답.
 */
public record CalendarEventSnapshot(boolean exists, Map<AttendeeRole, AttendeeResponse> attendeeResponses) {
    public CalendarEventSnapshot {
        Map<AttendeeRole, AttendeeResponse> copy = new EnumMap<>(AttendeeRole.class);
        if (attendeeResponses != null) {
            copy.putAll(attendeeResponses);
        }
        attendeeResponses = Map.copyOf(copy);
    }

    public static CalendarEventSnapshot missing() {
        return new CalendarEventSnapshot(false, Map.of());
    }

    public static CalendarEventSnapshot of(Map<AttendeeRole, AttendeeResponse> attendeeResponses) {
        return new CalendarEventSnapshot(true, attendeeResponses);
    }

    public AttendeeResponse responseOf(AttendeeRole role) {
        return attendeeResponses.getOrDefault(role, AttendeeResponse.NONE);
    }
}
