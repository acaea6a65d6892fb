package com.my.dispatch.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * 왜: 외부 캘린더 이벤트 생성에 필요한 필드를 단일 구조로 묶어 게이트웨이 구현이 매핑만 담당하도록 하기 위함.
 */
public record CalendarEventRequest(String subject,
                                   String body,
                                   String location,
                                   List<Attendee> attendees,
                                   TimeWindow window,
                                   boolean tentative) {
    public CalendarEventRequest {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(window, "window");
        body = body == null ? "" : body;
        location = location == null ? "" : location;
        attendees = attendees == null ? List.of() : List.copyOf(attendees);
    }
}
