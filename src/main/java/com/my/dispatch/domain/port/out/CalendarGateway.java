package com.my.dispatch.domain.port.out;

import com.my.dispatch.domain.model.Attendee;
import com.my.dispatch.domain.model.CalendarEventRequest;
import com.my.dispatch.domain.model.CalendarEventSnapshot;
import com.my.dispatch.domain.model.EventUpdate;

/**
 * 왜: 외부 캘린더 API 연동을 추상화하여 도메인이 외부 SDK 세부 구현에 의존하지 않도록 하기 위함.
 * <p>
 * 모든 메서드는 네트워크 호출이며 타임아웃과 통신 실패를 {@link com.my.dispatch.domain.exception.GatewayException} 으로 알린다.
 */
public interface CalendarGateway {

    /**
     * 이벤트를 만들고 외부 이벤트 참조를 돌려준다.
     */
    String createEvent(CalendarEventRequest request);

    void updateEvent(String eventRef, EventUpdate update);

    /**
     * 이미 같은 이메일의 참석자가 있으면 아무 것도 하지 않는다.
     */
    void addAttendee(String eventRef, Attendee attendee);

    /**
     * 외부에서 삭제되었거나 취소된 이벤트는 {@link CalendarEventSnapshot#missing()} 으로 돌려준다.
     */
    CalendarEventSnapshot getEvent(String eventRef);

    /**
     * 이미 삭제된 이벤트에 대해서도 성공으로 처리한다.
     */
    void cancelEvent(String eventRef);
}
