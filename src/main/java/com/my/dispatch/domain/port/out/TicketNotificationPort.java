package com.my.dispatch.domain.port.out;

/**
 * 왜: 일정 상태 변화를 티켓 시스템에 알리는 전달 경로를 도메인에서 분리하기 위함.
 */
public interface TicketNotificationPort {

    void notifyTicketUnscheduled(String ticketId);

    void notifyTicketScheduleConfirmed(String ticketId, String scheduleId);
}
