package com.my.dispatch.domain.port.in;

import com.my.dispatch.domain.model.DateRange;
import com.my.dispatch.domain.model.Schedule;
import com.my.dispatch.domain.model.Technician;
import com.my.dispatch.domain.model.WindowRequest;

import java.util.List;
import java.util.Optional;

/**
 * 왜: 디스패처 행동을 도메인 단일 진입점으로 수렴시켜 충돌 검사와 승인 흐름을 일관되게 적용하기 위함.
 * <p>
 * 변경 연산은 조회 시 받은 버전을 {@code expectedVersion} 으로 받는다.
 */
public interface SchedulingUseCase {

    Schedule createDraft(String ticketId, Technician technician, WindowRequest window);

    /**
     * @param newTechnician null 이면 기존 기사를 유지한다.
     */
    Schedule moveDraft(String scheduleId, long expectedVersion, WindowRequest newWindow, Technician newTechnician);

    Schedule commit(String scheduleId, long expectedVersion);

    Schedule sendCustomerInvite(String scheduleId, long expectedVersion);

    Schedule markConfirmedManually(String scheduleId, long expectedVersion, String dispatcherId);

    Schedule resetToDraft(String scheduleId, long expectedVersion);

    void remove(String scheduleId, long expectedVersion);

    Schedule getSchedule(String scheduleId);

    List<Schedule> listSchedulesForRange(Optional<String> technicianId, DateRange range);
}
