package com.my.dispatch.domain.port.in;

import com.my.dispatch.domain.model.ReconciliationOutcome;
import com.my.dispatch.domain.model.ReconciliationReport;

import java.util.Set;

/**
 * 왜: 외부 캘린더 응답을 주기 실행, 수동 실행, 단건 푸시 알림 어느 쪽에서든 같은 전이 규칙으로 반영하기 위함.
 */
public interface ReconcileResponsesUseCase {

    ReconciliationReport runReconciliationPass();

    ReconciliationOutcome reconcileSchedule(String scheduleId);

    /**
     * 연속 실패 횟수가 경보 기준을 넘은 일정 ID.
     */
    Set<String> stuckScheduleIds();
}
