package com.my.dispatch.domain.model;

/**
 * 작업 자체의 진행 상태. 승인 흐름은 {@link ConfirmationState} 가 따로 추적한다.
 */
public enum WorkStatus {
    SCHEDULED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED
}
