package com.my.dispatch.domain.model;

/**
 * 승인 흐름 상태 전이를 일으키는 사건. 디스패처 행동과 리컨실러 관찰을 모두 포함한다.
 */
public enum ConfirmationEvent {
    COMMIT,
    TECHNICIAN_ACCEPTED,
    TECHNICIAN_DECLINED,
    CUSTOMER_INVITE_SENT,
    MANUAL_CONFIRM,
    CUSTOMER_ACCEPTED,
    CUSTOMER_DECLINED,
    EVENT_DELETED,
    RESET
}
