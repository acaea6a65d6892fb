package com.my.dispatch.domain.model;

/**
 * 일정 하나에 대한 리컨실 결과.
 */
public enum ReconciliationOutcome {
    TECHNICIAN_ACCEPTED,
    CUSTOMER_ACCEPTED,
    TECHNICIAN_DECLINED,
    CUSTOMER_DECLINED,
    EVENT_DELETED,
    UNCHANGED,
    HELD_BY_CONFLICT,
    NOT_AWAITING,
    LEASED_ELSEWHERE,
    SUPERSEDED,
    FAILED;

    public boolean transitioned() {
        return switch (this) {
            case TECHNICIAN_ACCEPTED, CUSTOMER_ACCEPTED, TECHNICIAN_DECLINED, CUSTOMER_DECLINED, EVENT_DELETED -> true;
            default -> false;
        };
    }
}
