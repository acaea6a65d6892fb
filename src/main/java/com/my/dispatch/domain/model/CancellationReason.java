package com.my.dispatch.domain.model;

public enum CancellationReason {
    TECHNICIAN_DECLINED,
    CUSTOMER_DECLINED,
    EVENT_DELETED
}
