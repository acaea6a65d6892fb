package com.my.dispatch.domain.model;

public enum AttendeeRole {
    TECHNICIAN,
    CUSTOMER
}
