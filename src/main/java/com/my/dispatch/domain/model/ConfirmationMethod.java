package com.my.dispatch.domain.model;

import java.util.Arrays;

public enum ConfirmationMethod {
    CALENDAR_ACCEPT("calendar-accept"),
    EMAIL_LINK("email-link"),
    MANUAL_OVERRIDE("manual-override");

    private final String wireName;

    ConfirmationMethod(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ConfirmationMethod fromWire(String value) {
        return Arrays.stream(values())
                .filter(method -> method.wireName.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("알 수 없는 확인 방식: " + value));
    }
}
