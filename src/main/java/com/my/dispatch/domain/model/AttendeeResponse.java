package com.my.dispatch.domain.model;

import java.util.Arrays;

/**
 * 외부 캘린더에서 관찰한 참석자 응답.
 */
public enum AttendeeResponse {
    ACCEPTED("accepted"),
    DECLINED("declined"),
    TENTATIVE("tentative"),
    NONE("none");

    private final String wireName;

    AttendeeResponse(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static AttendeeResponse fromWire(String value) {
        if (value == null) {
            return NONE;
        }
        return Arrays.stream(values())
                .filter(response -> response.wireName.equals(value))
                .findFirst()
                .orElse(NONE);
    }
}
