package com.my.dispatch.domain.model;

import com.my.dispatch.domain.exception.ValidationException;

import java.util.Arrays;

/**
 * 고객 응답 링크가 나타내는 행동.
 */
public enum CustomerLinkAction {
    ACCEPT("accept"),
    DECLINE("decline");

    private final String wireName;

    CustomerLinkAction(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static CustomerLinkAction fromWire(String value) {
        return Arrays.stream(values())
                .filter(action -> action.wireName.equals(value))
                .findFirst()
                .orElseThrow(() -> new ValidationException("알 수 없는 고객 응답입니다: " + value));
    }
}
