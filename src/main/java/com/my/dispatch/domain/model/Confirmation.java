package com.my.dispatch.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 왜: 확정 시각/확정자/방식을 confirmed 상태에만 붙는 한 덩어리로 묶어 부분적으로 채워진 상태를 막기 위함.
 */
public record Confirmation(Instant at, String by, ConfirmationMethod method) {
    public Confirmation {
        Objects.requireNonNull(at, "at");
        Objects.requireNonNull(by, "by");
        Objects.requireNonNull(method, "method");
        if (by.isBlank()) {
            throw new IllegalArgumentException("확정자는 비어 있을 수 없습니다.");
        }
    }
}
