package com.my.dispatch.domain.model;

import java.util.Objects;

/**
 * 기존 외부 이벤트의 제목, 본문, 잠정(tentative) 표시 변경. 본문이 null 이면 기존 본문을 유지한다.
 */
public record EventUpdate(String subject, String description, boolean tentative) {
    public EventUpdate {
        Objects.requireNonNull(subject, "subject");
    }

    public EventUpdate(String subject, boolean tentative) {
        this(subject, null, tentative);
    }
}
