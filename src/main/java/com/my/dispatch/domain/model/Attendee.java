package com.my.dispatch.domain.model;

import java.util.Objects;

public record Attendee(AttendeeRole role, String email, String displayName) {
    public Attendee {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(email, "email");
        if (email.isBlank()) {
            throw new IllegalArgumentException("참석자 이메일은 비어 있을 수 없습니다.");
        }
        displayName = displayName == null || displayName.isBlank() ? email : displayName;
    }
}
