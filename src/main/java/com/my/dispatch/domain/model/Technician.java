package com.my.dispatch.domain.model;

import com.my.dispatch.domain.exception.ValidationException;

/**
 * 왜: 일정에 배정되는 기사의 식별자와 초대 대상 연락처를 함께 다루기 위함.
 */
public record Technician(String id, String name, String email) {
    public Technician {
        if (id == null || id.isBlank()) {
            throw new ValidationException("기사 ID는 비어 있을 수 없습니다.");
        }
        if (email == null || email.isBlank()) {
            throw new ValidationException("기사 이메일은 비어 있을 수 없습니다: " + id);
        }
        name = name == null || name.isBlank() ? id : name;
    }

    public boolean isSameAccount(String otherEmail) {
        return otherEmail != null && email.equalsIgnoreCase(otherEmail.trim());
    }
}
