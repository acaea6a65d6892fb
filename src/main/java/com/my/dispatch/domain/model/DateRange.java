package com.my.dispatch.domain.model;

import com.my.dispatch.domain.exception.ValidationException;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 양 끝 날짜를 포함하는 조회 범위.
 */
public record DateRange(LocalDate from, LocalDate to) {
    public DateRange {
        if (from == null || to == null) {
            throw new ValidationException("조회 범위의 시작/종료 날짜가 필요합니다.");
        }
        if (to.isBefore(from)) {
            throw new ValidationException("조회 범위 종료일이 시작일보다 이를 수 없습니다.");
        }
    }

    public static DateRange around(LocalDate date) {
        return new DateRange(date.minusDays(1), date.plusDays(1));
    }

    public LocalDateTime startInclusive() {
        return from.atStartOfDay();
    }

    public LocalDateTime endExclusive() {
        return to.plusDays(1).atStartOfDay();
    }
}
