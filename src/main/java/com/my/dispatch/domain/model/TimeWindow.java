package com.my.dispatch.domain.model;

import com.my.dispatch.domain.exception.ValidationException;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 왜: 일정 시간 범위의 형식 검증(양수 길이, 자정 넘김 금지)을 생성 시점에 강제하기 위함.
 */
public record TimeWindow(LocalDateTime start, LocalDateTime end) {
    public TimeWindow {
        if (start == null || end == null) {
            throw new ValidationException("일정 시작/종료 시간이 필요합니다.");
        }
        if (!end.isAfter(start)) {
            throw new ValidationException("종료 시간은 시작 시간보다 늦어야 합니다: " + start + " ~ " + end);
        }
        if (!end.toLocalDate().equals(start.toLocalDate())) {
            throw new ValidationException("자정을 넘기는 일정은 지원하지 않습니다: " + start + " ~ " + end);
        }
    }

    public LocalDate date() {
        return start.toLocalDate();
    }

    public long durationMinutes() {
        return Duration.between(start, end).toMinutes();
    }

    /**
     * 반열린 구간 [start, end) 끼리의 겹침.
     */
    public boolean overlaps(LocalDateTime otherStart, LocalDateTime otherEnd) {
        return start.isBefore(otherEnd) && end.isAfter(otherStart);
    }

    @Override
    public String toString() {
        return start + "~" + end.toLocalTime();
    }
}
