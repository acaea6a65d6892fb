package com.my.dispatch.domain.model;

import com.my.dispatch.domain.exception.ValidationException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * 디스패처가 입력한 날짜/시작 시간과 선택적인 종료 시간 또는 소요 시간.
 */
public record WindowRequest(LocalDate date, LocalTime start, LocalTime end, Integer durationMinutes) {

    public static WindowRequest between(LocalDate date, LocalTime start, LocalTime end) {
        return new WindowRequest(date, start, end, null);
    }

    public static WindowRequest lasting(LocalDate date, LocalTime start, int durationMinutes) {
        return new WindowRequest(date, start, null, durationMinutes);
    }

    public boolean hasExplicitLength() {
        return end != null || durationMinutes != null;
    }

    /**
     * 종료 시간, 소요 시간, 티켓 예상 시간, 기본값 순서로 길이를 정한다.
     */
    public TimeWindow resolve(Integer ticketEstimateMinutes, int defaultDurationMinutes) {
        if (date == null || start == null) {
            throw new ValidationException("일정 날짜와 시작 시간이 필요합니다.");
        }
        LocalDateTime startAt = date.atTime(start);
        if (end != null) {
            if (end.equals(LocalTime.MIDNIGHT)) {
                throw new ValidationException("자정을 넘기는 일정은 지원하지 않습니다.");
            }
            return new TimeWindow(startAt, date.atTime(end));
        }
        int minutes;
        if (durationMinutes != null) {
            minutes = durationMinutes;
        } else if (ticketEstimateMinutes != null && ticketEstimateMinutes > 0) {
            minutes = ticketEstimateMinutes;
        } else {
            minutes = defaultDurationMinutes;
        }
        if (minutes <= 0) {
            throw new ValidationException("소요 시간은 0보다 커야 합니다: " + minutes);
        }
        return new TimeWindow(startAt, startAt.plusMinutes(minutes));
    }
}
