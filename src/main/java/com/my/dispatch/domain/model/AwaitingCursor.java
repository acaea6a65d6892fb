package com.my.dispatch.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 응답 대기 일정 목록의 다음 페이지 위치. (createdAt, id) 순서에서 이 지점 뒤부터 읽는다.
 */
public record AwaitingCursor(Instant createdAt, String id) {
    public AwaitingCursor {
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(id, "id");
    }

    public static AwaitingCursor after(Schedule schedule) {
        return new AwaitingCursor(schedule.createdAt(), schedule.id());
    }

    public boolean isBefore(Schedule schedule) {
        int byTime = createdAt.compareTo(schedule.createdAt());
        return byTime < 0 || (byTime == 0 && id.compareTo(schedule.id()) < 0);
    }
}
