package com.my.dispatch.domain.service;

import com.my.dispatch.domain.model.Conflict;
import com.my.dispatch.domain.model.Schedule;
import com.my.dispatch.domain.model.TimeWindow;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Optional;

/**
 * 왜: 기사 한 명이 이동/준비 시간 없이 연달아 배정되는 것을 막기 위한 순수 판정 로직을 분리하기 위함.
 * <p>
 * 제안 구간만 버퍼만큼 양쪽으로 넓히고 기존 구간은 그대로 비교한다. 기사 한 명의 활성 일정 수는 작으므로 선형 탐색이다.
 */
public class BufferConflictChecker {

    public boolean hasConflict(String technicianId,
                               TimeWindow proposed,
                               int bufferMinutes,
                               Collection<Schedule> existing,
                               String excludeScheduleId) {
        return findConflict(technicianId, proposed, bufferMinutes, existing, excludeScheduleId).isPresent();
    }

    public Optional<Conflict> findConflict(String technicianId,
                                           TimeWindow proposed,
                                           int bufferMinutes,
                                           Collection<Schedule> existing,
                                           String excludeScheduleId) {
        if (bufferMinutes < 0) {
            throw new IllegalArgumentException("버퍼는 음수일 수 없습니다: " + bufferMinutes);
        }
        LocalDateTime expandedStart = proposed.start().minusMinutes(bufferMinutes);
        LocalDateTime expandedEnd = proposed.end().plusMinutes(bufferMinutes);
        for (Schedule other : existing) {
            if (!other.technicianId().equals(technicianId)) {
                continue;
            }
            if (other.id().equals(excludeScheduleId) || !other.confirmationState().holdsTechnician()) {
                continue;
            }
            TimeWindow otherWindow = other.window();
            if (expandedStart.isBefore(otherWindow.end()) && expandedEnd.isAfter(otherWindow.start())) {
                return Optional.of(new Conflict(
                        other.id(),
                        other.technicianId(),
                        other.technicianName(),
                        otherWindow,
                        other.confirmationState(),
                        bufferMinutes
                ));
            }
        }
        return Optional.empty();
    }
}
