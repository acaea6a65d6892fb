package com.my.dispatch.domain.port.out;

import java.time.Instant;
import java.time.OffsetDateTime;

/**
 * 왜: 현재 시간을 주입형으로 분리하여 일정 기록 시각과 임대 만료 판정을 테스트에서 고정하기 위함.
 */
public interface ClockPort {
    OffsetDateTime now();

    /**
     * 저장소에 기록하는 시각. 일정 행의 모든 Instant 필드는 이 값을 쓴다.
     */
    default Instant instant() {
        return now().toInstant();
    }
}
