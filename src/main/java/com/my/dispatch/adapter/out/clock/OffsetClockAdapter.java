package com.my.dispatch.adapter.out.clock;

import com.my.dispatch.domain.port.out.ClockPort;

import java.time.OffsetDateTime;
import java.time.ZoneId;

/**
 * 왜: 시스템 시간을 주입형으로 제공해 테스트와 일정 시간대 해석의 일관성을 확보하기 위함.
 */
public class OffsetClockAdapter implements ClockPort {

    private final ZoneId zoneId;

    private OffsetClockAdapter(ZoneId zoneId) {
        this.zoneId = zoneId;
    }

    public static OffsetClockAdapter of(ZoneId zoneId) {
        return new OffsetClockAdapter(zoneId);
    }

    @Override
    public OffsetDateTime now() {
        return OffsetDateTime.now(zoneId);
    }
}
