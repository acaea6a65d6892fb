package com.my.dispatch.domain.model;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * 왜: 작업 진행 상태와 별개로 기사/고객 승인 흐름의 위치를 표현하기 위함.
 */
public enum ConfirmationState {
    DRAFT("draft"),
    PENDING_TECH("pending_tech"),
    TECH_ACCEPTED("tech_accepted"),
    PENDING_CUSTOMER("pending_customer"),
    CONFIRMED("confirmed"),
    CANCELLED("cancelled");

    private static final Set<ConfirmationState> AWAITING_RESPONSE = EnumSet.of(PENDING_TECH, PENDING_CUSTOMER);
    private static final Set<ConfirmationState> HOLDS_TECHNICIAN = EnumSet.of(TECH_ACCEPTED, PENDING_CUSTOMER, CONFIRMED);

    private final String wireName;

    ConfirmationState(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * 리컨실러가 외부 캘린더 응답을 조회해야 하는 상태.
     */
    public boolean awaitingResponse() {
        return AWAITING_RESPONSE.contains(this);
    }

    /**
     * 기사의 시간을 실제로 점유하며 버퍼 충돌 검사 대상이 되는 상태. draft/pending_tech 는 잠정 옵션이다.
     */
    public boolean holdsTechnician() {
        return HOLDS_TECHNICIAN.contains(this);
    }

    public boolean requiresEventRef() {
        return this == PENDING_TECH || HOLDS_TECHNICIAN.contains(this);
    }

    public static ConfirmationState fromWire(String value) {
        return Arrays.stream(values())
                .filter(state -> state.wireName.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("알 수 없는 확인 상태: " + value));
    }
}
