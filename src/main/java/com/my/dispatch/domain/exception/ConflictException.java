package com.my.dispatch.domain.exception;

import com.my.dispatch.domain.model.Conflict;

/**
 * 왜: 디스패처가 별도 조회 없이 충돌 대상 기사와 시간대를 보고 해결할 수 있도록 충돌 정보를 함께 전달하기 위함.
 */
public class ConflictException extends DispatchException {

    private final Conflict conflict;

    public ConflictException(Conflict conflict) {
        super("기사 " + conflict.technicianName() + "(" + conflict.technicianId() + ") 의 기존 일정 "
                + conflict.scheduleId() + " [" + conflict.window() + "] 과(와) 버퍼 "
                + conflict.bufferMinutes() + "분 이내로 겹칩니다.");
        this.conflict = conflict;
    }

    public Conflict conflict() {
        return conflict;
    }

    @Override
    public String code() {
        return "CONFLICT";
    }
}
