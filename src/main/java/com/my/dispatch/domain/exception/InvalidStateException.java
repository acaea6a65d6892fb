package com.my.dispatch.domain.exception;

import com.my.dispatch.domain.model.ConfirmationState;

public class InvalidStateException extends DispatchException {

    private final String scheduleId;
    private final ConfirmationState currentState;

    public InvalidStateException(String scheduleId, ConfirmationState currentState, String operation) {
        super("일정 " + scheduleId + " 은(는) " + currentState.wireName() + " 상태에서 " + operation + " 을(를) 수행할 수 없습니다.");
        this.scheduleId = scheduleId;
        this.currentState = currentState;
    }

    public String scheduleId() {
        return scheduleId;
    }

    public ConfirmationState currentState() {
        return currentState;
    }

    @Override
    public String code() {
        return "INVALID_STATE";
    }
}
