package com.my.dispatch.domain.exception;

public class InvalidLinkException extends DispatchException {

    public InvalidLinkException(String scheduleId) {
        super("고객 응답 링크가 유효하지 않습니다: " + scheduleId);
    }

    @Override
    public String code() {
        return "INVALID_LINK";
    }
}
