package com.my.dispatch.domain.exception;

/**
 * 왜: 잘못된 시간 범위나 누락된 티켓 참조를 쓰기 전에 거절하기 위함.
 */
public class ValidationException extends DispatchException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String code() {
        return "VALIDATION";
    }
}
