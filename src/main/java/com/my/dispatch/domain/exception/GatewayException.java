package com.my.dispatch.domain.exception;

/**
 * 왜: 외부 캘린더/티켓 시스템의 일시적 장애를 응답 거절과 구분해 재시도 대상으로 표시하기 위함.
 */
public class GatewayException extends DispatchException {

    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String code() {
        return "GATEWAY";
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
