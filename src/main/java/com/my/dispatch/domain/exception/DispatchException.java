package com.my.dispatch.domain.exception;

/**
 * 왜: 인바운드 어댑터가 도메인 실패를 안정적인 오류 코드로 응답할 수 있도록 공통 상위 타입을 둔다.
 */
public abstract class DispatchException extends RuntimeException {

    protected DispatchException(String message) {
        super(message);
    }

    protected DispatchException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String code();

    /**
     * 같은 요청을 그대로 다시 보내면 성공할 수 있는 실패인지 여부.
     */
    public boolean retryable() {
        return false;
    }
}
