package com.my.dispatch.domain.exception;

/**
 * 왜: 동시에 같은 일정을 수정한 쪽 중 늦은 쪽에게 최신 상태를 다시 읽도록 알리기 위함.
 */
public class StaleWriteException extends DispatchException {

    private final String scheduleId;
    private final long expectedVersion;
    private final long actualVersion;

    public StaleWriteException(String scheduleId, long expectedVersion, long actualVersion) {
        super("일정 " + scheduleId + " 의 버전이 변경되었습니다. expected=" + expectedVersion + ", actual=" + actualVersion);
        this.scheduleId = scheduleId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String scheduleId() {
        return scheduleId;
    }

    public long expectedVersion() {
        return expectedVersion;
    }

    public long actualVersion() {
        return actualVersion;
    }

    @Override
    public String code() {
        return "STALE_WRITE";
    }
}
