package com.my.dispatch.domain.exception;

public class ScheduleNotFoundException extends DispatchException {

    private final String scheduleId;

    public ScheduleNotFoundException(String scheduleId) {
        super("일정을 찾을 수 없습니다: " + scheduleId);
        this.scheduleId = scheduleId;
    }

    public String scheduleId() {
        return scheduleId;
    }

    @Override
    public String code() {
        return "NOT_FOUND";
    }
}
