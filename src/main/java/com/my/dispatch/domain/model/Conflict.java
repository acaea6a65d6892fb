package com.my.dispatch.domain.model;

public record Conflict(String scheduleId,
                       String technicianId,
                       String technicianName,
                       TimeWindow window,
                       ConfirmationState state,
                       int bufferMinutes) {
}
