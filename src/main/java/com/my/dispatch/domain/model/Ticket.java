package com.my.dispatch.domain.model;

import java.util.Objects;
import java.util.Optional;

/**
 * 외부 티켓 시스템이 소유한 서비스 요청 중 일정 조율에 필요한 필드만 담는다.
 */
public record Ticket(String id,
                     String ticketNumber,
                     String title,
                     String description,
                     String customerName,
                     String customerEmail,
                     String customerPhone,
                     String serviceAddress,
                     Integer estimatedDurationMinutes) {
    public Ticket {
        Objects.requireNonNull(id, "id");
    }

    public Optional<Integer> estimatedDuration() {
        return Optional.ofNullable(estimatedDurationMinutes).filter(minutes -> minutes > 0);
    }

    public Optional<String> customerContact() {
        return Optional.ofNullable(customerEmail).filter(email -> !email.isBlank());
    }

    public String customerDisplayName() {
        return customerName == null || customerName.isBlank() ? "Customer" : customerName;
    }
}
