package com.my.dispatch.domain.service;

import com.my.dispatch.domain.exception.InvalidStateException;
import com.my.dispatch.domain.model.ConfirmationEvent;
import com.my.dispatch.domain.model.ConfirmationState;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import static com.my.dispatch.domain.model.ConfirmationEvent.COMMIT;
import static com.my.dispatch.domain.model.ConfirmationEvent.CUSTOMER_ACCEPTED;
import static com.my.dispatch.domain.model.ConfirmationEvent.CUSTOMER_DECLINED;
import static com.my.dispatch.domain.model.ConfirmationEvent.CUSTOMER_INVITE_SENT;
import static com.my.dispatch.domain.model.ConfirmationEvent.EVENT_DELETED;
import static com.my.dispatch.domain.model.ConfirmationEvent.MANUAL_CONFIRM;
import static com.my.dispatch.domain.model.ConfirmationEvent.RESET;
import static com.my.dispatch.domain.model.ConfirmationEvent.TECHNICIAN_ACCEPTED;
import static com.my.dispatch.domain.model.ConfirmationEvent.TECHNICIAN_DECLINED;
import static com.my.dispatch.domain.model.ConfirmationState.CANCELLED;
import static com.my.dispatch.domain.model.ConfirmationState.CONFIRMED;
import static com.my.dispatch.domain.model.ConfirmationState.DRAFT;
import static com.my.dispatch.domain.model.ConfirmationState.PENDING_CUSTOMER;
import static com.my.dispatch.domain.model.ConfirmationState.PENDING_TECH;
import static com.my.dispatch.domain.model.ConfirmationState.TECH_ACCEPTED;

/**
 * 허용된 승인 상태 전이 표. cancelled 에서 나가는 전이는 없다.
 */
public final class ConfirmationTransitions {

    private static final Map<ConfirmationState, Map<ConfirmationEvent, ConfirmationState>> TABLE = new EnumMap<>(ConfirmationState.class);

    static {
        allow(DRAFT, COMMIT, PENDING_TECH);

        allow(PENDING_TECH, TECHNICIAN_ACCEPTED, TECH_ACCEPTED);
        allow(PENDING_TECH, TECHNICIAN_DECLINED, CANCELLED);
        allow(PENDING_TECH, EVENT_DELETED, CANCELLED);
        allow(PENDING_TECH, RESET, DRAFT);

        allow(TECH_ACCEPTED, CUSTOMER_INVITE_SENT, PENDING_CUSTOMER);
        allow(TECH_ACCEPTED, MANUAL_CONFIRM, CONFIRMED);
        allow(TECH_ACCEPTED, RESET, DRAFT);

        allow(PENDING_CUSTOMER, CUSTOMER_ACCEPTED, CONFIRMED);
        allow(PENDING_CUSTOMER, MANUAL_CONFIRM, CONFIRMED);
        allow(PENDING_CUSTOMER, CUSTOMER_DECLINED, CANCELLED);
        allow(PENDING_CUSTOMER, EVENT_DELETED, CANCELLED);
        allow(PENDING_CUSTOMER, RESET, DRAFT);

        allow(CONFIRMED, RESET, DRAFT);
    }

    private ConfirmationTransitions() {
    }

    private static void allow(ConfirmationState from, ConfirmationEvent event, ConfirmationState to) {
        TABLE.computeIfAbsent(from, ignored -> new EnumMap<>(ConfirmationEvent.class)).put(event, to);
    }

    public static Optional<ConfirmationState> target(ConfirmationState from, ConfirmationEvent event) {
        return Optional.ofNullable(TABLE.getOrDefault(from, Map.of()).get(event));
    }

    public static boolean isAllowed(ConfirmationState from, ConfirmationEvent event) {
        return target(from, event).isPresent();
    }

    public static ConfirmationState require(String scheduleId, ConfirmationState from, ConfirmationEvent event) {
        return target(from, event)
                .orElseThrow(() -> new InvalidStateException(scheduleId, from, event.name()));
    }
}
