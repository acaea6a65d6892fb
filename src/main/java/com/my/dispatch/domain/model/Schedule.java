package com.my.dispatch.domain.model;

import com.my.dispatch.domain.exception.ValidationException;

import java.time.Instant;
import java.util.Objects;

/**
 * 왜: 기사 배정 일정과 승인 흐름 상태를 하나의 불변 엔티티로 다루고, 상태별로 허용되지 않는 필드 조합을 생성 시점에 거절하기 위함.
 */
public final class Schedule {

    private final String id;
    private final String ticketId;
    private final Technician technician;
    private final TimeWindow window;
    private final WorkStatus status;
    private final ConfirmationState confirmationState;
    private final String externalEventRef;
    private final boolean selfAssigned;
    private final Confirmation confirmation;
    private final Instant customerInviteSentAt;
    private final AttendeeResponse technicianResponse;
    private final AttendeeResponse customerResponse;
    private final Instant technicianAcceptedAt;
    private final Instant customerAcceptedAt;
    private final Instant lastResponseCheckAt;
    private final CancellationReason cancellationReason;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final long version;

    private Schedule(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        if (builder.ticketId == null || builder.ticketId.isBlank()) {
            throw new ValidationException("일정은 티켓 참조가 필요합니다.");
        }
        if (builder.technician == null) {
            throw new ValidationException("일정은 배정 기사가 필요합니다.");
        }
        if (builder.window == null) {
            throw new ValidationException("일정은 시간 범위가 필요합니다.");
        }
        this.ticketId = builder.ticketId;
        this.technician = builder.technician;
        this.window = builder.window;
        this.status = Objects.requireNonNull(builder.status, "status");
        this.confirmationState = Objects.requireNonNull(builder.confirmationState, "confirmationState");
        this.externalEventRef = builder.externalEventRef;
        this.selfAssigned = builder.selfAssigned;
        this.confirmation = builder.confirmation;
        this.customerInviteSentAt = builder.customerInviteSentAt;
        this.technicianResponse = builder.technicianResponse == null ? AttendeeResponse.NONE : builder.technicianResponse;
        this.customerResponse = builder.customerResponse == null ? AttendeeResponse.NONE : builder.customerResponse;
        this.technicianAcceptedAt = builder.technicianAcceptedAt;
        this.customerAcceptedAt = builder.customerAcceptedAt;
        this.lastResponseCheckAt = builder.lastResponseCheckAt;
        this.cancellationReason = builder.cancellationReason;
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt");
        this.updatedAt = builder.updatedAt == null ? builder.createdAt : builder.updatedAt;
        this.version = builder.version;
        checkInvariants();
    }

    private void checkInvariants() {
        if (confirmationState == ConfirmationState.DRAFT && externalEventRef != null) {
            throw new IllegalStateException("draft 일정은 외부 이벤트 참조를 가질 수 없습니다: " + id);
        }
        if (confirmationState.requiresEventRef() && externalEventRef == null) {
            throw new IllegalStateException(confirmationState.wireName() + " 일정은 외부 이벤트 참조가 필요합니다: " + id);
        }
        if ((confirmation != null) != (confirmationState == ConfirmationState.CONFIRMED)) {
            throw new IllegalStateException("확정 정보는 confirmed 상태에서만 존재합니다: " + id);
        }
        if (customerInviteSentAt != null && technicianAcceptedAt == null) {
            throw new IllegalStateException("기사 승인 전에는 고객 초대를 보낼 수 없습니다: " + id);
        }
        if (cancellationReason != null && confirmationState != ConfirmationState.CANCELLED) {
            throw new IllegalStateException("취소 사유는 cancelled 상태에서만 존재합니다: " + id);
        }
    }

    public static Schedule newDraft(String id, String ticketId, Technician technician, TimeWindow window, Instant now) {
        return builder()
                .id(id)
                .ticketId(ticketId)
                .technician(technician)
                .window(window)
                .status(WorkStatus.SCHEDULED)
                .confirmationState(ConfirmationState.DRAFT)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.id = id;
        builder.ticketId = ticketId;
        builder.technician = technician;
        builder.window = window;
        builder.status = status;
        builder.confirmationState = confirmationState;
        builder.externalEventRef = externalEventRef;
        builder.selfAssigned = selfAssigned;
        builder.confirmation = confirmation;
        builder.customerInviteSentAt = customerInviteSentAt;
        builder.technicianResponse = technicianResponse;
        builder.customerResponse = customerResponse;
        builder.technicianAcceptedAt = technicianAcceptedAt;
        builder.customerAcceptedAt = customerAcceptedAt;
        builder.lastResponseCheckAt = lastResponseCheckAt;
        builder.cancellationReason = cancellationReason;
        builder.createdAt = createdAt;
        builder.updatedAt = updatedAt;
        builder.version = version;
        return builder;
    }

    public String id() {
        return id;
    }

    public String ticketId() {
        return ticketId;
    }

    public Technician technician() {
        return technician;
    }

    public String technicianId() {
        return technician.id();
    }

    public String technicianName() {
        return technician.name();
    }

    public TimeWindow window() {
        return window;
    }

    public WorkStatus status() {
        return status;
    }

    public ConfirmationState confirmationState() {
        return confirmationState;
    }

    public String externalEventRef() {
        return externalEventRef;
    }

    public boolean selfAssigned() {
        return selfAssigned;
    }

    public Confirmation confirmation() {
        return confirmation;
    }

    public Instant customerInviteSentAt() {
        return customerInviteSentAt;
    }

    public AttendeeResponse technicianResponse() {
        return technicianResponse;
    }

    public AttendeeResponse customerResponse() {
        return customerResponse;
    }

    public AttendeeResponse recordedResponse(AttendeeRole role) {
        return role == AttendeeRole.TECHNICIAN ? technicianResponse : customerResponse;
    }

    public Instant technicianAcceptedAt() {
        return technicianAcceptedAt;
    }

    public Instant customerAcceptedAt() {
        return customerAcceptedAt;
    }

    public Instant lastResponseCheckAt() {
        return lastResponseCheckAt;
    }

    public CancellationReason cancellationReason() {
        return cancellationReason;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public long version() {
        return version;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Schedule other)) {
            return false;
        }
        return id.equals(other.id) && version == other.version;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version);
    }

    @Override
    public String toString() {
        return "Schedule{" + id + ", ticket=" + ticketId + ", tech=" + technician.id() + ", " + window
                + ", " + confirmationState.wireName() + ", v" + version + "}";
    }

    public static final class Builder {
        private String id;
        private String ticketId;
        private Technician technician;
        private TimeWindow window;
        private WorkStatus status = WorkStatus.SCHEDULED;
        private ConfirmationState confirmationState = ConfirmationState.DRAFT;
        private String externalEventRef;
        private boolean selfAssigned;
        private Confirmation confirmation;
        private Instant customerInviteSentAt;
        private AttendeeResponse technicianResponse = AttendeeResponse.NONE;
        private AttendeeResponse customerResponse = AttendeeResponse.NONE;
        private Instant technicianAcceptedAt;
        private Instant customerAcceptedAt;
        private Instant lastResponseCheckAt;
        private CancellationReason cancellationReason;
        private Instant createdAt;
        private Instant updatedAt;
        private long version;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder ticketId(String ticketId) {
            this.ticketId = ticketId;
            return this;
        }

        public Builder technician(Technician technician) {
            this.technician = technician;
            return this;
        }

        public Builder window(TimeWindow window) {
            this.window = window;
            return this;
        }

        public Builder status(WorkStatus status) {
            this.status = status;
            return this;
        }

        public Builder confirmationState(ConfirmationState confirmationState) {
            this.confirmationState = confirmationState;
            return this;
        }

        public Builder externalEventRef(String externalEventRef) {
            this.externalEventRef = externalEventRef;
            return this;
        }

        public Builder selfAssigned(boolean selfAssigned) {
            this.selfAssigned = selfAssigned;
            return this;
        }

        public Builder confirmation(Confirmation confirmation) {
            this.confirmation = confirmation;
            return this;
        }

        public Builder customerInviteSentAt(Instant customerInviteSentAt) {
            this.customerInviteSentAt = customerInviteSentAt;
            return this;
        }

        public Builder technicianResponse(AttendeeResponse technicianResponse) {
            this.technicianResponse = technicianResponse;
            return this;
        }

        public Builder customerResponse(AttendeeResponse customerResponse) {
            this.customerResponse = customerResponse;
            return this;
        }

        public Builder response(AttendeeRole role, AttendeeResponse response) {
            if (role == AttendeeRole.TECHNICIAN) {
                this.technicianResponse = response;
            } else {
                this.customerResponse = response;
            }
            return this;
        }

        public Builder technicianAcceptedAt(Instant technicianAcceptedAt) {
            this.technicianAcceptedAt = technicianAcceptedAt;
            return this;
        }

        public Builder customerAcceptedAt(Instant customerAcceptedAt) {
            this.customerAcceptedAt = customerAcceptedAt;
            return this;
        }

        public Builder lastResponseCheckAt(Instant lastResponseCheckAt) {
            this.lastResponseCheckAt = lastResponseCheckAt;
            return this;
        }

        public Builder cancellationReason(CancellationReason cancellationReason) {
            this.cancellationReason = cancellationReason;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Schedule build() {
            return new Schedule(this);
        }
    }
}
