package com.my.dispatch.domain.service;

import com.my.dispatch.domain.model.CustomerLinkAction;
import com.my.dispatch.domain.model.Schedule;
import com.my.dispatch.domain.model.Ticket;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 왜: 캘린더 초대의 제목 접두어와 본문 형식을 한 곳에서 관리해 단계별로 같은 형식을 유지하기 위함.
 */
public class InviteComposer {

    private final CustomerResponseLinks links;

    public InviteComposer() {
        this(CustomerResponseLinks.disabled());
    }

    public InviteComposer(CustomerResponseLinks links) {
        this.links = links;
    }

    public enum Stage {
        PENDING("[PENDING] "),
        AWAITING_CUSTOMER("[AWAITING CUSTOMER] "),
        FINAL("");

        private final String prefix;

        Stage(String prefix) {
            this.prefix = prefix;
        }

        public String prefix() {
            return prefix;
        }
    }

    public String subject(Schedule schedule, Optional<Ticket> ticket, Stage stage) {
        String customer = ticket.map(Ticket::customerDisplayName).orElse("Customer");
        String number = ticket.map(Ticket::ticketNumber)
                .filter(value -> !value.isBlank())
                .map(value -> " (#" + value + ")")
                .orElse("");
        return stage.prefix() + "Service: " + customer + number;
    }

    public String body(Schedule schedule, Optional<Ticket> ticket, boolean awaitingTechnician) {
        List<String> lines = new ArrayList<>();
        lines.add(ticket.map(Ticket::title).filter(this::present).orElse("Service Appointment"));
        lines.add("");
        ticket.ifPresent(t -> {
            lines.add("Customer: " + t.customerDisplayName());
            addIfPresent(lines, "Address: ", t.serviceAddress());
            addIfPresent(lines, "Phone: ", t.customerPhone());
            addIfPresent(lines, "Email: ", t.customerEmail());
            lines.add("");
            addIfPresent(lines, "Notes: ", t.description());
            addIfPresent(lines, "Ticket: #", t.ticketNumber());
        });
        if (ticket.isEmpty()) {
            lines.add("Ticket: " + schedule.ticketId());
        }
        lines.add("Technician: " + schedule.technicianName());
        if (awaitingTechnician) {
            lines.add("");
            lines.add("Awaiting technician confirmation");
        }
        return String.join("\n", lines).strip();
    }

    /**
     * 고객 초대 시점의 본문. 응답 링크를 만들 수 있으면 수락/거절 링크를 덧붙인다.
     */
    public String customerInviteBody(Schedule schedule, Ticket ticket) {
        String body = body(schedule, Optional.of(ticket), false);
        Optional<String> accept = links.url(schedule.id(), CustomerLinkAction.ACCEPT);
        Optional<String> decline = links.url(schedule.id(), CustomerLinkAction.DECLINE);
        if (accept.isEmpty() || decline.isEmpty()) {
            return body;
        }
        return body + "\n\nCan't see accept/decline buttons? Use these links:"
                + "\nAccept: " + accept.get()
                + "\nDecline: " + decline.get();
    }

    public String location(Optional<Ticket> ticket) {
        return ticket.map(Ticket::serviceAddress).filter(this::present).orElse("");
    }

    private void addIfPresent(List<String> lines, String label, String value) {
        if (present(value)) {
            lines.add(label + value);
        }
    }

    private boolean present(String value) {
        return value != null && !value.isBlank();
    }
}
