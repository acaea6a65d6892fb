package com.my.dispatch.domain.port.out;

import com.my.dispatch.domain.model.Ticket;

import java.util.Optional;

/**
 * 왜: 티켓 시스템이 소유한 서비스 요청 정보를 도메인이 조회만 하도록 경계를 두기 위함.
 */
public interface TicketPort {
    Optional<Ticket> getTicket(String ticketId);
}
