package com.my.dispatch.adapter.out.rabbitmq;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.dispatch.domain.port.out.ClockPort;
import com.my.dispatch.domain.port.out.TicketNotificationPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Channel;
import org.eclipse.microprofile.reactive.messaging.Emitter;
import org.jboss.logging.Logger;

/**
 * 왜: 일정 상태 변화를 티켓 시스템이 구독하는 RabbitMQ 채널로 전달하는 드리븐 어댑터를 분리하기 위함.
 */
@ApplicationScoped
public class RabbitTicketNotifier implements TicketNotificationPort {

    static final String UNSCHEDULED = "UNSCHEDULED";
    static final String SCHEDULE_CONFIRMED = "SCHEDULE_CONFIRMED";

    private static final Logger log = Logger.getLogger(RabbitTicketNotifier.class);

    private final Emitter<String> emitter;
    private final ObjectMapper objectMapper;
    private final ClockPort clockPort;

    @Inject
    public RabbitTicketNotifier(@Channel("ticket-events") Emitter<String> emitter,
                                ObjectMapper objectMapper,
                                ClockPort clockPort) {
        this.emitter = emitter;
        this.objectMapper = objectMapper;
        this.clockPort = clockPort;
    }

    @Override
    public void notifyTicketUnscheduled(String ticketId) {
        publish(new TicketEvent(UNSCHEDULED, ticketId, null, clockPort.now().toString()));
    }

    @Override
    public void notifyTicketScheduleConfirmed(String ticketId, String scheduleId) {
        publish(new TicketEvent(SCHEDULE_CONFIRMED, ticketId, scheduleId, clockPort.now().toString()));
    }

    private void publish(TicketEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("티켓 이벤트 직렬화 실패: " + event.type(), e);
        }
        emitter.send(payload);
        log.debugf("티켓 이벤트 발행: %s ticket=%s", event.type(), event.ticketId());
    }

    record TicketEvent(String type, String ticketId, String scheduleId, String occurredAt) {
    }
}
