package com.my.dispatch.adapter.out.reply;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.dispatch.domain.model.ReconciliationOutcome;
import com.my.dispatch.domain.model.ReconciliationReport;
import com.my.dispatch.domain.model.ReplyMessage;
import com.my.dispatch.domain.model.Schedule;
import com.my.dispatch.domain.port.out.ReplyPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Channel;
import org.eclipse.microprofile.reactive.messaging.Emitter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 왜: 명령 처리 결과를 RabbitMQ로 전달하는 기술적 구현을 분리하여 포트 계약을 지키기 위함.
 */
@ApplicationScoped
public class RabbitReplyProducer implements ReplyPort {

    private final Emitter<String> replyEmitter;
    private final ObjectMapper objectMapper;

    @Inject
    public RabbitReplyProducer(@Channel("dispatch-replies") Emitter<String> replyEmitter, ObjectMapper objectMapper) {
        this.replyEmitter = replyEmitter;
        this.objectMapper = objectMapper;
    }

    @Override
    public void send(ReplyMessage replyMessage) {
        try {
            replyEmitter.send(objectMapper.writeValueAsString(ReplyPayload.of(replyMessage)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("응답 직렬화 실패: " + replyMessage.commandId(), e);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ReplyPayload(String commandId,
                        String status,
                        String message,
                        List<ScheduleView> schedules,
                        Map<String, Integer> report) {

        static ReplyPayload of(ReplyMessage reply) {
            return new ReplyPayload(reply.commandId(), reply.status(), reply.message(),
                    reply.schedules().stream().map(ScheduleView::of).toList(),
                    reply.report() == null ? null : reportView(reply.report()));
        }

        private static Map<String, Integer> reportView(ReconciliationReport report) {
            Map<String, Integer> view = new LinkedHashMap<>();
            view.put("checked", report.checked());
            for (ReconciliationOutcome outcome : ReconciliationOutcome.values()) {
                view.put(outcome.name(), report.count(outcome));
            }
            return view;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ScheduleView(String id,
                        String ticketId,
                        String technicianId,
                        String technicianName,
                        String windowStart,
                        String windowEnd,
                        String status,
                        String confirmationState,
                        String externalEventRef,
                        boolean selfAssigned,
                        String confirmedBy,
                        String confirmationMethod,
                        String confirmedAt,
                        String customerInviteSentAt,
                        String technicianResponse,
                        String customerResponse,
                        String cancellationReason,
                        long version) {

        static ScheduleView of(Schedule schedule) {
            return new ScheduleView(
                    schedule.id(),
                    schedule.ticketId(),
                    schedule.technicianId(),
                    schedule.technicianName(),
                    schedule.window().start().toString(),
                    schedule.window().end().toString(),
                    schedule.status().name(),
                    schedule.confirmationState().wireName(),
                    schedule.externalEventRef(),
                    schedule.selfAssigned(),
                    schedule.confirmation() == null ? null : schedule.confirmation().by(),
                    schedule.confirmation() == null ? null : schedule.confirmation().method().wireName(),
                    schedule.confirmation() == null ? null : text(schedule.confirmation().at()),
                    text(schedule.customerInviteSentAt()),
                    schedule.technicianResponse().wireName(),
                    schedule.customerResponse().wireName(),
                    schedule.cancellationReason() == null ? null : schedule.cancellationReason().name(),
                    schedule.version());
        }

        private static String text(Instant instant) {
            return instant == null ? null : instant.toString();
        }
    }
}
