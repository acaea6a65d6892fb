package com.my.dispatch.adapter.in.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.dispatch.adapter.in.idempotency.IdempotencyStore;
import com.my.dispatch.domain.exception.DispatchException;
import com.my.dispatch.domain.exception.ValidationException;
import com.my.dispatch.domain.model.ReconciliationOutcome;
import com.my.dispatch.domain.model.ReplyMessage;
import com.my.dispatch.domain.port.in.CustomerResponseUseCase;
import com.my.dispatch.domain.port.in.ReconcileResponsesUseCase;
import com.my.dispatch.domain.port.in.SchedulingUseCase;
import com.my.dispatch.domain.port.out.ReplyPort;
import io.smallrye.mutiny.Uni;
import io.smallrye.reactive.messaging.annotations.Blocking;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * 왜: RabbitMQ 소비자를 통해 디스패처 명령을 도메인 유스케이스로 진입시키는 단일 경로를 제공하기 위함.
 */
@ApplicationScoped
public class DispatchCommandConsumer {

    private static final Logger log = Logger.getLogger(DispatchCommandConsumer.class);

    private final SchedulingUseCase schedulingUseCase;
    private final ReconcileResponsesUseCase reconcileResponsesUseCase;
    private final CustomerResponseUseCase customerResponseUseCase;
    private final IdempotencyStore idempotencyStore;
    private final ReplyPort replyPort;
    private final ObjectMapper objectMapper;

    @Inject
    public DispatchCommandConsumer(SchedulingUseCase schedulingUseCase,
                                   ReconcileResponsesUseCase reconcileResponsesUseCase,
                                   CustomerResponseUseCase customerResponseUseCase,
                                   IdempotencyStore idempotencyStore,
                                   ReplyPort replyPort,
                                   ObjectMapper objectMapper) {
        this.schedulingUseCase = schedulingUseCase;
        this.reconcileResponsesUseCase = reconcileResponsesUseCase;
        this.customerResponseUseCase = customerResponseUseCase;
        this.idempotencyStore = idempotencyStore;
        this.replyPort = replyPort;
        this.objectMapper = objectMapper;
    }

    @Incoming("dispatch-commands")
    @Blocking
    public Uni<Void> consume(Message<String> message) {
        return Uni.createFrom().item(() -> {
            DispatchCommand command;
            try {
                command = objectMapper.readValue(message.getPayload(), DispatchCommand.class);
            } catch (IOException e) {
                log.warnf("명령 파싱 실패로 처리 중단: %s", e.getMessage());
                return null;
            }
            MDC.put("commandId", command.commandId());
            if (command.scheduleId() != null) {
                MDC.put("scheduleId", command.scheduleId());
            }
            try {
                process(command);
            } finally {
                MDC.remove("commandId");
                MDC.remove("scheduleId");
            }
            return null;
        }).replaceWithVoid();
    }

    void process(DispatchCommand command) {
        Optional<String> processedType = idempotencyStore.processedType(command.commandId());
        if (processedType.isPresent()) {
            if (processedType.get().equals(command.type())) {
                log.infof("중복 명령을 건너뜁니다: %s(%s)", command.commandId(), command.type());
            } else {
                log.warnf("명령 ID %s 는 이미 %s 로 처리되었습니다. %s 명령을 건너뜁니다.",
                        command.commandId(), processedType.get(), command.type());
            }
            return;
        }
        try {
            ReplyMessage reply = handle(command);
            replyPort.send(reply);
            idempotencyStore.markProcessed(command.commandId(), command.type());
        } catch (DispatchException e) {
            log.warnf("명령 %s(%s) 거절: [%s] %s", command.commandId(), command.type(), e.code(), e.getMessage());
            replyPort.send(ReplyMessage.error(command.commandId(), e.code(), e.getMessage()));
            if (!e.retryable()) {
                idempotencyStore.markProcessed(command.commandId(), command.type());
            }
        } catch (RuntimeException e) {
            log.errorf(e, "명령 %s(%s) 처리 중 예외", command.commandId(), command.type());
            replyPort.send(ReplyMessage.error(command.commandId(), "INTERNAL", e.getMessage()));
        }
    }

    private ReplyMessage handle(DispatchCommand command) {
        String commandId = command.commandId();
        return switch (command.commandType()) {
            case CREATE_DRAFT -> {
                if (command.technicianOrNull() == null) {
                    throw new ValidationException("CREATE_DRAFT 명령에는 technician이 필요합니다.");
                }
                yield ReplyMessage.ok(commandId, List.of(schedulingUseCase.createDraft(
                        command.ticketId(), command.technicianOrNull(), command.windowOrNull())));
            }
            case MOVE_DRAFT -> ReplyMessage.ok(commandId, List.of(schedulingUseCase.moveDraft(
                    command.requireScheduleId(), command.requireExpectedVersion(),
                    command.windowOrNull(), command.technicianOrNull())));
            case COMMIT -> ReplyMessage.ok(commandId, List.of(schedulingUseCase.commit(
                    command.requireScheduleId(), command.requireExpectedVersion())));
            case SEND_CUSTOMER_INVITE -> ReplyMessage.ok(commandId, List.of(schedulingUseCase.sendCustomerInvite(
                    command.requireScheduleId(), command.requireExpectedVersion())));
            case MARK_CONFIRMED -> ReplyMessage.ok(commandId, List.of(schedulingUseCase.markConfirmedManually(
                    command.requireScheduleId(), command.requireExpectedVersion(), command.dispatcherId())));
            case RESET_TO_DRAFT -> ReplyMessage.ok(commandId, List.of(schedulingUseCase.resetToDraft(
                    command.requireScheduleId(), command.requireExpectedVersion())));
            case REMOVE -> {
                schedulingUseCase.remove(command.requireScheduleId(), command.requireExpectedVersion());
                yield ReplyMessage.ok(commandId, List.of());
            }
            case GET -> ReplyMessage.ok(commandId, List.of(schedulingUseCase.getSchedule(command.requireScheduleId())));
            case LIST -> ReplyMessage.ok(commandId, schedulingUseCase.listSchedulesForRange(
                    command.technicianFilter(), command.range()));
            case RECONCILE -> ReplyMessage.ok(commandId, reconcileResponsesUseCase.runReconciliationPass());
            case RECONCILE_ONE -> {
                ReconciliationOutcome outcome = reconcileResponsesUseCase.reconcileSchedule(command.requireScheduleId());
                yield new ReplyMessage(commandId, ReplyMessage.OK, outcome.name(), List.of(), null);
            }
            case CUSTOMER_RESPONSE -> ReplyMessage.ok(commandId, List.of(customerResponseUseCase.respondByLink(
                    command.requireScheduleId(), command.requireAction(), command.token())));
        };
    }
}
