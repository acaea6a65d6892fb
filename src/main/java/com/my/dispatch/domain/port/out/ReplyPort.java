package com.my.dispatch.domain.port.out;

import com.my.dispatch.domain.model.ReplyMessage;

/**
 * 왜: 응답 채널(RabbitMQ 등) 세부 구현을 숨기고 단일 계약으로 명령 결과를 전달하도록 하기 위함.
 */
public interface ReplyPort {
    void send(ReplyMessage replyMessage);
}
