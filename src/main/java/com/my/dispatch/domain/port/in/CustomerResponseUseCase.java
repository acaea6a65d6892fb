package com.my.dispatch.domain.port.in;

import com.my.dispatch.domain.model.Schedule;

/**
 * 왜: 캘린더 응답과 별개로 고객이 서명 링크로 보낸 수락/거절을 같은 승인 전이로 반영하기 위함.
 */
public interface CustomerResponseUseCase {

    /**
     * @param action {@code accept} 또는 {@code decline}
     * @throws com.my.dispatch.domain.exception.InvalidLinkException 토큰이 맞지 않을 때
     * @throws com.my.dispatch.domain.exception.InvalidStateException 고객 응답을 기다리는 일정이 아닐 때
     */
    Schedule respondByLink(String scheduleId, String action, String token);
}
