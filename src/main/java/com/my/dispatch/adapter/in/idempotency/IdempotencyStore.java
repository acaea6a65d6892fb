package com.my.dispatch.adapter.in.idempotency;

import java.util.Optional;

/**
 * 이미 처리한 디스패처 명령 ID 와 그 명령 유형을 TTL 동안 기억한다.
 */
public interface IdempotencyStore {

    /**
     * TTL 안에 처리된 명령이면 기록된 명령 유형을 돌려준다.
     */
    Optional<String> processedType(String commandId);

    default boolean isProcessed(String commandId) {
        return processedType(commandId).isPresent();
    }

    void markProcessed(String commandId, String commandType);
}
