package com.my.dispatch.adapter.in.idempotency;

import com.my.dispatch.config.AppConfig;
import com.my.dispatch.domain.port.out.ClockPort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@IfBuildProperty(name = "app.idempotency.backend", stringValue = "memory")
@ApplicationScoped
public class InMemoryIdempotencyStore implements IdempotencyStore {

    private final Duration ttl;
    private final ClockPort clockPort;
    private final Map<String, ProcessedCommand> processed = new ConcurrentHashMap<>();

    @Inject
    public InMemoryIdempotencyStore(AppConfig appConfig, ClockPort clockPort) {
        this(Duration.ofHours(appConfig.idempotency().ttlHours()), clockPort);
    }

    InMemoryIdempotencyStore(Duration ttl, ClockPort clockPort) {
        this.ttl = ttl;
        this.clockPort = clockPort;
    }

    @Override
    public Optional<String> processedType(String commandId) {
        evictExpired();
        return Optional.ofNullable(processed.get(commandId)).map(ProcessedCommand::type);
    }

    @Override
    public void markProcessed(String commandId, String commandType) {
        evictExpired();
        processed.putIfAbsent(commandId, new ProcessedCommand(commandType, clockPort.instant()));
    }

    private void evictExpired() {
        Instant cutoff = clockPort.instant().minus(ttl);
        processed.values().removeIf(command -> command.at().isBefore(cutoff));
    }

    private record ProcessedCommand(String type, Instant at) {
    }
}
