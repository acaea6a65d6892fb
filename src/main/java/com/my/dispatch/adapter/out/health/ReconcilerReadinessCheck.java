package com.my.dispatch.adapter.out.health;

import com.my.dispatch.config.AppConfig;
import com.my.dispatch.domain.port.in.ReconcileResponsesUseCase;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import java.util.Set;

/**
 * 연속 실패로 멈춘 일정이 있으면 DOWN 으로 보고한다.
 */
@Readiness
@ApplicationScoped
public class ReconcilerReadinessCheck implements HealthCheck {

    private final AppConfig appConfig;
    private final ReconcileResponsesUseCase reconcileResponsesUseCase;

    public ReconcilerReadinessCheck(AppConfig appConfig, ReconcileResponsesUseCase reconcileResponsesUseCase) {
        this.appConfig = appConfig;
        this.reconcileResponsesUseCase = reconcileResponsesUseCase;
    }

    @Override
    public HealthCheckResponse call() {
        Set<String> stuck = reconcileResponsesUseCase.stuckScheduleIds();
        return HealthCheckResponse.named("reconciler-readiness")
                .withData("storeBackend", appConfig.store().backend())
                .withData("storePath", appConfig.store().sqlitePath())
                .withData("reconcilerEnabled", appConfig.reconciler().enabled())
                .withData("stuckSchedules", stuck.size())
                .status(stuck.isEmpty())
                .build();
    }
}
