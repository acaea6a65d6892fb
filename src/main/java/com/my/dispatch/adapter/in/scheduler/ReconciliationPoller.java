package com.my.dispatch.adapter.in.scheduler;

import com.my.dispatch.config.AppConfig;
import com.my.dispatch.domain.port.in.ReconcileResponsesUseCase;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * 왜: 외부 캘린더 응답을 주기적으로 읽어 오는 리컨실 회차를 한 스레드에서 겹치지 않게 실행하기 위함.
 */
@Startup
@ApplicationScoped
public class ReconciliationPoller {

    private static final Logger log = Logger.getLogger(ReconciliationPoller.class);

    private final ReconcileResponsesUseCase reconcileResponsesUseCase;
    private final boolean enabled;
    private final int intervalSeconds;
    private final ScheduledExecutorService executor;

    @Inject
    public ReconciliationPoller(ReconcileResponsesUseCase reconcileResponsesUseCase, AppConfig appConfig) {
        this.reconcileResponsesUseCase = reconcileResponsesUseCase;
        this.enabled = appConfig.reconciler().enabled();
        this.intervalSeconds = appConfig.reconciler().intervalSeconds();
        this.executor = Executors.newSingleThreadScheduledExecutor(daemonThreads());
    }

    @PostConstruct
    void start() {
        if (!enabled) {
            log.info("응답 리컨실 폴러가 비활성화되어 있습니다.");
            return;
        }
        executor.scheduleWithFixedDelay(this::pollSafely, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        log.infof("응답 리컨실 폴러 시작: %d초 간격", intervalSeconds);
    }

    void pollSafely() {
        try {
            reconcileResponsesUseCase.runReconciliationPass();
        } catch (Exception e) {
            log.errorf(e, "응답 리컨실 회차 실패");
        }
    }

    @PreDestroy
    void stop() {
        executor.shutdownNow();
    }

    private static ThreadFactory daemonThreads() {
        return runnable -> {
            Thread thread = new Thread(runnable, "reconciliation-poller");
            thread.setDaemon(true);
            return thread;
        };
    }
}
