package com.my.dispatch.adapter.in.scheduler;

import com.my.dispatch.config.AppConfig;
import com.my.dispatch.domain.model.ReconciliationReport;
import com.my.dispatch.domain.port.in.ReconcileResponsesUseCase;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReconciliationPollerTest {

    @Test
    void failedPassDoesNotStopLaterPasses() {
        ReconcileResponsesUseCase useCase = mock(ReconcileResponsesUseCase.class);
        when(useCase.runReconciliationPass())
                .thenThrow(new IllegalStateException("database locked"))
                .thenReturn(ReconciliationReport.empty());
        AppConfig appConfig = mock(AppConfig.class, RETURNS_DEEP_STUBS);
        when(appConfig.reconciler().enabled()).thenReturn(false);
        when(appConfig.reconciler().intervalSeconds()).thenReturn(60);
        ReconciliationPoller poller = new ReconciliationPoller(useCase, appConfig);

        assertThatCode(poller::pollSafely).doesNotThrowAnyException();
        poller.pollSafely();

        verify(useCase, times(2)).runReconciliationPass();
        poller.stop();
    }
}
