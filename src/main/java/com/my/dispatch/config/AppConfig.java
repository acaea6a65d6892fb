package com.my.dispatch.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

@StaticInitSafe
@ConfigMapping(prefix = "app")
public interface AppConfig {

    ScheduleConfig schedule();

    CalendarConfig calendar();

    ReconcilerConfig reconciler();

    StoreConfig store();

    IdempotencyConfig idempotency();

    TicketConfig ticket();

    @WithName("customer-link")
    CustomerLinkConfig customerLink();

    interface ScheduleConfig {
        @WithDefault("UTC")
        String zone();

        @WithName("buffer-minutes")
        @WithDefault("30")
        int bufferMinutes();

        @WithName("default-duration-minutes")
        @WithDefault("120")
        int defaultDurationMinutes();
    }

    interface CalendarConfig {
        @WithName("organizer-email")
        @WithDefault("dispatch@example.com")
        String organizerEmail();

        @WithName("calendar-id")
        @WithDefault("primary")
        String calendarId();

        @WithName("credential-path")
        @WithDefault("/app/config/tokens")
        String credentialPath();

        @WithName("timeout-seconds")
        @WithDefault("10")
        int timeoutSeconds();
    }

    interface ReconcilerConfig {
        @WithDefault("true")
        boolean enabled();

        @WithName("interval-seconds")
        @WithDefault("180")
        int intervalSeconds();

        @WithName("batch-size")
        @WithDefault("20")
        int batchSize();

        @WithName("lease-seconds")
        @WithDefault("120")
        int leaseSeconds();

        @WithName("alert-after-failures")
        @WithDefault("5")
        int alertAfterFailures();
    }

    interface StoreConfig {
        @WithName("backend")
        @WithDefault("sqlite")
        String backend();

        @WithName("sqlite-path")
        @WithDefault("./data/dispatch.db")
        String sqlitePath();
    }

    interface IdempotencyConfig {
        @WithName("backend")
        @WithDefault("sqlite")
        String backend();

        @WithName("ttl-hours")
        @WithDefault("24")
        int ttlHours();
    }

    interface TicketConfig {
        @WithName("base-url")
        Optional<String> baseUrl();

        @WithName("timeout-seconds")
        @WithDefault("5")
        int timeoutSeconds();
    }

    interface CustomerLinkConfig {
        /**
         * 비어 있으면 고객 응답 링크를 만들지도 받지도 않는다.
         */
        Optional<String> secret();

        @WithName("base-url")
        Optional<String> baseUrl();
    }
}
