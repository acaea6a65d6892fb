package com.my.dispatch.config;

import io.quarkus.runtime.LaunchMode;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;

@Startup
@ApplicationScoped
public class ConfigValidator {

    private static final Logger log = Logger.getLogger(ConfigValidator.class);

    private static final int MIN_LINK_SECRET_LENGTH = 16;

    private final AppConfig appConfig;

    public ConfigValidator(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @PostConstruct
    void validate() {
        boolean isProd = LaunchMode.current() == LaunchMode.NORMAL;
        validateZone(appConfig.schedule().zone());
        validatePositive("app.schedule.default-duration-minutes", appConfig.schedule().defaultDurationMinutes());
        validatePositive("app.reconciler.batch-size", appConfig.reconciler().batchSize());
        validatePositive("app.reconciler.interval-seconds", appConfig.reconciler().intervalSeconds());
        if (appConfig.schedule().bufferMinutes() < 0) {
            throw new IllegalStateException("버퍼 시간은 음수일 수 없습니다: " + appConfig.schedule().bufferMinutes());
        }
        validateRequired("APP_CALENDAR_ORGANIZER_EMAIL", appConfig.calendar().organizerEmail(), isProd);
        validateRequired("APP_TICKET_BASE_URL", appConfig.ticket().baseUrl().orElse(null), isProd);
        validatePath("APP_CALENDAR_CREDENTIAL_PATH", appConfig.calendar().credentialPath(), isProd);
        validateCustomerLink(appConfig.customerLink());
    }

    private void validateCustomerLink(AppConfig.CustomerLinkConfig customerLink) {
        String secret = customerLink.secret().filter(value -> !value.isBlank()).orElse(null);
        if (secret != null && secret.length() < MIN_LINK_SECRET_LENGTH) {
            throw new IllegalStateException("고객 응답 링크 비밀 값은 " + MIN_LINK_SECRET_LENGTH + "자 이상이어야 합니다.");
        }
        if (secret == null && customerLink.baseUrl().filter(value -> !value.isBlank()).isPresent()) {
            log.warn("APP_PUBLIC_BASE_URL 이 있지만 APP_CUSTOMER_LINK_SECRET 이 비어 있어 고객 응답 링크를 만들지 않습니다.");
        }
    }

    private void validateZone(String zone) {
        try {
            ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new IllegalStateException("알 수 없는 시간대입니다: app.schedule.zone=" + zone, e);
        }
    }

    private void validatePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalStateException("설정 값은 0보다 커야 합니다: " + name + "=" + value);
        }
    }

    private void validateRequired(String name, String value, boolean strict) {
        if (value == null || value.isBlank()) {
            String message = "필수 설정이 비어 있습니다: " + name;
            if (strict) {
                throw new IllegalStateException(message);
            }
            log.warn(message);
        }
    }

    private void validatePath(String name, String path, boolean strict) {
        Path resolved = Path.of(path);
        if (!Files.exists(resolved)) {
            String message = "경로가 존재하지 않습니다: " + name + "=" + path;
            if (strict) {
                throw new IllegalStateException(message);
            }
            log.warn(message);
        }
    }
}
