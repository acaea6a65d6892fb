package com.my.dispatch.adapter.out.ticket;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.dispatch.config.AppConfig;
import com.my.dispatch.domain.exception.GatewayException;
import com.my.dispatch.domain.model.Ticket;
import com.my.dispatch.domain.port.out.TicketPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * 왜: 티켓 서비스 REST 호출을 캡슐화해 도메인이 티켓 조회 결과만 다루도록 하기 위함.
 */
@ApplicationScoped
public class HttpTicketClient implements TicketPort {

    private static final Logger log = Logger.getLogger(HttpTicketClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final Duration timeout;

    @Inject
    public HttpTicketClient(AppConfig appConfig, ObjectMapper objectMapper) {
        this(HttpClient.newBuilder()
                        .connectTimeout(Duration.ofSeconds(appConfig.ticket().timeoutSeconds()))
                        .build(),
                objectMapper,
                appConfig.ticket().baseUrl().orElse(""),
                Duration.ofSeconds(appConfig.ticket().timeoutSeconds()));
    }

    HttpTicketClient(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl, Duration timeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
    }

    @Override
    public Optional<Ticket> getTicket(String ticketId) {
        if (baseUrl.isBlank()) {
            log.warn("티켓 서비스 주소가 설정되지 않아 티켓 정보 없이 진행합니다.");
            return Optional.empty();
        }
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/tickets/" + URLEncoder.encode(ticketId, StandardCharsets.UTF_8)))
                .header("Accept", "application/json")
                .timeout(timeout)
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() == 404) {
                return Optional.empty();
            }
            if (response.statusCode() >= 400) {
                throw new GatewayException("티켓 조회 실패 status=" + response.statusCode() + " ticket=" + ticketId);
            }
            return Optional.of(objectMapper.readValue(response.body(), TicketPayload.class).toTicket(ticketId));
        } catch (IOException e) {
            throw new GatewayException("티켓 조회 중 통신 실패: " + ticketId, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException("티켓 조회가 중단되었습니다: " + ticketId, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TicketPayload(String id,
                         String ticketNumber,
                         String title,
                         String description,
                         String customerName,
                         String customerEmail,
                         String customerPhone,
                         String serviceAddress,
                         Integer estimatedDurationMinutes) {

        Ticket toTicket(String requestedId) {
            return new Ticket(id == null ? requestedId : id, ticketNumber, title, description, customerName,
                    customerEmail, customerPhone, serviceAddress, estimatedDurationMinutes);
        }
    }
}
