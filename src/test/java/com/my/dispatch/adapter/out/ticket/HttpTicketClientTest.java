package com.my.dispatch.adapter.out.ticket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.dispatch.domain.exception.GatewayException;
import com.my.dispatch.domain.model.Ticket;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class HttpTicketClientTest {

    private final HttpClient httpClient = mock(HttpClient.class);
    private final HttpTicketClient client =
            new HttpTicketClient(httpClient, new ObjectMapper(), "http://tickets.local/api/", Duration.ofSeconds(2));

    @Test
    void readsTicketFields() throws Exception {
        respond(200, "{\"id\":\"t-9\",\"ticketNumber\":\"1042\",\"customerName\":\"Jordan Lee\","
                + "\"customerEmail\":\"jordan@example.com\",\"estimatedDurationMinutes\":45,\"priority\":\"high\"}");

        Optional<Ticket> ticket = client.getTicket("t-9");

        assertThat(ticket).hasValueSatisfying(t -> {
            assertThat(t.ticketNumber()).isEqualTo("1042");
            assertThat(t.customerContact()).contains("jordan@example.com");
            assertThat(t.estimatedDuration()).contains(45);
        });
        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertThat(request.getValue().uri().toString()).isEqualTo("http://tickets.local/api/tickets/t-9");
    }

    @Test
    void unknownTicketIsEmpty() throws Exception {
        respond(404, "");

        assertThat(client.getTicket("t-404")).isEmpty();
    }

    @Test
    void serverErrorIsGatewayFailure() throws Exception {
        respond(503, "");

        assertThatThrownBy(() -> client.getTicket("t-9")).isInstanceOf(GatewayException.class);
    }

    @Test
    void transportErrorIsGatewayFailure() throws Exception {
        doThrow(new IOException("connection reset")).when(httpClient).send(any(), any());

        assertThatThrownBy(() -> client.getTicket("t-9"))
                .isInstanceOf(GatewayException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void missingBaseUrlSkipsLookup() {
        HttpTicketClient unconfigured = new HttpTicketClient(httpClient, new ObjectMapper(), "", Duration.ofSeconds(2));

        assertThat(unconfigured.getTicket("t-9")).isEmpty();
        verifyNoInteractions(httpClient);
    }

    @SuppressWarnings("unchecked")
    private void respond(int status, String body) throws Exception {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        doReturn(response).when(httpClient).send(any(), any());
    }
}
