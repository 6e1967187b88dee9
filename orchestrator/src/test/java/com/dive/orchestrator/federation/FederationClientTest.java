package com.dive.orchestrator.federation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FederationClientTest {

    @Mock HttpClient             http;
    @Mock HttpResponse<String>   response;

    FederationClient client;

    @BeforeEach
    void setUp() {
        client = new FederationClient(http, new ObjectMapper(), "http://drift.local/api/drift/", true, true);
    }

    @Test
    void reconcile_postsInstanceCodeAndParsesReply() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"reconciled\":true}");
        doReturn(response).when(http).send(any(), any());

        JsonNode reply = client.reconcile("fra");

        assertThat(reply.get("reconciled").asBoolean()).isTrue();
        ArgumentCaptor<HttpRequest> req = ArgumentCaptor.forClass(HttpRequest.class);
        verify(http).send(req.capture(), any());
        assertThat(req.getValue().uri().toString()).isEqualTo("http://drift.local/api/drift/reconcile");
        assertThat(req.getValue().method()).isEqualTo("POST");
    }

    @Test
    void reconcile_non2xx_throwsFederationException() throws Exception {
        when(response.statusCode()).thenReturn(502);
        when(response.body()).thenReturn("bad gateway");
        doReturn(response).when(http).send(any(), any());

        assertThatThrownBy(() -> client.reconcile("fra"))
                .isInstanceOf(FederationException.class)
                .hasMessageContaining("HTTP 502");
    }

    @Test
    void drift_emptyBody_isEmptyObject() throws Exception {
        when(response.statusCode()).thenReturn(204);
        when(response.body()).thenReturn("");
        doReturn(response).when(http).send(any(), any());

        assertThat(client.drift().isEmpty()).isTrue();
    }

    @Test
    void health_unreachable_isFalseNotException() throws Exception {
        doThrow(new ConnectException("refused")).when(http).send(any(), any());

        assertThat(client.health()).isFalse();
    }

    @Test
    void reconcilesOnComplete_requiresEnabled() {
        FederationClient disabled = new FederationClient(http, new ObjectMapper(), "http://x", false, true);

        assertThat(client.reconcilesOnComplete()).isTrue();
        assertThat(disabled.reconcilesOnComplete()).isFalse();
        verifyNoInteractions(http);
    }
}
