package com.linlay.threadagent.controller;

import com.linlay.threadagent.agent.AgentOrchestrator;
import com.linlay.threadagent.agent.AgentReply;
import com.linlay.threadagent.agent.ModelProperties;
import com.linlay.threadagent.agent.TurnRequest;
import com.linlay.threadagent.error.ModelInvocationException;
import com.linlay.threadagent.memory.ThreadKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TurnControllerTest {

    private AgentOrchestrator orchestrator;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        orchestrator = mock(AgentOrchestrator.class);
        ModelProperties modelProperties = new ModelProperties();
        modelProperties.setFailureMessage("model unavailable");
        webTestClient = WebTestClient.bindToController(new TurnController(orchestrator, modelProperties)).build();
    }

    @Test
    void shouldReturnReplyForThread() {
        when(orchestrator.process(any())).thenReturn(Mono.just(new AgentReply("hello there", "Rumi")));

        webTestClient.post()
                .uri("/api/turns")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"anchorMessageId\":100,\"chatId\":200,\"text\":\"hi\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.content").isEqualTo("hello there")
                .jsonPath("$.title").isEqualTo("Rumi");

        ArgumentCaptor<TurnRequest> captor = ArgumentCaptor.forClass(TurnRequest.class);
        verify(orchestrator).process(captor.capture());
        assertThat(captor.getValue().threadKey()).isEqualTo(ThreadKey.of(100, 200));
        assertThat(captor.getValue().text()).isEqualTo("hi");
    }

    @Test
    void shouldOmitMissingTitle() {
        when(orchestrator.process(any())).thenReturn(Mono.just(AgentReply.of("plain")));

        webTestClient.post()
                .uri("/api/turns")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"anchorMessageId\":1,\"chatId\":2,\"text\":\"hi\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.content").isEqualTo("plain")
                .jsonPath("$.title").doesNotExist();
    }

    @Test
    void shouldMapModelFailureToBadGateway() {
        when(orchestrator.process(any()))
                .thenReturn(Mono.error(new ModelInvocationException("upstream 503", null, true, 3)));

        webTestClient.post()
                .uri("/api/turns")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"anchorMessageId\":1,\"chatId\":2,\"text\":\"hi\"}")
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.BAD_GATEWAY)
                .expectBody()
                .jsonPath("$.content").isEqualTo("model unavailable");
    }

    @Test
    void shouldRejectBlankText() {
        webTestClient.post()
                .uri("/api/turns")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"anchorMessageId\":1,\"chatId\":2,\"text\":\" \"}")
                .exchange()
                .expectStatus().isBadRequest();
    }
}
