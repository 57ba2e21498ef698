package com.citewise.controller;

import com.citewise.research.ResearchCommand;
import com.citewise.research.ResearchService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Tests for ResearchController.
 */
class ResearchControllerTest {

    private ResearchService researchService;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        researchService = mock(ResearchService.class);
        client = WebTestClient.bindToController(new ResearchController(researchService)).build();
    }

    @Test
    void testResearchReturnsPlainTextAnswer() {
        when(researchService.research("python asyncio", "default")).thenReturn(Mono.just("Answer [1]"));

        client.post().uri("/v1/research")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"query\":\"python asyncio\"}")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.TEXT_PLAIN)
                .expectBody(String.class).isEqualTo("Answer [1]");
    }

    @Test
    void testFlagInQuerySelectsMode() {
        when(researchService.research("climate change causes", "deep")).thenReturn(Mono.just("Deep answer"));

        client.post().uri("/v1/research")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"query\":\"--deep climate change causes\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody(String.class).isEqualTo("Deep answer");
    }

    @Test
    void testBodyModeWinsOverFlag() {
        when(researchService.research("latest AI news", "quick")).thenReturn(Mono.just("Quick answer"));

        client.post().uri("/v1/research")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"query\":\"--deep latest AI news\",\"mode\":\"quick\"}")
                .exchange()
                .expectStatus().isOk();

        verify(researchService).research("latest AI news", "quick");
    }

    @Test
    void testEmptyQueryReturnsUsage() {
        client.post().uri("/v1/research")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"query\":\"  --quick \"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody(String.class).isEqualTo(ResearchCommand.USAGE);

        verifyNoInteractions(researchService);
    }

    @Test
    void testPipelineErrorReturnsServiceUnavailable() {
        when(researchService.research(anyString(), anyString()))
                .thenReturn(Mono.error(new IllegalStateException("No enabled provider")));

        client.post().uri("/v1/research")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"query\":\"anything\"}")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody(String.class).isEqualTo(ResearchController.RESEARCH_FAILED_MESSAGE);
    }
}
