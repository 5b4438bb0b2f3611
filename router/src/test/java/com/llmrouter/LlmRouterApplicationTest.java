package com.llmrouter;

import com.llmrouter.cache.InMemoryRequestCache;
import com.llmrouter.cache.RequestCache;
import com.llmrouter.health.HealthMonitor;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

@SpringBootTest
@AutoConfigureWebTestClient
class LlmRouterApplicationTest {

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private RequestCache requestCache;

    @Autowired
    private HealthMonitor healthMonitor;

    @Test
    void startsWithMemoryCacheAndIdleMonitor() {
        assertInstanceOf(InMemoryRequestCache.class, requestCache);
        assertFalse(healthMonitor.status().pollingEnabled());

        webTestClient.get().uri("/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("healthy")
                .jsonPath("$.active_providers").isEqualTo(0);
    }

    @Test
    void exposesOnlyEnabledNotificationServers() {
        webTestClient.get().uri("/admin/notifications/servers")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].name").isEqualTo("ops");
    }

    @Test
    void analyzeWithoutProvidersIsServiceUnavailable() {
        webTestClient.post().uri("/v1/analyze")
                .header("Content-Type", "application/json")
                .bodyValue("{\"content\": \"hello\", \"prompt_template\": \"Analyze {content}\"}")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.error.code").isEqualTo("no_eligible_provider");
    }
}
