package com.llmrouter.controller;

import com.llmrouter.config.GlobalExceptionHandler;
import com.llmrouter.config.LlmRouterProperties;
import com.llmrouter.provider.LlmClient;
import com.llmrouter.registry.InMemoryProviderRegistry;
import com.llmrouter.registry.Provider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Clock;

import static com.llmrouter.support.TestProviders.definition;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class ProviderControllerTest {

    private final LlmClient client = mock(LlmClient.class);
    private InMemoryProviderRegistry registry;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        registry = new InMemoryProviderRegistry(new LlmRouterProperties(), Clock.systemUTC());
        webTestClient = WebTestClient.bindToController(new ProviderController(registry, client))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void createsProviderWithoutEchoingKey() {
        webTestClient.post().uri("/admin/providers")
                .header("Content-Type", "application/json")
                .bodyValue("{\"name\": \"deepseek\", \"api_base\": \"https://api.deepseek.com/v1\", "
                        + "\"api_key\": \"sk-secret\", \"model\": \"deepseek-chat\", \"supports_image\": true}")
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.name").isEqualTo("deepseek")
                .jsonPath("$.priority").isEqualTo(10)
                .jsonPath("$.is_active").isEqualTo(true)
                .jsonPath("$.supports_text").isEqualTo(true)
                .jsonPath("$.supports_image").isEqualTo(true)
                .jsonPath("$.api_key_configured").isEqualTo(true)
                .jsonPath("$.health_status").isEqualTo("unknown")
                .jsonPath("$.api_key").doesNotExist();

        assertEquals("sk-secret", registry.list(false).get(0).getApiKey());
    }

    @Test
    void duplicateNameIsBadRequest() {
        registry.create(definition("primary", 1));

        webTestClient.post().uri("/admin/providers")
                .header("Content-Type", "application/json")
                .bodyValue("{\"name\": \"primary\", \"api_base\": \"https://x\", \"model\": \"m\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.code").isEqualTo("invalid_argument");
    }

    @Test
    void updateWithBlankKeyKeepsStoredKey() {
        Provider existing = registry.create(definition("primary", 1));

        webTestClient.put().uri("/admin/providers/{id}", existing.getId())
                .header("Content-Type", "application/json")
                .bodyValue("{\"name\": \"primary\", \"api_base\": \"https://new.example.com/v1\", "
                        + "\"api_key\": \"\", \"model\": \"gpt-4o\", \"priority\": 3}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.model").isEqualTo("gpt-4o")
                .jsonPath("$.priority").isEqualTo(3);

        Provider updated = registry.get(existing.getId()).orElseThrow();
        assertEquals("sk-primary", updated.getApiKey());
        assertEquals("https://new.example.com/v1", updated.getApiBase());
        assertTrue(updated.isActive());
    }

    @Test
    void togglesActiveFlag() {
        Provider existing = registry.create(definition("primary", 1));

        webTestClient.put().uri("/admin/providers/{id}/active?enabled=false", existing.getId())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.is_active").isEqualTo(false);

        assertFalse(registry.get(existing.getId()).orElseThrow().isActive());
    }

    @Test
    void unknownProviderIsNotFound() {
        webTestClient.get().uri("/admin/providers/99")
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.NOT_FOUND)
                .expectBody()
                .jsonPath("$.error.code").isEqualTo("provider_not_found");

        webTestClient.delete().uri("/admin/providers/99")
                .exchange()
                .expectStatus().isNotFound();
        verify(client, never()).release(anyLong());
    }

    @Test
    void listsAndDeletesProviders() {
        Provider first = registry.create(definition("first", 1));
        registry.create(definition("second", 2));

        webTestClient.get().uri("/admin/providers")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[0].stats.usage_count").isEqualTo(0);

        webTestClient.delete().uri("/admin/providers/{id}", first.getId())
                .exchange()
                .expectStatus().isOk();

        assertEquals(1, registry.list(false).size());
        verify(client).release(first.getId());
    }
}
