package com.maestro.core.models;

import com.maestro.core.config.PipelineDefinition;
import com.maestro.core.model.ModelTier;
import com.maestro.core.model.ResolvedModels;
import com.maestro.core.state.JsonSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ManifestAvailabilitySourceTest {

    private static final String MANIFEST = """
            {
              "version": 1,
              "lastUpdated": "2025-06-01",
              "tiers": {
                "opus":   {"id": "claude-opus-x", "available": false},
                "sonnet": {"id": "claude-sonnet-x", "available": true},
                "haiku":  {"id": "claude-haiku-x", "available": true}
              }
            }
            """;

    private final HttpClient httpClient = mock(HttpClient.class);

    private ManifestAvailabilitySource source(String url) {
        return new ManifestAvailabilitySource(url, Duration.ofMillis(200), httpClient, JsonSupport.newMapper());
    }

    @Nested
    @DisplayName("parse")
    class Parse {

        @Test
        @DisplayName("reads ids, availability and timestamp")
        void valid() {
            ResolvedModels models = source("http://x").parse(MANIFEST).orElseThrow();

            assertEquals(ResolvedModels.SOURCE_MANIFEST, models.source());
            assertEquals("2025-06-01", models.timestamp());
            assertFalse(models.isAvailable(ModelTier.REASONING));
            assertTrue(models.isAvailable(ModelTier.BALANCED));
            assertEquals("claude-haiku-x", models.modelId(ModelTier.FAST));
        }

        @Test
        @DisplayName("a missing tier rejects the manifest")
        void missingTier() {
            String body = """
                    {"tiers": {"opus": {"id": "a", "available": true}, "sonnet": {"id": "b", "available": true}}}
                    """;
            assertTrue(source("http://x").parse(body).isEmpty());
        }

        @Test
        @DisplayName("malformed JSON is rejected")
        void malformed() {
            assertTrue(source("http://x").parse("{not json").isEmpty());
        }
    }

    @Nested
    @DisplayName("fetch")
    class Fetch {

        @Test
        @DisplayName("no URL means no request")
        void noUrl() throws Exception {
            assertTrue(source("").fetch().isEmpty());
            verify(httpClient, never()).send(any(), any());
        }

        @Test
        @SuppressWarnings("unchecked")
        @DisplayName("HTTP 200 is parsed")
        void ok() throws Exception {
            HttpResponse<String> response = mock(HttpResponse.class);
            when(response.statusCode()).thenReturn(200);
            when(response.body()).thenReturn(MANIFEST);
            doReturn(response).when(httpClient).send(any(), any());

            Optional<ResolvedModels> models = source("http://models.example/manifest.json").fetch();

            assertTrue(models.isPresent());
        }

        @Test
        @SuppressWarnings("unchecked")
        @DisplayName("non-200 status yields empty")
        void badStatus() throws Exception {
            HttpResponse<String> response = mock(HttpResponse.class);
            when(response.statusCode()).thenReturn(503);
            doReturn(response).when(httpClient).send(any(), any());

            assertTrue(source("http://models.example/manifest.json").fetch().isEmpty());
        }

        @Test
        @DisplayName("a timeout falls back to the built-in registry through the resolver")
        void timeoutFallsBack() throws Exception {
            when(httpClient.send(any(), any())).thenThrow(new HttpTimeoutException("request timed out"));
            var manifest = source("http://models.example/manifest.json");

            assertTrue(manifest.fetch().isEmpty());

            var resolver = new ModelTierResolver(
                    PipelineDefinition.of("compact", Map.of()),
                    List.of(manifest, new BuiltinAvailabilitySource()));
            assertEquals(ResolvedModels.SOURCE_BUILTIN, resolver.assignment().basis().source());
        }
    }
}
