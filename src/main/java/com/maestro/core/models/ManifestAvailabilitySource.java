package com.maestro.core.models;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.maestro.core.model.ModelTier;
import com.maestro.core.model.ResolvedModels;
import com.maestro.core.model.TierInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Availability from a remote JSON manifest:
 * <pre>{@code
 * { "version": 1, "lastUpdated": "2025-06-01",
 *   "tiers": { "opus": {"id": "...", "available": true}, "sonnet": {...}, "haiku": {...} } }
 * }</pre>
 * The request is bounded by a hard timeout. Any transport, status or structure problem yields empty.
 */
public class ManifestAvailabilitySource implements ModelAvailabilitySource {

    private static final Logger log = LoggerFactory.getLogger(ManifestAvailabilitySource.class);

    private final String manifestUrl;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public ManifestAvailabilitySource(String manifestUrl, Duration timeout, ObjectMapper objectMapper) {
        this(manifestUrl, timeout, HttpClient.newBuilder().connectTimeout(timeout).build(), objectMapper);
    }

    ManifestAvailabilitySource(String manifestUrl, Duration timeout, HttpClient httpClient, ObjectMapper objectMapper) {
        this.manifestUrl = manifestUrl;
        this.timeout = timeout;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return ResolvedModels.SOURCE_MANIFEST;
    }

    @Override
    public Optional<ResolvedModels> fetch() {
        if (manifestUrl == null || manifestUrl.isBlank()) {
            return Optional.empty();
        }
        try {
            var request = HttpRequest.newBuilder(URI.create(manifestUrl))
                    .timeout(timeout)
                    .GET()
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.info("Model manifest returned HTTP {}; using built-in registry", response.statusCode());
                return Optional.empty();
            }
            return parse(response.body());
        } catch (IOException e) {
            log.info("Model manifest unreachable ({}); using built-in registry", e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    /**
     * Parses a manifest body. Every tier must be present with an id.
     */
    Optional<ResolvedModels> parse(String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode tiersNode = root.path("tiers");
            Map<ModelTier, TierInfo> tiers = new EnumMap<>(ModelTier.class);
            for (ModelTier tier : ModelTier.values()) {
                JsonNode node = tiersNode.path(tier.tierKey());
                if (!node.hasNonNull("id")) {
                    log.info("Model manifest is missing tier '{}'; using built-in registry", tier.tierKey());
                    return Optional.empty();
                }
                tiers.put(tier, new TierInfo(node.get("id").asText(), node.path("available").asBoolean(false)));
            }
            String timestamp = root.path("lastUpdated").asText("");
            return Optional.of(new ResolvedModels(ResolvedModels.SOURCE_MANIFEST, tiers, timestamp));
        } catch (IOException e) {
            log.info("Model manifest is not valid JSON; using built-in registry");
            return Optional.empty();
        }
    }
}
