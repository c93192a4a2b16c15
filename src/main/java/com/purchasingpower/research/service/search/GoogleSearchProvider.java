package com.purchasingpower.research.service.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.purchasingpower.research.configuration.SearchProperties;
import com.purchasingpower.research.model.CallContext;
import com.purchasingpower.research.model.ServiceType;
import com.purchasingpower.research.model.research.SearchResult;
import com.purchasingpower.research.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Google Custom Search JSON API.
 *
 * <p>Needs {@code app.search.google-api-key} and {@code app.search.google-cse-id}. The API returns
 * at most 10 results per request. Errors are logged and reported as "no results".
 */
@Slf4j
public class GoogleSearchProvider implements SearchProvider {

    static final int MAX_RESULTS_PER_REQUEST = 10;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String cseId;
    private final Duration timeout;

    public GoogleSearchProvider(SearchProperties props, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        Preconditions.checkArgument(props.hasGoogleCredentials(),
                "Google search needs app.search.google-api-key and app.search.google-cse-id");
        this.webClient = webClientBuilder
                .baseUrl(props.getGoogleBaseUrl())
                .build();
        this.objectMapper = objectMapper;
        this.apiKey = props.getGoogleApiKey();
        this.cseId = props.getGoogleCseId();
        this.timeout = props.getTimeout();
    }

    @Override
    public List<SearchResult> search(String query, int maxResults) {
        Preconditions.checkArgument(query != null && !query.isBlank(), "Query cannot be empty");
        Preconditions.checkArgument(maxResults > 0, "maxResults must be positive");

        int num = Math.min(maxResults, MAX_RESULTS_PER_REQUEST);
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.GOOGLE, "customsearch", log);
        callCtx.logRequest(query, "Num", num);

        try {
            String body = webClient.get()
                    .uri(uriBuilder -> uriBuilder.path("/customsearch/v1")
                            .queryParam("key", apiKey)
                            .queryParam("cx", cseId)
                            .queryParam("q", query)
                            .queryParam("num", num)
                            .build())
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();

            List<SearchResult> results = parseResponse(body, num);
            callCtx.logResponse("Found " + results.size() + " results");
            return results;

        } catch (WebClientResponseException e) {
            callCtx.logError("Google search failed with " + e.getStatusCode() + " for '" + query + "'", e);
            return List.of();
        } catch (Exception e) {
            // Graceful degradation - selector may still have another provider
            callCtx.logError("Google search failed for '" + query + "': " + e.getMessage(), e);
            return List.of();
        }
    }

    private List<SearchResult> parseResponse(String body, int limit) throws Exception {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        JsonNode items = objectMapper.readTree(body).path("items");
        List<SearchResult> results = new ArrayList<>();
        for (JsonNode item : items) {
            if (results.size() >= limit) {
                break;
            }
            String link = item.path("link").asText("");
            if (link.isBlank()) {
                continue;
            }
            results.add(SearchResult.builder()
                    .url(link)
                    .title(item.path("title").asText(""))
                    .snippet(item.path("snippet").asText(""))
                    .build());
        }
        return results;
    }

    @Override
    public String getName() {
        return "google";
    }
}
