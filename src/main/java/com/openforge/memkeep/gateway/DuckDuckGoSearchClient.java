package com.openforge.memkeep.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * DuckDuckGo instant-answer API.  Returns the abstract plus the first few
 * related topics; a query with no instant answer yields a single placeholder
 * result telling the model to fall back on its own knowledge.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DuckDuckGoSearchClient implements WebSearchClient {

    private final HttpClient       httpClient;
    private final ObjectMapper     objectMapper;
    private final SearchProperties properties;

    @Override
    public List<SearchResult> search(String query) {
        String url = properties.baseUrl() + "/?q=" + URLEncoder.encode(query, StandardCharsets.UTF_8)
                + "&format=json&no_html=1&skip_disambig=1";
        log.info("[Search] DuckDuckGo: {}", query);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(properties.timeout())
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException("Search interrupted", e);
        } catch (IOException e) {
            throw new GatewayException("Search failed: " + e.getMessage(), e);
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new GatewayException("Search failed: HTTP " + response.statusCode());
        }
        return parse(query, response.body());
    }

    List<SearchResult> parse(String query, String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new GatewayException("Search returned malformed JSON", e);
        }

        List<SearchResult> results = new ArrayList<>();
        String abstractText = root.path("Abstract").asText("");
        if (!abstractText.isBlank()) {
            results.add(new SearchResult(root.path("Heading").asText(""), abstractText,
                    root.path("AbstractURL").asText("")));
        }
        int taken = 0;
        for (JsonNode topic : root.path("RelatedTopics")) {
            if (taken >= properties.maxRelatedTopics()) break;
            String text = topic.path("Text").asText("");
            if (text.isBlank()) continue;
            results.add(new SearchResult(text.length() > 60 ? text.substring(0, 60) : text, text,
                    topic.path("FirstURL").asText("")));
            taken++;
        }
        if (results.isEmpty()) {
            results.add(new SearchResult("Search completed",
                    "Search for \"%s\" returned limited results from DuckDuckGo instant answers. "
                            .formatted(query) + "Answer from your own knowledge.", ""));
        }
        return results;
    }
}
