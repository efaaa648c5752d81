package com.openforge.memkeep.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DuckDuckGoSearchClientTest {

    private final DuckDuckGoSearchClient client = new DuckDuckGoSearchClient(HttpClient.newHttpClient(),
            new ObjectMapper(), new SearchProperties("https://api.duckduckgo.com", 2, Duration.ofSeconds(5)));

    @Test
    void abstractComesFirstThenCappedRelatedTopics() {
        String body = """
                {"Heading": "Oslo", "Abstract": "Oslo is the capital of Norway.", "AbstractURL": "https://en.wikipedia.org/wiki/Oslo",
                 "RelatedTopics": [
                   {"Text": "Oslo Opera House", "FirstURL": "https://duckduckgo.com/Oslo_Opera_House"},
                   {"Name": "group without text"},
                   {"Text": "Vigeland Park", "FirstURL": "https://duckduckgo.com/Vigeland"},
                   {"Text": "Holmenkollen", "FirstURL": "https://duckduckgo.com/Holmenkollen"}
                 ]}
                """;

        List<WebSearchClient.SearchResult> results = client.parse("oslo", body);

        assertThat(results).extracting(WebSearchClient.SearchResult::title)
                .containsExactly("Oslo", "Oslo Opera House", "Vigeland Park");
        assertThat(results.get(0).url()).isEqualTo("https://en.wikipedia.org/wiki/Oslo");
    }

    @Test
    void emptyAnswerYieldsPlaceholder() {
        List<WebSearchClient.SearchResult> results = client.parse("zzqx", "{\"Abstract\": \"\", \"RelatedTopics\": []}");

        assertThat(results).singleElement().satisfies(r -> {
            assertThat(r.title()).isEqualTo("Search completed");
            assertThat(r.body()).contains("\"zzqx\"").contains("Answer from your own knowledge.");
        });
    }

    @Test
    void malformedBodyIsAGatewayError() {
        assertThatThrownBy(() -> client.parse("q", "<html>"))
                .isInstanceOf(GatewayException.class);
    }
}
