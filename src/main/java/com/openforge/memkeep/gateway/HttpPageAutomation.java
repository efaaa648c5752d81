package com.openforge.memkeep.gateway;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Browser-less {@link PageAutomation}: plain HTTP GET plus regex text extraction.
 * Interactive actions need a real browser driver and are refused.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpPageAutomation implements PageAutomation {

    private static final Duration TIMEOUT = Duration.ofSeconds(15);
    private static final String USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0 Safari/537.36";

    private final HttpClient httpClient;

    @Override
    public Page navigate(String url) {
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            throw new GatewayException("Invalid URL: " + url, e);
        }
        if (uri.getScheme() == null || !uri.getScheme().startsWith("http")) {
            throw new GatewayException("Only http(s) URLs are supported: " + url);
        }

        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(TIMEOUT)
                .header("User-Agent", USER_AGENT)
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            log.debug("[Browse] {} ← HTTP {}", uri, response.statusCode());
            return new Page(uri.toString(), response.statusCode(), HtmlText.title(response.body()), response.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException("Fetch interrupted: " + url, e);
        } catch (IOException e) {
            throw new GatewayException("Fetch failed for " + url + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String extractText(String url) {
        return HtmlText.toPlainText(HtmlText.mainContent(navigate(url).html()));
    }

    @Override
    public String click(String url, String selector) {
        throw unsupported("click");
    }

    @Override
    public String type(String url, String selector, String text) {
        throw unsupported("type");
    }

    @Override
    public String screenshot(String url) {
        throw unsupported("screenshot");
    }

    private static UnsupportedOperationException unsupported(String action) {
        return new UnsupportedOperationException(
                "'" + action + "' requires a browser driver; only page extraction is available.");
    }
}
