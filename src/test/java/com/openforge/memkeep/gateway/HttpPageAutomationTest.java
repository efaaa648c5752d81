package com.openforge.memkeep.gateway;

import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpPageAutomationTest {

    private final HttpPageAutomation pages = new HttpPageAutomation(HttpClient.newHttpClient());

    @Test
    void interactiveActionsNeedABrowserDriver() {
        assertThatThrownBy(() -> pages.click("https://example.org", "#go"))
                .isInstanceOf(UnsupportedOperationException.class)
                .hasMessageContaining("'click' requires a browser driver");
        assertThatThrownBy(() -> pages.type("https://example.org", "#q", "cats"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> pages.screenshot("https://example.org"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void nonHttpUrlsAreRejectedBeforeAnyRequest() {
        assertThatThrownBy(() -> pages.navigate("file:///etc/passwd"))
                .isInstanceOf(GatewayException.class)
                .hasMessageContaining("Only http(s) URLs");
    }
}
