package com.openforge.memkeep.tool.builtin;

import com.openforge.memkeep.gateway.PageAutomation;
import com.openforge.memkeep.tool.ToolProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BrowseToolTest {

    @Mock PageAutomation pages;

    private BrowseTool tool() {
        return new BrowseTool(pages, ToolProperties.defaults());
    }

    @Test
    void defaultActionExtractsMainContent() {
        when(pages.navigate("https://example.org")).thenReturn(new PageAutomation.Page(
                "https://example.org", 200, "Example",
                "<html><body><nav>menu</nav><article><h1>Hello</h1><script>x()</script><p>World</p></article></body></html>"));

        assertThat(tool().execute("https://example.org"))
                .isEqualTo("Page loaded: \"Example\" (https://example.org)\nHello World");
    }

    @Test
    void interactiveActionsAreDelegated() {
        when(pages.click("https://example.org", "#go")).thenReturn("clicked");
        when(pages.type("https://example.org", "input[name=q]", "cats")).thenReturn("typed");

        assertThat(tool().execute("https://example.org click #go")).isEqualTo("clicked");
        assertThat(tool().execute("https://example.org type input[name=q] | cats")).isEqualTo("typed");
        verify(pages).click("https://example.org", "#go");
    }

    @Test
    void typeWithoutTextShowsUsage() {
        assertThat(tool().execute("https://example.org type #q")).startsWith("Usage:");
    }
}
