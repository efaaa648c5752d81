package com.openforge.memkeep.tool.builtin;

import com.openforge.memkeep.gateway.HtmlText;
import com.openforge.memkeep.gateway.PageAutomation;
import com.openforge.memkeep.tool.AgentTool;
import com.openforge.memkeep.tool.ToolProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class FetchTool implements AgentTool {

    private final PageAutomation pages;
    private final ToolProperties properties;

    @Override
    public String name() {
        return "FETCH";
    }

    @Override
    public String usage() {
        return "FETCH: <url> — fetch a page as plain text";
    }

    @Override
    public String execute(String args) {
        String url = args.trim();
        if (url.isEmpty()) {
            return "Usage: FETCH: <url>";
        }
        String text = HtmlText.toPlainText(pages.navigate(url).html());
        return "Fetched content from %s (first %d chars):\n%s"
                .formatted(url, properties.fetchMaxChars(), HtmlText.truncate(text, properties.fetchMaxChars()));
    }
}
