package com.openforge.memkeep.tool.builtin;

import com.openforge.memkeep.gateway.HtmlText;
import com.openforge.memkeep.gateway.PageAutomation;
import com.openforge.memkeep.tool.AgentTool;
import com.openforge.memkeep.tool.ToolProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * {@code BROWSE: <url> [extract | click <selector> | type <selector> | <text> | screenshot]}.
 * Without an action the page text is extracted.
 */
@Component
@RequiredArgsConstructor
public class BrowseTool implements AgentTool {

    private final PageAutomation pages;
    private final ToolProperties properties;

    @Override
    public String name() {
        return "BROWSE";
    }

    @Override
    public String usage() {
        return "BROWSE: <url> [click <selector> | type <selector> | <text> | screenshot] — browse a web page";
    }

    @Override
    public String execute(String args) {
        String trimmed = args.trim();
        if (trimmed.isEmpty()) {
            return "Usage: BROWSE: <url> [action]";
        }
        String url = trimmed;
        String action = "extract";
        int space = trimmed.indexOf(' ');
        if (space > 0) {
            url = trimmed.substring(0, space);
            action = trimmed.substring(space + 1).trim();
        }
        String verb = action.toLowerCase(Locale.ROOT);

        if (verb.startsWith("click")) {
            return pages.click(url, action.substring("click".length()).trim());
        }
        if (verb.startsWith("type")) {
            String[] parts = action.substring("type".length()).split("\\|", 2);
            if (parts.length < 2) {
                return "Usage: BROWSE: <url> type <selector> | <text>";
            }
            return pages.type(url, parts[0].trim(), parts[1].trim());
        }
        if (verb.startsWith("screenshot")) {
            return pages.screenshot(url);
        }

        PageAutomation.Page page = pages.navigate(url);
        String text = HtmlText.toPlainText(HtmlText.mainContent(page.html()));
        return "Page loaded: \"%s\" (%s)\n%s".formatted(page.title(), page.url(),
                HtmlText.truncate(text, properties.browseMaxChars()));
    }
}
