package com.openforge.memkeep.tool.builtin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memkeep.gateway.WebSearchClient;
import com.openforge.memkeep.tool.AgentTool;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SearchTool implements AgentTool {

    private final WebSearchClient searchClient;
    private final ObjectMapper    objectMapper;

    @Override
    public String name() {
        return "SEARCH";
    }

    @Override
    public String usage() {
        return "SEARCH: <query> — search the web";
    }

    @Override
    public String execute(String args) {
        if (args.isBlank()) {
            return "Usage: SEARCH: <query>";
        }
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(searchClient.search(args));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render search results", e);
        }
    }
}
