package com.openforge.memkeep.tool;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A fixed set of tools addressable by name.
 *
 * Execution never throws: an unregistered name yields "Unknown tool: NAME" and
 * a failing tool yields "[TOOL ERROR] NAME: message".
 */
@Slf4j
public class ToolRegistry {

    private final Map<String, AgentTool> tools = new LinkedHashMap<>();
    private final DirectiveParser parser;

    public ToolRegistry(Collection<? extends AgentTool> tools) {
        for (AgentTool tool : tools) {
            this.tools.put(tool.name().toUpperCase(Locale.ROOT), tool);
        }
        this.parser = new DirectiveParser(this.tools.keySet());
    }

    public List<String> names() {
        return List.copyOf(tools.keySet());
    }

    public DirectiveParser parser() {
        return parser;
    }

    /** Usage lines for the system prompt, one per tool. */
    public String describe() {
        return tools.values().stream().map(t -> "  " + t.usage()).collect(Collectors.joining("\n"));
    }

    public String execute(ToolDirective directive) {
        String name = directive.tool().toUpperCase(Locale.ROOT);
        AgentTool tool = tools.get(name);
        if (tool == null) {
            return "Unknown tool: " + directive.tool();
        }
        log.info("[Tool:{}] Executing{}", name,
                directive.args().isEmpty() ? "" : " → " + abbreviate(directive.args(), 60));
        try {
            String result = tool.execute(directive.args());
            return result == null ? "" : result;
        } catch (RuntimeException e) {
            log.warn("[Tool:{}] Failed: {}", name, e.getMessage());
            return "[TOOL ERROR] " + name + ": " + e.getMessage();
        }
    }

    private static String abbreviate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max) + "…";
    }
}
