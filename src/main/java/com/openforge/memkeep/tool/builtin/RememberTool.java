package com.openforge.memkeep.tool.builtin;

import com.openforge.memkeep.memory.MemoryStore;
import com.openforge.memkeep.tool.AgentTool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@code key = value} becomes a domain fact; anything else an experience.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RememberTool implements AgentTool {

    private final MemoryStore memoryStore;

    @Override
    public String name() {
        return "REMEMBER";
    }

    @Override
    public String usage() {
        return "REMEMBER: <key> = <value> — save a fact (or free text) to memory";
    }

    @Override
    public String execute(String args) {
        String text = args.trim();
        if (text.isEmpty()) {
            return "Usage: REMEMBER: <key> = <value>";
        }
        int eq = text.indexOf('=');
        if (eq < 0) {
            memoryStore.saveExperience(text);
            return "Noted and saved to experience memory: \"" + text + "\"";
        }
        String key   = text.substring(0, eq).trim();
        String value = text.substring(eq + 1).trim();
        memoryStore.saveDomain(key, value);
        log.info("[Tool:REMEMBER] {} = {}", key, value.length() > 40 ? value.substring(0, 40) : value);
        return "Saved to domain memory: " + key + " = " + value;
    }
}
