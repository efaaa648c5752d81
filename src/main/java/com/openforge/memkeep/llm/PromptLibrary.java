package com.openforge.memkeep.llm;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * The agent's identity, loaded once from classpath:prompts/.
 *
 *   core_memory.txt — who the agent is
 *   directives.txt  — how it behaves
 *
 * A missing file logs a warning and leaves that part empty.
 */
@Slf4j
@Component
public class PromptLibrary {

    private final String coreMemory;
    private final String directives;

    public PromptLibrary() {
        this(load("prompts/core_memory.txt"), load("prompts/directives.txt"));
    }

    public PromptLibrary(String coreMemory, String directives) {
        this.coreMemory = coreMemory;
        this.directives = directives;
    }

    /** Core identity followed by the directives block, the head of every system prompt. */
    public String identity() {
        return coreMemory + "\n\nDIRECTIVES:\n" + directives;
    }

    public String coreMemory() {
        return coreMemory;
    }

    public String directives() {
        return directives;
    }

    private static String load(String path) {
        Resource resource = new ClassPathResource(path);
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            log.warn("[Prompts] Could not load {}: {}", path, e.getMessage());
            return "";
        }
    }
}
