package com.openforge.memkeep.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/**
 * A single entry in the LLM conversation history.
 *
 * role variants:
 *   "system"    — persona, directives, consolidation summaries, tool results
 *   "user"      — human turn
 *   "assistant" — model reply
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
        String role,
        String content
) {

    // ── Static factory helpers ──────────────────────────────────────────────

    public static Message system(String content) {
        return new Message("system", content);
    }

    public static Message user(String content) {
        return new Message("user", content);
    }

    public static Message assistant(String content) {
        return new Message("assistant", content);
    }
}
