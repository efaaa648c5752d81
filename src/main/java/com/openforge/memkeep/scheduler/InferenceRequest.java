package com.openforge.memkeep.scheduler;

import com.openforge.memkeep.llm.ImageInput;
import com.openforge.memkeep.stream.ConversationTurn;

import java.util.List;

/**
 * Payload of one scheduled reasoning call.
 *
 * @param systemContext system prompt; may be empty
 * @param turns         dialogue turns sent after the system prompt
 * @param image         attached image, or {@code null} for text-only calls
 */
public record InferenceRequest(String systemContext, List<ConversationTurn> turns, ImageInput image) {

    public InferenceRequest {
        systemContext = systemContext == null ? "" : systemContext;
        turns = turns == null ? List.of() : List.copyOf(turns);
    }

    public static InferenceRequest of(String systemContext, List<ConversationTurn> turns) {
        return new InferenceRequest(systemContext, turns, null);
    }

    /** Single user prompt with no system context, the shape used by sub-task calls. */
    public static InferenceRequest prompt(String prompt) {
        return new InferenceRequest("", List.of(ConversationTurn.user(prompt)), null);
    }

    public boolean hasImage() {
        return image != null;
    }
}
