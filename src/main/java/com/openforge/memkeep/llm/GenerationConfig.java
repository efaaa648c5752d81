package com.openforge.memkeep.llm;

/**
 * Per-call generation settings handed to the {@link ReasoningService}.
 */
public record GenerationConfig(
        InferencePurpose purpose,
        double temperature,
        int maxOutputTokens
) {

    public static GenerationConfig forPurpose(InferencePurpose purpose, int maxOutputTokens) {
        return new GenerationConfig(purpose, purpose.temperature(), maxOutputTokens);
    }
}
