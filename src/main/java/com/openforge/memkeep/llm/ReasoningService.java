package com.openforge.memkeep.llm;

import com.openforge.memkeep.stream.ConversationTurn;

import java.util.List;

/**
 * The external reasoning service as the core sees it.
 *
 * Implementations may throw any runtime exception on transport or provider
 * failure; the scheduler is the only caller and turns failures into degraded
 * results.  Token usage, when the provider reports it, is logged by the
 * implementation and never returned.
 */
public interface ReasoningService {

    /**
     * @param systemContext persona, directives and recall context
     * @param turns         dialogue, oldest first
     * @param config        model selection and sampling settings
     * @return the model's text reply, possibly empty
     */
    String generate(String systemContext, List<ConversationTurn> turns, GenerationConfig config);

    /** Same as {@link #generate} with an image attached to the last user turn. */
    String generateWithImage(String systemContext,
                             List<ConversationTurn> turns,
                             ImageInput image,
                             GenerationConfig config);
}
