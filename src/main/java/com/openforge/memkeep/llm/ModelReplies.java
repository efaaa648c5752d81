package com.openforge.memkeep.llm;

import java.util.Optional;

/**
 * Helpers for pulling structured data out of free-form model output.
 */
public final class ModelReplies {

    private ModelReplies() {}

    /**
     * The text between the first '{' and the last '}' inclusive.  Tolerates
     * markdown fences and prose around the object.
     */
    public static Optional<String> extractJsonObject(String reply) {
        if (reply == null) {
            return Optional.empty();
        }
        int start = reply.indexOf('{');
        int end   = reply.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        return Optional.of(reply.substring(start, end + 1));
    }
}
