package com.openforge.memkeep.consolidation;

import java.util.List;

/**
 * What the Sifter returns for one snapshot:
 * {@code {"summary": "...", "patterns": ["...", "..."]}}.
 */
public record SiftResult(String summary, List<String> patterns) {

    public SiftResult {
        summary = summary == null || summary.isBlank() ? "Conversation consolidated." : summary.trim();
        patterns = patterns == null ? List.of() : patterns.stream()
                .filter(p -> p != null && !p.isBlank())
                .map(String::trim)
                .toList();
    }
}
