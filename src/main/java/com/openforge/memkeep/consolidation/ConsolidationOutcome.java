package com.openforge.memkeep.consolidation;

import com.openforge.memkeep.graph.PruneReport;

/**
 * Result of one sleep cycle.
 *
 * @param status         which path the cycle took
 * @param turnsBefore    stream size when the cycle started
 * @param turnsAfter     stream size when it finished
 * @param patternsStored sifter patterns written as experiences
 * @param prune          decay report, or {@code null} when no decay ran
 */
public record ConsolidationOutcome(Status status,
                                   int turnsBefore,
                                   int turnsAfter,
                                   int patternsStored,
                                   PruneReport prune) {

    public enum Status {
        /** Nothing in the stream. */
        EMPTY_STREAM,
        /** Sifted, persisted, decayed and flushed to summary + overlap. */
        CONSOLIDATED,
        /** Sift failed; the raw snapshot was stored and the stream truncated. */
        FALLBACK_PRESERVED,
        /** Sift failed and the snapshot could not be stored; the stream is untouched. */
        STORAGE_UNAVAILABLE
    }
}
