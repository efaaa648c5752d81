package com.openforge.memkeep.heartbeat;

public enum HeartbeatOutcome {
    DISABLED,
    SKIPPED_BUSY,
    SKIPPED_ACTIVE,
    /** The cycle ended with a thought that was stored. */
    INSIGHT_STORED,
    /** The cycle ended empty or still asking for tools. */
    NO_INSIGHT,
    FAILED
}
