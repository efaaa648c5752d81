package com.openforge.memkeep.tool;

import java.util.List;

/**
 * @param text       final reply text
 * @param rounds     regeneration rounds performed, 0 to the configured maximum
 * @param executions every tool run across all rounds, in order
 */
public record ToolLoopResult(String text, int rounds, List<ToolExecution> executions) {

    public boolean usedTools() {
        return !executions.isEmpty();
    }
}
