package com.openforge.memkeep.tool;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Bound from application.yml under "agent.tools".
 *
 * File tools (READ, WRITE, LIST_FILES) resolve paths against workspace-root
 * and refuse anything that escapes it.
 */
@ConfigurationProperties(prefix = "agent.tools")
public record ToolProperties(
        @DefaultValue("2")         int maxRounds,
        @DefaultValue("workspace") String workspaceRoot,
        @DefaultValue("3000")      int fetchMaxChars,
        @DefaultValue("4000")      int browseMaxChars,
        @DefaultValue("10000")     int readMaxChars,
        @DefaultValue("50")        int listMaxEntries,
        @DefaultValue("20")        int taskListLimit,
        @DefaultValue({"SEARCH", "REMEMBER", "TASK_ADD", "ANALYZE", "BROWSE", "EMAIL", "TELEGRAM"})
        List<String> heartbeatTools
) {

    public static ToolProperties defaults() {
        return new ToolProperties(2, "workspace", 3000, 4000, 10000, 50, 20,
                List.of("SEARCH", "REMEMBER", "TASK_ADD", "ANALYZE", "BROWSE", "EMAIL", "TELEGRAM"));
    }
}
