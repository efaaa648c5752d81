package com.openforge.memkeep.tool.builtin;

import com.openforge.memkeep.tool.ToolProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Resolves model-supplied paths inside the tool workspace.
 */
@Component
public class WorkspacePaths {

    private final Path root;

    public WorkspacePaths(ToolProperties properties) {
        this.root = Path.of(properties.workspaceRoot()).toAbsolutePath().normalize();
    }

    /**
     * @throws IllegalArgumentException when the path leaves the workspace
     */
    public Path resolve(String raw) {
        String cleaned = raw.trim();
        if (cleaned.length() >= 2 && cleaned.startsWith("\"") && cleaned.endsWith("\"")) {
            cleaned = cleaned.substring(1, cleaned.length() - 1);
        }
        Path resolved = root.resolve(cleaned).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path is outside the workspace: " + raw.trim());
        }
        return resolved;
    }

    public Path root() {
        return root;
    }
}
