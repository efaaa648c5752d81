package com.openforge.memkeep.tool.builtin;

import com.openforge.memkeep.tool.AgentTool;
import com.openforge.memkeep.tool.ToolProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
@RequiredArgsConstructor
public class ReadFileTool implements AgentTool {

    private final WorkspacePaths paths;
    private final ToolProperties properties;

    @Override
    public String name() {
        return "READ";
    }

    @Override
    public String usage() {
        return "READ: <path> — read a workspace file";
    }

    @Override
    public String execute(String args) {
        if (args.isBlank()) {
            return "Usage: READ: <path>";
        }
        Path file = paths.resolve(args);
        try {
            String content = Files.readString(file);
            int max = properties.readMaxChars();
            return "Content of %s:\n%s%s".formatted(args.trim(),
                    content.length() > max ? content.substring(0, max) : content,
                    content.length() > max ? "\n...[truncated]" : "");
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read file " + args.trim() + ": " + e.getMessage(), e);
        }
    }
}
