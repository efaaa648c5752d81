package com.openforge.memkeep.tool.builtin;

import com.openforge.memkeep.tool.AgentTool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Slf4j
@Component
@RequiredArgsConstructor
public class WriteFileTool implements AgentTool {

    private final WorkspacePaths paths;

    @Override
    public String name() {
        return "WRITE";
    }

    @Override
    public String usage() {
        return "WRITE: <path> | <content> — write a workspace file";
    }

    @Override
    public String execute(String args) {
        int pipe = args.indexOf('|');
        if (pipe < 0) {
            return "Usage: WRITE: <path> | <content>";
        }
        Path file = paths.resolve(args.substring(0, pipe));
        String content = args.substring(pipe + 1).trim();
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, content);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write file: " + e.getMessage(), e);
        }
        log.info("[Tool:WRITE] {} ({} chars)", file, content.length());
        return "Successfully wrote to " + paths.root().relativize(file);
    }
}
