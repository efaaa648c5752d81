package com.openforge.memkeep.tool.builtin;

import com.openforge.memkeep.tool.AgentTool;
import com.openforge.memkeep.tool.ToolProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

@Component
@RequiredArgsConstructor
public class ListFilesTool implements AgentTool {

    private final WorkspacePaths paths;
    private final ToolProperties properties;

    @Override
    public String name() {
        return "LIST_FILES";
    }

    @Override
    public String usage() {
        return "LIST_FILES: <dir> — list a workspace directory";
    }

    @Override
    public String execute(String args) {
        String dirArg = args.isBlank() ? "." : args;
        Path dir = paths.resolve(dirArg);
        List<String> names;
        try (Stream<Path> entries = Files.list(dir)) {
            names = entries.map(p -> p.getFileName().toString()).sorted().toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list files in " + dirArg.trim() + ": " + e.getMessage(), e);
        }
        int max = properties.listMaxEntries();
        return "Files in %s:\n%s%s".formatted(dirArg.trim(),
                String.join("\n", names.subList(0, Math.min(max, names.size()))),
                names.size() > max ? "\n...and more" : "");
    }
}
