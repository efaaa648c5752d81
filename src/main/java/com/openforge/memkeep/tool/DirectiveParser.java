package com.openforge.memkeep.tool;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Finds tool directives in free-form model output.
 *
 * A directive is a line that, once trimmed, is {@code NAME:<args>} or exactly
 * {@code NAME}, for a registered NAME, compared case-insensitively.  Every
 * matching line is reported, in order; at most one directive per line.
 */
public class DirectiveParser {

    private final List<String> names;

    public DirectiveParser(Collection<String> toolNames) {
        this.names = toolNames.stream()
                .map(n -> n.toUpperCase(Locale.ROOT))
                .distinct()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .toList();
    }

    public List<ToolDirective> parse(String reply) {
        if (reply == null || reply.isBlank()) {
            return List.of();
        }
        List<ToolDirective> directives = new ArrayList<>();
        for (String line : reply.split("\\R")) {
            String trimmed = line.trim();
            String upper   = trimmed.toUpperCase(Locale.ROOT);
            for (String name : names) {
                if (upper.startsWith(name + ":")) {
                    directives.add(new ToolDirective(name,
                            trimmed.substring(name.length() + 1).trim(), ToolDirective.Shape.WITH_ARGS));
                    break;
                }
                if (upper.equals(name)) {
                    directives.add(new ToolDirective(name, "", ToolDirective.Shape.BARE));
                    break;
                }
            }
        }
        return directives;
    }
}
