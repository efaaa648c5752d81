package com.openforge.memkeep.tool;

import com.openforge.memkeep.support.StubTool;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ToolRegistryTest {

    private final ToolRegistry registry = new ToolRegistry(List.of(
            new StubTool("echo", args -> "echo: " + args),
            new StubTool("FAIL", args -> {
                throw new IllegalArgumentException("bad input");
            })));

    @Test
    void namesAreUpperCased() {
        assertThat(registry.names()).containsExactly("ECHO", "FAIL");
        assertThat(registry.describe()).contains("ECHO: <args>").contains("FAIL: <args>");
    }

    @Test
    void executesRegisteredTool() {
        assertThat(registry.execute(new ToolDirective("ECHO", "hi", ToolDirective.Shape.WITH_ARGS)))
                .isEqualTo("echo: hi");
    }

    @Test
    void unknownToolIsReportedNotThrown() {
        assertThat(registry.execute(new ToolDirective("NOPE", "", ToolDirective.Shape.BARE)))
                .isEqualTo("Unknown tool: NOPE");
    }

    @Test
    void failingToolBecomesErrorResult() {
        assertThat(registry.execute(new ToolDirective("FAIL", "x", ToolDirective.Shape.WITH_ARGS)))
                .isEqualTo("[TOOL ERROR] FAIL: bad input");
    }
}
