package com.openforge.memkeep.tool.builtin;

import com.openforge.memkeep.memory.MemoryStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class RememberToolTest {

    @Mock MemoryStore memoryStore;
    @InjectMocks RememberTool tool;

    @Test
    void keyValueBecomesDomainFact() {
        assertThat(tool.execute(" favorite_color = green ")).isEqualTo("Saved to domain memory: favorite_color = green");
        verify(memoryStore).saveDomain("favorite_color", "green");
    }

    @Test
    void freeTextBecomesExperience() {
        assertThat(tool.execute("User prefers morning meetings"))
                .isEqualTo("Noted and saved to experience memory: \"User prefers morning meetings\"");
        verify(memoryStore).saveExperience("User prefers morning meetings");
    }

    @Test
    void emptyArgumentsShowUsage() {
        assertThat(tool.execute("  ")).startsWith("Usage:");
        verifyNoInteractions(memoryStore);
    }
}
