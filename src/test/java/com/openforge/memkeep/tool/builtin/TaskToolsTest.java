package com.openforge.memkeep.tool.builtin;

import com.openforge.memkeep.domain.AgentTask;
import com.openforge.memkeep.memory.MemoryStore;
import com.openforge.memkeep.tool.ToolProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TaskToolsTest {

    @Mock MemoryStore memoryStore;

    private static AgentTask task(long id, String description, AgentTask.TaskStatus status) {
        AgentTask task = AgentTask.builder().description(description).status(status).build();
        task.setId(id);
        task.setCreateTime(LocalDateTime.of(2025, 3, 1, 9, 0));
        return task;
    }

    @Test
    void addReportsNewId() {
        when(memoryStore.createTask("call the vet")).thenReturn(task(7, "call the vet", AgentTask.TaskStatus.PENDING));

        assertThat(new TaskAddTool(memoryStore).execute("call the vet")).isEqualTo("Task #7 created: \"call the vet\"");
    }

    @Test
    void listShowsStatusPerTask() {
        when(memoryStore.listTasks(20)).thenReturn(List.of(
                task(2, "book flights", AgentTask.TaskStatus.DONE),
                task(1, "call the vet", AgentTask.TaskStatus.PENDING)));

        String listing = new TaskListTool(memoryStore, ToolProperties.defaults()).execute("");

        assertThat(listing).startsWith("Current tasks:")
                .contains("#2 [DONE] book flights")
                .contains("#1 [PENDING] call the vet");
    }

    @Test
    void emptyListSaysSo() {
        when(memoryStore.listTasks(20)).thenReturn(List.of());

        assertThat(new TaskListTool(memoryStore, ToolProperties.defaults()).execute("")).startsWith("No tasks found");
    }

    @Test
    void doneHandlesHashPrefixUnknownAndGarbageIds() {
        TaskDoneTool tool = new TaskDoneTool(memoryStore);
        when(memoryStore.completeTask(3)).thenReturn(Optional.of(task(3, "x", AgentTask.TaskStatus.DONE)));
        when(memoryStore.completeTask(4)).thenReturn(Optional.empty());

        assertThat(tool.execute("#3")).isEqualTo("Task #3 marked as done.");
        assertThat(tool.execute("4")).isEqualTo("Task #4 not found.");
        assertThat(tool.execute("soon")).isEqualTo("Invalid task ID.");
    }
}
