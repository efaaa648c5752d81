package com.openforge.memkeep.tool.builtin;

import com.openforge.memkeep.domain.AgentTask;
import com.openforge.memkeep.memory.MemoryStore;
import com.openforge.memkeep.tool.AgentTool;
import com.openforge.memkeep.tool.ToolProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class TaskListTool implements AgentTool {

    private final MemoryStore    memoryStore;
    private final ToolProperties properties;

    @Override
    public String name() {
        return "TASK_LIST";
    }

    @Override
    public String usage() {
        return "TASK_LIST — list recent tasks";
    }

    @Override
    public String execute(String args) {
        List<AgentTask> tasks = memoryStore.listTasks(properties.taskListLimit());
        if (tasks.isEmpty()) {
            return "No tasks found. The task list is empty.";
        }
        return "Current tasks:\n" + tasks.stream()
                .map(t -> "#%d [%s] %s (%s)".formatted(t.getId(), t.getStatus(), t.getDescription(), t.getCreateTime()))
                .collect(Collectors.joining("\n"));
    }
}
