package com.openforge.memkeep.tool.builtin;

import com.openforge.memkeep.domain.AgentTask;
import com.openforge.memkeep.memory.MemoryStore;
import com.openforge.memkeep.tool.AgentTool;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class TaskAddTool implements AgentTool {

    private final MemoryStore memoryStore;

    @Override
    public String name() {
        return "TASK_ADD";
    }

    @Override
    public String usage() {
        return "TASK_ADD: <description> — create a task";
    }

    @Override
    public String execute(String args) {
        if (args.isBlank()) {
            return "Usage: TASK_ADD: <description>";
        }
        AgentTask task = memoryStore.createTask(args);
        return "Task #%d created: \"%s\"".formatted(task.getId(), task.getDescription());
    }
}
