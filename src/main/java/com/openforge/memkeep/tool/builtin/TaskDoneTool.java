package com.openforge.memkeep.tool.builtin;

import com.openforge.memkeep.memory.MemoryStore;
import com.openforge.memkeep.tool.AgentTool;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class TaskDoneTool implements AgentTool {

    private final MemoryStore memoryStore;

    @Override
    public String name() {
        return "TASK_DONE";
    }

    @Override
    public String usage() {
        return "TASK_DONE: <id> — mark a task as done";
    }

    @Override
    public String execute(String args) {
        long id;
        try {
            id = Long.parseLong(args.replace("#", "").trim());
        } catch (NumberFormatException e) {
            return "Invalid task ID.";
        }
        return memoryStore.completeTask(id)
                .map(t -> "Task #" + id + " marked as done.")
                .orElse("Task #" + id + " not found.");
    }
}
