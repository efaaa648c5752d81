package com.openforge.memkeep.tool.builtin;

import com.openforge.memkeep.tool.AgentTool;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

@Component
@RequiredArgsConstructor
public class TimeTool implements AgentTool {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("EEEE, MMMM d, yyyy", Locale.US);
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("h:mm:ss a z", Locale.US);

    private final Clock clock;

    @Override
    public String name() {
        return "TIME";
    }

    @Override
    public String usage() {
        return "TIME — current date and time";
    }

    @Override
    public String execute(String args) {
        ZonedDateTime now = ZonedDateTime.now(clock);
        return "Current date and time: " + DATE.format(now) + " at " + TIME.format(now);
    }
}
