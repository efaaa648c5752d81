package com.openforge.memkeep.tool.builtin;

import com.openforge.memkeep.gateway.MessagingGateway;
import com.openforge.memkeep.tool.AgentTool;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class TelegramTool implements AgentTool {

    private final MessagingGateway messaging;

    @Override
    public String name() {
        return "TELEGRAM";
    }

    @Override
    public String usage() {
        return "TELEGRAM: <message> — message the user on Telegram";
    }

    @Override
    public String execute(String args) {
        if (args.isBlank()) {
            return "Usage: TELEGRAM: <message>";
        }
        if (!messaging.isConfigured()) {
            return "Telegram not configured.";
        }
        messaging.sendMessage(messaging.defaultChannel(), args.trim());
        return "Telegram message sent to user.";
    }
}
