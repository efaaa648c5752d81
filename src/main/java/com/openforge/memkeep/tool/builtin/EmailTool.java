package com.openforge.memkeep.tool.builtin;

import com.openforge.memkeep.gateway.EmailTransport;
import com.openforge.memkeep.tool.AgentTool;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EmailTool implements AgentTool {

    private final EmailTransport transport;

    @Override
    public String name() {
        return "EMAIL";
    }

    @Override
    public String usage() {
        return "EMAIL: <to> | <subject> | <body> — send an email";
    }

    @Override
    public String execute(String args) {
        String[] parts = args.split("\\|", 3);
        if (parts.length < 3) {
            return "Email format: EMAIL: to@address.com | Subject | Body text";
        }
        String to      = parts[0].trim();
        String subject = parts[1].trim();
        String body    = parts[2].trim();
        String messageId = transport.send(new EmailTransport.EmailMessage(to, subject, body));
        return "Email sent to %s with subject \"%s\". Message ID: %s".formatted(to, subject, messageId);
    }
}
