package com.openforge.memkeep.gateway;

import com.openforge.memkeep.agent.AgentCore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Pulls inbound Telegram messages and answers them through the {@link AgentCore}.
 *
 * Only the configured chat is answered; anything else is logged and dropped.
 * The update offset lives in memory, so a restart may replay the last batch
 * Telegram still holds.
 */
@Slf4j
@Component
public class TelegramInboundPoller {

    private final TelegramGateway    gateway;
    private final TelegramProperties properties;
    private final AgentCore          agentCore;

    private long offset;

    public TelegramInboundPoller(TelegramGateway gateway, TelegramProperties properties, AgentCore agentCore) {
        this.gateway    = gateway;
        this.properties = properties;
        this.agentCore  = agentCore;
    }

    @Scheduled(fixedDelayString = "${agent.telegram.poll-interval:PT30S}")
    public void tick() {
        if (!properties.isConfigured()) {
            return;
        }
        poll();
    }

    /** @return number of messages answered */
    public synchronized int poll() {
        List<TelegramGateway.InboundMessage> updates;
        try {
            updates = gateway.fetchUpdates(offset);
        } catch (GatewayException e) {
            log.warn("[Telegram] Poll failed: {}", e.getMessage());
            return 0;
        }

        int answered = 0;
        for (TelegramGateway.InboundMessage message : updates) {
            offset = Math.max(offset, message.updateId() + 1);
            if (!properties.chatId().equals(message.chatId())) {
                log.warn("[Telegram] Ignoring message from unauthorized chat {}.", message.chatId());
                continue;
            }
            if (message.text().isBlank()) {
                continue;
            }
            log.info("[Telegram] Inbound from {} ({} chars).", message.senderName(), message.text().length());
            String reply;
            try {
                reply = agentCore.handleMessage(message.text(), "telegram:" + message.chatId());
            } catch (RuntimeException e) {
                log.error("[Telegram] Update {} could not be answered: {}", message.updateId(), e.getMessage(), e);
                continue;
            }
            try {
                gateway.sendMessage(message.chatId(), reply);
                answered++;
            } catch (GatewayException e) {
                log.warn("[Telegram] Reply to chat {} failed: {}", message.chatId(), e.getMessage());
            }
        }
        return answered;
    }

    long offset() {
        return offset;
    }
}
