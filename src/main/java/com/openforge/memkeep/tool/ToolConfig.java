package com.openforge.memkeep.tool;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.util.List;
import java.util.Locale;

/**
 * The two registries: every tool for foreground chat, a reduced set for the
 * unattended heartbeat.
 */
@Slf4j
@Configuration
public class ToolConfig {

    @Bean
    @Primary
    public ToolRegistry foregroundToolRegistry(List<AgentTool> tools) {
        ToolRegistry registry = new ToolRegistry(tools);
        log.info("[Tools] Foreground registry: {}", registry.names());
        return registry;
    }

    @Bean
    public ToolRegistry heartbeatToolRegistry(List<AgentTool> tools, ToolProperties properties) {
        List<String> allowed = properties.heartbeatTools().stream()
                .map(n -> n.toUpperCase(Locale.ROOT))
                .toList();
        ToolRegistry registry = new ToolRegistry(tools.stream()
                .filter(t -> allowed.contains(t.name().toUpperCase(Locale.ROOT)))
                .toList());
        log.info("[Tools] Heartbeat registry: {}", registry.names());
        return registry;
    }
}
