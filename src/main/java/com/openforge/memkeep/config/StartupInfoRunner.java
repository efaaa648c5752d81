package com.openforge.memkeep.config;

import com.openforge.memkeep.gateway.EmailTransport;
import com.openforge.memkeep.gateway.TelegramProperties;
import com.openforge.memkeep.heartbeat.HeartbeatProperties;
import com.openforge.memkeep.llm.LlmProperties;
import com.openforge.memkeep.stream.StreamProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Checks performed:
 *   - Database: opens a real JDBC connection and reads the server version
 *   - LLM providers: primary + fallback (API key masked)
 *   - Stream budget, heartbeat cadence, outbound channels
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final DataSource          dataSource;
    private final LlmProperties       llmProperties;
    private final StreamProperties    streamProperties;
    private final HeartbeatProperties heartbeatProperties;
    private final TelegramProperties  telegramProperties;
    private final EmailTransport      emailTransport;

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              MemKeep  —  Startup Summary                 ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Database                                                ║
                ║    {}
                ╠══════════════════════════════════════════════════════════╣
                ║  LLM Providers                                           ║
                ║    Primary        : {}
                ║    Fallback       : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Memory                                                  ║
                ║    Context cap    : {} tokens (consolidate at {}%)
                ║    Stream file    : {}
                ║    Vision         : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Background                                              ║
                ║    Heartbeat      : {}
                ║    Telegram       : {}
                ║    Email          : {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                probeDatabase(),

                describe(llmProperties.primary()),
                describe(llmProperties.fallback()),

                streamProperties.contextCap(),
                Math.round(streamProperties.capacityFraction() * 100),
                streamProperties.streamFile(),
                streamProperties.visionEnabled() ? "✔ enabled" : "✘ disabled",

                heartbeatProperties.enabled() ? "✔ every " + heartbeatProperties.interval() : "✘ disabled",
                telegramProperties.isConfigured() ? "✔ chat " + telegramProperties.chatId() : "✘ not configured",
                emailTransport.isConfigured() ? "✔ configured" : "✘ not configured"
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String probeDatabase() {
        try (Connection conn = dataSource.getConnection()) {
            String url     = conn.getMetaData().getURL();
            String version = conn.getMetaData().getDatabaseProductVersion();
            String safeUrl = url.replaceAll("password=[^&;]*", "password=***");
            return "✔ Connected  version=" + version + "  url=" + safeUrl;
        } catch (Exception e) {
            return "✘ FAILED: " + e.getMessage();
        }
    }

    private static String describe(LlmProperties.ProviderConfig provider) {
        if (provider == null || !provider.isConfigured()) {
            return "(not configured)";
        }
        return "%s  [%s]  key=%s".formatted(provider.name(), provider.model(), maskKey(provider.apiKey()));
    }

    /**
     * Masks an API key: shows first 6 chars + "..." + last 4 chars.
     */
    static String maskKey(String key) {
        if (key == null || key.isBlank()) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
