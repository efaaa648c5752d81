package com.openforge.memkeep.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.openforge.memkeep.scheduler.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

/**
 * Core infrastructure beans:
 *  - Background executor   → fire-and-forget intake work
 *  - Inference executor    → the reasoning calls themselves, run under the scheduler's hard timeout
 *  - Java HttpClient       → the ONLY HTTP engine; LLM, search, fetch and Telegram all use it
 *  - Jackson ObjectMapper  → snake_case ↔ camelCase, Java 8 time, tolerant deserialization
 *  - Clock / Sleeper       → injected time sources so the scheduler can be driven by tests
 */
@Configuration
@EnableScheduling
public class AppConfig {

    /**
     * Named "agentBackgroundExecutor" to avoid clashing with Spring Boot's
     * auto-configured "applicationTaskExecutor".  Bounded queue: intake work
     * beyond it is rejected and logged instead of piling up behind a slow provider.
     */
    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor agentBackgroundExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("agent-bg-");
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(64);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Runs only the reasoning calls dispatched by the InferenceScheduler.  Callers
     * of schedule() block on these futures, so nothing that calls schedule() may
     * ever run on this pool.  Calls are serialized upstream; the spare threads
     * absorb calls abandoned at the hard timeout that are still running.
     */
    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor inferenceCallExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("agent-llm-");
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(8);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Single, shared HttpClient instance.
     * 30 s connect timeout; per-request read timeouts are set at call site.
     */
    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper configured for OpenAI-compatible JSON:
     *  - snake_case property names (finish_reason, chat_id, update_id …)
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored (APIs can add fields without breaking us)
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleep();
    }
}
