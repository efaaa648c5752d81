package com.openforge.memkeep.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Externalised reasoning-provider configuration.
 *
 * Reads from application.yml under the "agent.llm" prefix:
 *
 * agent:
 *   llm:
 *     primary:
 *       name: mistral
 *       base-url: https://api.mistral.ai/v1
 *       api-key: ${PRIMARY_LLM_API_KEY}
 *       model: mistral-large-latest
 *       sifter-model: mistral-small-latest
 *       vision-model: pixtral-large-latest
 *       timeout-seconds: 55
 *     fallback:
 *       name: deepseek
 *       base-url: https://api.deepseek.com/v1
 *       api-key: ${FALLBACK_LLM_API_KEY:}
 *       model: deepseek-chat
 *
 * sifter-model serves the classification and analytical purposes; when blank,
 * the chat model is used for everything.
 */
@ConfigurationProperties(prefix = "agent.llm")
public record LlmProperties(
        ProviderConfig primary,
        ProviderConfig fallback,
        @DefaultValue("2048") int maxOutputTokens
) {

    public record ProviderConfig(
            String name,
            String baseUrl,
            String apiKey,
            String model,
            String sifterModel,
            String visionModel,
            @DefaultValue("55") int timeoutSeconds
    ) {

        /** True when enough is set to attempt a call. */
        public boolean isConfigured() {
            return baseUrl != null && !baseUrl.isBlank()
                    && model != null && !model.isBlank();
        }

        public String sifterModelOrDefault() {
            return sifterModel == null || sifterModel.isBlank() ? model : sifterModel;
        }

        public String visionModelOrDefault() {
            return visionModel == null || visionModel.isBlank() ? model : visionModel;
        }
    }
}
