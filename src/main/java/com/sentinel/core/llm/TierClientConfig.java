package com.sentinel.core.llm;

import com.sentinel.core.config.SentinelProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds one OpenAI-compatible chat client per model tier.
 * <p>
 * The local tier typically points at LM Studio or Ollama ({@code http://localhost:1234}),
 * the cloud tier at a hosted endpoint. Both speak the OpenAI chat-completions protocol.
 */
@Configuration
public class TierClientConfig {

    private static final Logger log = LoggerFactory.getLogger(TierClientConfig.class);

    @Bean
    @Qualifier("localTier")
    LlmService localTierLlm(SentinelProperties properties) {
        return build("local", properties.getTiers().getLocal());
    }

    @Bean
    @Qualifier("cloudTier")
    LlmService cloudTierLlm(SentinelProperties properties) {
        SentinelProperties.Tier cloud = properties.getTiers().getCloud();
        if (!cloud.hasApiKey()) {
            log.warn("sentinel.tiers.cloud.api-key is not set; tier 2 repair calls will be rejected by the endpoint");
        }
        return build("cloud", cloud);
    }

    static LlmService build(String name, SentinelProperties.Tier tier) {
        var api = OpenAiApi.builder()
                .baseUrl(tier.getBaseUrl())
                .apiKey(tier.hasApiKey() ? tier.getApiKey() : "unset")
                .build();
        var chatModel = OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(OpenAiChatOptions.builder()
                        .model(tier.getModel())
                        .temperature(0.0)
                        .build())
                .build();
        log.info("Tier '{}' chat client -> {} (model {})", name, tier.getBaseUrl(), tier.getModel());
        return new LlmService(ChatClient.create(chatModel), name);
    }
}
