package com.sentinel.core.tier;

import com.sentinel.core.config.SentinelProperties;
import com.sentinel.core.llm.LlmService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires one {@link LlmRepairAgent} per tier.
 */
@Configuration
public class RepairAgentConfig {

    @Bean
    @Qualifier("localTier")
    RepairAgent localRepairAgent(@Qualifier("localTier") LlmService llm, EditGuard guard) {
        // the local tier is free regardless of configured rates
        return new LlmRepairAgent(llm, guard, 0.0, 0.0);
    }

    @Bean
    @Qualifier("cloudTier")
    RepairAgent cloudRepairAgent(@Qualifier("cloudTier") LlmService llm, EditGuard guard,
                                 SentinelProperties properties) {
        return new LlmRepairAgent(llm, guard, properties.getTiers().getCloud());
    }
}
