package com.syrup.agent.service;

import com.syrup.agent.config.AgentProperties;
import com.syrup.shared.exception.InvalidCredentialsException;
import com.syrup.shared.exception.UnsupportedProviderException;
import com.syrup.shared.model.AgentConfig;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

/**
 * 依 agent_type 建立對應供應商的 agent
 * AgentConfig 沒帶 api_key 時改用 application.yml 的預設 key，兩者都沒有就拒絕建立
 */
@Component
public class TradingAgentFactory {

    private final OkHttpClient okHttpClient;
    private final AgentProperties properties;

    public TradingAgentFactory(OkHttpClient okHttpClient, AgentProperties properties) {
        this.okHttpClient = okHttpClient;
        this.properties = properties;
    }

    public TradingAgent create(AgentConfig config) {
        return switch (config.getAgentType()) {
            case OPENAI -> new OpenAiTradingAgent(config,
                    requireKey(config.getApiKey(), properties.getOpenaiApiKey(), "OpenAI"),
                    okHttpClient, properties);
            case ANTHROPIC -> new AnthropicTradingAgent(config,
                    requireKey(config.getApiKey(), properties.getAnthropicApiKey(), "Anthropic"),
                    okHttpClient, properties);
            default -> throw new UnsupportedProviderException("Unsupported agent type: " + config.getAgentType());
        };
    }

    private static String requireKey(String configured, String fallback, String provider) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        if (fallback != null && !fallback.isBlank()) {
            return fallback;
        }
        throw new InvalidCredentialsException(provider + " API key is required");
    }
}
