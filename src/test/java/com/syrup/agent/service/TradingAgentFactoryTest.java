package com.syrup.agent.service;

import com.syrup.agent.config.AgentProperties;
import com.syrup.shared.exception.InvalidCredentialsException;
import com.syrup.shared.exception.UnsupportedProviderException;
import com.syrup.shared.model.AgentConfig;
import com.syrup.shared.model.AgentProvider;
import okhttp3.Call;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.syrup.support.OkHttpMocks.mockClient;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class TradingAgentFactoryTest {

    private final OkHttpClient httpClient = mockClient(mock(Call.class));

    private static AgentProperties propertiesWithKeys(String openaiKey, String anthropicKey) {
        return new AgentProperties("https://openai.test/v1", openaiKey, "https://anthropic.test/v1", anthropicKey,
                "2023-06-01", 60, 2048, 1024, 0.7, 0.3);
    }

    private static AgentConfig config(AgentProvider provider, String apiKey) {
        return AgentConfig.builder().name("a").agentType(provider).apiKey(apiKey).build();
    }

    @Test
    @DisplayName("依 agent_type 建立對應的 agent")
    void createsPerProvider() {
        TradingAgentFactory factory = new TradingAgentFactory(httpClient, propertiesWithKeys(null, null));

        assertThat(factory.create(config(AgentProvider.OPENAI, "sk-1"))).isInstanceOf(OpenAiTradingAgent.class);
        assertThat(factory.create(config(AgentProvider.ANTHROPIC, "ak-1"))).isInstanceOf(AnthropicTradingAgent.class);
    }

    @Test
    @DisplayName("沒帶 api_key：改用預設 key")
    void fallsBackToDefaultKey() {
        TradingAgentFactory factory = new TradingAgentFactory(httpClient, propertiesWithKeys("sk-default", null));

        TradingAgent agent = factory.create(config(AgentProvider.OPENAI, null));

        assertThat(agent.name()).isEqualTo("a");
    }

    @Test
    @DisplayName("兩邊都沒有 key：InvalidCredentialsException")
    void missingKey() {
        TradingAgentFactory factory = new TradingAgentFactory(httpClient, propertiesWithKeys("", null));

        assertThatThrownBy(() -> factory.create(config(AgentProvider.OPENAI, null)))
                .isInstanceOf(InvalidCredentialsException.class)
                .hasMessage("OpenAI API key is required");
        assertThatThrownBy(() -> factory.create(config(AgentProvider.ANTHROPIC, " ")))
                .isInstanceOf(InvalidCredentialsException.class)
                .hasMessage("Anthropic API key is required");
    }

    @Test
    @DisplayName("custom 供應商：UnsupportedProviderException")
    void customProvider() {
        TradingAgentFactory factory = new TradingAgentFactory(httpClient, propertiesWithKeys("sk", "ak"));

        assertThatThrownBy(() -> factory.create(config(AgentProvider.CUSTOM, "k")))
                .isInstanceOf(UnsupportedProviderException.class)
                .hasMessage("Unsupported agent type: custom");
    }
}
