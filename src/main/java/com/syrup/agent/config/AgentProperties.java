package com.syrup.agent.config;

import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * AI 供應商端點與生成參數
 * api key 可由 AgentConfig 個別指定，這裡的是沒指定時的預設值
 */
@Getter
@ConfigurationProperties(prefix = "agent")
public class AgentProperties {

    private final String openaiBaseUrl;
    private final String openaiApiKey;
    private final String anthropicBaseUrl;
    private final String anthropicApiKey;
    private final String anthropicVersion;
    private final int readTimeoutSeconds;
    private final int analysisMaxTokens;
    private final int decisionMaxTokens;
    private final double analysisTemperature;
    private final double decisionTemperature;

    public AgentProperties(
            @DefaultValue("https://api.openai.com/v1") String openaiBaseUrl,
            String openaiApiKey,
            @DefaultValue("https://api.anthropic.com/v1") String anthropicBaseUrl,
            String anthropicApiKey,
            @DefaultValue("2023-06-01") String anthropicVersion,
            @DefaultValue("60") int readTimeoutSeconds,
            @DefaultValue("2048") int analysisMaxTokens,
            @DefaultValue("1024") int decisionMaxTokens,
            @DefaultValue("0.7") double analysisTemperature,
            @DefaultValue("0.3") double decisionTemperature
    ) {
        this.openaiBaseUrl = openaiBaseUrl;
        this.openaiApiKey = openaiApiKey;
        this.anthropicBaseUrl = anthropicBaseUrl;
        this.anthropicApiKey = anthropicApiKey;
        this.anthropicVersion = anthropicVersion;
        this.readTimeoutSeconds = readTimeoutSeconds;
        this.analysisMaxTokens = analysisMaxTokens;
        this.decisionMaxTokens = decisionMaxTokens;
        this.analysisTemperature = analysisTemperature;
        this.decisionTemperature = decisionTemperature;
    }

    /** 測試用：指定 base url，其餘用預設值 */
    public static AgentProperties forBaseUrls(String openaiBaseUrl, String anthropicBaseUrl) {
        return new AgentProperties(openaiBaseUrl, null, anthropicBaseUrl, null,
                "2023-06-01", 60, 2048, 1024, 0.7, 0.3);
    }
}
