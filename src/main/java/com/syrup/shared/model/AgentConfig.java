package com.syrup.shared.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Agent 設定：定義一個 agent 的運作範圍
 * name 是 AgentRegistry 的唯一 key，建立後不可修改
 */
@Value
@Builder
@Jacksonized
public class AgentConfig {

    @NonNull
    @NotBlank(message = "agent 名稱不可為空")
    String name;

    @NonNull
    @JsonProperty("agent_type")
    AgentProvider agentType;

    /** 未提供時改用 application.yml 的供應商預設 key */
    @ToString.Exclude
    @JsonProperty("api_key")
    String apiKey;

    @Builder.Default
    String model = "gpt-4-turbo-preview";

    @Builder.Default
    @JsonProperty("system_prompt")
    String systemPrompt = "You are a trading agent.";

    @Builder.Default
    @JsonProperty("max_position_size")
    double maxPositionSize = 1000.0;

    @Builder.Default
    @JsonProperty("risk_limit")
    double riskLimit = 0.1;

    @Builder.Default
    List<Platform> platforms = List.of();

    @Builder.Default
    Map<String, Object> metadata = Map.of();
}
