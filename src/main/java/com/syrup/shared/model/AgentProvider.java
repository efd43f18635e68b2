package com.syrup.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * AI 模型供應商
 * CUSTOM 保留給外部擴充，目前沒有實作
 */
public enum AgentProvider {

    OPENAI("openai"),
    ANTHROPIC("anthropic"),
    CUSTOM("custom");

    private final String value;

    AgentProvider(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AgentProvider fromValue(String value) {
        if (value != null) {
            for (AgentProvider p : values()) {
                if (p.value.equalsIgnoreCase(value.trim())) {
                    return p;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported agent type: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
