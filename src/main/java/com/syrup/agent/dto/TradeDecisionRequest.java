package com.syrup.agent.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * POST /api/agent/{name}/trade 的 body
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TradeDecisionRequest {

    @JsonProperty("market_data")
    private Map<String, Object> marketData;

    private Map<String, Object> portfolio;
}
