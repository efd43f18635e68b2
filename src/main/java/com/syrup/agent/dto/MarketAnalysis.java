package com.syrup.agent.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 市場分析結果
 * 成功時有 analysis / model / tokens_used，失敗時只有 error
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MarketAnalysis {

    private String analysis;

    private String model;

    @JsonProperty("tokens_used")
    private Integer tokensUsed;

    private String error;

    public static MarketAnalysis failed(String error) {
        return MarketAnalysis.builder().error(error).build();
    }

    @JsonIgnore
    public boolean isSuccess() {
        return error == null;
    }
}
