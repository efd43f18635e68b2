package com.syrup.shared.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * 與平台無關的交易請求
 *
 * 由 agent 決策解析或呼叫端直接建立，建立後不可修改。
 * amount / slippage 的合法性由各平台 adapter 的 validateTrade 檢查，
 * 這裡不擋，讓不合法的請求也能得到一個 FAILED 的 TradeResult。
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TradeRequest {

    public static final double DEFAULT_SLIPPAGE = 0.01;

    @NonNull
    Platform platform;

    @NonNull
    @JsonProperty("trade_type")
    TradeType tradeType;

    @NonNull
    @NotBlank(message = "symbol 不可為空")
    String symbol;

    double amount;

    /** null = 市價單 */
    Double price;

    /** 可接受滑價 0~1 */
    @Builder.Default
    double slippage = DEFAULT_SLIPPAGE;

    @Builder.Default
    Map<String, Object> metadata = Map.of();

    public boolean isMarketOrder() {
        return price == null;
    }
}
