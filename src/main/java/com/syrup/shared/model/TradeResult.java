package com.syrup.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * 單次 execute 的結果
 *
 * 每次 executeTrade 產生一筆，之後不會被更新；
 * 查單得到的是新的觀察結果，不是改寫這一筆。
 * 價格 / 數量一律是平台的自然單位（美元、整顆 token），不是 cents / lamports。
 */
@Value
@Builder
@Jacksonized
public class TradeResult {

    @JsonProperty("trade_id")
    String tradeId;

    Platform platform;

    TradeStatus status;

    /** 結算參考：交易 hash 或訂單 id */
    @JsonProperty("transaction_hash")
    String transactionHash;

    @JsonProperty("executed_amount")
    Double executedAmount;

    @JsonProperty("executed_price")
    Double executedPrice;

    Double fee;

    @Builder.Default
    Instant timestamp = Instant.now();

    String error;

    @Builder.Default
    Map<String, Object> metadata = Map.of();

    public static TradeResult failed(Platform platform, String error) {
        return TradeResult.builder()
                .tradeId("")
                .platform(platform)
                .status(TradeStatus.FAILED)
                .error(error)
                .build();
    }

    @JsonIgnore
    public boolean isCompleted() {
        return status == TradeStatus.COMPLETED;
    }
}
