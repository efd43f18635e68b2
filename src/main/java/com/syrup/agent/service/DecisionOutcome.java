package com.syrup.agent.service;

import com.syrup.shared.model.TradeRequest;

import java.util.Optional;

/**
 * 一次決策解析的內部分類
 *
 * 對外一律只有「有交易 / 沒交易」（Optional），
 * 這裡保留 hold 與各種解析失敗的差別，只用於 log。
 */
public record DecisionOutcome(Kind kind, TradeRequest trade, String detail) {

    public enum Kind {
        TRADE,
        HOLD,
        NO_JSON,
        MALFORMED_JSON,
        INVALID_FIELD,
        PROVIDER_ERROR
    }

    public static DecisionOutcome trade(TradeRequest trade) {
        return new DecisionOutcome(Kind.TRADE, trade, null);
    }

    public static DecisionOutcome hold(String reasoning) {
        return new DecisionOutcome(Kind.HOLD, null, reasoning);
    }

    public static DecisionOutcome rejected(Kind kind, String detail) {
        return new DecisionOutcome(kind, null, detail);
    }

    public Optional<TradeRequest> toTrade() {
        return Optional.ofNullable(trade);
    }
}
