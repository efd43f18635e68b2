package com.syrup.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 交易動作
 *
 * 各平台只支援其中一部分：
 * - Solana (鏈上 swap)：只接受 SWAP
 * - Polymarket / Kalshi (訂單制)：只接受 BUY / SELL
 */
public enum TradeType {

    BUY("buy"),
    SELL("sell"),
    SWAP("swap");

    private final String value;

    TradeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static TradeType fromValue(String value) {
        if (value != null) {
            for (TradeType t : values()) {
                if (t.value.equalsIgnoreCase(value.trim())) {
                    return t;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported trade type: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
