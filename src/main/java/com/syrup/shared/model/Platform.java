package com.syrup.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 支援的交易平台
 * 同時作為 TradeRouter 註冊 adapter 的 key
 */
public enum Platform {

    SOLANA("solana"),
    POLYMARKET("polymarket"),
    KALSHI("kalshi");

    private final String value;

    Platform(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * 由 wire 值（小寫）轉換，不認得的值拋 IllegalArgumentException
     */
    @JsonCreator
    public static Platform fromValue(String value) {
        if (value != null) {
            for (Platform p : values()) {
                if (p.value.equalsIgnoreCase(value.trim())) {
                    return p;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported platform: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
