package com.syrup.trading.platform;

/**
 * 下單前檢查結果
 */
public record TradeValidation(boolean valid, String reason) {

    private static final TradeValidation OK = new TradeValidation(true, null);

    public static TradeValidation ok() {
        return OK;
    }

    public static TradeValidation reject(String reason) {
        return new TradeValidation(false, reason);
    }
}
