package com.syrup.shared.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 交易狀態
 * PENDING → EXECUTING → (COMPLETED | FAILED | CANCELLED)
 *
 * execute 同步呼叫只會產生 COMPLETED 或 FAILED，
 * 其餘狀態只會出現在查單 / 撤單的回應中。
 */
public enum TradeStatus {

    PENDING("pending"),
    EXECUTING("executing"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String value;

    TradeStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
