package com.syrup.agent.service;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.syrup.agent.service.DecisionOutcome.Kind;
import com.syrup.shared.model.Platform;
import com.syrup.shared.model.TradeRequest;
import com.syrup.shared.model.TradeType;

import java.util.Map;

/**
 * 把模型輸出轉成 TradeRequest
 *
 * 兩種來源：
 * - 純文字：取第一個 '{' 到最後一個 '}' 之間的內容解析，需有 action 欄位
 * - tool call 參數：本身就是 JSON，action 視為 "trade"
 *
 * 規則：
 * - action = "trade" 必須有 platform / trade_type / symbol / amount
 * - platform、trade_type 不在支援清單內、slippage 不在 0~1 之間 → 整筆丟棄
 * - price、slippage（預設 0.01）、reasoning 可省略；reasoning 放進 metadata
 * - 任何解析失敗都不拋例外，只回傳非 TRADE 的分類
 */
public class TradeDecisionParser {

    /**
     * 從模型的自由文字中找出 JSON 決策
     */
    public DecisionOutcome parseText(String text) {
        if (text == null) {
            return DecisionOutcome.rejected(Kind.NO_JSON, "empty response");
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return DecisionOutcome.rejected(Kind.NO_JSON, abbreviate(text));
        }

        JsonObject decision;
        try {
            JsonElement parsed = JsonParser.parseString(text.substring(start, end + 1));
            if (!parsed.isJsonObject()) {
                return DecisionOutcome.rejected(Kind.MALFORMED_JSON, "not an object");
            }
            decision = parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            return DecisionOutcome.rejected(Kind.MALFORMED_JSON, e.getMessage());
        }

        String action = stringField(decision, "action");
        if ("hold".equalsIgnoreCase(action)) {
            return DecisionOutcome.hold(stringField(decision, "reasoning"));
        }
        if (!"trade".equalsIgnoreCase(action)) {
            return DecisionOutcome.rejected(Kind.INVALID_FIELD, "action=" + action);
        }
        return toTradeRequest(decision);
    }

    /**
     * 解析 function / tool call 的 arguments（呼叫本身就代表要交易）
     */
    public DecisionOutcome parseToolArguments(String arguments) {
        try {
            JsonElement parsed = JsonParser.parseString(arguments);
            if (!parsed.isJsonObject()) {
                return DecisionOutcome.rejected(Kind.MALFORMED_JSON, "tool arguments not an object");
            }
            return toTradeRequest(parsed.getAsJsonObject());
        } catch (JsonParseException e) {
            return DecisionOutcome.rejected(Kind.MALFORMED_JSON, e.getMessage());
        }
    }

    private DecisionOutcome toTradeRequest(JsonObject decision) {
        Platform platform;
        TradeType tradeType;
        try {
            platform = Platform.fromValue(stringField(decision, "platform"));
            tradeType = TradeType.fromValue(stringField(decision, "trade_type"));
        } catch (IllegalArgumentException e) {
            return DecisionOutcome.rejected(Kind.INVALID_FIELD, e.getMessage());
        }

        String symbol = stringField(decision, "symbol");
        if (symbol == null || symbol.isBlank()) {
            return DecisionOutcome.rejected(Kind.INVALID_FIELD, "symbol missing");
        }

        Double amount;
        Double price;
        Double slippage;
        try {
            amount = numberField(decision, "amount");
            price = numberField(decision, "price");
            slippage = numberField(decision, "slippage");
        } catch (NumberFormatException | UnsupportedOperationException | IllegalStateException e) {
            return DecisionOutcome.rejected(Kind.INVALID_FIELD, "non-numeric field: " + e.getMessage());
        }
        if (amount == null) {
            return DecisionOutcome.rejected(Kind.INVALID_FIELD, "amount missing");
        }
        if (slippage != null && !(slippage >= 0 && slippage <= 1)) {
            return DecisionOutcome.rejected(Kind.INVALID_FIELD, "slippage out of range: " + slippage);
        }

        TradeRequest.TradeRequestBuilder builder = TradeRequest.builder()
                .platform(platform)
                .tradeType(tradeType)
                .symbol(symbol.trim())
                .amount(amount)
                .price(price);
        if (slippage != null) {
            builder.slippage(slippage);
        }
        String reasoning = stringField(decision, "reasoning");
        if (reasoning != null) {
            builder.metadata(Map.of("reasoning", reasoning));
        }
        return DecisionOutcome.trade(builder.build());
    }

    private static String stringField(JsonObject json, String key) {
        JsonElement value = json.get(key);
        if (value == null || value.isJsonNull() || !value.isJsonPrimitive()) {
            return null;
        }
        return value.getAsString();
    }

    private static Double numberField(JsonObject json, String key) {
        JsonElement value = json.get(key);
        if (value == null || value.isJsonNull()) {
            return null;
        }
        double number = value.getAsDouble();
        // Gson 寬鬆模式會讀進 NaN / Infinity
        if (!Double.isFinite(number)) {
            throw new NumberFormatException(key + "=" + number);
        }
        return number;
    }

    private static String abbreviate(String text) {
        return text.length() > 100 ? text.substring(0, 100) + "..." : text;
    }
}
