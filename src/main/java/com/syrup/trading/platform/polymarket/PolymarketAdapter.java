package com.syrup.trading.platform.polymarket;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.syrup.shared.model.Platform;
import com.syrup.shared.model.PlatformCredentials;
import com.syrup.shared.model.TradeRequest;
import com.syrup.shared.model.TradeResult;
import com.syrup.shared.model.TradeStatus;
import com.syrup.shared.model.TradeType;
import com.syrup.shared.util.HmacSignatureUtil;
import com.syrup.trading.config.VenueConfig;
import com.syrup.trading.platform.AbstractPlatformAdapter;
import com.syrup.trading.platform.VenueResponse;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Polymarket 預測市場
 *
 * 每個請求都要帶簽名 header：
 * POLY-SIGNATURE = HMAC-SHA256(timestamp + METHOD + path + body, secret)，timestamp 為秒
 * path 取編碼後的路徑，和實際送出的 URL 一致
 */
@Slf4j
public class PolymarketAdapter extends AbstractPlatformAdapter {

    private final String baseUrl;
    private final String apiKey;
    private final String secret;
    private final String passphrase;

    public PolymarketAdapter(PlatformCredentials credentials, OkHttpClient baseClient, VenueConfig venueConfig) {
        super(baseClient, venueConfig.getReadTimeoutSeconds());
        requirePlatform(Platform.POLYMARKET, credentials.getPlatform());
        this.baseUrl = venueConfig.getPolymarketBaseUrl();
        this.apiKey = credentials.getApiKey() != null ? credentials.getApiKey() : "";
        this.secret = credentials.getSecret();
        this.passphrase = credentials.getPassphrase() != null ? credentials.getPassphrase() : "";
        log.info("Polymarket adapter 初始化: baseUrl={}", baseUrl);
    }

    @Override
    public Platform platform() {
        return Platform.POLYMARKET;
    }

    @Override
    protected Set<TradeType> supportedTradeTypes() {
        return Set.of(TradeType.BUY, TradeType.SELL);
    }

    @Override
    protected TradeResult submitTrade(TradeRequest trade) {
        JsonObject order = new JsonObject();
        order.addProperty("market", trade.getSymbol());
        order.addProperty("side", trade.getTradeType() == TradeType.BUY ? "BUY" : "SELL");
        order.addProperty("size", trade.getAmount());
        order.addProperty("price", trade.getPrice());
        order.addProperty("type", trade.isMarketOrder() ? "MARKET" : "LIMIT");

        VenueResponse response = signedRequest("POST", url("orders"), order);
        JsonObject json = response.object();
        if (!isSuccess(json)) {
            return TradeResult.failed(platform(), response.errorMessage("Unknown error"));
        }

        return TradeResult.builder()
                .tradeId(optString(json, "orderId", ""))
                .platform(platform())
                .status(TradeStatus.COMPLETED)
                .transactionHash(optString(json, "transactionHash", null))
                .executedAmount(trade.getAmount())
                .executedPrice(optDouble(json, "executedPrice"))
                .fee(optDouble(json, "fee", 0))
                .timestamp(Instant.now())
                .build();
    }

    @Override
    protected Map<String, Double> fetchBalance(String token) {
        VenueResponse response = signedRequest("GET", url("balances"), null);
        JsonObject json = response.object();
        if (!isSuccess(json) || !json.has("balances") || !json.get("balances").isJsonObject()) {
            log.warn("Polymarket 查詢餘額失敗: {}", response.errorMessage("no balances"));
            return Map.of();
        }

        Map<String, Double> balances = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : json.getAsJsonObject("balances").entrySet()) {
            if (token != null && !token.isBlank() && !entry.getKey().equalsIgnoreCase(token)) {
                continue;
            }
            balances.put(entry.getKey(), entry.getValue().getAsDouble());
        }
        return balances;
    }

    @Override
    protected double fetchPrice(String symbol) {
        VenueResponse response = signedRequest("GET", url("markets", symbol), null);
        JsonObject json = response.object();
        if (!isSuccess(json)) {
            return 0.0;
        }
        return optDouble(json, "lastPrice", 0.0);
    }

    @Override
    protected Map<String, Object> fetchOrderStatus(String orderId) {
        VenueResponse response = signedRequest("GET", url("orders", orderId), null);
        if (response.isTransportFailure()) {
            return Map.of("error", response.getError());
        }
        return toMap(response);
    }

    @Override
    protected boolean requestCancel(String orderId) {
        VenueResponse response = signedRequest("DELETE", url("orders", orderId), null);
        return isSuccess(response.object());
    }

    // ==================== 簽名請求 ====================

    /**
     * symbol / orderId 當成單一路徑段編碼，不會跑出 /orders 之外
     */
    private HttpUrl url(String... segments) {
        HttpUrl.Builder builder = HttpUrl.get(baseUrl).newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder.build();
    }

    private VenueResponse signedRequest(String method, HttpUrl url, JsonObject payload) {
        String timestamp = String.valueOf(Instant.now().getEpochSecond());
        String body = payload != null ? gson.toJson(payload) : "";
        String signature = HmacSignatureUtil.sign(timestamp + method + url.encodedPath() + body, secret);

        Request.Builder builder = new Request.Builder()
                .url(url)
                .addHeader("POLY-API-KEY", apiKey)
                .addHeader("POLY-SIGNATURE", signature)
                .addHeader("POLY-TIMESTAMP", timestamp)
                .addHeader("POLY-PASSPHRASE", passphrase)
                .addHeader("Content-Type", "application/json");

        RequestBody requestBody = payload != null ? RequestBody.create(body, JSON_MEDIA) : null;
        builder.method(method, requestBody);
        return send(builder.build());
    }

    private static boolean isSuccess(JsonObject json) {
        return json.has("success") && json.get("success").isJsonPrimitive() && json.get("success").getAsBoolean();
    }
}
