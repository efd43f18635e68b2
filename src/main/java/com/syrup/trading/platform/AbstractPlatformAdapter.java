package com.syrup.trading.platform;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.reflect.TypeToken;
import com.syrup.shared.exception.InvalidCredentialsException;
import com.syrup.shared.model.Platform;
import com.syrup.shared.model.TradeRequest;
import com.syrup.shared.model.TradeResult;
import com.syrup.shared.model.TradeType;
import lombok.extern.slf4j.Slf4j;
import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.lang.reflect.Type;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * PlatformAdapter 共用骨架
 *
 * 負責：
 * 1. 連線生命週期：第一次呼叫時才從共用 OkHttpClient 衍生自己的 client，
 *    dispatcher 與 connection pool 自己建立（newBuilder 預設會共用），close() 時只釋放自己的
 * 2. 下單前檢查：amount > 0、0 ≤ slippage ≤ 1、平台支援該 TradeType
 * 3. 邊界保護：子類別的 submit / fetch 方法若拋出 RuntimeException，
 *    在這裡轉成 FAILED 結果或 sentinel 值，不會往上傳到 TradeRouter
 */
@Slf4j
public abstract class AbstractPlatformAdapter implements PlatformAdapter {

    protected static final MediaType JSON_MEDIA = MediaType.get("application/json; charset=utf-8");
    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    protected final Gson gson = new Gson();

    private final OkHttpClient baseClient;
    private final int readTimeoutSeconds;
    private OkHttpClient client;
    private Dispatcher dispatcher;
    private ConnectionPool connectionPool;

    protected AbstractPlatformAdapter(OkHttpClient baseClient, int readTimeoutSeconds) {
        this.baseClient = baseClient;
        this.readTimeoutSeconds = readTimeoutSeconds;
    }

    /**
     * 這個平台接受的 TradeType
     */
    protected abstract Set<TradeType> supportedTradeTypes();

    /**
     * validateTrade 通過之後才會被呼叫
     */
    protected abstract TradeResult submitTrade(TradeRequest trade);

    protected abstract Map<String, Double> fetchBalance(String token);

    protected abstract double fetchPrice(String symbol);

    protected abstract Map<String, Object> fetchOrderStatus(String orderId);

    protected abstract boolean requestCancel(String orderId);

    // ==================== 對外介面 ====================

    @Override
    public final TradeResult executeTrade(TradeRequest trade) {
        TradeValidation validation = validateTrade(trade);
        if (!validation.valid()) {
            log.warn("{} 下單檢查未通過: {} ({})", platform(), validation.reason(), trade);
            return TradeResult.failed(platform(), validation.reason());
        }
        try {
            TradeResult result = submitTrade(trade);
            log.info("{} 下單結果: status={} tradeId={} error={}",
                    platform(), result.getStatus(), result.getTradeId(), result.getError());
            return result;
        } catch (RuntimeException e) {
            log.error("{} 下單例外: {}", platform(), e.getMessage(), e);
            return TradeResult.failed(platform(), messageOf(e));
        }
    }

    @Override
    public final Map<String, Double> getBalance(String token) {
        try {
            return fetchBalance(token);
        } catch (RuntimeException e) {
            log.warn("{} 查詢餘額失敗: {}", platform(), e.getMessage());
            return Map.of();
        }
    }

    @Override
    public final double getPrice(String symbol) {
        try {
            return fetchPrice(symbol);
        } catch (RuntimeException e) {
            log.warn("{} 查詢價格失敗: {} {}", platform(), symbol, e.getMessage());
            return 0.0;
        }
    }

    @Override
    public final Map<String, Object> getOrderStatus(String orderId) {
        try {
            return fetchOrderStatus(orderId);
        } catch (RuntimeException e) {
            log.warn("{} 查詢訂單失敗: {} {}", platform(), orderId, e.getMessage());
            return Map.of("error", messageOf(e));
        }
    }

    @Override
    public final boolean cancelOrder(String orderId) {
        try {
            return requestCancel(orderId);
        } catch (RuntimeException e) {
            log.warn("{} 撤單失敗: {} {}", platform(), orderId, e.getMessage());
            return false;
        }
    }

    /**
     * 子類別先檢查平台特有條件（例如錢包是否存在），再呼叫 super 做共用檢查
     */
    @Override
    public TradeValidation validateTrade(TradeRequest trade) {
        if (!(trade.getAmount() > 0) || !Double.isFinite(trade.getAmount())) {
            return TradeValidation.reject("Amount must be positive");
        }
        if (!(trade.getSlippage() >= 0 && trade.getSlippage() <= 1)) {
            return TradeValidation.reject("Slippage must be between 0 and 1");
        }
        if (!supportedTradeTypes().contains(trade.getTradeType())) {
            return TradeValidation.reject(
                    "Trade type " + trade.getTradeType() + " not supported on " + platform());
        }
        return TradeValidation.ok();
    }

    @Override
    public synchronized void close() {
        if (client == null) {
            return;
        }
        client = null;
        dispatcher.executorService().shutdown();
        connectionPool.evictAll();
        onClose();
        log.info("{} 連線已關閉", platform());
    }

    /**
     * 子類別在連線關閉時需要清掉的狀態（例如 session token）
     */
    protected void onClose() {
    }

    // ==================== HTTP ====================

    protected synchronized OkHttpClient client() {
        if (client == null) {
            dispatcher = new Dispatcher();
            connectionPool = new ConnectionPool();
            client = baseClient.newBuilder()
                    .dispatcher(dispatcher)
                    .connectionPool(connectionPool)
                    .readTimeout(readTimeoutSeconds, TimeUnit.SECONDS)
                    .build();
            log.debug("{} 建立連線", platform());
        }
        return client;
    }

    /**
     * 送出請求並解析 JSON 回應，所有傳輸層錯誤都收斂成 VenueResponse.failure
     */
    protected VenueResponse send(Request request) {
        try (Response response = client().newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                log.warn("{} API 回應異常: {} {} → HTTP {} - {}",
                        platform(), request.method(), request.url().encodedPath(), response.code(), body);
            }
            JsonElement json = body.isBlank() ? null : JsonParser.parseString(body);
            return VenueResponse.of(response.code(), json);
        } catch (IOException e) {
            log.error("{} HTTP 請求失敗: {} {} - {}",
                    platform(), request.method(), request.url().encodedPath(), e.getMessage());
            return VenueResponse.failure(messageOf(e));
        } catch (JsonParseException e) {
            log.error("{} 回應不是合法 JSON: {}", platform(), e.getMessage());
            return VenueResponse.failure("Invalid response from " + platform() + ": " + e.getMessage());
        }
    }

    /**
     * 把 JSON object 轉成一般 Map（order status 原樣回傳給呼叫端用）
     */
    protected Map<String, Object> toMap(VenueResponse response) {
        Map<String, Object> map = gson.fromJson(response.object(), MAP_TYPE);
        return map != null ? map : new LinkedHashMap<>();
    }

    protected static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    protected static double optDouble(JsonObject json, String key, double fallback) {
        if (json == null || !json.has(key) || json.get(key).isJsonNull()) {
            return fallback;
        }
        return json.get(key).getAsDouble();
    }

    protected static Double optDouble(JsonObject json, String key) {
        if (json == null || !json.has(key) || json.get(key).isJsonNull()) {
            return null;
        }
        return json.get(key).getAsDouble();
    }

    protected static String optString(JsonObject json, String key, String fallback) {
        if (json == null || !json.has(key) || json.get(key).isJsonNull()) {
            return fallback;
        }
        return json.get(key).getAsString();
    }

    protected static Platform requirePlatform(Platform expected, Platform actual) {
        if (expected != actual) {
            throw new InvalidCredentialsException("Credentials for " + actual + " passed to " + expected + " adapter");
        }
        return expected;
    }
}
