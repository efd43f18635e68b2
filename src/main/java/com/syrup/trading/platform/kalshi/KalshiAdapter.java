package com.syrup.trading.platform.kalshi;

import com.google.gson.JsonObject;
import com.syrup.shared.model.Platform;
import com.syrup.shared.model.PlatformCredentials;
import com.syrup.shared.model.TradeRequest;
import com.syrup.shared.model.TradeResult;
import com.syrup.shared.model.TradeStatus;
import com.syrup.shared.model.TradeType;
import com.syrup.trading.config.VenueConfig;
import com.syrup.trading.platform.AbstractPlatformAdapter;
import com.syrup.trading.platform.TradeValidation;
import com.syrup.trading.platform.VenueResponse;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Kalshi 事件合約
 *
 * 認證：POST /login 取得 session token，之後所有請求帶 Bearer token。
 * token 第一次需要時才取得並快取；收到 401 時清掉，下一次呼叫重新登入。
 *
 * 價格單位：Kalshi 以 cents 報價，進出這個 adapter 時一律轉成美元。
 */
@Slf4j
public class KalshiAdapter extends AbstractPlatformAdapter {

    static final String AUTH_FAILED = "Kalshi authentication failed";

    private final String baseUrl;
    private final String email;
    private final String password;

    private String token;

    public KalshiAdapter(PlatformCredentials credentials, OkHttpClient baseClient, VenueConfig venueConfig) {
        super(baseClient, venueConfig.getReadTimeoutSeconds());
        requirePlatform(Platform.KALSHI, credentials.getPlatform());
        this.baseUrl = venueConfig.getKalshiBaseUrl();
        this.email = credentials.getApiKey();
        this.password = credentials.getPrivateKey();
        log.info("Kalshi adapter 初始化: baseUrl={}", baseUrl);
    }

    @Override
    public Platform platform() {
        return Platform.KALSHI;
    }

    @Override
    protected Set<TradeType> supportedTradeTypes() {
        return Set.of(TradeType.BUY, TradeType.SELL);
    }

    /**
     * 合約數量取整數，不足 1 口直接拒絕
     */
    @Override
    public TradeValidation validateTrade(TradeRequest trade) {
        TradeValidation base = super.validateTrade(trade);
        if (!base.valid()) {
            return base;
        }
        if (Math.floor(trade.getAmount()) < 1) {
            return TradeValidation.reject("Kalshi orders require at least 1 contract");
        }
        return base;
    }

    @Override
    protected TradeResult submitTrade(TradeRequest trade) {
        String side = sideOf(trade);

        JsonObject order = new JsonObject();
        order.addProperty("ticker", trade.getSymbol());
        order.addProperty("action", trade.getTradeType() == TradeType.BUY ? "BUY" : "SELL");
        order.addProperty("count", (long) Math.floor(trade.getAmount()));
        order.addProperty("type", trade.isMarketOrder() ? "market" : "limit");
        order.addProperty("side", side);
        if (!trade.isMarketOrder()) {
            order.addProperty(side + "_price", toCents(trade.getPrice()));
        }

        VenueResponse response = authorizedRequest("POST", url("portfolio", "orders"), order);
        JsonObject json = response.object();
        if (!json.has("order") || !json.get("order").isJsonObject()) {
            return TradeResult.failed(platform(), response.errorMessage("Unknown error"));
        }

        JsonObject placed = json.getAsJsonObject("order");
        double priceCents = optDouble(placed, side + "_price", optDouble(placed, "yes_price", 0));
        return TradeResult.builder()
                .tradeId(optString(placed, "order_id", ""))
                .platform(platform())
                .status(TradeStatus.COMPLETED)
                .transactionHash(optString(placed, "order_id", null))
                .executedAmount(optDouble(placed, "quantity", 0))
                .executedPrice(priceCents / 100)
                .fee(optDouble(placed, "fee", 0) / 100)
                .timestamp(Instant.now())
                .metadata(Map.of("side", side))
                .build();
    }

    @Override
    protected Map<String, Double> fetchBalance(String token) {
        VenueResponse response = authorizedRequest("GET", url("portfolio", "balance"), null);
        JsonObject json = response.object();
        if (!json.has("balance") || json.get("balance").isJsonNull()) {
            log.warn("Kalshi 查詢餘額失敗: {}", response.errorMessage("no balance"));
            return Map.of();
        }
        if (token != null && !token.isBlank() && !"USD".equalsIgnoreCase(token)) {
            return Map.of();
        }
        return Map.of("USD", json.get("balance").getAsDouble() / 100);
    }

    @Override
    protected double fetchPrice(String symbol) {
        VenueResponse response = authorizedRequest("GET", url("markets", symbol), null);
        JsonObject json = response.object();
        if (!json.has("market") || !json.get("market").isJsonObject()) {
            return 0.0;
        }
        return optDouble(json.getAsJsonObject("market"), "last_price", 0) / 100;
    }

    @Override
    protected Map<String, Object> fetchOrderStatus(String orderId) {
        VenueResponse response = authorizedRequest("GET", url("portfolio", "orders", orderId), null);
        if (response.isTransportFailure()) {
            return Map.of("error", response.getError());
        }
        return toMap(response);
    }

    @Override
    protected boolean requestCancel(String orderId) {
        VenueResponse response = authorizedRequest("DELETE", url("portfolio", "orders", orderId), null);
        JsonObject json = response.object();
        if (!json.has("order") || !json.get("order").isJsonObject()) {
            return false;
        }
        return "canceled".equals(optString(json.getAsJsonObject("order"), "status", null));
    }

    @Override
    protected synchronized void onClose() {
        token = null;
    }

    // ==================== 認證 ====================

    /**
     * 取得快取的 token，沒有就登入一次；登入失敗回傳 null
     */
    synchronized String sessionToken() {
        if (token != null) {
            return token;
        }
        JsonObject credentials = new JsonObject();
        credentials.addProperty("email", email);
        credentials.addProperty("password", password);

        VenueResponse response = send(new Request.Builder()
                .url(url("login"))
                .post(RequestBody.create(gson.toJson(credentials), JSON_MEDIA))
                .build());
        String issued = optString(response.object(), "token", null);
        if (issued == null || issued.isBlank()) {
            log.warn("Kalshi 登入失敗: {}", response.errorMessage("no token"));
            return null;
        }
        token = issued;
        log.info("Kalshi 登入成功");
        return token;
    }

    private synchronized void invalidateToken(String rejected) {
        if (rejected.equals(token)) {
            token = null;
        }
    }

    /**
     * 接在 baseUrl 的路徑後面，每一段各自編碼
     */
    private HttpUrl url(String... segments) {
        HttpUrl.Builder builder = HttpUrl.get(baseUrl).newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder.build();
    }

    private VenueResponse authorizedRequest(String method, HttpUrl url, JsonObject payload) {
        String bearer = sessionToken();
        if (bearer == null) {
            return VenueResponse.failure(AUTH_FAILED);
        }

        RequestBody body = payload != null ? RequestBody.create(gson.toJson(payload), JSON_MEDIA) : null;
        VenueResponse response = send(new Request.Builder()
                .url(url)
                .addHeader("Authorization", "Bearer " + bearer)
                .method(method, body)
                .build());
        if (response.getHttpCode() == 401) {
            log.warn("Kalshi token 已失效，下次呼叫重新登入");
            invalidateToken(bearer);
        }
        return response;
    }

    private static String sideOf(TradeRequest trade) {
        Object side = trade.getMetadata() != null ? trade.getMetadata().get("side") : null;
        return side != null && "no".equalsIgnoreCase(side.toString()) ? "no" : "yes";
    }

    private static long toCents(double dollars) {
        return Math.round(dollars * 100);
    }
}
