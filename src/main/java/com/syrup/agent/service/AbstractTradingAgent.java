package com.syrup.agent.service;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.syrup.agent.config.AgentProperties;
import com.syrup.agent.dto.MarketAnalysis;
import com.syrup.shared.model.AgentConfig;
import com.syrup.shared.model.Platform;
import com.syrup.shared.model.TradeRequest;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * TradingAgent 共用骨架
 *
 * 負責 prompt 組裝（system prompt + 交易守則 + 可用平台、市場資料 context）
 * 以及把供應商錯誤收斂在這一層，子類別只處理各家 API 的格式。
 */
@Slf4j
public abstract class AbstractTradingAgent implements TradingAgent {

    protected static final MediaType JSON_MEDIA = MediaType.get("application/json; charset=utf-8");

    private static final String TRADING_GUIDELINES = """


            Trading Guidelines:
            - Always consider risk management and position sizing
            - Analyze market conditions before making decisions
            - Consider slippage and fees in trade calculations
            - Never exceed maximum position size or risk limits
            - Provide clear reasoning for each trade decision

            Available Platforms:\s""";

    protected final AgentConfig config;
    protected final String apiKey;
    protected final AgentProperties properties;
    protected final OkHttpClient httpClient;
    protected final TradeDecisionParser decisionParser = new TradeDecisionParser();
    protected final Gson gson = new Gson();

    protected AbstractTradingAgent(AgentConfig config, String apiKey, OkHttpClient baseClient,
                                   AgentProperties properties) {
        this.config = config;
        this.apiKey = apiKey;
        this.properties = properties;
        // AI 回應較慢，延長 readTimeout
        this.httpClient = baseClient.newBuilder()
                .readTimeout(properties.getReadTimeoutSeconds(), TimeUnit.SECONDS)
                .build();
    }

    protected abstract MarketAnalysis requestAnalysis(String systemPrompt, String userMessage)
            throws ModelCallException;

    protected abstract DecisionOutcome requestDecision(String systemPrompt, String userMessage)
            throws ModelCallException;

    protected abstract AnalysisStream openStream(String systemPrompt, String userMessage);

    @Override
    public AgentConfig config() {
        return config;
    }

    // ==================== 對外介面 ====================

    @Override
    public final MarketAnalysis analyzeMarket(Map<String, Object> marketData, String context) {
        String userMessage = buildTradeContext(marketData, null)
                + "\n\n" + nullToEmpty(context) + "\n\nProvide market analysis and insights.";
        try {
            MarketAnalysis analysis = requestAnalysis(buildSystemPrompt(), userMessage);
            log.info("Agent {} 市場分析完成: model={} tokens={}",
                    name(), analysis.getModel(), analysis.getTokensUsed());
            return analysis;
        } catch (ModelCallException | RuntimeException e) {
            log.warn("Agent {} 市場分析失敗: {}", name(), e.getMessage());
            return MarketAnalysis.failed(messageOf(e));
        }
    }

    @Override
    public final Optional<TradeRequest> generateTradeDecision(Map<String, Object> marketData,
                                                            Map<String, Object> portfolio,
                                                            String context) {
        String userMessage = buildTradeContext(marketData, portfolio)
                + "\n\n" + nullToEmpty(context) + "\n\n" + decisionQuestion();
        DecisionOutcome outcome;
        try {
            outcome = requestDecision(buildSystemPrompt(), userMessage);
        } catch (ModelCallException | RuntimeException e) {
            outcome = DecisionOutcome.rejected(DecisionOutcome.Kind.PROVIDER_ERROR, messageOf(e));
        }

        switch (outcome.kind()) {
            case TRADE -> log.info("Agent {} 決定交易: {}", name(), outcome.trade());
            case HOLD -> log.info("Agent {} 決定不交易: {}", name(), outcome.detail());
            default -> log.warn("Agent {} 決策無法解析，視為不交易: kind={} detail={}",
                    name(), outcome.kind(), outcome.detail());
        }
        return outcome.toTrade();
    }

    @Override
    public final AnalysisStream streamAnalysis(Map<String, Object> marketData, String context) {
        String userMessage = buildTradeContext(marketData, null)
                + "\n\n" + nullToEmpty(context) + "\n\nProvide detailed market analysis.";
        try {
            return openStream(buildSystemPrompt(), userMessage);
        } catch (RuntimeException e) {
            log.warn("Agent {} 串流分析建立失敗: {}", name(), e.getMessage());
            return AnalysisStream.failed(messageOf(e));
        }
    }

    /**
     * 決策請求最後一句，依供應商的輸出方式不同
     */
    protected String decisionQuestion() {
        return "Should we execute a trade?";
    }

    // ==================== Prompt ====================

    protected String buildSystemPrompt() {
        return config.getSystemPrompt() + TRADING_GUIDELINES + platformList();
    }

    protected String platformList() {
        return allowedPlatforms().stream().map(Platform::getValue).collect(Collectors.joining(", "));
    }

    protected List<Platform> allowedPlatforms() {
        return config.getPlatforms() != null ? config.getPlatforms() : List.of();
    }

    /**
     * Market Data: / Portfolio: 逐行列出，最後附上部位上限與風險上限
     */
    protected String buildTradeContext(Map<String, Object> marketData, Map<String, Object> portfolio) {
        StringBuilder sb = new StringBuilder("Market Data:");
        if (marketData != null) {
            marketData.forEach((key, value) -> sb.append("\n- ").append(key).append(": ").append(value));
        }
        if (portfolio != null && !portfolio.isEmpty()) {
            sb.append("\n\nPortfolio:");
            portfolio.forEach((key, value) -> sb.append("\n- ").append(key).append(": ").append(value));
        }
        sb.append("\n\nMax Position Size: ").append(config.getMaxPositionSize());
        sb.append("\nRisk Limit: ").append(config.getRiskLimit() * 100).append("%");
        return sb.toString();
    }

    // ==================== HTTP ====================

    /**
     * 同步呼叫並回傳 JSON；HTTP 非 2xx 時以供應商的錯誤訊息拋出
     */
    protected JsonObject execute(Request request) throws ModelCallException {
        try (Response response = httpClient.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                log.warn("Agent {} API 回應異常: HTTP {} - {}", name(), response.code(), body);
                throw new ModelCallException("HTTP " + response.code() + ": " + providerError(body));
            }
            JsonElement json = JsonParser.parseString(body);
            if (!json.isJsonObject()) {
                throw new ModelCallException("Unexpected response: " + body);
            }
            return json.getAsJsonObject();
        } catch (IOException e) {
            throw new ModelCallException(messageOf(e), e);
        } catch (JsonParseException e) {
            throw new ModelCallException("Invalid JSON response: " + e.getMessage(), e);
        }
    }

    /**
     * 兩家供應商的錯誤格式都是 {"error": {"message": ...}}
     */
    protected static String providerError(String body) {
        try {
            JsonElement json = JsonParser.parseString(body);
            if (json.isJsonObject() && json.getAsJsonObject().has("error")) {
                JsonElement error = json.getAsJsonObject().get("error");
                if (error.isJsonObject() && error.getAsJsonObject().has("message")) {
                    return error.getAsJsonObject().get("message").getAsString();
                }
                return error.toString();
            }
        } catch (JsonParseException e) {
            log.debug("錯誤回應不是 JSON: {}", e.getMessage());
        }
        return body;
    }

    protected static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }
}
