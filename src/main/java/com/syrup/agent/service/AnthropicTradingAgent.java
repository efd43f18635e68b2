package com.syrup.agent.service;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.syrup.agent.config.AgentProperties;
import com.syrup.agent.dto.MarketAnalysis;
import com.syrup.shared.model.AgentConfig;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;

/**
 * Anthropic Messages API agent
 *
 * 交易決策要求模型在回覆中放一個 JSON 物件（action = trade / hold），
 * 由 TradeDecisionParser 從文字中找出並驗證。
 */
@Slf4j
public class AnthropicTradingAgent extends AbstractTradingAgent {

    static final String DECISION_FORMAT = """


            If you decide to execute a trade, respond with a JSON object in this format:
            {
              "action": "trade",
              "platform": "solana|polymarket|kalshi",
              "trade_type": "buy|sell|swap",
              "symbol": "symbol/market identifier",
              "amount": 0.0,
              "price": 0.0 (optional),
              "slippage": 0.01,
              "reasoning": "your reasoning"
            }

            If you decide not to trade, respond with:
            {
              "action": "hold",
              "reasoning": "your reasoning"
            }
            """;

    public AnthropicTradingAgent(AgentConfig config, String apiKey, OkHttpClient baseClient,
                                 AgentProperties properties) {
        super(config, apiKey, baseClient, properties);
    }

    @Override
    protected MarketAnalysis requestAnalysis(String systemPrompt, String userMessage) throws ModelCallException {
        JsonObject body = messagesBody(systemPrompt, userMessage,
                properties.getAnalysisMaxTokens(), properties.getAnalysisTemperature());
        JsonObject response = execute(messagesRequest(body));

        int tokens = 0;
        if (response.has("usage") && response.get("usage").isJsonObject()) {
            JsonObject usage = response.getAsJsonObject("usage");
            tokens = (usage.has("input_tokens") ? usage.get("input_tokens").getAsInt() : 0)
                    + (usage.has("output_tokens") ? usage.get("output_tokens").getAsInt() : 0);
        }
        return MarketAnalysis.builder()
                .analysis(textOf(response))
                .model(config.getModel())
                .tokensUsed(tokens)
                .build();
    }

    @Override
    protected DecisionOutcome requestDecision(String systemPrompt, String userMessage) throws ModelCallException {
        JsonObject body = messagesBody(systemPrompt + DECISION_FORMAT, userMessage,
                properties.getDecisionMaxTokens(), properties.getDecisionTemperature());
        String text = textOf(execute(messagesRequest(body)));
        return decisionParser.parseText(text);
    }

    @Override
    protected AnalysisStream openStream(String systemPrompt, String userMessage) {
        JsonObject body = messagesBody(systemPrompt, userMessage,
                properties.getAnalysisMaxTokens(), properties.getAnalysisTemperature());
        body.addProperty("stream", true);
        return new AnalysisStream(httpClient.newCall(messagesRequest(body)), AnthropicTradingAgent::decodeChunk);
    }

    /**
     * 只取 content_block_delta 的 text_delta；message_stop 結束；error 事件轉成錯誤片段
     */
    static AnalysisStream.Chunk decodeChunk(String event, String data) {
        JsonObject json = JsonParser.parseString(data).getAsJsonObject();
        String type = json.has("type") ? json.get("type").getAsString() : event;
        if (type == null) {
            return AnalysisStream.Chunk.SKIP;
        }
        switch (type) {
            case "content_block_delta": {
                JsonObject delta = json.getAsJsonObject("delta");
                if (delta != null && "text_delta".equals(delta.get("type").getAsString())) {
                    return AnalysisStream.Chunk.text(delta.get("text").getAsString());
                }
                return AnalysisStream.Chunk.SKIP;
            }
            case "message_stop":
                return AnalysisStream.Chunk.END;
            case "error": {
                JsonElement error = json.get("error");
                return AnalysisStream.Chunk.error(error != null && error.isJsonObject()
                        && error.getAsJsonObject().has("message")
                        ? error.getAsJsonObject().get("message").getAsString() : data);
            }
            default:
                return AnalysisStream.Chunk.SKIP;
        }
    }

    // ==================== Request ====================

    private JsonObject messagesBody(String systemPrompt, String userMessage, int maxTokens, double temperature) {
        JsonObject user = new JsonObject();
        user.addProperty("role", "user");
        user.addProperty("content", userMessage);
        JsonArray messages = new JsonArray();
        messages.add(user);

        JsonObject body = new JsonObject();
        body.addProperty("model", config.getModel());
        body.addProperty("max_tokens", maxTokens);
        body.addProperty("system", systemPrompt);
        body.add("messages", messages);
        body.addProperty("temperature", temperature);
        return body;
    }

    private Request messagesRequest(JsonObject body) {
        return new Request.Builder()
                .url(properties.getAnthropicBaseUrl() + "/messages")
                .addHeader("x-api-key", apiKey)
                .addHeader("anthropic-version", properties.getAnthropicVersion())
                .post(RequestBody.create(gson.toJson(body), JSON_MEDIA))
                .build();
    }

    /**
     * 串接所有 text 類型的 content block
     */
    private static String textOf(JsonObject response) {
        JsonArray content = response.getAsJsonArray("content");
        if (content == null) {
            return "";
        }
        StringBuilder text = new StringBuilder();
        for (JsonElement block : content) {
            JsonObject obj = block.getAsJsonObject();
            if (obj.has("type") && "text".equals(obj.get("type").getAsString()) && obj.has("text")) {
                text.append(obj.get("text").getAsString());
            }
        }
        return text.toString();
    }
}
