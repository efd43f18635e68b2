package com.syrup.agent.service;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.syrup.agent.config.AgentProperties;
import com.syrup.agent.dto.MarketAnalysis;
import com.syrup.shared.model.AgentConfig;
import com.syrup.shared.model.Platform;
import com.syrup.shared.model.TradeType;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;

import java.util.Arrays;
import java.util.List;

/**
 * OpenAI Chat Completions agent
 *
 * 交易決策走 tool calling：定義 execute_trade function，
 * 模型呼叫它就代表要交易，arguments 交給 TradeDecisionParser 驗證。
 */
@Slf4j
public class OpenAiTradingAgent extends AbstractTradingAgent {

    static final String TRADE_FUNCTION = "execute_trade";

    public OpenAiTradingAgent(AgentConfig config, String apiKey, OkHttpClient baseClient,
                              AgentProperties properties) {
        super(config, apiKey, baseClient, properties);
    }

    @Override
    protected String decisionQuestion() {
        return "Should we execute a trade? If yes, provide trade details.";
    }

    @Override
    protected MarketAnalysis requestAnalysis(String systemPrompt, String userMessage) throws ModelCallException {
        JsonObject body = chatBody(systemPrompt, userMessage, properties.getAnalysisTemperature());
        JsonObject response = execute(chatRequest(body));

        JsonObject message = firstMessage(response);
        int tokens = 0;
        if (response.has("usage") && response.get("usage").isJsonObject()) {
            JsonObject usage = response.getAsJsonObject("usage");
            tokens = usage.has("total_tokens") ? usage.get("total_tokens").getAsInt() : 0;
        }
        return MarketAnalysis.builder()
                .analysis(textOf(message.get("content")))
                .model(config.getModel())
                .tokensUsed(tokens)
                .build();
    }

    @Override
    protected DecisionOutcome requestDecision(String systemPrompt, String userMessage) throws ModelCallException {
        JsonObject body = chatBody(systemPrompt, userMessage, properties.getDecisionTemperature());
        JsonArray tools = new JsonArray();
        tools.add(tradeTool());
        body.add("tools", tools);
        body.addProperty("tool_choice", "auto");

        JsonObject message = firstMessage(execute(chatRequest(body)));

        // 新版 tool_calls，舊版 function_call
        JsonObject function = null;
        if (message.has("tool_calls") && message.get("tool_calls").isJsonArray()
                && !message.getAsJsonArray("tool_calls").isEmpty()) {
            function = message.getAsJsonArray("tool_calls").get(0).getAsJsonObject().getAsJsonObject("function");
        } else if (message.has("function_call") && message.get("function_call").isJsonObject()) {
            function = message.getAsJsonObject("function_call");
        }

        if (function == null) {
            return DecisionOutcome.hold(textOf(message.get("content")));
        }
        String name = function.has("name") ? function.get("name").getAsString() : null;
        if (!TRADE_FUNCTION.equals(name)) {
            return DecisionOutcome.rejected(DecisionOutcome.Kind.INVALID_FIELD, "unknown function: " + name);
        }
        String arguments = function.has("arguments") ? function.get("arguments").getAsString() : "";
        return decisionParser.parseToolArguments(arguments);
    }

    @Override
    protected AnalysisStream openStream(String systemPrompt, String userMessage) {
        JsonObject body = chatBody(systemPrompt, userMessage, properties.getAnalysisTemperature());
        body.addProperty("stream", true);
        return new AnalysisStream(httpClient.newCall(chatRequest(body)), OpenAiTradingAgent::decodeChunk);
    }

    /**
     * data: {"choices":[{"delta":{"content":"..."}}]}，最後一筆是 data: [DONE]
     */
    static AnalysisStream.Chunk decodeChunk(String event, String data) {
        if ("[DONE]".equals(data)) {
            return AnalysisStream.Chunk.END;
        }
        JsonObject json = JsonParser.parseString(data).getAsJsonObject();
        if (json.has("error")) {
            JsonElement error = json.get("error");
            return AnalysisStream.Chunk.error(error.isJsonObject() && error.getAsJsonObject().has("message")
                    ? error.getAsJsonObject().get("message").getAsString() : error.toString());
        }
        JsonArray choices = json.getAsJsonArray("choices");
        if (choices == null || choices.isEmpty()) {
            return AnalysisStream.Chunk.SKIP;
        }
        JsonObject delta = choices.get(0).getAsJsonObject().getAsJsonObject("delta");
        if (delta == null || !delta.has("content") || delta.get("content").isJsonNull()) {
            return AnalysisStream.Chunk.SKIP;
        }
        return AnalysisStream.Chunk.text(delta.get("content").getAsString());
    }

    // ==================== Request ====================

    private JsonObject chatBody(String systemPrompt, String userMessage, double temperature) {
        JsonArray messages = new JsonArray();
        messages.add(message("system", systemPrompt));
        messages.add(message("user", userMessage));

        JsonObject body = new JsonObject();
        body.addProperty("model", config.getModel());
        body.add("messages", messages);
        body.addProperty("temperature", temperature);
        return body;
    }

    private Request chatRequest(JsonObject body) {
        return new Request.Builder()
                .url(properties.getOpenaiBaseUrl() + "/chat/completions")
                .addHeader("Authorization", "Bearer " + apiKey)
                .post(RequestBody.create(gson.toJson(body), JSON_MEDIA))
                .build();
    }

    /**
     * execute_trade 的 JSON schema，platform 只列出這個 agent 允許的平台
     */
    JsonObject tradeTool() {
        JsonObject fields = new JsonObject();
        List<Platform> platforms = allowedPlatforms().isEmpty() ? Arrays.asList(Platform.values()) : allowedPlatforms();
        fields.add("platform", enumProperty("Trading platform",
                platforms.stream().map(Platform::getValue).toList()));
        fields.add("trade_type", enumProperty("Type of trade",
                Arrays.stream(TradeType.values()).map(TradeType::getValue).toList()));
        fields.add("symbol", typedProperty("string", "Trading symbol or market identifier"));
        fields.add("amount", typedProperty("number", "Amount to trade"));
        fields.add("price", typedProperty("number", "Limit price (optional for market orders)"));
        fields.add("slippage", typedProperty("number", "Acceptable slippage (0-1)"));
        fields.add("reasoning", typedProperty("string", "Reasoning for this trade"));

        JsonArray required = new JsonArray();
        List.of("platform", "trade_type", "symbol", "amount").forEach(required::add);

        JsonObject parameters = new JsonObject();
        parameters.addProperty("type", "object");
        parameters.add("properties", fields);
        parameters.add("required", required);

        JsonObject function = new JsonObject();
        function.addProperty("name", TRADE_FUNCTION);
        function.addProperty("description", "Execute a trade on a supported platform");
        function.add("parameters", parameters);

        JsonObject tool = new JsonObject();
        tool.addProperty("type", "function");
        tool.add("function", function);
        return tool;
    }

    private static JsonObject enumProperty(String description, List<String> values) {
        JsonObject property = typedProperty("string", description);
        JsonArray enumValues = new JsonArray();
        values.forEach(enumValues::add);
        property.add("enum", enumValues);
        return property;
    }

    private static JsonObject typedProperty(String type, String description) {
        JsonObject property = new JsonObject();
        property.addProperty("type", type);
        property.addProperty("description", description);
        return property;
    }

    private static JsonObject message(String role, String content) {
        JsonObject message = new JsonObject();
        message.addProperty("role", role);
        message.addProperty("content", content);
        return message;
    }

    /**
     * choices[0].message
     */
    private static JsonObject firstMessage(JsonObject response) throws ModelCallException {
        JsonArray choices = response.getAsJsonArray("choices");
        if (choices == null || choices.isEmpty()) {
            throw new ModelCallException("OpenAI response has no choices");
        }
        JsonObject message = choices.get(0).getAsJsonObject().getAsJsonObject("message");
        if (message == null) {
            throw new ModelCallException("OpenAI response has no message");
        }
        return message;
    }

    private static String textOf(JsonElement content) {
        return content == null || content.isJsonNull() ? "" : content.getAsString();
    }
}
