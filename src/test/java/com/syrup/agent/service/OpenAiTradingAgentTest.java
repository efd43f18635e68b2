package com.syrup.agent.service;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.syrup.agent.config.AgentProperties;
import com.syrup.agent.dto.MarketAnalysis;
import com.syrup.shared.model.AgentConfig;
import com.syrup.shared.model.AgentProvider;
import com.syrup.shared.model.Platform;
import com.syrup.shared.model.TradeRequest;
import com.syrup.shared.model.TradeType;
import okhttp3.Call;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.syrup.support.OkHttpMocks.bodyOf;
import static com.syrup.support.OkHttpMocks.buildResponse;
import static com.syrup.support.OkHttpMocks.mockClient;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * OpenAiTradingAgent 測試
 *
 * 測試重點：請求格式、tool call 解析、錯誤收斂成失敗結果而不拋例外
 */
class OpenAiTradingAgentTest {

    private Call mockCall;
    private OkHttpClient httpClient;
    private OpenAiTradingAgent agent;

    @BeforeEach
    void setUp() {
        mockCall = mock(Call.class);
        httpClient = mockClient(mockCall);
        agent = new OpenAiTradingAgent(config(List.of(Platform.SOLANA, Platform.KALSHI)), "sk-test", httpClient,
                AgentProperties.forBaseUrls("https://openai.test/v1", "https://anthropic.test/v1"));
    }

    private static AgentConfig config(List<Platform> platforms) {
        return AgentConfig.builder()
                .name("alpha")
                .agentType(AgentProvider.OPENAI)
                .model("gpt-4o")
                .systemPrompt("You are a cautious trader.")
                .maxPositionSize(500)
                .riskLimit(0.1)
                .platforms(platforms)
                .build();
    }

    private Request capturedRequest() {
        ArgumentCaptor<Request> captor = ArgumentCaptor.forClass(Request.class);
        verify(httpClient).newCall(captor.capture());
        return captor.getValue();
    }

    private JsonObject capturedBody() throws IOException {
        return JsonParser.parseString(bodyOf(capturedRequest())).getAsJsonObject();
    }

    @Nested
    @DisplayName("analyzeMarket")
    class AnalyzeTests {

        @Test
        @DisplayName("成功：回傳內容、模型與 token 數")
        void success() throws IOException {
            when(mockCall.execute()).thenReturn(buildResponse(200, """
                    {"choices":[{"message":{"role":"assistant","content":"SOL is consolidating."}}],
                     "usage":{"total_tokens":321}}"""));

            MarketAnalysis analysis = agent.analyzeMarket(Map.of("SOL", 142.5), "weekly view");

            assertThat(analysis.isSuccess()).isTrue();
            assertThat(analysis.getAnalysis()).isEqualTo("SOL is consolidating.");
            assertThat(analysis.getModel()).isEqualTo("gpt-4o");
            assertThat(analysis.getTokensUsed()).isEqualTo(321);

            Request request = capturedRequest();
            assertThat(request.url().toString()).isEqualTo("https://openai.test/v1/chat/completions");
            assertThat(request.header("Authorization")).isEqualTo("Bearer sk-test");
        }

        @Test
        @DisplayName("prompt 包含守則、可用平台、市場資料與風險上限")
        void promptContents() throws IOException {
            when(mockCall.execute()).thenReturn(buildResponse(200,
                    "{\"choices\":[{\"message\":{\"content\":\"ok\"}}]}"));

            agent.analyzeMarket(Map.of("SOL", 142.5), "weekly view");

            JsonArray messages = capturedBody().getAsJsonArray("messages");
            String system = messages.get(0).getAsJsonObject().get("content").getAsString();
            String user = messages.get(1).getAsJsonObject().get("content").getAsString();

            assertThat(system).startsWith("You are a cautious trader.")
                    .contains("Trading Guidelines:")
                    .endsWith("Available Platforms: solana, kalshi");
            assertThat(user).contains("Market Data:\n- SOL: 142.5")
                    .contains("Max Position Size: 500.0")
                    .contains("Risk Limit: 10.0%")
                    .contains("weekly view")
                    .endsWith("Provide market analysis and insights.");
            assertThat(capturedBody().get("temperature").getAsDouble()).isEqualTo(0.7);
        }

        @Test
        @DisplayName("HTTP 錯誤：不拋例外，error 帶供應商訊息")
        void providerError() throws IOException {
            when(mockCall.execute()).thenReturn(buildResponse(429,
                    "{\"error\":{\"message\":\"Rate limit reached\"}}"));

            MarketAnalysis analysis = agent.analyzeMarket(Map.of(), null);

            assertThat(analysis.isSuccess()).isFalse();
            assertThat(analysis.getError()).contains("429").contains("Rate limit reached");
        }

        @Test
        @DisplayName("連線失敗：不拋例外")
        void networkError() throws IOException {
            when(mockCall.execute()).thenThrow(new IOException("timeout"));

            assertThat(agent.analyzeMarket(Map.of(), null).getError()).isEqualTo("timeout");
        }
    }

    @Nested
    @DisplayName("generateTradeDecision")
    class DecisionTests {

        @Test
        @DisplayName("tool call：轉成 TradeRequest")
        void toolCall() throws IOException {
            when(mockCall.execute()).thenReturn(buildResponse(200, """
                    {"choices":[{"message":{"content":null,"tool_calls":[{"id":"call_1","type":"function",
                      "function":{"name":"execute_trade",
                        "arguments":"{\\"platform\\":\\"solana\\",\\"trade_type\\":\\"swap\\",\\"symbol\\":\\"SOL/USDC\\",\\"amount\\":0.25,\\"reasoning\\":\\"breakout\\"}"}}]}}]}"""));

            Optional<TradeRequest> decision = agent.generateTradeDecision(
                    Map.of("SOL", 150), Map.of("USDC", 1000), "");

            assertThat(decision).isPresent();
            assertThat(decision.get().getPlatform()).isEqualTo(Platform.SOLANA);
            assertThat(decision.get().getTradeType()).isEqualTo(TradeType.SWAP);
            assertThat(decision.get().getAmount()).isEqualTo(0.25);
            assertThat(decision.get().getMetadata()).containsEntry("reasoning", "breakout");

            JsonObject body = capturedBody();
            assertThat(body.get("tool_choice").getAsString()).isEqualTo("auto");
            assertThat(body.get("temperature").getAsDouble()).isEqualTo(0.3);
            String user = body.getAsJsonArray("messages").get(1).getAsJsonObject().get("content").getAsString();
            assertThat(user).contains("Portfolio:\n- USDC: 1000")
                    .endsWith("Should we execute a trade? If yes, provide trade details.");
        }

        @Test
        @DisplayName("舊版 function_call 也能解析")
        void legacyFunctionCall() throws IOException {
            when(mockCall.execute()).thenReturn(buildResponse(200, """
                    {"choices":[{"message":{"function_call":{"name":"execute_trade",
                      "arguments":"{\\"platform\\":\\"kalshi\\",\\"trade_type\\":\\"buy\\",\\"symbol\\":\\"FED\\",\\"amount\\":2,\\"price\\":0.4}"}}}]}"""));

            assertThat(agent.generateTradeDecision(Map.of(), Map.of(), null))
                    .hasValueSatisfying(trade -> assertThat(trade.getPrice()).isEqualTo(0.4));
        }

        @Test
        @DisplayName("沒有 tool call：不交易")
        void plainTextMeansHold() throws IOException {
            when(mockCall.execute()).thenReturn(buildResponse(200,
                    "{\"choices\":[{\"message\":{\"content\":\"I would wait for confirmation.\"}}]}"));

            assertThat(agent.generateTradeDecision(Map.of(), Map.of(), null)).isEmpty();
        }

        @Test
        @DisplayName("呼叫其他 function：不交易")
        void unknownFunction() throws IOException {
            when(mockCall.execute()).thenReturn(buildResponse(200, """
                    {"choices":[{"message":{"tool_calls":[{"function":{"name":"get_weather","arguments":"{}"}}]}}]}"""));

            assertThat(agent.generateTradeDecision(Map.of(), Map.of(), null)).isEmpty();
        }

        @Test
        @DisplayName("供應商錯誤：不交易、不拋例外")
        void providerErrorMeansNoTrade() throws IOException {
            when(mockCall.execute()).thenReturn(buildResponse(500, "{\"error\":{\"message\":\"server\"}}"));

            assertThat(agent.generateTradeDecision(Map.of(), Map.of(), null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("tool schema")
    class ToolSchemaTests {

        @Test
        @DisplayName("platform enum 只列出允許的平台")
        void restrictedPlatforms() {
            JsonObject parameters = agent.tradeTool().getAsJsonObject("function").getAsJsonObject("parameters");
            JsonArray platforms = parameters.getAsJsonObject("properties")
                    .getAsJsonObject("platform").getAsJsonArray("enum");

            assertThat(platforms).hasSize(2);
            assertThat(platforms.get(0).getAsString()).isEqualTo("solana");
            assertThat(platforms.get(1).getAsString()).isEqualTo("kalshi");
            assertThat(parameters.getAsJsonArray("required").toString())
                    .isEqualTo("[\"platform\",\"trade_type\",\"symbol\",\"amount\"]");
        }

        @Test
        @DisplayName("沒有限制平台：列出全部")
        void allPlatformsWhenUnrestricted() {
            OpenAiTradingAgent open = new OpenAiTradingAgent(config(List.of()), "sk-test", httpClient,
                    AgentProperties.forBaseUrls("https://openai.test/v1", "https://anthropic.test/v1"));

            JsonArray platforms = open.tradeTool().getAsJsonObject("function").getAsJsonObject("parameters")
                    .getAsJsonObject("properties").getAsJsonObject("platform").getAsJsonArray("enum");

            assertThat(platforms).hasSize(Platform.values().length);
        }
    }

    @Nested
    @DisplayName("streamAnalysis")
    class StreamTests {

        @Test
        @DisplayName("stream=true，片段依序輸出")
        void streamsChunks() throws IOException {
            when(mockCall.execute()).thenReturn(buildResponse(200, """
                    data: {"choices":[{"delta":{"content":"Bull"}}]}

                    data: {"choices":[{"delta":{"content":"ish"}}]}

                    data: [DONE]

                    """, "text/event-stream"));

            List<String> chunks = new ArrayList<>();
            try (AnalysisStream stream = agent.streamAnalysis(Map.of("SOL", 150), "")) {
                stream.forEachRemaining(chunks::add);
            }

            assertThat(chunks).containsExactly("Bull", "ish");
            assertThat(capturedBody().get("stream").getAsBoolean()).isTrue();
        }

        @Test
        @DisplayName("decodeChunk：error 物件轉成錯誤片段")
        void decodeError() {
            AnalysisStream.Chunk chunk = OpenAiTradingAgent.decodeChunk(null,
                    "{\"error\":{\"message\":\"quota exceeded\"}}");

            assertThat(chunk.error()).isEqualTo("quota exceeded");
        }
    }
}
