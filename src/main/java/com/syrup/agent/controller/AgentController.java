package com.syrup.agent.controller;

import com.syrup.agent.dto.MarketAnalysis;
import com.syrup.agent.dto.TradeDecisionRequest;
import com.syrup.agent.service.AgentRegistry;
import com.syrup.agent.service.AnalysisStream;
import com.syrup.agent.service.TradingAgent;
import com.syrup.shared.model.AgentConfig;
import com.syrup.shared.model.Platform;
import com.syrup.shared.model.TradeRequest;
import com.syrup.shared.model.TradeResult;
import com.syrup.trading.service.TradeRouter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * AI agent API
 *
 * agent 只負責產生決策，要不要真的下單由呼叫端的 execute 參數決定，
 * 下單一律經過 TradeRouter。
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AgentController {

    private final AgentRegistry agentRegistry;
    private final TradeRouter tradeRouter;

    /**
     * 建立 agent
     * POST /api/agent/create
     * Body: { "name": "alpha", "agent_type": "anthropic", "model": "...", "platforms": ["solana"] }
     */
    @PostMapping("/agent/create")
    public ResponseEntity<Map<String, Object>> create(@Valid @RequestBody AgentConfig config) {
        agentRegistry.create(config);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "agent_name", config.getName(),
                "agent_type", config.getAgentType(),
                "message", "Agent created successfully"));
    }

    /**
     * 市場分析
     * POST /api/agent/{name}/analyze?context=...
     * Body: 市場資料 { "SOL": 142.5, "volume_24h": "1.2B" }
     */
    @PostMapping("/agent/{name}/analyze")
    public ResponseEntity<Map<String, Object>> analyze(
            @PathVariable String name,
            @RequestBody(required = false) Map<String, Object> marketData,
            @RequestParam(defaultValue = "") String context) {
        TradingAgent agent = agentRegistry.get(name);
        MarketAnalysis analysis = agent.analyzeMarket(orEmpty(marketData), context);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "agent", name,
                "analysis", analysis));
    }

    /**
     * 交易決策（execute=true 時直接下單）
     * POST /api/agent/{name}/trade?execute=true
     * Body: { "market_data": {...}, "portfolio": {...} }
     */
    @PostMapping("/agent/{name}/trade")
    public ResponseEntity<Map<String, Object>> trade(
            @PathVariable String name,
            @RequestBody(required = false) TradeDecisionRequest body,
            @RequestParam(defaultValue = "") String context,
            @RequestParam(defaultValue = "false") boolean execute) {
        TradingAgent agent = agentRegistry.get(name);
        Map<String, Object> marketData = body != null ? orEmpty(body.getMarketData()) : Map.of();
        Map<String, Object> portfolio = body != null ? orEmpty(body.getPortfolio()) : Map.of();

        Optional<TradeRequest> decision = agent.generateTradeDecision(marketData, portfolio, context);
        if (decision.isEmpty()) {
            return ResponseEntity.ok(Map.of(
                    "success", true,
                    "agent", name,
                    "decision", "hold",
                    "message", "Agent decided not to trade"));
        }

        TradeResult result = null;
        if (execute) {
            log.info("Agent {} 決策執行下單: {}", name, decision.get());
            result = tradeRouter.executeTrade(decision.get());
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("agent", name);
        response.put("decision", "trade");
        response.put("trade_request", decision.get());
        response.put("execution_result", result);
        return ResponseEntity.ok(response);
    }

    /**
     * 串流分析（SSE）
     * POST /api/agent/{name}/stream
     * 每個片段輸出成 "data: <chunk>\n\n"
     */
    @PostMapping(value = "/agent/{name}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<StreamingResponseBody> stream(
            @PathVariable String name,
            @RequestBody(required = false) Map<String, Object> marketData,
            @RequestParam(defaultValue = "") String context) {
        TradingAgent agent = agentRegistry.get(name);
        Map<String, Object> data = orEmpty(marketData);

        StreamingResponseBody body = out -> {
            try (AnalysisStream chunks = agent.streamAnalysis(data, context)) {
                while (chunks.hasNext()) {
                    out.write(("data: " + chunks.next() + "\n\n").getBytes(StandardCharsets.UTF_8));
                    out.flush();
                }
            }
        };
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .body(body);
    }

    /**
     * GET /api/agents
     */
    @GetMapping("/agents")
    public ResponseEntity<Map<String, Object>> list() {
        List<Map<String, Object>> agents = agentRegistry.list().stream()
                .map(agent -> Map.<String, Object>of(
                        "name", agent.name(),
                        "type", agent.config().getAgentType(),
                        "platforms", platformsOf(agent.config())))
                .toList();
        return ResponseEntity.ok(Map.of("success", true, "agents", agents));
    }

    /**
     * DELETE /api/agent/{name}
     */
    @DeleteMapping("/agent/{name}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable String name) {
        agentRegistry.delete(name);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "Agent " + name + " deleted"));
    }

    private static List<Platform> platformsOf(AgentConfig config) {
        return config.getPlatforms() != null ? config.getPlatforms() : List.of();
    }

    private static Map<String, Object> orEmpty(Map<String, Object> map) {
        return map != null ? map : Map.of();
    }
}
