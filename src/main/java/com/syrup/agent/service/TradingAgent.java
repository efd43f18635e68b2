package com.syrup.agent.service;

import com.syrup.agent.dto.MarketAnalysis;
import com.syrup.shared.model.AgentConfig;
import com.syrup.shared.model.TradeRequest;

import java.util.Map;
import java.util.Optional;

/**
 * AI 交易 agent
 * 三個操作都不拋例外：失敗分別回傳 error 分析、empty、"Error:" 片段
 */
public interface TradingAgent {

    AgentConfig config();

    default String name() {
        return config().getName();
    }

    MarketAnalysis analyzeMarket(Map<String, Object> marketData, String context);

    /**
     * @return 要執行的交易；empty = 不交易（明確 hold 或模型輸出無法解析，呼叫端無法區分）
     */
    Optional<TradeRequest> generateTradeDecision(Map<String, Object> marketData,
                                                 Map<String, Object> portfolio,
                                                 String context);

    /**
     * 呼叫端負責 close（或讀到結束）
     */
    AnalysisStream streamAnalysis(Map<String, Object> marketData, String context);
}
