package com.syrup.agent.service;

import com.syrup.shared.exception.AgentNotFoundException;
import com.syrup.shared.model.AgentConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 以名稱管理已建立的 agent（只存在記憶體，重啟後需重新建立）
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AgentRegistry {

    private final TradingAgentFactory agentFactory;

    private final Map<String, TradingAgent> agents = new ConcurrentHashMap<>();

    /**
     * 同名的 agent 會被取代
     */
    public TradingAgent create(AgentConfig config) {
        TradingAgent agent = agentFactory.create(config);
        TradingAgent previous = agents.put(config.getName(), agent);
        if (previous != null) {
            log.info("Agent 已取代: {}", config.getName());
        } else {
            log.info("Agent 已建立: name={} type={} model={}",
                    config.getName(), config.getAgentType(), config.getModel());
        }
        return agent;
    }

    public TradingAgent get(String name) {
        TradingAgent agent = agents.get(name);
        if (agent == null) {
            throw new AgentNotFoundException(name);
        }
        return agent;
    }

    public List<TradingAgent> list() {
        return agents.values().stream()
                .sorted(Comparator.comparing(TradingAgent::name))
                .toList();
    }

    public void delete(String name) {
        if (agents.remove(name) == null) {
            throw new AgentNotFoundException(name);
        }
        log.info("Agent 已刪除: {}", name);
    }
}
