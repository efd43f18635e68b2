package com.syrup.trading.config;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 餘額查詢 fan-out 線程池
 *
 * 每個已註冊平台一個任務，平台數量固定且很少（目前 3 個），
 * 所以 core = max = 平台數，多出來的請求排隊等待。
 */
@Slf4j
@Configuration
public class TradingExecutorConfig {

    private static final int POOL_SIZE = 3;

    private ExecutorService balanceFanoutExecutor;

    @Bean(name = "balanceFanoutExecutor")
    public ExecutorService balanceFanoutExecutor() {
        this.balanceFanoutExecutor = new ThreadPoolExecutor(
                POOL_SIZE, POOL_SIZE,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
        log.info("餘額查詢線程池已初始化: size={}", POOL_SIZE);
        return this.balanceFanoutExecutor;
    }

    @PreDestroy
    public void shutdown() {
        if (balanceFanoutExecutor != null) {
            balanceFanoutExecutor.shutdown();
            try {
                if (!balanceFanoutExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                    log.warn("線程池未在 10 秒內關閉，強制終止");
                    balanceFanoutExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                balanceFanoutExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("餘額查詢線程池已關閉");
        }
    }
}
