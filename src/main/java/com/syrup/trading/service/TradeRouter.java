package com.syrup.trading.service;

import com.syrup.shared.model.Platform;
import com.syrup.shared.model.PlatformCredentials;
import com.syrup.shared.model.TradeRequest;
import com.syrup.shared.model.TradeResult;
import com.syrup.trading.config.VenueConfig;
import com.syrup.trading.platform.PlatformAdapter;
import com.syrup.trading.platform.PlatformAdapterFactory;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * 交易路由：平台 → adapter 的註冊表
 *
 * 每個平台最多一個 adapter。所有操作都以 TradeRequest / 參數中的平台查表後委派，
 * 未註冊的平台不拋例外，回傳 FAILED 結果或 sentinel 值。
 *
 * 同一平台重新註冊時，舊 adapter 會被關閉（釋放連線）。
 */
@Slf4j
@Service
public class TradeRouter {

    private final PlatformAdapterFactory adapterFactory;
    private final ExecutorService balanceFanoutExecutor;
    private final long fanoutTimeoutSeconds;

    private final Map<Platform, PlatformAdapter> adapters = new ConcurrentHashMap<>();

    public TradeRouter(
            PlatformAdapterFactory adapterFactory,
            @Qualifier("balanceFanoutExecutor") ExecutorService balanceFanoutExecutor,
            VenueConfig venueConfig) {
        this.adapterFactory = adapterFactory;
        this.balanceFanoutExecutor = balanceFanoutExecutor;
        this.fanoutTimeoutSeconds = venueConfig.getBalanceFanoutTimeoutSeconds();
    }

    // ==================== 註冊 ====================

    /**
     * 建立並註冊平台 adapter，取代既有的同平台 adapter
     *
     * @throws com.syrup.shared.exception.UnsupportedPlatformException 沒有對應實作
     * @throws com.syrup.shared.exception.InvalidCredentialsException  憑證格式錯誤
     */
    public void registerPlatform(PlatformCredentials credentials) {
        PlatformAdapter adapter = adapterFactory.create(credentials);
        PlatformAdapter previous = adapters.put(credentials.getPlatform(), adapter);
        if (previous != null && previous != adapter) {
            closeQuietly(previous);
            log.info("平台重新註冊，舊連線已關閉: {}", credentials.getPlatform());
        }
        log.info("平台已註冊: {}", credentials.getPlatform());
    }

    /**
     * 未註冊時不做任何事
     */
    public void unregisterPlatform(Platform platform) {
        PlatformAdapter removed = adapters.remove(platform);
        if (removed != null) {
            closeQuietly(removed);
            log.info("平台已移除: {}", platform);
        }
    }

    public Set<Platform> registeredPlatforms() {
        return Set.copyOf(adapters.keySet());
    }

    public boolean isRegistered(Platform platform) {
        return adapters.containsKey(platform);
    }

    // ==================== 委派 ====================

    public TradeResult executeTrade(TradeRequest trade) {
        PlatformAdapter adapter = adapters.get(trade.getPlatform());
        if (adapter == null) {
            log.warn("下單失敗，平台未註冊: {}", trade.getPlatform());
            return TradeResult.failed(trade.getPlatform(), "Platform " + trade.getPlatform() + " not registered");
        }
        log.info("路由下單: platform={} type={} symbol={} amount={}",
                trade.getPlatform(), trade.getTradeType(), trade.getSymbol(), trade.getAmount());
        return adapter.executeTrade(trade);
    }

    public Map<String, Double> getBalance(Platform platform, String token) {
        PlatformAdapter adapter = adapters.get(platform);
        return adapter != null ? adapter.getBalance(token) : Map.of();
    }

    public double getPrice(Platform platform, String symbol) {
        PlatformAdapter adapter = adapters.get(platform);
        return adapter != null ? adapter.getPrice(symbol) : 0.0;
    }

    public Map<String, Object> getOrderStatus(Platform platform, String orderId) {
        PlatformAdapter adapter = adapters.get(platform);
        if (adapter == null) {
            return Map.of("error", "Platform " + platform + " not registered");
        }
        return adapter.getOrderStatus(orderId);
    }

    public boolean cancelOrder(Platform platform, String orderId) {
        PlatformAdapter adapter = adapters.get(platform);
        return adapter != null && adapter.cancelOrder(orderId);
    }

    /**
     * 並行查詢所有已註冊平台的餘額
     *
     * 每個平台各一個任務，單一平台逾時或失敗只會讓該平台變成空 Map，
     * 結果一定包含每個已註冊平台。
     */
    public Map<Platform, Map<String, Double>> getAllBalances() {
        List<Map.Entry<Platform, PlatformAdapter>> snapshot = new ArrayList<>(adapters.entrySet());
        Map<Platform, Map<String, Double>> balances = new EnumMap<>(Platform.class);
        if (snapshot.isEmpty()) {
            return balances;
        }

        List<Callable<Map<String, Double>>> tasks = new ArrayList<>();
        for (Map.Entry<Platform, PlatformAdapter> entry : snapshot) {
            tasks.add(() -> entry.getValue().getBalance(null));
        }

        try {
            // invokeAll：全部提交，等待全部完成（或超時）
            List<Future<Map<String, Double>>> futures =
                    balanceFanoutExecutor.invokeAll(tasks, fanoutTimeoutSeconds, TimeUnit.SECONDS);
            for (int i = 0; i < snapshot.size(); i++) {
                balances.put(snapshot.get(i).getKey(), resultOf(snapshot.get(i).getKey(), futures.get(i)));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("餘額查詢中斷: {}", e.getMessage());
            snapshot.forEach(entry -> balances.putIfAbsent(entry.getKey(), Map.of()));
        }
        return balances;
    }

    private Map<String, Double> resultOf(Platform platform, Future<Map<String, Double>> future)
            throws InterruptedException {
        if (future.isCancelled()) {
            log.warn("餘額查詢逾時: {}", platform);
            return Map.of();
        }
        try {
            Map<String, Double> result = future.get();
            return result != null ? result : Map.of();
        } catch (ExecutionException e) {
            log.warn("餘額查詢失敗: {} - {}", platform, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return Map.of();
        }
    }

    // ==================== 關閉 ====================

    @PreDestroy
    public void closeAll() {
        for (Platform platform : List.copyOf(adapters.keySet())) {
            PlatformAdapter adapter = adapters.remove(platform);
            if (adapter != null) {
                closeQuietly(adapter);
            }
        }
        log.info("所有平台連線已關閉");
    }

    private static void closeQuietly(PlatformAdapter adapter) {
        try {
            adapter.close();
        } catch (RuntimeException e) {
            log.warn("關閉 {} 連線失敗: {}", adapter.platform(), e.getMessage());
        }
    }
}
