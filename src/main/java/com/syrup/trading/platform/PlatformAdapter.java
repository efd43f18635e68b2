package com.syrup.trading.platform;

import com.syrup.shared.model.Platform;
import com.syrup.shared.model.TradeRequest;
import com.syrup.shared.model.TradeResult;

import java.io.Closeable;
import java.util.Map;

/**
 * 交易平台統一介面
 *
 * 每個實作擁有一條自己的連線（第一次使用時建立），不與其他 adapter 共用。
 * 所有方法都不拋例外：失敗時回傳 FAILED 的 TradeResult、空 Map、0、{"error": ...} 或 false。
 */
public interface PlatformAdapter extends Closeable {

    Platform platform();

    /**
     * 先跑 validateTrade，再轉成平台原生的下單格式送出
     */
    TradeResult executeTrade(TradeRequest trade);

    /**
     * @param token 只查某個資產，null = 全部
     * @return 資產代號 → 數量，失敗時為空
     */
    Map<String, Double> getBalance(String token);

    /**
     * @return 目前價格，失敗時為 0
     */
    double getPrice(String symbol);

    /**
     * @return 平台回傳的訂單狀態，失敗時為 {"error": ...}
     */
    Map<String, Object> getOrderStatus(String orderId);

    boolean cancelOrder(String orderId);

    TradeValidation validateTrade(TradeRequest trade);

    /**
     * 釋放連線，可重複呼叫，從未建立連線時也安全
     */
    @Override
    void close();
}
