package com.syrup.trading.controller;

import com.syrup.shared.model.Platform;
import com.syrup.shared.model.TradeRequest;
import com.syrup.shared.model.TradeResult;
import com.syrup.trading.service.TradeRouter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 交易 / 查詢 API
 *
 * 全部委派給 TradeRouter；平台失敗不會變成 HTTP 錯誤，
 * 而是 FAILED 的 TradeResult 或空值（與 adapter 的不拋例外約定一致）
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class TradeController {

    private final TradeRouter tradeRouter;

    /**
     * 執行交易
     * POST /api/trade/execute
     * Body: { "platform": "solana", "trade_type": "swap", "symbol": "SOL/USDC", "amount": 1.0 }
     */
    @PostMapping("/trade/execute")
    public ResponseEntity<TradeResult> executeTrade(@Valid @RequestBody TradeRequest trade) {
        return ResponseEntity.ok(tradeRouter.executeTrade(trade));
    }

    /**
     * 所有已註冊平台的餘額
     * GET /api/balances
     */
    @GetMapping("/balances")
    public ResponseEntity<Map<String, Object>> getAllBalances() {
        Map<String, Map<String, Double>> balances = new LinkedHashMap<>();
        tradeRouter.getAllBalances().forEach((platform, balance) -> balances.put(platform.getValue(), balance));
        return ResponseEntity.ok(Map.of("success", true, "balances", balances));
    }

    /**
     * GET /api/balances/solana?token=USDC
     */
    @GetMapping("/balances/{platform}")
    public ResponseEntity<Map<String, Object>> getBalance(
            @PathVariable Platform platform,
            @RequestParam(required = false) String token) {
        return ResponseEntity.ok(Map.of(
                "success", true,
                "platform", platform,
                "balance", tradeRouter.getBalance(platform, token)));
    }

    /**
     * symbol 可能含 "/"（例如 SOL/USDC），用 catch-all path 變數接
     * GET /api/price/solana/SOL/USDC
     */
    @GetMapping("/price/{platform}/{*symbol}")
    public ResponseEntity<Map<String, Object>> getPrice(
            @PathVariable Platform platform,
            @PathVariable String symbol) {
        String normalized = symbol.startsWith("/") ? symbol.substring(1) : symbol;
        return ResponseEntity.ok(Map.of(
                "success", true,
                "platform", platform,
                "symbol", normalized,
                "price", tradeRouter.getPrice(platform, normalized)));
    }

    /**
     * GET /api/orders/kalshi/{orderId}
     */
    @GetMapping("/orders/{platform}/{orderId}")
    public ResponseEntity<Map<String, Object>> getOrderStatus(
            @PathVariable Platform platform,
            @PathVariable String orderId) {
        return ResponseEntity.ok(tradeRouter.getOrderStatus(platform, orderId));
    }

    /**
     * DELETE /api/orders/kalshi/{orderId}
     */
    @DeleteMapping("/orders/{platform}/{orderId}")
    public ResponseEntity<Map<String, Object>> cancelOrder(
            @PathVariable Platform platform,
            @PathVariable String orderId) {
        boolean cancelled = tradeRouter.cancelOrder(platform, orderId);
        log.info("撤單: platform={} orderId={} cancelled={}", platform, orderId, cancelled);
        return ResponseEntity.ok(Map.of("success", true, "cancelled", cancelled));
    }
}
