package com.syrup.trading.controller;

import com.syrup.shared.model.Platform;
import com.syrup.shared.model.PlatformCredentials;
import com.syrup.trading.service.TradeRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * 平台註冊管理
 * 建構失敗（不支援的平台、憑證格式錯誤）由 GlobalExceptionHandler 轉成 400
 */
@Slf4j
@RestController
@RequestMapping("/api/platforms")
@RequiredArgsConstructor
public class PlatformController {

    private final TradeRouter tradeRouter;

    /**
     * 註冊平台（同平台已存在則取代）
     * POST /api/platforms/register
     * Body: { "platform": "solana", "private_key": "..." }
     */
    @PostMapping("/register")
    public ResponseEntity<Map<String, Object>> register(@RequestBody PlatformCredentials credentials) {
        tradeRouter.registerPlatform(credentials);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "platform", credentials.getPlatform(),
                "message", "Platform " + credentials.getPlatform() + " registered successfully"));
    }

    /**
     * 移除平台，未註冊也回成功
     * POST /api/platforms/unregister?platform=kalshi
     */
    @PostMapping("/unregister")
    public ResponseEntity<Map<String, Object>> unregister(@RequestParam Platform platform) {
        tradeRouter.unregisterPlatform(platform);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "platform", platform,
                "message", "Platform " + platform + " unregistered"));
    }

    /**
     * GET /api/platforms
     */
    @GetMapping
    public ResponseEntity<List<Platform>> list() {
        return ResponseEntity.ok(tradeRouter.registeredPlatforms().stream().sorted().toList());
    }
}
