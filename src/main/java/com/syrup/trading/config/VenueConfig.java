package com.syrup.trading.config;

import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 各交易平台的端點與逾時設定
 * 憑證不在這裡，註冊平台時由 PlatformCredentials 帶入
 */
@Getter
@ConfigurationProperties(prefix = "venue")
public class VenueConfig {

    private final String solanaRpcUrl;
    private final String jupiterQuoteUrl;
    private final String jupiterPriceUrl;
    private final String polymarketBaseUrl;
    private final String kalshiBaseUrl;
    private final int readTimeoutSeconds;
    private final int balanceFanoutTimeoutSeconds;

    public VenueConfig(
            @DefaultValue("https://api.mainnet-beta.solana.com") String solanaRpcUrl,
            @DefaultValue("https://quote-api.jup.ag/v6") String jupiterQuoteUrl,
            @DefaultValue("https://api.jup.ag/price/v2") String jupiterPriceUrl,
            @DefaultValue("https://api.polymarket.com") String polymarketBaseUrl,
            @DefaultValue("https://api.elections.kalshi.com/trade-api/v2") String kalshiBaseUrl,
            @DefaultValue("15") int readTimeoutSeconds,
            @DefaultValue("30") int balanceFanoutTimeoutSeconds
    ) {
        this.solanaRpcUrl = solanaRpcUrl;
        this.jupiterQuoteUrl = jupiterQuoteUrl;
        this.jupiterPriceUrl = jupiterPriceUrl;
        this.polymarketBaseUrl = polymarketBaseUrl;
        this.kalshiBaseUrl = kalshiBaseUrl;
        this.readTimeoutSeconds = readTimeoutSeconds;
        this.balanceFanoutTimeoutSeconds = balanceFanoutTimeoutSeconds;
    }

    /** 測試與預設用 */
    public static VenueConfig defaults() {
        return new VenueConfig(
                "https://api.mainnet-beta.solana.com",
                "https://quote-api.jup.ag/v6",
                "https://api.jup.ag/price/v2",
                "https://api.polymarket.com",
                "https://api.elections.kalshi.com/trade-api/v2",
                15, 30);
    }
}
