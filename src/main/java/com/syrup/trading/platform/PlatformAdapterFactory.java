package com.syrup.trading.platform;

import com.syrup.shared.exception.UnsupportedPlatformException;
import com.syrup.shared.model.Platform;
import com.syrup.shared.model.PlatformCredentials;
import com.syrup.trading.config.VenueConfig;
import com.syrup.trading.platform.kalshi.KalshiAdapter;
import com.syrup.trading.platform.polymarket.PolymarketAdapter;
import com.syrup.trading.platform.solana.SolanaAdapter;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;

/**
 * 依平台建立對應的 adapter
 * 憑證格式錯誤時由 adapter 建構子拋出 InvalidCredentialsException
 */
@Component
public class PlatformAdapterFactory {

    private final Map<Platform, Function<PlatformCredentials, PlatformAdapter>> creators;

    @Autowired
    public PlatformAdapterFactory(OkHttpClient okHttpClient, VenueConfig venueConfig) {
        this.creators = new EnumMap<>(Platform.class);
        creators.put(Platform.SOLANA, c -> new SolanaAdapter(c, okHttpClient, venueConfig));
        creators.put(Platform.POLYMARKET, c -> new PolymarketAdapter(c, okHttpClient, venueConfig));
        creators.put(Platform.KALSHI, c -> new KalshiAdapter(c, okHttpClient, venueConfig));
    }

    /** 測試用：自行指定每個平台的建立方式 */
    PlatformAdapterFactory(Map<Platform, Function<PlatformCredentials, PlatformAdapter>> creators) {
        this.creators = new EnumMap<>(Platform.class);
        this.creators.putAll(creators);
    }

    public PlatformAdapter create(PlatformCredentials credentials) {
        Function<PlatformCredentials, PlatformAdapter> creator = creators.get(credentials.getPlatform());
        if (creator == null) {
            throw new UnsupportedPlatformException("Unsupported platform: " + credentials.getPlatform());
        }
        return creator.apply(credentials);
    }
}
