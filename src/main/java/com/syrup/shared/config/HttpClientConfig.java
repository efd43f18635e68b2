package com.syrup.shared.config;

import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * 共用 OkHttpClient
 *
 * 各平台 adapter / AI 供應商都用 newBuilder() 從這裡衍生自己的 client。
 * 平台 adapter 另外建立自己的 connection pool 與 dispatcher，關閉時不影響其他平台。
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public OkHttpClient okHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(15, TimeUnit.SECONDS)
                .writeTimeout(15, TimeUnit.SECONDS)
                .build();
    }
}
