package com.syrup.shared.config;

import com.syrup.shared.model.AgentProvider;
import com.syrup.shared.model.Platform;
import com.syrup.shared.model.TradeType;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * path variable / query param 的 enum 轉換
 * 與 JSON 一致使用小寫 wire 值（solana、buy、openai），不是 enum 常數名稱
 */
@Configuration
public class WebConversionConfig implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, Platform.class, Platform::fromValue);
        registry.addConverter(String.class, TradeType.class, TradeType::fromValue);
        registry.addConverter(String.class, AgentProvider.class, AgentProvider::fromValue);
    }
}
