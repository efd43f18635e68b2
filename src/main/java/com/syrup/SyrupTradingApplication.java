package com.syrup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan({"com.syrup.shared.config", "com.syrup.trading.config", "com.syrup.agent.config"})
public class SyrupTradingApplication {

    public static void main(String[] args) {
        SpringApplication.run(SyrupTradingApplication.class, args);
    }
}
