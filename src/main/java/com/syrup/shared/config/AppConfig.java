package com.syrup.shared.config;

import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

@Getter
@ConfigurationProperties(prefix = "app")
public class AppConfig {

    private final String name;
    private final String version;
    private final List<String> corsOrigins;

    public AppConfig(
            @DefaultValue("Syrup Trading API") String name,
            @DefaultValue("0.1.0") String version,
            @DefaultValue("http://localhost:3000") List<String> corsOrigins
    ) {
        this.name = name;
        this.version = version;
        this.corsOrigins = corsOrigins != null ? List.copyOf(corsOrigins) : List.of();
    }
}
