package com.jdc.foodgram.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "app.short-link")
@Getter @Setter
public class ShortLinkProperties {
    private int length = 6;
    private int maxAttempts = 5;
}
