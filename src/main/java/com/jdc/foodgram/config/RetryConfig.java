package com.jdc.foodgram.config;

import com.jdc.foodgram.facade.ShortLinkCollisionException;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

@Configuration
@RequiredArgsConstructor
public class RetryConfig {

    private final ShortLinkProperties shortLinkProperties;

    @Bean
    public RetryTemplate shortLinkRetryTemplate() {
        return RetryTemplate.builder()
                .maxAttempts(shortLinkProperties.getMaxAttempts())
                .retryOn(ShortLinkCollisionException.class)
                .noBackoff()
                .build();
    }
}
