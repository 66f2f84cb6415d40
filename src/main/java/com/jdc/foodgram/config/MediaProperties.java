package com.jdc.foodgram.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 업로드 이미지 저장 위치와 공개 URL 접두사.
 */
@Configuration
@ConfigurationProperties(prefix = "app.media")
@Getter @Setter
public class MediaProperties {
    private String root = "media";
    private String urlPrefix = "/media/";
}
