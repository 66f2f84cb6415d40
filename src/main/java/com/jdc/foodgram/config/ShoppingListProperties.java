package com.jdc.foodgram.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "app.shopping-list")
@Getter @Setter
public class ShoppingListProperties {
    /** TTF 폰트 경로. 비어 있으면 Helvetica 로 렌더링한다. */
    private String fontPath;
    private String boldFontPath;
    private String title = "Shopping list";
    private String footer = "Foodgram";
    private String fileName = "shopping_list.pdf";
}
