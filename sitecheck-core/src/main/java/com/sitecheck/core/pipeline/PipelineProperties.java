package com.sitecheck.core.pipeline;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "sitecheck.pipeline")
@Getter
@Setter
public class PipelineProperties {
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration responseTimeout = Duration.ofSeconds(30);
    private String userAgent = "SiteCheckBot/1.0 (+https://seochecksite.net)";
    private int minWordCount = 300;
}
