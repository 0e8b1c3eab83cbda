package com.sitecheck.core.email;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "sitecheck.email")
@Getter
@Setter
public class EmailProperties {
    private String apiKey;
    private String baseUrl = "https://api.resend.com";
    private String from = "contact@seochecksite.net";
    private String fromName = "SEO CheckSite";
    private String replyTo;
    private String siteUrl = "https://seochecksite.net";
    private Duration timeout = Duration.ofSeconds(30);
}
