package com.sitecheck.api.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Shared secrets for the trigger and admin endpoints. A blank secret leaves the
 * endpoint open.
 */
@Configuration
@ConfigurationProperties(prefix = "sitecheck.security")
@Getter
@Setter
public class SecurityProperties {
    private String queueSecret;
    private String adminSecret;
}
