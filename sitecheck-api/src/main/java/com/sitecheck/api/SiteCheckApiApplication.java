package com.sitecheck.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.sitecheck")
@EntityScan("com.sitecheck.data.entity")
@EnableJpaRepositories("com.sitecheck.data.repository")
public class SiteCheckApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(SiteCheckApiApplication.class, args);
    }
}
