package com.sitecheck.core;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication
@EntityScan("com.sitecheck.data.entity")
@EnableJpaRepositories("com.sitecheck.data.repository")
public class CoreTestApplication {
}
