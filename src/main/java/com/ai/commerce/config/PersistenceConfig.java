package com.ai.commerce.config;

import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * JPA repositories and entities. Lives outside the application class so web slice tests load without JPA.
 */
@Configuration(proxyBeanMethods = false)
@EnableJpaRepositories(basePackages = "com.ai.commerce.repository")
@EntityScan(basePackages = "com.ai.commerce.entity")
public class PersistenceConfig {
}
