package com.quantbacktest.rebalancer.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * JPA configuration for database access and entity auditing.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.quantbacktest.rebalancer.repository")
@EnableJpaAuditing
@EnableTransactionManagement
public class JpaConfig {
}
