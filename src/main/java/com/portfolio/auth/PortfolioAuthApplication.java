package com.portfolio.auth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.portfolio.auth")
@EnableJpaRepositories(basePackages = "com.portfolio.auth.infrastructure.jpa")
@EntityScan(basePackages = "com.portfolio.auth.infrastructure.jpa")
@EnableAsync
@EnableScheduling
public class PortfolioAuthApplication {
	public static void main(String[] args) {
		SpringApplication.run(PortfolioAuthApplication.class, args);
	}
}
