package com.portfolio.auth.config;

import com.portfolio.auth.domain.LockoutPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class CoreConfig {

    private static final Logger log = LoggerFactory.getLogger(CoreConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public LockoutPolicy lockoutPolicy(AppProperties props, Clock clock) {
        AppProperties.Lockout lockout = props.getAuth().getLockout();
        log.info("Lockout policy: {} attempts, {} minute lock", lockout.getMaxAttempts(), lockout.getDurationMinutes());
        return new LockoutPolicy(lockout.getMaxAttempts(), Duration.ofMinutes(lockout.getDurationMinutes()), clock);
    }
}
