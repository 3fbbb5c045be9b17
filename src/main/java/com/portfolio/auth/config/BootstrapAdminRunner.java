package com.portfolio.auth.config;

import com.portfolio.auth.domain.Credential;
import com.portfolio.auth.domain.Role;
import com.portfolio.auth.domain.ports.CredentialStore;
import com.portfolio.auth.infrastructure.security.PasswordHashingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BootstrapAdminRunner {

    private static final Logger log = LoggerFactory.getLogger(BootstrapAdminRunner.class);

    @Bean
    ApplicationRunner seedFirstAdmin(
            CredentialStore credentials,
            PasswordHashingService passwordHashing,
            @Value("${bootstrap.admin.email:}") String adminEmail,
            @Value("${bootstrap.admin.password:}") String adminPassword
    ) {
        return args -> {
            if (adminEmail == null || adminEmail.isBlank() || adminPassword == null || adminPassword.isBlank()) {
                log.warn("Bootstrap admin not created - set bootstrap.admin.email and bootstrap.admin.password");
                return;
            }

            if (credentials.existsByEmail(adminEmail)) {
                log.info("Bootstrap admin exists: {}", adminEmail);
                return;
            }

            Credential admin = new Credential();
            admin.setEmail(adminEmail);
            admin.setFirstName("System");
            admin.setLastName("Administrator");
            admin.setPasswordHash(passwordHashing.hash(adminPassword));
            admin.setRole(Role.ADMIN);
            admin.setActive(true);
            admin.setVerified(true);
            credentials.save(admin);

            log.info("Bootstrap admin created: {} (id={})", adminEmail, admin.getId());
        };
    }
}
