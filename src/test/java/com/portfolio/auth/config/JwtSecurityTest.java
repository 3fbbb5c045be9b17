package com.portfolio.auth.config;

import com.portfolio.auth.domain.Role;
import com.portfolio.auth.domain.TokenClaims;
import com.portfolio.auth.exception.InvalidTokenException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class JwtSecurityTest {

    @Autowired
    private JwtService jwtService;

    @Test
    void shouldGenerateValidToken() {
        String subject = UUID.randomUUID().toString();
        String token = jwtService.issue(TokenClaims.forIdentity(subject, "test@example.com", Role.ADMIN));

        assertThat(token).isNotEmpty();
        TokenClaims claims = jwtService.verify(token);
        assertThat(claims.subject()).isEqualTo(subject);
        assertThat(claims.email()).isEqualTo("test@example.com");
        assertThat(claims.role()).isEqualTo(Role.ADMIN);
    }

    @Test
    void shouldRejectInvalidToken() {
        assertThatThrownBy(() -> jwtService.verify("invalid-token")).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void shouldUseConfiguredLifetimes() {
        assertThat(jwtService.getDefaultTtl()).isEqualTo(Duration.ofDays(7));
        assertThat(jwtService.ttlFor(true)).isEqualTo(Duration.ofDays(30));
        assertThat(jwtService.getRefreshThreshold()).isEqualTo(Duration.ofDays(1));
    }

    @Test
    void shouldCarryRoleAsLowercaseClaim() {
        String token = jwtService.issue(TokenClaims.forIdentity("user-1", "test@example.com", Role.MANAGER));
        String payload = new String(java.util.Base64.getUrlDecoder().decode(token.split("\\.")[1]));

        assertThat(payload).contains("\"role\":\"manager\"");
    }
}
