package com.portfolio.auth.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Value("${server.port:5000}")
    private String serverPort;

    @Bean
    public OpenAPI portfolioAuthOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Portfolio Auth API")
                        .description("""
                                Authentication, session and second-factor management for the portfolio platform.

                                ## Authentication
                                Protected endpoints require a Bearer token from `/api/auth/login` or `/api/auth/register`.
                                Tokens close to expiry are refreshed through the `X-New-Token` response header.

                                ## Two-factor authentication
                                Accounts with TOTP enabled must call `/api/auth/totp/login-verify` after login
                                before any state-changing request is accepted.
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")))
                .addSecurityItem(new SecurityRequirement().addList("Bearer Authentication"))
                .components(new Components()
                        .addSecuritySchemes("Bearer Authentication",
                                new SecurityScheme()
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .bearerFormat("JWT")
                                        .description("Enter JWT Bearer token")));
    }
}
