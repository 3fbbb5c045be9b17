package com.portfolio.auth.config;

import com.portfolio.auth.application.RequestAuthenticator;
import com.portfolio.auth.application.TwoFactorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;

@Configuration
@EnableMethodSecurity(prePostEnabled = true)
public class SecurityConfig {

  private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

  @Bean
  public PasswordEncoder passwordEncoder(AppProperties props) {
    int strength = props.getAuth().getBcryptStrength();
    log.info("BCrypt password encoder strength: {}", strength);
    return new BCryptPasswordEncoder(strength);
  }

  @Bean
  public CorsConfigurationSource corsConfigurationSource() {
    CorsConfiguration configuration = new CorsConfiguration();

    configuration.setAllowedOriginPatterns(List.of("*"));
    configuration.setAllowedMethods(Arrays.asList(
            "GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS", "HEAD"
    ));
    configuration.setAllowedHeaders(Arrays.asList(
            "Authorization",
            "Content-Type",
            "X-Requested-With",
            "Accept",
            "Origin",
            "Access-Control-Request-Method",
            "Access-Control-Request-Headers"
    ));
    // Browsers only let scripts read the refreshed token if it is exposed
    configuration.setExposedHeaders(List.of(TokenRefreshFilter.NEW_TOKEN_HEADER));
    configuration.setAllowCredentials(true);
    configuration.setMaxAge(3600L);

    UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/**", configuration);
    return source;
  }

  @Bean
  SecurityFilterChain security(HttpSecurity http,
                               RequestAuthenticator authenticator,
                               TwoFactorService twoFactorService,
                               JwtService jwtService,
                               ApiErrorWriter errorWriter,
                               Clock clock) throws Exception {
    log.info("Configuring security filter chain");

    JwtAuthFilter jwtFilter = new JwtAuthFilter(authenticator, errorWriter);
    TwoFactorGateFilter twoFactorGate = new TwoFactorGateFilter(twoFactorService, errorWriter);
    TokenRefreshFilter refreshFilter = new TokenRefreshFilter(jwtService, clock);

    String[] publicPaths = JwtAuthFilter.PUBLIC_PATHS.toArray(String[]::new);
    String[] optionalPaths = JwtAuthFilter.OPTIONAL_AUTH_PATHS.toArray(String[]::new);

    http
            .csrf(csrf -> csrf.disable())
            .cors(cors -> cors.configurationSource(corsConfigurationSource()))
            .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                    .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                    .requestMatchers(publicPaths).permitAll()
                    .requestMatchers(optionalPaths).permitAll()
                    .requestMatchers("/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html").permitAll()
                    .requestMatchers("/actuator/**").hasRole("ADMIN")
                    .anyRequest().authenticated())

            // authenticate -> 2FA gate -> soft refresh
            .addFilterBefore(jwtFilter, UsernamePasswordAuthenticationFilter.class)
            .addFilterAfter(twoFactorGate, UsernamePasswordAuthenticationFilter.class)
            .addFilterAfter(refreshFilter, AnonymousAuthenticationFilter.class)

            .exceptionHandling(e -> e
                    .authenticationEntryPoint(json401(errorWriter))
                    .accessDeniedHandler(json403(errorWriter))
            );

    log.info("Security filter chain configured: {} public paths, {} optional-auth paths",
            publicPaths.length, optionalPaths.length);
    return http.build();
  }

  private AuthenticationEntryPoint json401(ApiErrorWriter errorWriter) {
    return (request, response, ex) -> {
      log.warn("Authentication failed for {} {}: {}",
              request.getMethod(), request.getRequestURI(), ex.getMessage());
      errorWriter.write(request, response, 401, RequestAuthenticator.MISSING_TOKEN_MESSAGE);
    };
  }

  private AccessDeniedHandler json403(ApiErrorWriter errorWriter) {
    return (request, response, ex) -> {
      log.warn("Access denied for {} {}: {}",
              request.getMethod(), request.getRequestURI(), ex.getMessage());
      errorWriter.write(request, response, 403, "Access denied.");
    };
  }
}
