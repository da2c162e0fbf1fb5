package com.netwarden.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.web.SecurityFilterChain;

/**
 * swagger 路徑：
 * - dev/test/local：放行
 * - prod：一律 404（不透露需要登入/權限）
 */
public final class SwaggerSecurityConfig {

    private static final String[] DOC_PATHS = {
            "/swagger-ui.html",
            "/swagger-ui/**",
            "/v3/api-docs/**",
            "/v3/api-docs.yaml"
    };

    private SwaggerSecurityConfig() {}

    @Configuration
    @Profile({"dev", "test", "local"})
    static class Open {
        @Bean
        @Order(0)
        public SecurityFilterChain swaggerChain(HttpSecurity http) throws Exception {
            http.securityMatcher(DOC_PATHS)
                    .authorizeHttpRequests(reg -> reg.anyRequest().permitAll())
                    .csrf(AbstractHttpConfigurer::disable);
            return http.build();
        }
    }

    @Configuration
    @Profile("prod")
    static class Blocked {
        @Bean
        @Order(0)
        public SecurityFilterChain swaggerBlockChain(HttpSecurity http) throws Exception {
            http.securityMatcher(DOC_PATHS)
                    .authorizeHttpRequests(reg -> reg.anyRequest().denyAll())
                    .csrf(AbstractHttpConfigurer::disable)
                    .exceptionHandling(ex -> ex
                            .authenticationEntryPoint((req, res, e) -> res.sendError(HttpStatus.NOT_FOUND.value()))
                            .accessDeniedHandler((req, res, e) -> res.sendError(HttpStatus.NOT_FOUND.value()))
                    );
            return http.build();
        }
    }
}
