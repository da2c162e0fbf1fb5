package com.netwarden.backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;

/**
 * 兩條 chain：
 * - /actuator/** → ROLE_ACTUATOR
 * - /api/**      → ROLE_OPERATOR（內部營運 / bot 後台呼叫）
 * 帳密都走 config，HTTP Basic，無 session。
 */
@Configuration
public class SecurityConfig {

    @Bean
    @Order(1) // ✅ 優先匹配 actuator
    public SecurityFilterChain actuatorChain(HttpSecurity http) throws Exception {
        http.securityMatcher("/actuator/**")
                .authorizeHttpRequests(reg -> reg
                        .requestMatchers("/actuator/health", "/actuator/health/**").permitAll()
                        .anyRequest().hasRole("ACTUATOR"))
                .httpBasic(Customizer.withDefaults())
                .csrf(AbstractHttpConfigurer::disable);
        return http.build();
    }

    @Bean
    @Order(2)
    public SecurityFilterChain apiChain(HttpSecurity http) throws Exception {
        http.securityMatcher("/api/**")
                .authorizeHttpRequests(reg -> reg.anyRequest().hasRole("OPERATOR"))
                .httpBasic(Customizer.withDefaults())
                .sessionManagement(s -> s.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .csrf(AbstractHttpConfigurer::disable);
        return http.build();
    }

    @Bean
    public UserDetailsService internalUsers(
            @Value("${app.actuator.user:actuator}") String actuatorUser,
            @Value("${app.actuator.pass:change-me}") String actuatorPass,
            @Value("${app.security.operator.user:operator}") String operatorUser,
            @Value("${app.security.operator.pass:change-me}") String operatorPass
    ) {
        return new InMemoryUserDetailsManager(
                User.withUsername(actuatorUser)
                        .password("{noop}" + actuatorPass) // MVP：先 noop；上線可改成 bcrypt
                        .roles("ACTUATOR")
                        .build(),
                User.withUsername(operatorUser)
                        .password("{noop}" + operatorPass)
                        .roles("OPERATOR")
                        .build()
        );
    }
}
