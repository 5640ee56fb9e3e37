package com.fueltrack.archival.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import static org.springframework.security.config.Customizer.withDefaults;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

    public static final String SUPER_ADMIN = "SUPER_ADMIN";
    public static final String ADMIN = "ADMIN";
    public static final String MANAGER = "MANAGER";

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/actuator/health").permitAll()
                        .requestMatchers("/actuator/**").hasAnyRole(ADMIN, SUPER_ADMIN)
                        .requestMatchers("/swagger-ui/**", "/v3/api-docs/**").hasAnyRole(ADMIN, SUPER_ADMIN)
                        // Operations that move data, and the full-history export, are reserved to super admins
                        .requestMatchers(HttpMethod.POST, "/api/archival/run", "/api/archival/restore",
                                "/api/archival/cancel", "/api/archival/export").hasRole(SUPER_ADMIN)
                        .requestMatchers(HttpMethod.POST, "/api/archival/query")
                        .hasAnyRole(ADMIN, SUPER_ADMIN, MANAGER)
                        .requestMatchers("/api/archival/**").hasAnyRole(ADMIN, SUPER_ADMIN)
                        .anyRequest().authenticated())
                .httpBasic(withDefaults());
        return http.build();
    }
}
