package com.fueltrack.archival.service;

import com.fueltrack.archival.config.SecurityConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

/**
 * Operator accounts configured in properties. Passwords are encoded once at startup.
 */
@Service
@Slf4j
public class CustomUserDetailsService implements UserDetailsService {

        private final Map<String, UserDetails> users = new HashMap<>();

        public CustomUserDetailsService(PasswordEncoder passwordEncoder,
                        @Value("${app.admin.username}") String adminUsername,
                        @Value("${app.admin.password}") String adminPassword,
                        @Value("${app.auditor.username:}") String auditorUsername,
                        @Value("${app.auditor.password:}") String auditorPassword) {
                register(passwordEncoder, adminUsername, adminPassword, SecurityConfig.SUPER_ADMIN,
                                SecurityConfig.ADMIN);
                register(passwordEncoder, auditorUsername, auditorPassword, SecurityConfig.MANAGER);
                log.info("CustomUserDetailsService initialized with {} operator accounts", users.size());
        }

        private void register(PasswordEncoder passwordEncoder, String username, String password, String... roles) {
                // Trim injected values to avoid subtle whitespace issues
                String trimmedUsername = username != null ? username.trim() : "";
                String trimmedPassword = password != null ? password.trim() : "";
                if (trimmedUsername.isEmpty() || trimmedPassword.isEmpty()) {
                        return;
                }
                users.put(trimmedUsername, User.builder()
                                .username(trimmedUsername)
                                .password(passwordEncoder.encode(trimmedPassword))
                                .roles(roles)
                                .build());
        }

        private String sanitize(String input) {
                return input != null ? input.replaceAll("[\\r\\n]", "_") : "null";
        }

        @Override
        public UserDetails loadUserByUsername(String username) throws UsernameNotFoundException {
                UserDetails user = users.get(username);
                if (user == null) {
                        log.warn("Unknown operator: {}", sanitize(username));
                        throw new UsernameNotFoundException("User not found: " + sanitize(username));
                }
                // Fresh copy so the framework's credential erasure never touches the stored hash
                return User.withUserDetails(user).build();
        }
}
