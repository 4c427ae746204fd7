package com.example.schoolops.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;

import java.util.ArrayList;
import java.util.List;

@Configuration
public class SecurityConfig {

    private final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    @Bean
    public BCryptPasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    /**
     * API accounts come from {@code schoolops.users}; accounts themselves are managed outside this service.
     */
    @Bean
    public InMemoryUserDetailsManager userDetailsService(SchoolOpsProperties properties, BCryptPasswordEncoder passwordEncoder) {
        List<UserDetails> users = new ArrayList<>();
        for (SchoolOpsProperties.ApiUser u : properties.getUsers()) {
            if (u.getUsername() == null || u.getUsername().isBlank() || u.getPassword() == null) {
                log.warn("Skipping API user with missing username or password");
                continue;
            }
            users.add(User.withUsername(u.getUsername())
                    .password(passwordEncoder.encode(u.getPassword()))
                    .roles(u.getRoles().toArray(new String[0]))
                    .build());
        }
        log.info("Configured {} API users", users.size());
        return new InMemoryUserDetailsManager(users);
    }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http
                .csrf(csrf -> csrf.ignoringRequestMatchers("/api/**"))
                .sessionManagement(s -> s.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(HttpMethod.GET, "/api/schedule/**").hasAnyRole("ADMIN", "TEACHER", "COUNSELOR")
                        .requestMatchers("/api/schedule/**").hasRole("ADMIN")
                        .requestMatchers("/api/records/**").hasAnyRole("ADMIN", "TEACHER")
                        .requestMatchers("/api/sessions/*/bulk-report").hasRole("ADMIN")
                        .requestMatchers("/api/sessions/**").hasAnyRole("ADMIN", "TEACHER")
                        .requestMatchers("/api/absences/**").hasAnyRole("ADMIN", "COUNSELOR")
                        .requestMatchers("/api/substitution-requests/pending",
                                "/api/substitution-requests/*/accept",
                                "/api/substitution-requests/*/reject").hasAnyRole("ADMIN", "TEACHER")
                        .requestMatchers("/api/substitution-requests/**").hasRole("ADMIN")
                        .anyRequest().authenticated()
                )
                .httpBasic(Customizer.withDefaults());

        return http.build();
    }
}
