package dev.relaygate.config;

import dev.relaygate.exception.PermissionDeniedException;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.crypto.factory.PasswordEncoderFactories;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.web.servlet.HandlerExceptionResolver;

/**
 * Stateless security. CSRF disabled (JSON API, no browser sessions).
 * Gateway traffic is open; rule edits and queue/cache control need ROLE_ADMIN over HTTP Basic.
 * A missing role is rendered by {@code GlobalExceptionHandler} like any other permission error.
 */
@Configuration
public class SecurityConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);
    static final String ADMIN = "ADMIN";

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http,
                                           @Qualifier("handlerExceptionResolver") HandlerExceptionResolver resolver)
            throws Exception {
        http
            .csrf(AbstractHttpConfigurer::disable)
            .sessionManagement(s -> s.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .httpBasic(Customizer.withDefaults())
            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/health", "/health/**").permitAll()
                .requestMatchers("/actuator/health/**", "/actuator/info", "/actuator/prometheus").permitAll()
                .requestMatchers("/v1/admin/**").hasRole(ADMIN)
                .requestMatchers(HttpMethod.POST, "/v1/queue/pause", "/v1/queue/resume").hasRole(ADMIN)
                .requestMatchers(HttpMethod.DELETE, "/v1/cache").hasRole(ADMIN)
                .requestMatchers("/v1/**").permitAll()
                .anyRequest().authenticated()
            )
            .exceptionHandling(e -> e.accessDeniedHandler((request, response, denied) -> {
                if (resolver.resolveException(request, response, null,
                        new PermissionDeniedException("Admin role required")) == null)
                    response.sendError(HttpServletResponse.SC_FORBIDDEN);
            }));
        return http.build();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return PasswordEncoderFactories.createDelegatingPasswordEncoder();
    }

    @Bean
    public UserDetailsService userDetailsService(AdminProperties admin, PasswordEncoder encoder) {
        InMemoryUserDetailsManager users = new InMemoryUserDetailsManager();
        if (admin.enabled()) {
            users.createUser(User.withUsername(admin.username())
                    .password(encoder.encode(admin.password()))
                    .roles(ADMIN)
                    .build());
        } else {
            log.warn("relaygate.security.admin.password is not set; admin endpoints are unreachable");
        }
        return users;
    }
}
