package dev.relaygate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Credentials of the single admin account guarding rule edits and queue/cache control.
 * A blank password disables admin login.
 */
@ConfigurationProperties(prefix = "relaygate.security.admin")
public record AdminProperties(String username, String password) {

    public AdminProperties {
        if (username == null || username.isBlank()) username = "admin";
    }

    public boolean enabled() {
        return password != null && !password.isBlank();
    }
}
