package com.example.pos.config;

import com.example.pos.user.UserService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;

/**
 * Seeds the {@code admin} account once the schema is in place. Set {@code SKIP_DB_INIT=true}
 * to leave the users table alone.
 */
@Configuration
@RequiredArgsConstructor
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    static final String DEFAULT_ADMIN_PASSWORD = "admin123";

    private final UserService userService;
    private final Environment environment;

    @EventListener(ApplicationReadyEvent.class)
    public void initUsersAfterReady() {
        if ("true".equalsIgnoreCase(environment.getProperty("SKIP_DB_INIT"))) {
            log.info("SKIP_DB_INIT=true, not seeding users");
            return;
        }
        String password = environment.getProperty("DEFAULT_ADMIN_PASSWORD", DEFAULT_ADMIN_PASSWORD);
        if (userService.ensureAdminAccount(password)) {
            log.info("Admin account created (username={})", UserService.ADMIN_USERNAME);
        }
    }
}
