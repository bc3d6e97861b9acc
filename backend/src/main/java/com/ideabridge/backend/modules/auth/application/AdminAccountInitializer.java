package com.ideabridge.backend.modules.auth.application;

import com.ideabridge.backend.global.error.DuplicateIdentityException;
import com.ideabridge.backend.modules.auth.domain.AppUser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Provisions the administrator account from {@code auth.admin.username} / {@code auth.admin.password}
 * on startup. Does nothing when either is unset or the account already exists.
 */
@Component
public class AdminAccountInitializer implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(AdminAccountInitializer.class);

    private final IdentityRegistry identityRegistry;
    private final String username;
    private final String password;

    public AdminAccountInitializer(
            IdentityRegistry identityRegistry,
            @Value("${auth.admin.username:}") String username,
            @Value("${auth.admin.password:}") String password
    ) {
        this.identityRegistry = identityRegistry;
        this.username = username;
        this.password = password;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (username == null || username.isBlank() || password == null || password.isBlank()) {
            log.debug("Admin credentials not configured; skipping admin provisioning");
            return;
        }
        if (identityRegistry.findByUsername(username).isPresent()) {
            log.info("Admin account '{}' already exists", username);
            return;
        }
        try {
            AppUser admin = identityRegistry.registerAdmin(username, password);
            log.info("Created admin account '{}' ({})", admin.getUsername(), admin.getId());
        } catch (DuplicateIdentityException e) {
            // another instance created it between the lookup and the insert
            log.info("Admin account '{}' was created concurrently", username);
        }
    }
}
