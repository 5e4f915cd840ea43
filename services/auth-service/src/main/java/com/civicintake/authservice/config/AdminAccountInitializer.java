package com.civicintake.authservice.config;

import com.civicintake.authservice.domain.AccountService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Creates the configured administrator account at startup, so a fresh deployment has someone
 * who can assign roles.
 */
@Component
public class AdminAccountInitializer implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(AdminAccountInitializer.class);

    private final AuthProperties auth;
    private final AccountService accounts;

    public AdminAccountInitializer(AuthProperties auth, AccountService accounts) {
        this.auth = auth;
        this.accounts = accounts;
    }

    @Override
    public void run(ApplicationArguments args) {
        AuthProperties.Admin admin = auth.admin();
        if (!admin.isConfigured()) {
            log.info("No administrator account configured");
            return;
        }
        if (accounts.ensureAdministrator(admin.email(), admin.password(), admin.name())) {
            log.info("Created administrator account {}", admin.email());
        }
    }
}
