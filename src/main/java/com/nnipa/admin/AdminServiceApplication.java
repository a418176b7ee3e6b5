package com.nnipa.admin;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main application class for the Admin Service.
 *
 * This service handles:
 * - Password policy enforcement and credential rotation for admin principals
 * - BCrypt hashing and fail-closed verification of credentials
 * - Trace ID generation and propagation for every inbound request
 * - Audit trail of every mutating admin request, committed atomically
 *   with the change it describes
 */
@Slf4j
@SpringBootApplication
@EnableJpaAuditing
@EnableTransactionManagement
@ConfigurationPropertiesScan("com.nnipa.admin.config")
public class AdminServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdminServiceApplication.class, args);
        log.info("===========================================");
        log.info("NNIPA Admin Service Started");
        log.info("===========================================");
        log.info("Credential Security:");
        log.info("- Password Policy (length, uppercase, digit, special)");
        log.info("- BCrypt Hashing (cost 12)");
        log.info("- Password History (last 3 retired credentials)");
        log.info("===========================================");
        log.info("Audit Trail:");
        log.info("- ULID Trace IDs on every request and log line");
        log.info("- One audit record per mutating request, same transaction");
        log.info("===========================================");
    }
}
