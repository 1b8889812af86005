package com.parish.governance;

import com.parish.governance.config.GovernanceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Governance service: resolves every request to one security context and hosts the
 * privileged mutations the authorization core guards (roles, branches, tenant users,
 * tenant plan and status, impersonation, audit log).
 *
 * <p>Configured by default:
 *
 * <ul>
 *   <li>Graceful shutdown ({@code server.shutdown=graceful})
 *   <li>Actuator health, metrics and Prometheus endpoints
 *   <li>Correlation ID propagation and tenant-tagged logging
 *   <li>Structured error handling (RFC 7807 ProblemDetail)
 *   <li>Flyway-managed schema
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(GovernanceProperties.class)
public class GovernanceServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(GovernanceServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(GovernanceServiceApplication.class, args);
        log.info("Parish governance service started");
    }
}
