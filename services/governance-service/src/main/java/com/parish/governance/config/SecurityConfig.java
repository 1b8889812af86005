package com.parish.governance.config;

import com.parish.governance.infrastructure.identity.HttpIdentityVerifier;
import com.parish.observability.MetricFactory;
import com.parish.observability.SensitiveDataRedactor;
import com.parish.security.IdentityVerifier;
import com.parish.security.PlatformAdminAllowList;
import com.parish.security.SessionResolver;
import com.parish.security.TenantDirectory;
import com.parish.security.audit.AuditRecorder;
import com.parish.security.audit.AuditSink;
import com.parish.security.impersonation.ImpersonationManager;
import com.parish.security.impersonation.ImpersonationRevocations;
import com.parish.security.impersonation.ImpersonationTokenCodec;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.http.HttpClient;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Wires the framework-free authorization core into the Spring context.
 *
 * <p>The core classes take their collaborators through constructors; the store-backed
 * ports ({@link TenantDirectory}, {@link ImpersonationRevocations}, {@link AuditSink}) are
 * the JDBC components of {@code infrastructure.persistence}.
 */
@Configuration
public class SecurityConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, GovernanceProperties properties) {
        return new MetricFactory(registry, properties.name());
    }

    @Bean
    public PlatformAdminAllowList platformAdminAllowList(GovernanceProperties properties) {
        return PlatformAdminAllowList.of(properties.platformAdminEmails());
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }

    @Bean
    public AuditRecorder auditRecorder(AuditSink auditSink, SensitiveDataRedactor redactor, Clock clock) {
        return new AuditRecorder(auditSink, redactor, clock);
    }

    @Bean
    public ImpersonationTokenCodec impersonationTokenCodec(GovernanceProperties properties, Clock clock) {
        return new ImpersonationTokenCodec(properties.impersonation().secret(), clock);
    }

    @Bean
    public ImpersonationManager impersonationManager(ImpersonationTokenCodec codec,
                                                     ImpersonationRevocations revocations,
                                                     TenantDirectory tenantDirectory,
                                                     AuditRecorder auditRecorder,
                                                     GovernanceProperties properties,
                                                     Clock clock) {
        return new ImpersonationManager(codec, revocations, tenantDirectory, auditRecorder,
                properties.impersonation().ttl(), clock);
    }

    @Bean
    public IdentityVerifier identityVerifier(GovernanceProperties properties, MetricFactory metrics) {
        GovernanceProperties.Identity identity = properties.identity();
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(identity.timeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(identity.timeout());
        RestClient restClient = RestClient.builder()
                .requestFactory(requestFactory)
                .build();
        return new HttpIdentityVerifier(restClient, identity.verifyUrl(), metrics);
    }

    @Bean
    public SessionResolver sessionResolver(IdentityVerifier identityVerifier,
                                           TenantDirectory tenantDirectory,
                                           PlatformAdminAllowList platformAdmins,
                                           ImpersonationManager impersonationManager) {
        return new SessionResolver(identityVerifier, tenantDirectory, platformAdmins, impersonationManager);
    }
}
