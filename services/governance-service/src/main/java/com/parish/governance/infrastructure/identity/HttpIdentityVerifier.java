package com.parish.governance.infrastructure.identity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.parish.observability.MetricFactory;
import com.parish.security.IdentityClaims;
import com.parish.security.IdentityVerifier;
import com.parish.security.UnauthenticatedException;
import io.micrometer.core.instrument.Timer;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Verifies bearer credentials against the identity provider's introspection endpoint.
 *
 * <p>Sends {@code {"token": "..."}} and expects {@code {"subjectId", "email",
 * "signInProvider"}} back. Any non-2xx answer, timeout or transport error fails closed
 * with {@link UnauthenticatedException}. Connect and read timeouts are set on the
 * {@link RestClient} by {@code SecurityConfig}.
 */
public class HttpIdentityVerifier implements IdentityVerifier {

    private static final Logger log = LoggerFactory.getLogger(HttpIdentityVerifier.class);

    private final RestClient restClient;
    private final String verifyUrl;
    private final MetricFactory metrics;

    public HttpIdentityVerifier(RestClient restClient, String verifyUrl, MetricFactory metrics) {
        this.restClient = restClient;
        this.verifyUrl = verifyUrl;
        this.metrics = metrics;
    }

    @Override
    public IdentityClaims verify(String token) {
        Timer.Sample sample = Timer.start(metrics.registry());
        String outcome = "error";
        try {
            VerifyResponse response = restClient.post()
                    .uri(verifyUrl)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(Map.of("token", token))
                    .retrieve()
                    .body(VerifyResponse.class);
            if (response == null || response.subjectId() == null || response.subjectId().isBlank()) {
                outcome = "invalid";
                throw new UnauthenticatedException("Identity provider returned no subject");
            }
            outcome = "verified";
            return new IdentityClaims(response.subjectId(), response.email(), response.signInProvider());
        } catch (RestClientResponseException e) {
            outcome = "rejected";
            log.debug("Identity provider rejected credential: status={}", e.getStatusCode().value());
            throw new UnauthenticatedException("Identity provider rejected the credential", e);
        } catch (ResourceAccessException e) {
            outcome = "unavailable";
            log.warn("Identity provider unreachable: {}", e.getMessage());
            throw new UnauthenticatedException("Identity provider unavailable", e);
        } catch (RestClientException e) {
            log.warn("Identity verification failed: {}", e.getMessage());
            throw new UnauthenticatedException("Identity verification failed", e);
        } finally {
            sample.stop(metrics.timer("parish.identity.verify", "Identity provider verification calls",
                    "outcome", outcome));
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record VerifyResponse(String subjectId, String email, String signInProvider) {
    }
}
