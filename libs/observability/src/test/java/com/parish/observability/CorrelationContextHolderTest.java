package com.parish.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CorrelationContextHolder}: thread-local storage, the MDC bridge,
 * principal enrichment and scoped execution.
 */
@DisplayName("CorrelationContextHolder")
class CorrelationContextHolderTest {

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("set/get/clear lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should return empty when no context is set")
        void shouldReturnEmptyWhenNoContext() {
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should store and retrieve context")
        void shouldStoreAndRetrieveContext() {
            var ctx = CorrelationContext.anonymous("corr-1", "req-1");
            CorrelationContextHolder.set(ctx);

            assertThat(CorrelationContextHolder.get()).contains(ctx);
        }

        @Test
        @DisplayName("should reject null context")
        void shouldRejectNullContext() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("context");
        }
    }

    @Nested
    @DisplayName("MDC bridge")
    class MdcBridge {

        @Test
        @DisplayName("should populate MDC keys when context is set")
        void shouldPopulateMdcOnSet() {
            CorrelationContextHolder.set(
                    new CorrelationContext("corr-1", "req-1", "tenant-1", "user-1", "TENANT_USER"));

            assertThat(MDC.get("correlationId")).isEqualTo("corr-1");
            assertThat(MDC.get("requestId")).isEqualTo("req-1");
            assertThat(MDC.get("tenantId")).isEqualTo("tenant-1");
            assertThat(MDC.get("userId")).isEqualTo("user-1");
            assertThat(MDC.get("sessionKind")).isEqualTo("TENANT_USER");
        }

        @Test
        @DisplayName("should clear MDC keys when context is cleared")
        void shouldClearMdcOnClear() {
            CorrelationContextHolder.set(
                    new CorrelationContext("corr-1", "req-1", "tenant-1", "user-1", "TENANT_USER"));
            CorrelationContextHolder.clear();

            assertThat(MDC.get("correlationId")).isNull();
            assertThat(MDC.get("tenantId")).isNull();
            assertThat(MDC.get("userId")).isNull();
            assertThat(MDC.get("sessionKind")).isNull();
        }

        @Test
        @DisplayName("enrich should tag the current thread with the resolved principal")
        void enrichAddsPrincipal() {
            CorrelationContextHolder.set(CorrelationContext.anonymous("corr-1", "req-1"));

            CorrelationContextHolder.enrich("tenant-9", "user-9", "IMPERSONATION");

            assertThat(MDC.get("correlationId")).isEqualTo("corr-1");
            assertThat(MDC.get("tenantId")).isEqualTo("tenant-9");
            assertThat(MDC.get("sessionKind")).isEqualTo("IMPERSONATION");
        }

        @Test
        @DisplayName("enrich without an established context is a no-op")
        void enrichWithoutContext() {
            CorrelationContextHolder.enrich("tenant-9", "user-9", "TENANT_USER");

            assertThat(CorrelationContextHolder.get()).isEmpty();
            assertThat(MDC.get("tenantId")).isNull();
        }

        @Test
        @DisplayName("platform admin principal removes a stale tenant key")
        void nullTenantRemovesKey() {
            CorrelationContextHolder.set(
                    new CorrelationContext("corr-1", "req-1", "tenant-1", "user-1", "TENANT_USER"));

            CorrelationContextHolder.enrich(null, "admin-1", "PLATFORM_ADMIN");

            assertThat(MDC.get("tenantId")).isNull();
            assertThat(MDC.get("userId")).isEqualTo("admin-1");
        }
    }

    @Nested
    @DisplayName("runWithContext")
    class RunWithContext {

        @Test
        @DisplayName("should set context for the duration of the runnable and restore afterwards")
        void shouldSetContextAndRestore() {
            var outer = CorrelationContext.anonymous("outer-corr", null);
            var inner = CorrelationContext.anonymous("inner-corr", null);
            CorrelationContextHolder.set(outer);

            AtomicReference<String> captured = new AtomicReference<>();
            CorrelationContextHolder.runWithContext(inner, () -> captured.set(
                    CorrelationContextHolder.get().map(CorrelationContext::correlationId).orElse(null)));

            assertThat(captured.get()).isEqualTo("inner-corr");
            assertThat(CorrelationContextHolder.get()).contains(outer);
        }

        @Test
        @DisplayName("should clear context after runnable when no previous context existed")
        void shouldClearWhenNoPreviousContext() {
            CorrelationContextHolder.runWithContext(CorrelationContext.anonymous("temp", null),
                    () -> assertThat(CorrelationContextHolder.get()).isPresent());

            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should restore context even if runnable throws")
        void shouldRestoreOnException() {
            var outer = CorrelationContext.anonymous("outer-corr", null);
            CorrelationContextHolder.set(outer);

            assertThatThrownBy(() -> CorrelationContextHolder.runWithContext(
                    CorrelationContext.anonymous("inner-corr", null), () -> {
                        throw new IllegalStateException("boom");
                    }))
                    .isInstanceOf(IllegalStateException.class);

            assertThat(CorrelationContextHolder.get()).contains(outer);
        }
    }

    @Test
    @DisplayName("should not leak context across threads")
    void shouldNotLeakAcrossThreads() throws InterruptedException {
        CorrelationContextHolder.set(CorrelationContext.anonymous("main-corr", null));

        AtomicReference<Boolean> otherThreadHasContext = new AtomicReference<>();
        Thread other = new Thread(() -> otherThreadHasContext.set(CorrelationContextHolder.get().isPresent()));
        other.start();
        other.join();

        assertThat(otherThreadHasContext.get()).isFalse();
    }
}
