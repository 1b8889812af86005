package com.parish.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("MetricFactory")
class MetricFactoryTest {

    private SimpleMeterRegistry registry;
    private MetricFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        factory = new MetricFactory(registry, "governance-service");
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject null registry")
        void shouldRejectNullRegistry() {
            assertThatThrownBy(() -> new MetricFactory(null, "svc"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("registry");
        }

        @Test
        @DisplayName("should reject blank service name")
        void shouldRejectBlankServiceName() {
            assertThatThrownBy(() -> new MetricFactory(registry, "  "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("serviceName");
        }
    }

    @Nested
    @DisplayName("Counter")
    class CounterTests {

        @Test
        @DisplayName("repeated lookups with the same tags share one counter")
        void repeatedLookupsShareCounter() {
            factory.counter("parish.access.denied", "Denied requests", "code", "FORBIDDEN").increment();
            factory.counter("parish.access.denied", "Denied requests", "code", "FORBIDDEN").increment();
            factory.counter("parish.access.denied", "Denied requests", "code", "UNAUTHENTICATED").increment();

            assertThat(registry.get("parish.access.denied").tag("code", "FORBIDDEN").counter().count())
                    .isEqualTo(2.0);
            assertThat(registry.get("parish.access.denied").tag("code", "UNAUTHENTICATED").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("should carry the service tag")
        void shouldCarryServiceTag() {
            Counter counter = factory.counter("parish.audit.failed", "Audit writes that failed");

            assertThat(counter.getId().getTag("service")).isEqualTo("governance-service");
        }
    }

    @Test
    @DisplayName("timer should record durations with service and extra tags")
    void timerRecords() {
        Timer timer = factory.timer("parish.identity.verify", "Identity verification latency", "outcome", "ok");

        timer.record(Duration.ofMillis(150));
        timer.record(Duration.ofMillis(250));

        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(400.0);
        assertThat(timer.getId().getTag("service")).isEqualTo("governance-service");
        assertThat(timer.getId().getTag("outcome")).isEqualTo("ok");
    }
}
