package conduit.adapter.out.storage.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import conduit.core.model.storage.StoreException;
import conduit.core.port.out.Metrics;

@DisplayName("RedisTimeoutHelper")
@ExtendWith(MockitoExtension.class)
class RedisTimeoutHelperTest {

    private static final Duration TIMEOUT = Duration.ofMillis(50);
    private static final String STORE_NAME = "refresh-tokens";
    private static final String OPERATION_NAME = "get";

    @Mock
    private Metrics metrics;

    private RedisTimeoutHelper helper;

    @BeforeEach
    void setUp() {
        helper = new RedisTimeoutHelper(TIMEOUT, metrics, STORE_NAME);
    }

    @Nested
    @DisplayName("withTimeout()")
    class WithTimeoutTests {

        @Test
        @DisplayName("should return result when operation completes within timeout")
        void shouldReturnResultWhenOperationCompletesWithinTimeout() {
            final var operation = Uni.createFrom().item("value");

            final var result = helper.withTimeout(operation, OPERATION_NAME).await().indefinitely();

            assertEquals("value", result);
            verifyNoInteractions(metrics);
        }

        @Test
        @DisplayName("should fail with StoreException when operation times out")
        void shouldFailWhenOperationTimesOut() {
            final var operation = Uni.createFrom().<String>nothing();

            final var exception = assertThrows(
                    StoreException.class,
                    () -> helper.withTimeout(operation, OPERATION_NAME).await().indefinitely());

            assertEquals(OPERATION_NAME, exception.getOperation());
            assertEquals(STORE_NAME, exception.getStore());
            assertTrue(exception.getMessage().contains("timed out"));
            verify(metrics).recordStoreTimeout(eq(STORE_NAME), eq(OPERATION_NAME));
        }

        @Test
        @DisplayName("should wrap backend failures in StoreException")
        void shouldWrapBackendFailures() {
            final var operation = Uni.createFrom().<String>failure(new RuntimeException("Connection refused"));

            final var exception = assertThrows(
                    StoreException.class,
                    () -> helper.withTimeout(operation, OPERATION_NAME).await().indefinitely());

            assertInstanceOf(RuntimeException.class, exception.getCause());
            assertEquals("Connection refused", exception.getCause().getMessage());
            verify(metrics).recordStoreFailure(eq(STORE_NAME), eq(OPERATION_NAME));
        }

        @Test
        @DisplayName("should tolerate missing metrics")
        void shouldTolerateMissingMetrics() {
            final var withoutMetrics = new RedisTimeoutHelper(TIMEOUT, null, STORE_NAME);

            assertThrows(
                    StoreException.class,
                    () -> withoutMetrics
                            .withTimeout(Uni.createFrom().<String>nothing(), OPERATION_NAME)
                            .await()
                            .indefinitely());
        }
    }

    @Nested
    @DisplayName("withTimeoutFallback()")
    class WithTimeoutFallbackTests {

        @Test
        @DisplayName("should return result when operation completes within timeout")
        void shouldReturnResultWhenOperationCompletesWithinTimeout() {
            final var result = helper.withTimeoutFallback(Uni.createFrom().item(true), "healthCheck", () -> false)
                    .await()
                    .indefinitely();

            assertTrue(result);
            verifyNoInteractions(metrics);
        }

        @Test
        @DisplayName("should return fallback value when operation times out")
        void shouldReturnFallbackValueWhenOperationTimesOut() {
            final var result = helper.withTimeoutFallback(Uni.createFrom().<Boolean>nothing(), "healthCheck", () -> false)
                    .await()
                    .indefinitely();

            assertFalse(result);
            verify(metrics).recordStoreTimeout(eq(STORE_NAME), eq("healthCheck"));
        }

        @Test
        @DisplayName("should return null fallback when configured")
        void shouldReturnNullFallbackWhenConfigured() {
            final var result = helper.withTimeoutFallback(Uni.createFrom().<String>nothing(), OPERATION_NAME, () -> null)
                    .await()
                    .indefinitely();

            assertNull(result);
        }

        @Test
        @DisplayName("should return fallback value when operation fails with exception")
        void shouldReturnFallbackValueWhenOperationFails() {
            final var operation = Uni.createFrom().<Boolean>failure(new RuntimeException("Connection refused"));

            final var result = helper.withTimeoutFallback(operation, "healthCheck", () -> false)
                    .await()
                    .indefinitely();

            assertFalse(result);
            verify(metrics).recordStoreFailure(eq(STORE_NAME), eq("healthCheck"));
        }
    }
}
