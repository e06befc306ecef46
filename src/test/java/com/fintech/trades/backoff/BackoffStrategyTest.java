package com.fintech.trades.backoff;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Backoff strategies")
class BackoffStrategyTest {

    @Nested
    @DisplayName("Exponential")
    class Exponential {

        private final ExponentialBackoffStrategy strategy =
            new ExponentialBackoffStrategy(Duration.ofSeconds(5), Duration.ofSeconds(300), 2.0);

        @ParameterizedTest(name = "attempt {0} -> {1}s")
        @CsvSource({"1,5", "2,10", "3,20", "4,40", "5,80", "6,160", "7,300", "8,300", "50,300"})
        @DisplayName("Doubles from 5s and caps at 300s")
        void defaultSequence(int attempt, long expectedSeconds) {
            assertThat(strategy.getDelay(attempt)).isEqualTo(Duration.ofSeconds(expectedSeconds));
        }

        @Test
        @DisplayName("Caps a 1s/30s sequence at 1,2,4,8,16,30,30")
        void cappedSequence() {
            ExponentialBackoffStrategy capped =
                new ExponentialBackoffStrategy(Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0);

            assertThat(IntStream.rangeClosed(1, 7).mapToObj(capped::getDelay).map(Duration::getSeconds))
                .containsExactly(1L, 2L, 4L, 8L, 16L, 30L, 30L);
        }

        @Test
        @DisplayName("Huge attempt numbers saturate instead of overflowing")
        void saturates() {
            assertThat(strategy.getDelay(Integer.MAX_VALUE)).isEqualTo(Duration.ofSeconds(300));
        }

        @ParameterizedTest(name = "attempt {0}")
        @ValueSource(ints = {0, -1, Integer.MIN_VALUE})
        @DisplayName("Rejects attempt numbers below 1")
        void rejectsInvalidAttempt(int attempt) {
            assertThatThrownBy(() -> strategy.getDelay(attempt)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Rejects a cap below the initial delay and multipliers below 1")
        void rejectsInvalidConfiguration() {
            assertThatThrownBy(() -> new ExponentialBackoffStrategy(Duration.ofSeconds(10), Duration.ofSeconds(5), 2.0))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new ExponentialBackoffStrategy(Duration.ofSeconds(1), Duration.ofSeconds(5), 0.5))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Linear")
    class Linear {

        private final LinearBackoffStrategy strategy =
            new LinearBackoffStrategy(Duration.ofSeconds(5), Duration.ofSeconds(12));

        @ParameterizedTest(name = "attempt {0} -> {1}s")
        @CsvSource({"1,5", "2,10", "3,12", "1000,12", "2147483647,12"})
        @DisplayName("Grows by the initial delay and caps")
        void sequence(int attempt, long expectedSeconds) {
            assertThat(strategy.getDelay(attempt)).isEqualTo(Duration.ofSeconds(expectedSeconds));
        }

        @Test
        @DisplayName("Rejects attempt 0")
        void rejectsZero() {
            assertThatThrownBy(() -> strategy.getDelay(0)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("BackoffType builds the configured strategy")
    void typeFactory() {
        assertThat(BackoffType.EXPONENTIAL.create(Duration.ofSeconds(1), Duration.ofSeconds(2), 2.0))
            .isInstanceOf(ExponentialBackoffStrategy.class);
        assertThat(BackoffType.LINEAR.create(Duration.ofSeconds(1), Duration.ofSeconds(2), 2.0))
            .isInstanceOf(LinearBackoffStrategy.class);
    }
}
