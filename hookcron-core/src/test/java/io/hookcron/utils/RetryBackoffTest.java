package io.hookcron.utils;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryBackoffTest {

    @Test
    void delayShouldDoubleWithEachAttemptPlusBoundedJitter() {
        RetryBackoff backoff = new RetryBackoff(Duration.ofSeconds(1));

        for (int attempt = 1; attempt <= 5; attempt++) {
            long floor = 1000L << attempt;
            for (int i = 0; i < 50; i++) {
                assertThat(backoff.delayFor(attempt).toMillis())
                        .isGreaterThanOrEqualTo(floor)
                        .isLessThan(floor + 1000);
            }
        }
    }

    @Test
    void jitterShouldComeFromTheRandomSource() {
        Random half = new Random() {
            @Override
            public double nextDouble() {
                return 0.5;
            }
        };
        RetryBackoff backoff = new RetryBackoff(Duration.ofMillis(200), () -> half);

        assertThat(backoff.delayFor(1)).isEqualTo(Duration.ofMillis(500));
        assertThat(backoff.delayFor(3)).isEqualTo(Duration.ofMillis(1700));
    }

    @Test
    void exponentShouldBeCapped() {
        Random zero = new Random() {
            @Override
            public double nextDouble() {
                return 0.0;
            }
        };
        RetryBackoff backoff = new RetryBackoff(Duration.ofMillis(1), () -> zero);

        assertThat(backoff.delayFor(500)).isEqualTo(backoff.delayFor(RetryBackoff.MAX_EXPONENT));
    }

    @Test
    void baseMustBePositive() {
        assertThatThrownBy(() -> new RetryBackoff(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
