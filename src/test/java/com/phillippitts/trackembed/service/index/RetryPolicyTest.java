package com.phillippitts.trackembed.service.index;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void delayDoublesPerFailedAttempt() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(100));

        assertThat(policy.delayAfter(1)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.delayAfter(2)).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.delayAfter(3)).isEqualTo(Duration.ofMillis(400));
    }

    @Test
    void lastAttemptHasNoAttemptsLeft() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(1));

        assertThat(policy.hasAttemptsLeft(1)).isTrue();
        assertThat(policy.hasAttemptsLeft(2)).isTrue();
        assertThat(policy.hasAttemptsLeft(3)).isFalse();
    }

    @Test
    void backoffUsesSleeper() throws InterruptedException {
        List<Duration> slept = new ArrayList<>();
        RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(1), slept::add);

        policy.backoff(1);
        policy.backoff(2);

        assertThat(slept).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(3, Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(3, Duration.ofSeconds(1)).delayAfter(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
