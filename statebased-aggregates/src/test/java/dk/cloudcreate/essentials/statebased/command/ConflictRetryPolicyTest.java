package dk.cloudcreate.essentials.statebased.command;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class ConflictRetryPolicyTest {
    @Test
    void verify_fixed_backoff() {
        var policy = ConflictRetryPolicy.fixedBackoff(Duration.ofMillis(100), 3);
        assertThat(policy.maximumNumberOfRetries).isEqualTo(3);
        assertThat(policy.calculateRetryDelay(0)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.calculateRetryDelay(1)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.calculateRetryDelay(2)).isEqualTo(Duration.ofMillis(100));
    }

    @Test
    void verify_linear_backoff() {
        var policy = ConflictRetryPolicy.linearBackoff(Duration.ofMillis(100), Duration.ofMillis(250), 5);
        assertThat(policy.calculateRetryDelay(0)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.calculateRetryDelay(1)).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.calculateRetryDelay(2)).isEqualTo(Duration.ofMillis(250));
    }

    @Test
    void verify_exponential_backoff_is_capped_at_the_maximum_delay() {
        var policy = ConflictRetryPolicy.exponentialBackoff(Duration.ofMillis(10), 2.0d, Duration.ofMillis(50), 5);
        assertThat(policy.calculateRetryDelay(0)).isEqualTo(Duration.ofMillis(10));
        assertThat(policy.calculateRetryDelay(1)).isEqualTo(Duration.ofMillis(20));
        assertThat(policy.calculateRetryDelay(2)).isEqualTo(Duration.ofMillis(40));
        assertThat(policy.calculateRetryDelay(3)).isEqualTo(Duration.ofMillis(50));
    }

    @Test
    void verify_that_invalid_settings_are_rejected() {
        assertThatThrownBy(() -> ConflictRetryPolicy.fixedBackoff(Duration.ofMillis(10), -1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ConflictRetryPolicy.exponentialBackoff(Duration.ofMillis(10), 0.5d, Duration.ofMillis(50), 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
