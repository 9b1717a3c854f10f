package com.acme.assistant.retry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BackoffPolicyTest {

    private final BackoffPolicy policy =
            new BackoffPolicy(
                    List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4)));

    @Test
    @DisplayName("delay follows the schedule by retry count")
    void testDelayFollowsSchedule() {
        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.delayFor(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.delayFor(3)).isEqualTo(Duration.ofSeconds(4));
    }

    @Test
    @DisplayName("last value repeats once the count exceeds the schedule")
    void testLastValueRepeats() {
        assertThat(policy.delayFor(4)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.delayFor(100)).isEqualTo(Duration.ofSeconds(4));
    }

    @Test
    @DisplayName("retry count below one is rejected")
    void testRejectsZeroCount() {
        assertThatThrownBy(() -> policy.delayFor(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("empty schedule is rejected")
    void testRejectsEmptySchedule() {
        assertThatThrownBy(() -> new BackoffPolicy(List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must not be empty");
    }
}
