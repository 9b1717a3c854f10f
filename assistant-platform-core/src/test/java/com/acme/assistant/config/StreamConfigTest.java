package com.acme.assistant.config;

import static org.assertj.core.api.Assertions.*;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class StreamConfigTest {

    @Nested
    @DisplayName("defaults")
    class Defaults {

        @Test
        @DisplayName("should default to the assistant stream names")
        void testDefaultNames() {
            StreamConfig config = new StreamConfig();

            assertThat(config.getInputStream()).isEqualTo("to_secretary");
            assertThat(config.getGroup()).isEqualTo("assistant");
            assertThat(config.getOutputStream()).isEqualTo("to_telegram");
            assertThat(config.getDlqStream()).isEqualTo("to_secretary:dlq");
            assertThat(config.getPayloadField()).isEqualTo("payload");
            assertThat(config.getConsumerName()).startsWith("assistant-");
        }

        @Test
        @DisplayName("should default lease timings")
        void testDefaultTimings() {
            StreamConfig config = new StreamConfig();

            assertThat(config.getBlockTimeout()).isEqualTo(Duration.ofSeconds(5));
            assertThat(config.getIdleTimeout()).isEqualTo(Duration.ofSeconds(60));
            assertThat(config.getReclaimInterval()).isEqualTo(Duration.ofSeconds(30));
            assertThat(config.getReclaimBatchSize()).isEqualTo(10);
        }

        @Test
        @DisplayName("retry defaults match a 1s, 2s, 4s schedule with three attempts")
        void testRetryDefaults() {
            RetryConfig retry = new RetryConfig();

            assertThat(retry.getMaxRetries()).isEqualTo(3);
            assertThat(retry.getBackoffSchedule())
                    .containsExactly(
                            Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4));
            assertThat(retry.getLedgerTtl()).isEqualTo(Duration.ofHours(1));
            assertThat(retry.getKeyPrefix()).isEqualTo("msg_retry:");
            assertThat(retry.largestBackoff()).isEqualTo(Duration.ofSeconds(4));
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("defaults are valid")
        void testDefaultsValid() {
            assertThatCode(() -> new StreamConfig().validate(new RetryConfig()))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("rejects an empty backoff schedule")
        void testRejectsEmptySchedule() {
            RetryConfig retry = new RetryConfig();
            retry.setBackoffSchedule(List.of());

            assertThatThrownBy(() -> new StreamConfig().validate(retry))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("backoff-schedule");
        }

        @Test
        @DisplayName("rejects max retries below one")
        void testRejectsZeroRetries() {
            RetryConfig retry = new RetryConfig();
            retry.setMaxRetries(0);

            assertThatThrownBy(() -> new StreamConfig().validate(retry))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("max-retries");
        }

        @Test
        @DisplayName("only warns when idle timeout is shorter than the largest backoff")
        void testShortIdleTimeoutWarns() {
            StreamConfig config = new StreamConfig();
            config.setIdleTimeout(Duration.ofSeconds(2));

            assertThatCode(() -> config.validate(new RetryConfig())).doesNotThrowAnyException();
        }
    }

    @Test
    @DisplayName("worker consumer names are suffixed with the worker index")
    void testConsumerNameFor() {
        StreamConfig config = new StreamConfig();
        config.setConsumerName("assistant-host");

        assertThat(config.consumerNameFor(2)).isEqualTo("assistant-host-2");
    }

    @Test
    @DisplayName("transport backoff doubles from the initial value up to the cap")
    void testTransportBackoff() {
        WorkerConfig worker = new WorkerConfig();

        assertThat(worker.transportBackoff(1)).isEqualTo(Duration.ofMillis(100));
        assertThat(worker.transportBackoff(2)).isEqualTo(Duration.ofMillis(200));
        assertThat(worker.transportBackoff(4)).isEqualTo(Duration.ofMillis(800));
        assertThat(worker.transportBackoff(10)).isEqualTo(Duration.ofSeconds(5));
        assertThat(worker.transportBackoff(1000)).isEqualTo(Duration.ofSeconds(5));
    }
}
