package com.acme.assistant.redis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.awaitility.Awaitility.await;

import com.acme.assistant.config.StreamConfig;
import com.acme.assistant.core.StreamEvent;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.redisson.api.PendingEntry;
import org.redisson.api.RStream;
import org.redisson.api.StreamMessageId;
import org.redisson.api.stream.StreamAddArgs;

class RedisStreamConsumerTest extends RedisContainerTestBase {

    private StreamConfig config;
    private RedisStreamPublisher publisher;
    private RedisStreamConsumer consumerA;
    private RedisStreamConsumer consumerB;

    @BeforeEach
    void setUp() {
        config = streamConfig();
        publisher = new RedisStreamPublisher(redisson, config.getPayloadField());
        consumerA = new RedisStreamConsumer(redisson, config, "worker-a", Clock.systemUTC());
        consumerB = new RedisStreamConsumer(redisson, config, "worker-b", Clock.systemUTC());
        consumerA.ensureGroup();
    }

    private String add(String payload) {
        return publisher.publish(config.getInputStream(), payload.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("ensureGroup is idempotent")
    void testEnsureGroupIdempotent() {
        assertThatCode(() -> consumerB.ensureGroup()).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("read returns the appended event byte-identical with delivery count 1")
    void testReadNewEvent() {
        // Given
        byte[] payload = new byte[] {0, (byte) 0xff, 'a', '\n'};
        String id = publisher.publish(config.getInputStream(), payload);

        // When
        Optional<StreamEvent> event = consumerA.read();

        // Then
        assertThat(event).isPresent();
        assertThat(event.get().id()).isEqualTo(id);
        assertThat(event.get().payload()).isEqualTo(payload);
        assertThat(event.get().deliveryCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("read times out empty when nothing is pending")
    void testReadTimesOut() {
        assertThat(consumerA.read()).isEmpty();
    }

    @Test
    @DisplayName("an event is delivered to only one consumer while its lease is fresh")
    void testExclusiveLease() {
        add("{\"n\":1}");

        assertThat(consumerA.read()).isPresent();
        assertThat(consumerB.reclaimStale(Duration.ofMinutes(5))).isEmpty();
    }

    @Test
    @DisplayName("ack succeeds once; a second ack is a no-op")
    void testAckOnce() {
        String id = add("{\"n\":1}");
        consumerA.read();

        assertThat(consumerA.ack(id)).isTrue();
        assertThat(consumerA.ack(id)).isFalse();
    }

    @Test
    @DisplayName("stale lease is reclaimed by another consumer; the late ack is a no-op")
    void testStaleLeaseReclaimed() {
        // Given: A leases E2 and stalls
        String e2 = add("{\"n\":2}");
        assertThat(consumerA.read()).map(StreamEvent::id).contains(e2);

        // When: B reads after the idle timeout
        AtomicReference<StreamEvent> reclaimed = new AtomicReference<>();
        await().atMost(Duration.ofSeconds(5))
                .untilAsserted(
                        () -> {
                            Optional<StreamEvent> event = consumerB.read();
                            assertThat(event).isPresent();
                            reclaimed.set(event.get());
                        });

        // Then
        assertThat(reclaimed.get().id()).isEqualTo(e2);
        assertThat(reclaimed.get().deliveryCount()).isEqualTo(2);
        assertThat(consumerB.ack(e2)).isTrue();
        assertThat(consumerA.ack(e2)).isFalse();
    }

    @Test
    @DisplayName("interval sweep serves reclaimed events ahead of new ones")
    void testIntervalSweepRunsUnderTraffic() throws Exception {
        // Given
        String stale = add("{\"n\":1}");
        consumerA.read();
        Thread.sleep(config.getIdleTimeout().toMillis() + 100);
        String fresh = add("{\"n\":2}");

        StreamConfig sweeping = streamConfig();
        sweeping.setReclaimInterval(Duration.ZERO);
        RedisStreamConsumer sweeper =
                new RedisStreamConsumer(redisson, sweeping, "worker-c", Clock.systemUTC());

        // When / Then
        assertThat(sweeper.read()).map(StreamEvent::id).contains(stale);
        assertThat(sweeper.read()).map(StreamEvent::id).contains(fresh);
    }

    @Test
    @DisplayName("reclaimStale takes over idle leases with incremented delivery counts")
    void testReclaimStale() throws Exception {
        add("{\"n\":1}");
        add("{\"n\":2}");
        consumerA.read();
        consumerA.read();
        Thread.sleep(config.getIdleTimeout().toMillis() + 100);

        List<StreamEvent> events = consumerB.reclaimStale(config.getIdleTimeout());

        assertThat(events).hasSize(2);
        assertThat(events).allMatch(e -> e.deliveryCount() == 2);
        assertThat(events).allMatch(StreamEvent::isRedelivery);
    }

    @Test
    @DisplayName("read claims one stale lease at a time and leaves the rest with their holder")
    void testReadClaimsOneStaleLease() throws Exception {
        // Given
        String first = add("{\"n\":1}");
        String second = add("{\"n\":2}");
        String third = add("{\"n\":3}");
        consumerA.read();
        consumerA.read();
        consumerA.read();
        Thread.sleep(config.getIdleTimeout().toMillis() + 100);

        // When
        Optional<StreamEvent> claimed = consumerB.read();

        // Then
        assertThat(claimed).map(StreamEvent::id).contains(first);
        assertThat(ownersOfPending())
                .containsEntry(first, "worker-b")
                .containsEntry(second, "worker-a")
                .containsEntry(third, "worker-a");
    }

    @Test
    @DisplayName("successive reads continue the stale scan in id order")
    void testSuccessiveReadsContinueScan() throws Exception {
        // Given
        String first = add("{\"n\":1}");
        String second = add("{\"n\":2}");
        String third = add("{\"n\":3}");
        consumerA.read();
        consumerA.read();
        consumerA.read();
        Thread.sleep(config.getIdleTimeout().toMillis() + 100);

        StreamConfig sweeping = streamConfig();
        sweeping.setReclaimInterval(Duration.ZERO);
        RedisStreamConsumer sweeper =
                new RedisStreamConsumer(redisson, sweeping, "worker-c", Clock.systemUTC());

        // When
        List<String> served =
                List.of(
                        sweeper.read().map(StreamEvent::id).orElse("none"),
                        sweeper.read().map(StreamEvent::id).orElse("none"),
                        sweeper.read().map(StreamEvent::id).orElse("none"));

        // Then
        assertThat(served).containsExactly(first, second, third);
    }

    private Map<String, String> ownersOfPending() {
        RStream<String, byte[]> stream =
                redisson.getStream(config.getInputStream(), RedisCodecs.STREAM);
        Map<String, String> owners = new HashMap<>();
        for (PendingEntry entry :
                stream.listPending(config.getGroup(), StreamMessageId.MIN, StreamMessageId.MAX, 100)) {
            owners.put(entry.getId().toString(), entry.getConsumerName());
        }
        return owners;
    }

    @Test
    @DisplayName("entries without a payload field are acknowledged and skipped")
    void testEntryWithoutPayload() {
        // Given
        RStream<String, byte[]> stream =
                redisson.getStream(config.getInputStream(), RedisCodecs.STREAM);
        stream.add(StreamAddArgs.entry("other", "x".getBytes(StandardCharsets.UTF_8)));
        String good = add("{\"n\":1}");

        // When
        Optional<StreamEvent> first = consumerA.read();
        Optional<StreamEvent> second = consumerA.read();

        // Then
        assertThat(first).isEmpty();
        assertThat(second).map(StreamEvent::id).contains(good);
        assertThat(new RedisQueueInspector(redisson, config).pendingCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("a deleted stream is recreated together with its group")
    void testRecoversMissingGroup() {
        redisson.getStream(config.getInputStream()).delete();

        assertThat(consumerA.read()).isEmpty();
        String id = add("{\"n\":1}");
        assertThat(consumerA.read()).map(StreamEvent::id).contains(id);
    }
}
