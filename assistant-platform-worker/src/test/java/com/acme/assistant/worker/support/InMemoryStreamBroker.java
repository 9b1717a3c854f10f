package com.acme.assistant.worker.support;

import com.acme.assistant.core.StreamEvent;
import com.acme.assistant.spi.StreamConsumer;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory stand-in for a stream with one consumer group. Leases never go stale on their own:
 * tests call {@link #expireLeases()} to simulate the idle timeout passing.
 */
public class InMemoryStreamBroker {

  private final Map<String, byte[]> entries = new LinkedHashMap<>();
  private final Map<String, Instant> enqueuedAt = new LinkedHashMap<>();
  private final Deque<String> undelivered = new ArrayDeque<>();
  private final Map<String, Lease> pending = new LinkedHashMap<>();
  private long sequence;
  private boolean groupCreated;

  private static final class Lease {
    String owner;
    long deliveryCount;
    boolean stale;

    Lease(String owner) {
      this.owner = owner;
      this.deliveryCount = 1;
    }
  }

  public synchronized String add(byte[] payload) {
    sequence++;
    String id = (1_700_000_000_000L + sequence) + "-0";
    entries.put(id, payload.clone());
    enqueuedAt.put(id, Instant.ofEpochMilli(1_700_000_000_000L + sequence));
    undelivered.add(id);
    return id;
  }

  public synchronized void expireLeases() {
    pending.values().forEach(lease -> lease.stale = true);
  }

  public synchronized boolean isPending(String eventId) {
    return pending.containsKey(eventId);
  }

  public synchronized int pendingCount() {
    return pending.size();
  }

  public synchronized int undeliveredCount() {
    return undelivered.size();
  }

  public synchronized boolean isGroupCreated() {
    return groupCreated;
  }

  public StreamConsumer consumer(String name) {
    return new Consumer(name);
  }

  private synchronized Optional<StreamEvent> read(String consumer) {
    for (Map.Entry<String, Lease> e : pending.entrySet()) {
      if (e.getValue().stale) {
        return Optional.of(claim(e.getKey(), e.getValue(), consumer));
      }
    }
    String next = undelivered.poll();
    if (next == null) {
      return Optional.empty();
    }
    pending.put(next, new Lease(consumer));
    return Optional.of(new StreamEvent(next, entries.get(next).clone(), enqueuedAt.get(next), 1));
  }

  private synchronized List<StreamEvent> reclaim(String consumer) {
    List<StreamEvent> claimed = new ArrayList<>();
    for (Map.Entry<String, Lease> e : pending.entrySet()) {
      if (e.getValue().stale) {
        claimed.add(claim(e.getKey(), e.getValue(), consumer));
      }
    }
    return claimed;
  }

  private StreamEvent claim(String id, Lease lease, String consumer) {
    lease.owner = consumer;
    lease.deliveryCount++;
    lease.stale = false;
    return new StreamEvent(id, entries.get(id).clone(), enqueuedAt.get(id), lease.deliveryCount);
  }

  private synchronized boolean ack(String id) {
    return pending.remove(id) != null;
  }

  private synchronized void createGroup() {
    groupCreated = true;
  }

  private final class Consumer implements StreamConsumer {
    private final String name;

    Consumer(String name) {
      this.name = name;
    }

    @Override
    public String consumerName() {
      return name;
    }

    @Override
    public void ensureGroup() {
      createGroup();
    }

    @Override
    public Optional<StreamEvent> read() {
      Optional<StreamEvent> event = InMemoryStreamBroker.this.read(name);
      if (event.isEmpty()) {
        pauseBriefly();
      }
      return event;
    }

    @Override
    public boolean ack(String eventId) {
      return InMemoryStreamBroker.this.ack(eventId);
    }

    @Override
    public List<StreamEvent> reclaimStale(Duration idleThreshold) {
      return reclaim(name);
    }

    private void pauseBriefly() {
      try {
        Thread.sleep(5);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }
}
