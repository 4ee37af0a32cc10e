/*
 * Copyright 2014 WANdisco
 *
 *  WANdisco licenses this file to you under the Apache License,
 *  version 2.0 (the "License"); you may not use this file except in compliance
 *  with the License. You may obtain a copy of the License at:
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 *  WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 *  License for the specific language governing permissions and limitations
 *  under the License.
 */

package tracescope.channel;

import tracescope.interfaces.channel.ChannelStatistics;
import tracescope.interfaces.channel.ChannelSubscription;
import tracescope.interfaces.channel.OutboundConnection;
import tracescope.util.FiberFutures;
import tracescope.util.FiberOnly;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ListenableFuture;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.LinkedHashSet;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.ToLongFunction;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Ordered delivery of keyed messages to any number of subscribers, with replay of recent
 * history. Keys must arrive in strictly increasing order; anything else is rejected.
 * <p/>
 * All state is confined to one fiber. Each subscriber has a bounded queue and at most one
 * send outstanding on its connection. A subscriber whose queue is full when a message
 * arrives is disconnected, and is expected to reconnect with the last key it received.
 *
 * @param <T> Message type.
 */
public class ReliableChannel<T> {
  private static final Logger LOG = LoggerFactory.getLogger(ReliableChannel.class);

  private final String name;
  private final Fiber fiber;
  private final ToLongFunction<T> keyFunction;
  private final int outboundLimit;
  private final ReplayBuffer<T> replayBuffer;
  private final Set<Subscriber> subscribers = new LinkedHashSet<>();

  private final AtomicLong accepted = new AtomicLong();
  private final AtomicLong rejected = new AtomicLong();
  private final AtomicLong backpressureDisconnects = new AtomicLong();
  private volatile long lastKey = 0;
  private volatile int retained = 0;
  private volatile int subscriberCount = 0;

  /**
   * @param name               Used in log messages.
   * @param fiber              Started fiber that will own the channel's state.
   * @param keyFunction        Extracts the ordering key of a message.
   * @param retentionCount     Messages kept for replay.
   * @param retentionAgeMillis Maximum age of a message kept for replay, or 0 for no limit.
   * @param outboundLimit      Messages that may queue for one subscriber; at least the retention count.
   * @param ticker             Time source for retention ages.
   */
  public ReliableChannel(String name,
                         Fiber fiber,
                         ToLongFunction<T> keyFunction,
                         int retentionCount,
                         long retentionAgeMillis,
                         int outboundLimit,
                         Ticker ticker) {
    checkArgument(outboundLimit >= retentionCount,
        "outbound limit %s must hold a full replay of %s messages", outboundLimit, retentionCount);
    this.name = name;
    this.fiber = fiber;
    this.keyFunction = keyFunction;
    this.outboundLimit = outboundLimit;
    this.replayBuffer = new ReplayBuffer<>(retentionCount, retentionAgeMillis, ticker);
  }

  /**
   * Hand a message to the channel. Returns immediately; the message is retained and
   * forwarded on the channel fiber.
   */
  public void publish(T message) {
    fiber.execute(() -> accept(message));
  }

  /**
   * Subscribe a connection. Every retained message with a key above
   * {@code lastAckedKey} is queued for it, followed by live messages, with no message
   * repeated or skipped in between.
   */
  public ChannelSubscription subscribe(long lastAckedKey, OutboundConnection<T> connection) {
    Subscriber subscriber = new Subscriber(lastAckedKey, connection);
    fiber.execute(() -> attach(subscriber));
    return subscriber;
  }

  /**
   * Close every subscriber's connection, for instance when the owning module stops.
   */
  public void closeAll(String reason) {
    fiber.execute(() -> {
      for (Subscriber subscriber : ImmutableList.copyOf(subscribers)) {
        subscriber.disconnect(reason);
      }
    });
  }

  public ChannelStatistics getStatistics() {
    return new ChannelStatistics(
        accepted.get(),
        rejected.get(),
        backpressureDisconnects.get(),
        lastKey,
        retained,
        subscriberCount);
  }

  @FiberOnly
  private void accept(T message) {
    long key = keyFunction.applyAsLong(message);
    if (key <= lastKey) {
      rejected.incrementAndGet();
      LOG.error("{}: rejected message with key {}, which is not after the last accepted key {}",
          name, key, lastKey);
      return;
    }

    lastKey = key;
    accepted.incrementAndGet();
    replayBuffer.add(key, message);
    retained = replayBuffer.size();

    for (Subscriber subscriber : ImmutableList.copyOf(subscribers)) {
      subscriber.offer(key, message);
    }
  }

  @FiberOnly
  private void attach(Subscriber subscriber) {
    if (subscriber.cancelled) {
      return;
    }

    if (replayBuffer.hasEvictedAfter(subscriber.lastQueuedKey)) {
      LOG.warn("{}: subscriber resuming after key {} missed messages no longer retained (oldest retained is {})",
          name, subscriber.lastQueuedKey, replayBuffer.oldestKey());
    }

    subscribers.add(subscriber);
    subscriberCount = subscribers.size();

    long fromKey = subscriber.lastQueuedKey;
    for (T message : replayBuffer.entriesAfter(fromKey)) {
      subscriber.offer(keyFunction.applyAsLong(message), message);
    }
    LOG.debug("{}: attached subscriber after key {}, {} messages replayed", name, fromKey,
        subscriber.queue.size() + (subscriber.sendInFlight ? 1 : 0));
  }

  @FiberOnly
  private void detach(Subscriber subscriber) {
    subscribers.remove(subscriber);
    subscriberCount = subscribers.size();
    subscriber.queue.clear();
  }

  private class Subscriber implements ChannelSubscription {
    private final OutboundConnection<T> connection;
    private final Queue<T> queue = new ArrayDeque<>();
    private volatile boolean cancelled = false;
    private long lastQueuedKey;
    private boolean sendInFlight = false;

    private Subscriber(long lastAckedKey, OutboundConnection<T> connection) {
      this.lastQueuedKey = lastAckedKey;
      this.connection = connection;
    }

    @FiberOnly
    private void offer(long key, T message) {
      if (cancelled || key <= lastQueuedKey) {
        return;
      }
      if (queue.size() >= outboundLimit) {
        backpressureDisconnects.incrementAndGet();
        LOG.info("{}: disconnecting subscriber with {} queued messages at key {}", name, queue.size(), key);
        disconnect("outbound queue full, reconnect with your last received sequence");
        return;
      }
      queue.add(message);
      lastQueuedKey = key;
      sendNext();
    }

    @FiberOnly
    private void sendNext() {
      if (sendInFlight || cancelled) {
        return;
      }
      T next = queue.poll();
      if (next == null) {
        return;
      }

      sendInFlight = true;
      ListenableFuture<?> sent;
      try {
        sent = connection.send(next);
      } catch (RuntimeException e) {
        sendFailed(e);
        return;
      }
      FiberFutures.addCallback(sent, result -> {
        sendInFlight = false;
        sendNext();
      }, this::sendFailed, fiber);
    }

    @FiberOnly
    private void sendFailed(Throwable t) {
      sendInFlight = false;
      if (cancelled) {
        return;
      }
      LOG.info("{}: send to subscriber failed, disconnecting", name, t);
      disconnect("send failed");
    }

    @FiberOnly
    private void disconnect(String reason) {
      cancelled = true;
      detach(this);
      connection.close(reason);
    }

    @Override
    public void cancel() {
      cancelled = true;
      fiber.execute(() -> detach(this));
    }

    @Override
    public boolean isActive() {
      return !cancelled;
    }
  }
}
