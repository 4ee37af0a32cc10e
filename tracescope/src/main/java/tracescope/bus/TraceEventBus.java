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

package tracescope.bus;

import tracescope.TracescopeConstants;
import tracescope.interfaces.EventBusModule;
import tracescope.interfaces.ModuleType;
import tracescope.interfaces.bus.SinkSubscription;
import tracescope.interfaces.bus.TraceSink;
import tracescope.model.TraceEvent;
import tracescope.util.FiberSupplier;
import com.google.common.util.concurrent.AbstractService;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Fans trace events out to sinks. Every sink is subscribed on a fiber of its own; a publish
 * queues the event on each of those fibers and returns without running any sink code.
 * <p>
 * Each sink may have at most {@code sinkQueueLimit} events queued. Once a sink falls that far
 * behind, further events are dropped for that sink only and counted as overflow until it
 * catches up.
 */
public class TraceEventBus extends AbstractService implements EventBusModule {
  private static final Logger LOG = LoggerFactory.getLogger(TraceEventBus.class);

  private final FiberSupplier fiberSupplier;
  private final int sinkQueueLimit;
  private final Set<SinkRegistration> registrations = ConcurrentHashMap.newKeySet();

  private final AtomicLong publishedCount = new AtomicLong();
  private final AtomicLong sinkFailureCount = new AtomicLong();
  private final AtomicLong sinkOverflowCount = new AtomicLong();

  public TraceEventBus(FiberSupplier fiberSupplier) {
    this(fiberSupplier, TracescopeConstants.DEFAULT_BUS_SINK_QUEUE_LIMIT);
  }

  public TraceEventBus(FiberSupplier fiberSupplier, int sinkQueueLimit) {
    checkArgument(sinkQueueLimit > 0, "sink queue limit must be positive");
    this.fiberSupplier = fiberSupplier;
    this.sinkQueueLimit = sinkQueueLimit;
  }

  @Override
  protected void doStart() {
    notifyStarted();
  }

  @Override
  protected void doStop() {
    for (SinkRegistration registration : registrations) {
      registration.dispose();
    }
    notifyStopped();
  }

  @Override
  public void publish(TraceEvent event) {
    publishedCount.incrementAndGet();
    for (SinkRegistration registration : registrations) {
      registration.offer(event);
    }
  }

  @Override
  public SinkSubscription subscribe(TraceSink sink) {
    Fiber fiber = fiberSupplier.getFiber(
        throwable -> LOG.error("Dispatch fiber of sink {} failed a task", sink, throwable));
    fiber.start();

    SinkRegistration registration = new SinkRegistration(sink, fiber);
    registrations.add(registration);
    LOG.debug("Subscribed sink {}", sink);
    return registration;
  }

  @Override
  public void unsubscribe(SinkSubscription subscription) {
    subscription.dispose();
  }

  @Override
  public long getPublishedCount() {
    return publishedCount.get();
  }

  @Override
  public long getSinkFailureCount() {
    return sinkFailureCount.get();
  }

  @Override
  public long getSinkOverflowCount() {
    return sinkOverflowCount.get();
  }

  @Override
  public int getSubscriberCount() {
    return registrations.size();
  }

  @Override
  public ModuleType getModuleType() {
    return ModuleType.EventBus;
  }

  private class SinkRegistration implements SinkSubscription {
    private final TraceSink sink;
    private final Fiber fiber;
    private final AtomicInteger pending = new AtomicInteger();
    private final AtomicBoolean overflowing = new AtomicBoolean(false);
    private volatile boolean active = true;

    private SinkRegistration(TraceSink sink, Fiber fiber) {
      this.sink = sink;
      this.fiber = fiber;
    }

    private void offer(TraceEvent event) {
      if (!active) {
        return;
      }
      if (pending.incrementAndGet() > sinkQueueLimit) {
        pending.decrementAndGet();
        sinkOverflowCount.incrementAndGet();
        if (overflowing.compareAndSet(false, true)) {
          LOG.warn("Sink {} has {} events queued, dropping event {} and later ones until it catches up",
              sink, sinkQueueLimit, event.getSequence());
        } else {
          LOG.debug("Sink {} is full, dropped event {}", sink, event.getSequence());
        }
        return;
      }
      fiber.execute(() -> deliver(event));
    }

    private void deliver(TraceEvent event) {
      pending.decrementAndGet();
      if (!active) {
        return;
      }
      if (overflowing.get() && pending.get() == 0 && overflowing.compareAndSet(true, false)) {
        LOG.info("Sink {} caught up, {} events dropped on the bus so far", sink, sinkOverflowCount.get());
      }
      try {
        sink.onEvent(event);
      } catch (Exception e) {
        sinkFailureCount.incrementAndGet();
        LOG.warn("Sink {} failed to handle event {}", sink, event.getSequence(), e);
      }
    }

    @Override
    public boolean isActive() {
      return active;
    }

    @Override
    public void dispose() {
      if (!active) {
        return;
      }
      active = false;
      registrations.remove(this);
      fiber.dispose();
      LOG.debug("Unsubscribed sink {}", sink);
    }
  }
}
