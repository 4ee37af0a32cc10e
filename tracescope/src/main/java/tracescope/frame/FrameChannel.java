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

package tracescope.frame;

import tracescope.interfaces.FrameModule;
import tracescope.interfaces.ModuleType;
import tracescope.interfaces.channel.ChannelSubscription;
import tracescope.interfaces.channel.OutboundConnection;
import tracescope.model.Frame;
import tracescope.util.FiberFutures;
import tracescope.util.FiberOnly;
import tracescope.util.FiberSupplier;
import com.google.common.util.concurrent.AbstractService;
import com.google.common.util.concurrent.ListenableFuture;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Latest-wins delivery of frames. Each session has a single slot holding its newest frame;
 * publishing overwrites the slot and wakes the session's subscribers, which send whatever
 * the slot holds once their previous send has completed. Frames overwritten before a
 * subscriber got to them are never sent to it.
 * <p>
 * A session's slot lives only while it is in use: it is created by the first publish or
 * subscribe and dropped when its last subscriber leaves or the session is ended.
 */
public class FrameChannel extends AbstractService implements FrameModule {
  private static final Logger LOG = LoggerFactory.getLogger(FrameChannel.class);

  private final Fiber fiber;
  private final ConcurrentMap<String, Session> sessions = new ConcurrentHashMap<>();
  private final AtomicLong droppedFrames = new AtomicLong();
  private final AtomicLong staleFrames = new AtomicLong();

  public FrameChannel(FiberSupplier fiberSupplier) {
    this.fiber = fiberSupplier.getFiber(this::handleThrowable);
  }

  private void handleThrowable(Throwable fiberError) {
    LOG.error("Got fiber exception", fiberError);
  }

  @Override
  protected void doStart() {
    fiber.start();
    notifyStarted();
  }

  @Override
  protected void doStop() {
    fiber.execute(() -> {
      for (Session session : sessions.values()) {
        for (FrameSubscriber subscriber : session.subscribers) {
          subscriber.close("server shutting down");
        }
      }
      fiber.dispose();
      notifyStopped();
    });
  }

  @Override
  public void publish(Frame frame) {
    Session session = session(frame.getSessionId());

    Frame previous;
    do {
      previous = session.latest.get();
      if (!frame.isNewerThan(previous)) {
        staleFrames.incrementAndGet();
        LOG.trace("Ignoring frame {}, slot already holds {}", frame, previous);
        return;
      }
    } while (!session.latest.compareAndSet(previous, frame));

    for (FrameSubscriber subscriber : session.subscribers) {
      if (previous != null && previous.getSequence() > subscriber.lastSentSequence) {
        droppedFrames.incrementAndGet();
      }
      subscriber.signal();
    }
  }

  @Override
  public ChannelSubscription subscribe(String sessionId, OutboundConnection<Frame> connection) {
    FrameSubscriber subscriber;
    while (true) {
      Session session = session(sessionId);
      subscriber = new FrameSubscriber(sessionId, session, connection);
      session.subscribers.add(subscriber);
      // the session may have been dropped by its last subscriber leaving in the meantime
      if (sessions.get(sessionId) == session) {
        break;
      }
      session.subscribers.remove(subscriber);
    }
    subscriber.signal();
    LOG.debug("Frame subscriber attached to session {}", sessionId);
    return subscriber;
  }

  @Override
  public void endSession(String sessionId) {
    Session session = sessions.remove(sessionId);
    if (session == null) {
      return;
    }
    for (FrameSubscriber subscriber : session.subscribers) {
      subscriber.close("session ended");
    }
    LOG.debug("Frame session {} ended", sessionId);
  }

  @Override
  public Frame latestFrame(String sessionId) {
    Session session = sessions.get(sessionId);
    return session == null ? null : session.latest.get();
  }

  /**
   * @return Frames that were overwritten in their slot before a subscriber sent them,
   * counted once per subscriber that missed them.
   */
  @Override
  public long getDroppedFrameCount() {
    return droppedFrames.get();
  }

  /**
   * @return Frames that arrived after a newer frame of the same session and were ignored.
   */
  public long getStaleFrameCount() {
    return staleFrames.get();
  }

  /**
   * @return Sessions currently holding a frame slot.
   */
  public int getSessionCount() {
    return sessions.size();
  }

  @Override
  public ModuleType getModuleType() {
    return ModuleType.Frames;
  }

  private Session session(String sessionId) {
    Session session = sessions.get(sessionId);
    if (session == null) {
      session = sessions.computeIfAbsent(sessionId, id -> new Session());
    }
    return session;
  }

  private static class Session {
    private final AtomicReference<Frame> latest = new AtomicReference<>();
    private final Set<FrameSubscriber> subscribers = new CopyOnWriteArraySet<>();
  }

  private class FrameSubscriber implements ChannelSubscription {
    private final String sessionId;
    private final Session session;
    private final OutboundConnection<Frame> connection;
    private final AtomicBoolean drainScheduled = new AtomicBoolean(false);
    private volatile boolean cancelled = false;
    private volatile long lastSentSequence = Long.MIN_VALUE;
    private boolean sendInFlight = false;

    private FrameSubscriber(String sessionId, Session session, OutboundConnection<Frame> connection) {
      this.sessionId = sessionId;
      this.session = session;
      this.connection = connection;
    }

    private void signal() {
      if (drainScheduled.compareAndSet(false, true)) {
        fiber.execute(this::drain);
      }
    }

    @FiberOnly
    private void drain() {
      drainScheduled.set(false);
      if (sendInFlight || cancelled) {
        return;
      }
      Frame frame = session.latest.get();
      if (frame == null || frame.getSequence() <= lastSentSequence) {
        return;
      }

      sendInFlight = true;
      lastSentSequence = frame.getSequence();
      ListenableFuture<?> sent;
      try {
        sent = connection.send(frame);
      } catch (RuntimeException e) {
        sendFailed(e);
        return;
      }
      FiberFutures.addCallback(sent, result -> {
        sendInFlight = false;
        drain();
      }, this::sendFailed, fiber);
    }

    @FiberOnly
    private void sendFailed(Throwable t) {
      sendInFlight = false;
      if (cancelled) {
        return;
      }
      LOG.debug("Frame send failed, closing subscriber", t);
      close("send failed");
    }

    private void close(String reason) {
      cancel();
      connection.close(reason);
    }

    @Override
    public void cancel() {
      cancelled = true;
      if (session.subscribers.remove(this) && session.subscribers.isEmpty()
          && sessions.remove(sessionId, session)) {
        LOG.debug("Last frame subscriber of session {} left, dropping its slot", sessionId);
      }
    }

    @Override
    public boolean isActive() {
      return !cancelled;
    }
  }
}
