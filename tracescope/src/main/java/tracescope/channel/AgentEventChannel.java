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

import tracescope.PipelineConfig;
import tracescope.interfaces.AgentEventModule;
import tracescope.interfaces.EventBusModule;
import tracescope.interfaces.ModuleType;
import tracescope.interfaces.bus.SinkSubscription;
import tracescope.interfaces.channel.ChannelStatistics;
import tracescope.interfaces.channel.ChannelSubscription;
import tracescope.interfaces.channel.OutboundConnection;
import tracescope.model.TraceEvent;
import tracescope.util.FiberSupplier;
import com.google.common.base.Ticker;
import com.google.common.util.concurrent.AbstractService;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subscribes to the event bus and offers the trace events to UI clients through a
 * {@link ReliableChannel} keyed by event sequence.
 */
public class AgentEventChannel extends AbstractService implements AgentEventModule {
  private static final Logger LOG = LoggerFactory.getLogger(AgentEventChannel.class);

  private final EventBusModule eventBus;
  private final Fiber fiber;
  private final ReliableChannel<TraceEvent> channel;

  private SinkSubscription busSubscription;

  public AgentEventChannel(EventBusModule eventBus, FiberSupplier fiberSupplier, PipelineConfig config) {
    this(eventBus, fiberSupplier, config, Ticker.systemTicker());
  }

  public AgentEventChannel(EventBusModule eventBus,
                           FiberSupplier fiberSupplier,
                           PipelineConfig config,
                           Ticker ticker) {
    this.eventBus = eventBus;
    this.fiber = fiberSupplier.getFiber(this::handleThrowable);
    this.channel = new ReliableChannel<>(
        "agent-events",
        fiber,
        TraceEvent::getSequence,
        config.getEventRetentionCount(),
        config.getEventRetentionAgeMillis(),
        config.getEventOutboundLimit(),
        ticker);
  }

  private void handleThrowable(Throwable fiberError) {
    LOG.error("Got fiber exception", fiberError);
  }

  @Override
  protected void doStart() {
    try {
      fiber.start();
      busSubscription = eventBus.subscribe(channel::publish);
      notifyStarted();
    } catch (Throwable t) {
      fiber.dispose();
      notifyFailed(t);
    }
  }

  @Override
  protected void doStop() {
    if (busSubscription != null) {
      busSubscription.dispose();
    }
    channel.closeAll("server shutting down");
    // let the close requests run before the fiber goes away
    fiber.execute(() -> {
      fiber.dispose();
      notifyStopped();
    });
  }

  @Override
  public ChannelSubscription subscribe(long lastAckedSequence, OutboundConnection<TraceEvent> connection) {
    return channel.subscribe(lastAckedSequence, connection);
  }

  @Override
  public ChannelStatistics getStatistics() {
    return channel.getStatistics();
  }

  @Override
  public ModuleType getModuleType() {
    return ModuleType.AgentEvents;
  }

  @Override
  public String toString() {
    return "AgentEventChannel";
  }
}
