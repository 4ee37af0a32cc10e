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

package tracescope.insight;

import tracescope.PipelineConfig;
import tracescope.channel.ReliableChannel;
import tracescope.interfaces.InsightModule;
import tracescope.interfaces.ModuleType;
import tracescope.interfaces.channel.ChannelStatistics;
import tracescope.interfaces.channel.ChannelSubscription;
import tracescope.interfaces.channel.OutboundConnection;
import tracescope.model.Insight;
import tracescope.util.FiberOnly;
import tracescope.util.FiberSupplier;
import com.google.common.base.Ticker;
import com.google.common.util.concurrent.AbstractService;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Numbers insights in the order they are published and offers them to UI clients through a
 * {@link ReliableChannel}, so insight subscribers get the same ordering and replay behavior
 * as agent event subscribers.
 */
public class InsightPublisher extends AbstractService implements InsightModule {
  private static final Logger LOG = LoggerFactory.getLogger(InsightPublisher.class);

  private final Fiber fiber;
  private final ReliableChannel<Insight> channel;

  private long lastSequence = 0;

  public InsightPublisher(FiberSupplier fiberSupplier, PipelineConfig config) {
    this.fiber = fiberSupplier.getFiber(this::handleThrowable);
    this.channel = new ReliableChannel<>(
        "insights",
        fiber,
        Insight::getSequence,
        config.getInsightRetentionCount(),
        0,
        config.getInsightOutboundLimit(),
        Ticker.systemTicker());
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
    channel.closeAll("server shutting down");
    fiber.execute(() -> {
      fiber.dispose();
      notifyStopped();
    });
  }

  @Override
  public void publish(Insight insight) {
    fiber.execute(() -> stampAndPublish(insight));
  }

  @FiberOnly
  private void stampAndPublish(Insight insight) {
    lastSequence++;
    Insight stamped = insight.withSequence(lastSequence);
    LOG.debug("Publishing insight {}", stamped);
    channel.publish(stamped);
  }

  @Override
  public ChannelSubscription subscribe(long lastAckedSequence, OutboundConnection<Insight> connection) {
    return channel.subscribe(lastAckedSequence, connection);
  }

  @Override
  public ChannelStatistics getStatistics() {
    return channel.getStatistics();
  }

  @Override
  public ModuleType getModuleType() {
    return ModuleType.Insights;
  }
}
