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

package tracescope;

import tracescope.bus.TraceEventBus;
import tracescope.channel.AgentEventChannel;
import tracescope.critic.CriticObserver;
import tracescope.frame.FrameChannel;
import tracescope.insight.InsightPublisher;
import tracescope.interfaces.AgentEventModule;
import tracescope.interfaces.CriticModule;
import tracescope.interfaces.EventBusModule;
import tracescope.interfaces.FrameModule;
import tracescope.interfaces.InsightModule;
import tracescope.interfaces.PipelineServer;
import tracescope.interfaces.TracescopeModule;
import tracescope.interfaces.critic.TraceAnalyzer;
import tracescope.source.TraceRecorder;
import tracescope.util.ExceptionHandlingBatchExecutor;
import tracescope.util.FiberSupplier;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.AbstractService;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.Service;
import com.google.common.util.concurrent.SettableFuture;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.jetlang.core.RunnableExecutorImpl;
import org.jetlang.fibers.Fiber;
import org.jetlang.fibers.PoolFiberFactory;
import org.jetlang.fibers.ThreadFiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns the shared resources of one pipeline (the thread pool behind every fiber) and the
 * modules built on them. Starting the pipeline builds and starts the event bus, the agent
 * event channel, the frame channel, the insight publisher and, if enabled, the critic;
 * stopping it stops every module in reverse start order, including any module added with
 * {@link #startModule}.
 */
public class TracescopePipeline extends AbstractService implements PipelineServer {
  private static final Logger LOG = LoggerFactory.getLogger(TracescopePipeline.class);
  private static final long MODULE_STOP_TIMEOUT_SECONDS = 10;

  private final PipelineConfig config;
  private final TraceAnalyzer analyzer;
  private final SettableFuture<Void> shutdownFuture = SettableFuture.create();
  private final List<TracescopeModule> startedModules = new ArrayList<>();

  private ExecutorService executor;
  private PoolFiberFactory fiberPool;
  private Fiber serverFiber;

  private TraceEventBus eventBus;
  private AgentEventChannel agentEvents;
  private FrameChannel frames;
  private InsightPublisher insights;
  private CriticObserver critic;
  private TraceRecorder traceRecorder;

  /**
   * @param analyzer Analysis function for the critic; unused if the config disables the critic.
   */
  public TracescopePipeline(PipelineConfig config, TraceAnalyzer analyzer) {
    this.config = config;
    this.analyzer = analyzer;
  }

  @Override
  public FiberSupplier getFiberSupplier() {
    return (throwableConsumer) ->
        fiberPool.create(new ExceptionHandlingBatchExecutor(throwableConsumer));
  }

  @Override
  protected void doStart() {
    try {
      serverFiber = new ThreadFiber(new RunnableExecutorImpl(), "Tracescope-Server", true);
      int processors = Runtime.getRuntime().availableProcessors();
      executor = Executors.newFixedThreadPool(Math.max(2, processors),
          new ThreadFactoryBuilder().setNameFormat("tracescope-fiber-%d").setDaemon(true).build());
      fiberPool = new PoolFiberFactory(executor);
      serverFiber.start();

      FiberSupplier fiberSupplier = getFiberSupplier();
      eventBus = new TraceEventBus(fiberSupplier, config.getBusSinkQueueLimit());
      agentEvents = new AgentEventChannel(eventBus, fiberSupplier, config);
      frames = new FrameChannel(fiberSupplier);
      insights = new InsightPublisher(fiberSupplier, config);
      if (config.isCriticEnabled()) {
        critic = new CriticObserver(eventBus, insights, analyzer, fiberSupplier, config);
      }
      traceRecorder = new TraceRecorder(eventBus);

      LOG.info("Starting pipeline with {}", config);
      startModule(eventBus);
      startModule(agentEvents);
      startModule(frames);
      startModule(insights);
      if (critic != null) {
        startModule(critic);
      }

      notifyStarted();
    } catch (Exception e) {
      LOG.error("Pipeline failed to start", e);
      stopModules();
      notifyFailed(e);
    }
  }

  @Override
  protected void doStop() {
    stopModules();
    serverFiber.dispose();
    fiberPool.dispose();
    executor.shutdown();

    shutdownFuture.set(null);
    notifyStopped();
  }

  /**
   * Start a module and wait until it runs. The module is stopped along with the pipeline.
   */
  public void startModule(TracescopeModule module) {
    LOG.info("Starting service {}", module.getModuleType());
    module.addListener(new ModuleStateLogger(module), serverFiber);
    synchronized (startedModules) {
      startedModules.add(module);
    }
    module.startAsync().awaitRunning();
  }

  private void stopModules() {
    List<TracescopeModule> toStop;
    synchronized (startedModules) {
      toStop = Lists.reverse(ImmutableList.copyOf(startedModules));
      startedModules.clear();
    }
    for (TracescopeModule module : toStop) {
      try {
        module.stopAsync().awaitTerminated(MODULE_STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS);
      } catch (TimeoutException | IllegalStateException e) {
        LOG.warn("Module {} did not stop cleanly", module.getModuleType(), e);
      }
    }
  }

  public TraceRecorder getTraceRecorder() {
    return traceRecorder;
  }

  @Override
  public PipelineConfig getConfig() {
    return config;
  }

  @Override
  public EventBusModule getEventBus() {
    return eventBus;
  }

  @Override
  public AgentEventModule getAgentEvents() {
    return agentEvents;
  }

  @Override
  public FrameModule getFrames() {
    return frames;
  }

  @Override
  public InsightModule getInsights() {
    return insights;
  }

  @Override
  public CriticModule getCritic() {
    return critic;
  }

  @Override
  public ListenableFuture<Void> getShutdownFuture() {
    return shutdownFuture;
  }

  /**
   * Logs the state changes of one module.
   */
  private static class ModuleStateLogger extends Service.Listener {
    private final TracescopeModule module;

    private ModuleStateLogger(TracescopeModule module) {
      this.module = module;
    }

    @Override
    public void starting() {
      LOG.debug("Starting module {}", module.getModuleType());
    }

    @Override
    public void running() {
      LOG.debug("Running module {}", module.getModuleType());
    }

    @Override
    public void stopping(State from) {
      LOG.debug("Stopping module {}", module.getModuleType());
    }

    @Override
    public void terminated(State from) {
      LOG.debug("Terminated module {}", module.getModuleType());
    }

    @Override
    public void failed(State from, Throwable failure) {
      LOG.error("Failed module {}", module.getModuleType(), failure);
    }
  }
}
