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

package tracescope.critic;

import tracescope.PipelineConfig;
import tracescope.interfaces.CriticModule;
import tracescope.interfaces.EventBusModule;
import tracescope.interfaces.InsightModule;
import tracescope.interfaces.ModuleType;
import tracescope.interfaces.bus.SinkSubscription;
import tracescope.interfaces.critic.CriticState;
import tracescope.interfaces.critic.TraceAnalyzer;
import tracescope.model.Insight;
import tracescope.model.InsightDraft;
import tracescope.model.TraceEvent;
import tracescope.util.FiberFutures;
import tracescope.util.FiberOnly;
import tracescope.util.FiberSupplier;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.AbstractService;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.jetlang.core.Disposable;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Watches the trace event stream on behalf of an analysis function.
 * <p/>
 * Events are buffered on the critic fiber in a {@link DropOldestBuffer}. A batch of at most
 * {@code batchSize} of the oldest events is flushed to the analyzer when the buffer holds
 * {@code batchSize} events, or when the flush interval passes, whichever comes first. Only
 * one batch is analyzed at a time, on a separate executor and under a timeout; a trigger
 * that fires meanwhile is honored when the analysis settles. A batch whose analysis throws
 * or times out is dropped.
 * <p/>
 * Insights may only refer to events of the batch they were drafted from. Other references
 * are removed, and a draft left with no valid reference is discarded.
 */
public class CriticObserver extends AbstractService implements CriticModule {
  private static final Logger LOG = LoggerFactory.getLogger(CriticObserver.class);

  private final EventBusModule eventBus;
  private final InsightModule insights;
  private final TraceAnalyzer analyzer;
  private final Fiber fiber;
  private final int batchSize;
  private final long flushIntervalMillis;
  private final long analysisTimeoutMillis;
  private final DropOldestBuffer<TraceEvent> buffer;

  private final AtomicLong droppedEvents = new AtomicLong();
  private final AtomicLong batchesAnalyzed = new AtomicLong();
  private final AtomicLong batchesFailed = new AtomicLong();
  private final AtomicLong insightsEmitted = new AtomicLong();
  private final AtomicLong referencesRejected = new AtomicLong();
  private volatile CriticState state = CriticState.IDLE;

  private ListeningExecutorService analysisExecutor;
  private ScheduledExecutorService timeoutScheduler;
  private SinkSubscription busSubscription;
  private Disposable flushTimer;
  private boolean analyzing = false;
  private boolean flushDue = false;

  public CriticObserver(EventBusModule eventBus,
                        InsightModule insights,
                        TraceAnalyzer analyzer,
                        FiberSupplier fiberSupplier,
                        PipelineConfig config) {
    this.eventBus = eventBus;
    this.insights = insights;
    this.analyzer = analyzer;
    this.fiber = fiberSupplier.getFiber(this::handleThrowable);
    this.batchSize = config.getCriticBatchSize();
    this.flushIntervalMillis = config.getCriticFlushIntervalMillis();
    this.analysisTimeoutMillis = config.getCriticAnalysisTimeoutMillis();
    this.buffer = new DropOldestBuffer<>(config.getCriticBufferCapacity());
  }

  private void handleThrowable(Throwable fiberError) {
    LOG.error("Got fiber exception", fiberError);
  }

  @Override
  protected void doStart() {
    try {
      // a hung analyze call keeps its thread after timing out, so the next batch needs another one
      analysisExecutor = MoreExecutors.listeningDecorator(Executors.newCachedThreadPool(
          new ThreadFactoryBuilder().setNameFormat("critic-analysis-%d").setDaemon(true).build()));
      timeoutScheduler = Executors.newSingleThreadScheduledExecutor(
          new ThreadFactoryBuilder().setNameFormat("critic-timeout-%d").setDaemon(true).build());

      fiber.start();
      fiber.execute(this::scheduleFlushTimer);
      busSubscription = eventBus.subscribe(event -> fiber.execute(() -> ingest(event)));
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
    fiber.dispose();
    analysisExecutor.shutdownNow();
    timeoutScheduler.shutdownNow();
    LOG.info("Critic stopped: {} batches analyzed, {} failed, {} events dropped, {} insights emitted",
        batchesAnalyzed.get(), batchesFailed.get(), droppedEvents.get(), insightsEmitted.get());
    notifyStopped();
  }

  @FiberOnly
  private void ingest(TraceEvent event) {
    TraceEvent evicted = buffer.add(event);
    if (evicted != null) {
      droppedEvents.incrementAndGet();
      LOG.debug("Critic buffer full, dropped event {}", evicted.getSequence());
    }
    if (!analyzing) {
      state = CriticState.BUFFERING;
    }
    if (buffer.size() >= batchSize) {
      flush();
    }
  }

  @FiberOnly
  private void scheduleFlushTimer() {
    if (flushTimer != null) {
      flushTimer.dispose();
    }
    flushTimer = fiber.schedule(this::flush, flushIntervalMillis, TimeUnit.MILLISECONDS);
  }

  @FiberOnly
  private void flush() {
    if (analyzing) {
      flushDue = true;
      return;
    }
    flushDue = false;
    scheduleFlushTimer();

    if (buffer.isEmpty()) {
      state = CriticState.IDLE;
      return;
    }

    List<TraceEvent> batch = ImmutableList.copyOf(buffer.take(batchSize));
    analyzing = true;
    state = CriticState.ANALYZING;
    LOG.debug("Analyzing batch of {} events, {} still buffered", batch.size(), buffer.size());

    ListenableFuture<List<InsightDraft>> analysis = Futures.withTimeout(
        analysisExecutor.submit(() -> analyzer.analyze(batch)),
        analysisTimeoutMillis,
        TimeUnit.MILLISECONDS,
        timeoutScheduler);
    FiberFutures.addCallback(analysis,
        drafts -> analysisSucceeded(batch, drafts),
        error -> analysisFailed(batch, error),
        fiber);
  }

  @FiberOnly
  private void analysisSucceeded(List<TraceEvent> batch, List<InsightDraft> drafts) {
    batchesAnalyzed.incrementAndGet();
    if (drafts != null) {
      Set<Long> observed = new HashSet<>();
      for (TraceEvent event : batch) {
        observed.add(event.getSequence());
      }
      for (InsightDraft draft : drafts) {
        emit(draft, observed);
      }
    }
    settle();
  }

  @FiberOnly
  private void analysisFailed(List<TraceEvent> batch, Throwable error) {
    batchesFailed.incrementAndGet();
    LOG.warn("Discarding batch of {} events ({} to {}), analysis failed",
        batch.size(), batch.get(0).getSequence(), batch.get(batch.size() - 1).getSequence(), error);
    settle();
  }

  @FiberOnly
  private void settle() {
    analyzing = false;
    state = buffer.isEmpty() ? CriticState.IDLE : CriticState.BUFFERING;
    if (flushDue || buffer.size() >= batchSize) {
      flush();
    }
  }

  @FiberOnly
  private void emit(InsightDraft draft, Set<Long> observed) {
    List<Long> related = new ArrayList<>(draft.relatedSequences.size());
    for (Long sequence : draft.relatedSequences) {
      if (observed.contains(sequence)) {
        related.add(sequence);
      }
    }

    int rejected = draft.relatedSequences.size() - related.size();
    if (rejected > 0) {
      referencesRejected.addAndGet(rejected);
      LOG.warn("Removed {} references to events outside the analyzed batch from {}", rejected, draft);
      if (related.isEmpty()) {
        return;
      }
    }

    Insight insight = new Insight(
        UUID.randomUUID().toString(),
        0,
        draft.category,
        draft.severity,
        draft.message,
        related,
        System.currentTimeMillis());
    insightsEmitted.incrementAndGet();
    insights.publish(insight);
  }

  @Override
  public CriticState getState() {
    return state;
  }

  @Override
  public long getDroppedEventCount() {
    return droppedEvents.get();
  }

  @Override
  public long getBatchesAnalyzed() {
    return batchesAnalyzed.get();
  }

  @Override
  public long getBatchesFailed() {
    return batchesFailed.get();
  }

  @Override
  public long getInsightsEmitted() {
    return insightsEmitted.get();
  }

  @Override
  public long getReferencesRejected() {
    return referencesRejected.get();
  }

  @Override
  public ModuleType getModuleType() {
    return ModuleType.Critic;
  }
}
