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
import tracescope.bus.TraceEventBus;
import tracescope.channel.RecordingConnection;
import tracescope.insight.InsightPublisher;
import tracescope.interfaces.critic.CriticState;
import tracescope.interfaces.critic.TraceAnalyzer;
import tracescope.model.Insight;
import tracescope.model.InsightCategory;
import tracescope.model.InsightDraft;
import tracescope.model.Severity;
import tracescope.model.TraceEvent;
import tracescope.util.ExceptionHandlingBatchExecutor;
import tracescope.util.FiberSupplier;
import tracescope.util.JUnitRuleFiberExceptions;
import com.google.common.collect.ImmutableList;
import org.jetlang.fibers.PoolFiberFactory;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static tracescope.TestHelpers.TIMEOUT_MILLIS;
import static tracescope.TestHelpers.event;
import static tracescope.TestHelpers.waitUntil;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

public class CriticObserverTest {
  @Rule
  public JUnitRuleFiberExceptions fiberExceptions = new JUnitRuleFiberExceptions();

  private final ExecutorService executor = Executors.newFixedThreadPool(4);
  private final PoolFiberFactory fiberFactory = new PoolFiberFactory(executor);
  private final FiberSupplier fiberSupplier = (ignore) ->
      fiberFactory.create(new ExceptionHandlingBatchExecutor(fiberExceptions));

  private final BlockingQueue<List<Long>> analyzedBatches = new LinkedBlockingQueue<>();
  private final RecordingConnection<Insight> insightConnection = RecordingConnection.autoCompleting();

  private TraceEventBus bus;
  private InsightPublisher insights;
  private CriticObserver critic;

  @Before
  public void before() {
    bus = new TraceEventBus(fiberSupplier);
    bus.startAsync().awaitRunning();
    insights = new InsightPublisher(fiberSupplier, PipelineConfig.defaults());
    insights.startAsync().awaitRunning();
    insights.subscribe(0, insightConnection);
  }

  @After
  public void after() {
    if (critic != null) {
      critic.stopAsync().awaitTerminated();
    }
    insights.stopAsync().awaitTerminated();
    bus.stopAsync().awaitTerminated();
    fiberFactory.dispose();
    executor.shutdownNow();
  }

  private void startCritic(TraceAnalyzer analyzer, PipelineConfig.Builder config) {
    critic = new CriticObserver(bus, insights, analyzer, fiberSupplier, config.build());
    critic.startAsync().awaitRunning();
  }

  private static PipelineConfig.Builder config(int capacity, int batchSize, long flushMillis) {
    return PipelineConfig.builder()
        .setCriticBufferCapacity(capacity)
        .setCriticBatchSize(batchSize)
        .setCriticFlushIntervalMillis(flushMillis);
  }

  private TraceAnalyzer recordingAnalyzer() {
    return batch -> {
      analyzedBatches.add(sequencesOf(batch));
      return ImmutableList.of();
    };
  }

  private static List<Long> sequencesOf(List<TraceEvent> batch) {
    List<Long> sequences = new ArrayList<>(batch.size());
    for (TraceEvent event : batch) {
      sequences.add(event.getSequence());
    }
    return sequences;
  }

  private List<Long> nextBatch() throws InterruptedException {
    return analyzedBatches.poll(TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
  }

  private void publish(long from, long to) {
    for (long sequence = from; sequence <= to; sequence++) {
      bus.publish(event(sequence));
    }
  }

  @Test(timeout = 10000)
  public void aFullBatchIsAnalyzedWithoutWaitingForTheTimer() throws Exception {
    startCritic(recordingAnalyzer(), config(100, 3, 60000));

    publish(1, 3);

    assertThat(nextBatch(), contains(1L, 2L, 3L));
  }

  @Test(timeout = 10000)
  public void aPartialBatchIsAnalyzedWhenTheTimerFires() throws Exception {
    startCritic(recordingAnalyzer(), config(100, 50, 100));

    publish(1, 2);

    assertThat(nextBatch(), contains(1L, 2L));
    waitUntil("the critic goes idle", () -> critic.getState() == CriticState.IDLE);
  }

  @Test(timeout = 10000)
  public void eventsArrivingDuringASlowAnalysisDisplaceTheOldestBufferedOnes() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    startCritic(batch -> {
      release.await();
      analyzedBatches.add(sequencesOf(batch));
      return ImmutableList.of();
    }, config(5, 1, 60000));

    publish(1, 1);
    waitUntil("the first batch is being analyzed", () -> critic.getState() == CriticState.ANALYZING);
    publish(2, 10);
    waitUntil("four events are dropped", () -> critic.getDroppedEventCount() == 4);

    release.countDown();

    assertThat(nextBatch(), contains(1L));
    for (long sequence = 6; sequence <= 10; sequence++) {
      assertThat(nextBatch(), contains(sequence));
    }
    assertThat(analyzedBatches.poll(200, TimeUnit.MILLISECONDS), is(nullValue()));
  }

  @Test(timeout = 10000)
  public void aHungAnalysisTimesOutAndTheNextBatchProceeds() throws Exception {
    CountDownLatch never = new CountDownLatch(1);
    startCritic(batch -> {
      if (batch.get(0).getSequence() == 1) {
        never.await();
      }
      analyzedBatches.add(sequencesOf(batch));
      return ImmutableList.of();
    }, config(100, 2, 60000).setCriticAnalysisTimeoutMillis(200));

    publish(1, 4);

    assertThat(nextBatch(), contains(3L, 4L));
    assertThat(critic.getBatchesFailed(), is(equalTo(1L)));
  }

  @Test(timeout = 10000)
  public void aFailingAnalyzerNeitherStopsTheCriticNorTheBus() throws Exception {
    AtomicLong calls = new AtomicLong();
    startCritic(batch -> {
      calls.incrementAndGet();
      throw new IllegalStateException("model unavailable");
    }, config(100, 3, 60000));

    BlockingQueue<Long> otherSink = new LinkedBlockingQueue<>();
    bus.subscribe(event -> otherSink.add(event.getSequence()));

    publish(1, 6);

    waitUntil("both batches fail", () -> critic.getBatchesFailed() == 2);
    waitUntil("the critic goes idle", () -> critic.getState() == CriticState.IDLE);
    assertThat(calls.get(), is(equalTo(2L)));
    for (long sequence = 1; sequence <= 6; sequence++) {
      assertThat(otherSink.poll(TIMEOUT_MILLIS, TimeUnit.MILLISECONDS), is(equalTo(sequence)));
    }
    assertThat(insightConnection.pollSent(200), is(nullValue()));
  }

  @Test(timeout = 10000)
  public void insightsOnlyReferenceEventsFromTheAnalyzedBatch() throws Exception {
    startCritic(batch -> ImmutableList.of(
        new InsightDraft(InsightCategory.PROCESS_QUALITY, Severity.INFO, "grounded", ImmutableList.of(1L, 2L)),
        new InsightDraft(InsightCategory.ERROR, Severity.CRITICAL, "invented", ImmutableList.of(999L, 777L)),
        new InsightDraft(InsightCategory.SECURITY, Severity.WARNING, "partly grounded", ImmutableList.of(3L, 999L))),
        config(100, 3, 60000));

    publish(1, 3);

    Insight first = insightConnection.nextSent();
    assertThat(first.getMessage(), is(equalTo("grounded")));
    assertThat(first.getSequence(), is(equalTo(1L)));
    assertThat(first.getRelatedSequences(), contains(1L, 2L));

    Insight second = insightConnection.nextSent();
    assertThat(second.getMessage(), is(equalTo("partly grounded")));
    assertThat(second.getSequence(), is(equalTo(2L)));
    assertThat(second.getRelatedSequences(), contains(3L));

    assertThat(insightConnection.pollSent(200), is(nullValue()));
    assertThat(critic.getInsightsEmitted(), is(equalTo(2L)));
    assertThat(critic.getReferencesRejected(), is(equalTo(3L)));
  }

  @Test(timeout = 10000)
  public void aNewCriticIsIdle() {
    startCritic(recordingAnalyzer(), config(100, 3, 60000));

    assertThat(critic.getState(), is(equalTo(CriticState.IDLE)));
  }
}
