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

import tracescope.channel.RecordingConnection;
import tracescope.interfaces.critic.CriticState;
import tracescope.interfaces.critic.TraceAnalyzer;
import tracescope.model.EventKind;
import tracescope.model.TraceEvent;
import tracescope.model.TracePayload;
import tracescope.source.TraceRecorder;
import org.junit.After;
import org.junit.Test;

import java.util.List;

import static tracescope.TestHelpers.waitUntil;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;

public class TracescopePipelineTest {
  private TracescopePipeline pipeline;

  @After
  public void after() {
    if (pipeline != null && pipeline.isRunning()) {
      pipeline.stopAsync().awaitTerminated();
    }
  }

  private void start(PipelineConfig config, TraceAnalyzer analyzer) {
    pipeline = new TracescopePipeline(config, analyzer);
    pipeline.startAsync().awaitRunning();
  }

  @Test(timeout = 20000)
  public void aBrokenCriticDoesNotDisturbEventDelivery() throws Exception {
    start(PipelineConfig.builder()
            .setCriticBatchSize(5)
            .setCriticFlushIntervalMillis(60000)
            .build(),
        batch -> {
          throw new IllegalStateException("analyzer is broken");
        });

    RecordingConnection<TraceEvent> connection = RecordingConnection.autoCompleting();
    pipeline.getAgentEvents().subscribe(0, connection);

    TraceRecorder recorder = pipeline.getTraceRecorder();
    for (int i = 1; i <= 100; i++) {
      recorder.record(EventKind.TEXT_OUTPUT, "main", TracePayload.text("line " + i));
    }

    List<TraceEvent> delivered = connection.nextSent(100);
    for (int i = 0; i < 100; i++) {
      assertThat(delivered.get(i).getSequence(), is(equalTo(i + 1L)));
    }

    waitUntil("the critic has tried every batch", () -> pipeline.getCritic().getBatchesFailed() == 20);
    waitUntil("the critic goes idle", () -> pipeline.getCritic().getState() == CriticState.IDLE);
    assertThat(pipeline.getCritic().getInsightsEmitted(), is(equalTo(0L)));
    assertThat(pipeline.getEventBus().getSinkFailureCount(), is(equalTo(0L)));
  }

  @Test(timeout = 20000)
  public void theCriticCanBeTurnedOff() throws Exception {
    start(PipelineConfig.builder().setCriticEnabled(false).build(), null);

    assertThat(pipeline.getCritic(), is(nullValue()));
    assertThat(pipeline.getEventBus(), is(notNullValue()));
    assertThat(pipeline.getFrames(), is(notNullValue()));
    assertThat(pipeline.getInsights(), is(notNullValue()));
  }

  @Test(timeout = 20000)
  public void stoppingThePipelineCompletesTheShutdownFuture() throws Exception {
    start(PipelineConfig.builder().setCriticEnabled(false).build(), null);
    assertThat(pipeline.getShutdownFuture().isDone(), is(false));

    pipeline.stopAsync().awaitTerminated();

    assertThat(pipeline.getShutdownFuture().isDone(), is(true));
    assertThat(pipeline.getEventBus().isRunning(), is(false));
  }
}
