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

import tracescope.channel.RecordingConnection;
import tracescope.interfaces.channel.ChannelSubscription;
import tracescope.model.Frame;
import tracescope.util.ExceptionHandlingBatchExecutor;
import tracescope.util.FiberSupplier;
import tracescope.util.JUnitRuleFiberExceptions;
import org.jetlang.fibers.PoolFiberFactory;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static tracescope.TestHelpers.waitUntil;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

public class FrameChannelTest {
  @Rule
  public JUnitRuleFiberExceptions fiberExceptions = new JUnitRuleFiberExceptions();

  private final ExecutorService executor = Executors.newFixedThreadPool(2);
  private final PoolFiberFactory fiberFactory = new PoolFiberFactory(executor);
  private final FiberSupplier fiberSupplier = (ignore) ->
      fiberFactory.create(new ExceptionHandlingBatchExecutor(fiberExceptions));

  private FrameChannel frames;

  @Before
  public void before() {
    frames = new FrameChannel(fiberSupplier);
    frames.startAsync().awaitRunning();
  }

  @After
  public void after() {
    frames.stopAsync().awaitTerminated();
    fiberFactory.dispose();
    executor.shutdownNow();
  }

  private static Frame frame(String session, long sequence) {
    return new Frame(session, 5000 + sequence, sequence, "jpeg", new byte[]{(byte) sequence}, 640, 480);
  }

  @Test(timeout = 10000)
  public void aSlowSubscriberOnlyGetsTheNewestFrame() throws Exception {
    RecordingConnection<Frame> connection = RecordingConnection.manual();
    frames.subscribe("s1", connection);

    frames.publish(frame("s1", 1));
    assertThat(connection.nextSent().getSequence(), is(equalTo(1L)));

    for (long sequence = 2; sequence <= 100; sequence++) {
      frames.publish(frame("s1", sequence));
    }
    assertThat(connection.pollSent(100), is(nullValue()));

    connection.completeNext();
    assertThat(connection.nextSent().getSequence(), is(equalTo(100L)));
    connection.completeNext();
    assertThat(connection.pollSent(200), is(nullValue()));

    assertThat(frames.getDroppedFrameCount(), is(equalTo(98L)));
  }

  @Test(timeout = 10000)
  public void framesArriveInChronologicalOrder() throws Exception {
    RecordingConnection<Frame> connection = RecordingConnection.autoCompleting();
    frames.subscribe("s1", connection);

    long last = 0;
    for (long sequence = 1; sequence <= 200; sequence++) {
      frames.publish(frame("s1", sequence));
    }
    Frame received;
    while ((received = connection.pollSent(200)) != null) {
      assertThat(received.getSequence() > last, is(true));
      last = received.getSequence();
    }
    assertThat(last, is(equalTo(200L)));
  }

  @Test(timeout = 10000)
  public void anOlderFrameDoesNotReplaceANewerOne() throws Exception {
    frames.publish(frame("s1", 10));
    frames.publish(frame("s1", 4));

    assertThat(frames.latestFrame("s1").getSequence(), is(equalTo(10L)));
    assertThat(frames.getStaleFrameCount(), is(equalTo(1L)));
    assertThat(frames.latestFrame("unknown"), is(nullValue()));
  }

  @Test(timeout = 10000)
  public void aNewSubscriberStartsWithTheNewestFrameOfItsSessionOnly() throws Exception {
    frames.publish(frame("s1", 3));
    frames.publish(frame("s2", 7));

    RecordingConnection<Frame> connection = RecordingConnection.autoCompleting();
    frames.subscribe("s2", connection);

    Frame first = connection.nextSent();
    assertThat(first.getSessionId(), is(equalTo("s2")));
    assertThat(first.getSequence(), is(equalTo(7L)));

    frames.publish(frame("s1", 4));
    assertThat(connection.pollSent(200), is(nullValue()));
  }

  @Test(timeout = 10000)
  public void aFailedSendClosesTheSubscription() throws Exception {
    RecordingConnection<Frame> connection = RecordingConnection.manual();
    ChannelSubscription subscription = frames.subscribe("s1", connection);

    frames.publish(frame("s1", 1));
    connection.nextSent();
    connection.failNext(new IOException("broken pipe"));

    connection.awaitClose();
    waitUntil("the subscription is cancelled", () -> !subscription.isActive());
    frames.publish(frame("s1", 2));
    assertThat(connection.pollSent(200), is(nullValue()));
  }

  @Test(timeout = 10000)
  public void aSessionIsDroppedWhenItsLastSubscriberLeaves() throws Exception {
    for (int i = 0; i < 1000; i++) {
      String session = "session-" + i;
      RecordingConnection<Frame> connection = RecordingConnection.autoCompleting();
      ChannelSubscription subscription = frames.subscribe(session, connection);
      frames.publish(new Frame(session, 5000, 1, "jpeg", new byte[64 * 1024], 640, 480));
      assertThat(connection.nextSent().getSessionId(), is(equalTo(session)));
      subscription.cancel();
    }

    assertThat(frames.getSessionCount(), is(equalTo(0)));
    assertThat(frames.latestFrame("session-0"), is(nullValue()));
  }

  @Test(timeout = 10000)
  public void aSessionStaysWhileAnySubscriberRemains() throws Exception {
    RecordingConnection<Frame> first = RecordingConnection.autoCompleting();
    RecordingConnection<Frame> second = RecordingConnection.autoCompleting();
    ChannelSubscription leaving = frames.subscribe("s1", first);
    frames.subscribe("s1", second);
    frames.publish(frame("s1", 1));
    assertThat(second.nextSent().getSequence(), is(equalTo(1L)));

    leaving.cancel();
    assertThat(frames.getSessionCount(), is(equalTo(1)));

    frames.publish(frame("s1", 2));
    assertThat(second.nextSent().getSequence(), is(equalTo(2L)));
    assertThat(frames.latestFrame("s1").getSequence(), is(equalTo(2L)));
  }

  @Test(timeout = 10000)
  public void endingASessionClosesItsSubscribersAndDropsTheSlot() throws Exception {
    RecordingConnection<Frame> connection = RecordingConnection.autoCompleting();
    ChannelSubscription subscription = frames.subscribe("s1", connection);
    frames.publish(frame("s1", 1));
    connection.nextSent();

    frames.endSession("s1");

    assertThat(connection.awaitClose(), is(equalTo("session ended")));
    assertThat(subscription.isActive(), is(false));
    assertThat(frames.latestFrame("s1"), is(nullValue()));
    assertThat(frames.getSessionCount(), is(equalTo(0)));
  }
}
