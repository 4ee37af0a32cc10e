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

import tracescope.interfaces.bus.SinkSubscription;
import tracescope.model.TraceEvent;
import tracescope.util.ExceptionHandlingBatchExecutor;
import tracescope.util.FiberSupplier;
import tracescope.util.JUnitRuleFiberExceptions;
import org.jetlang.fibers.PoolFiberFactory;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static tracescope.TestHelpers.TIMEOUT_MILLIS;
import static tracescope.TestHelpers.event;
import static tracescope.TestHelpers.waitUntil;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;

public class TraceEventBusTest {
  @Rule
  public JUnitRuleFiberExceptions fiberExceptions = new JUnitRuleFiberExceptions();

  private final ExecutorService executor = Executors.newFixedThreadPool(4);
  private final PoolFiberFactory fiberFactory = new PoolFiberFactory(executor);
  private final FiberSupplier fiberSupplier = (ignore) ->
      fiberFactory.create(new ExceptionHandlingBatchExecutor(fiberExceptions));

  private TraceEventBus bus;

  @Before
  public void startBus() {
    bus = new TraceEventBus(fiberSupplier);
    bus.startAsync().awaitRunning();
  }

  @After
  public void stopBus() {
    bus.stopAsync().awaitTerminated();
    fiberFactory.dispose();
    executor.shutdownNow();
  }

  @Test(timeout = 10000)
  public void publishDoesNotWaitForAStalledSink() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    List<Long> slowSeen = Collections.synchronizedList(new ArrayList<>());
    bus.subscribe(event -> {
      release.await();
      slowSeen.add(event.getSequence());
    });
    BlockingQueue<TraceEvent> fastSeen = new LinkedBlockingQueue<>();
    bus.subscribe(fastSeen::add);

    long start = System.nanoTime();
    for (long sequence = 1; sequence <= 1000; sequence++) {
      bus.publish(event(sequence));
    }
    long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    assertThat(elapsedMillis, is(lessThan(1000L)));

    for (long sequence = 1; sequence <= 1000; sequence++) {
      TraceEvent received = fastSeen.poll(TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
      assertThat(received, is(notNullValue()));
      assertThat(received.getSequence(), is(equalTo(sequence)));
    }
    assertThat(slowSeen.isEmpty(), is(true));
    assertThat(bus.getSinkOverflowCount(), is(equalTo(0L)));

    release.countDown();
    waitUntil("the stalled sink catches up", () -> slowSeen.size() == 1000);
    for (int i = 0; i < 1000; i++) {
      assertThat(slowSeen.get(i), is(equalTo(i + 1L)));
    }
  }

  @Test(timeout = 10000)
  public void aStalledSinkQueuesAtMostItsLimitAndTheRestIsDroppedForIt() throws Exception {
    TraceEventBus boundedBus = new TraceEventBus(fiberSupplier, 10);
    boundedBus.startAsync().awaitRunning();
    try {
      CountDownLatch entered = new CountDownLatch(1);
      CountDownLatch release = new CountDownLatch(1);
      List<Long> slowSeen = Collections.synchronizedList(new ArrayList<>());
      boundedBus.subscribe(event -> {
        entered.countDown();
        release.await();
        slowSeen.add(event.getSequence());
      });

      boundedBus.publish(event(1));
      assertThat(entered.await(TIMEOUT_MILLIS, TimeUnit.MILLISECONDS), is(true));
      for (long sequence = 2; sequence <= 1000; sequence++) {
        boundedBus.publish(event(sequence));
      }
      assertThat(boundedBus.getSinkOverflowCount(), is(equalTo(989L)));

      release.countDown();
      waitUntil("the stalled sink drains its queue", () -> slowSeen.size() == 11);
      for (int i = 0; i < 11; i++) {
        assertThat(slowSeen.get(i), is(equalTo(i + 1L)));
      }

      boundedBus.publish(event(1001));
      waitUntil("delivery resumes once the sink caught up", () -> slowSeen.size() == 12);
      assertThat(slowSeen.get(11), is(equalTo(1001L)));
      assertThat(boundedBus.getSinkOverflowCount(), is(equalTo(989L)));
      assertThat(boundedBus.getPublishedCount(), is(equalTo(1001L)));
    } finally {
      boundedBus.stopAsync().awaitTerminated();
    }
  }

  @Test
  public void aFailingSinkDoesNotAffectOtherSinks() throws Exception {
    bus.subscribe(event -> {
      throw new IllegalStateException("sink is broken");
    });
    BlockingQueue<TraceEvent> seen = new LinkedBlockingQueue<>();
    bus.subscribe(seen::add);

    for (long sequence = 1; sequence <= 5; sequence++) {
      bus.publish(event(sequence));
    }

    for (long sequence = 1; sequence <= 5; sequence++) {
      assertThat(seen.poll(TIMEOUT_MILLIS, TimeUnit.MILLISECONDS).getSequence(), is(equalTo(sequence)));
    }
    waitUntil("every failure is counted", () -> bus.getSinkFailureCount() == 5);
  }

  @Test
  public void aSinkOnlySeesEventsPublishedAfterItSubscribed() throws Exception {
    bus.publish(event(1));
    BlockingQueue<TraceEvent> seen = new LinkedBlockingQueue<>();
    bus.subscribe(seen::add);
    bus.publish(event(2));

    assertThat(seen.poll(TIMEOUT_MILLIS, TimeUnit.MILLISECONDS).getSequence(), is(equalTo(2L)));
    assertThat(bus.getPublishedCount(), is(equalTo(2L)));
  }

  @Test
  public void unsubscribedSinksReceiveNothingFurther() throws Exception {
    BlockingQueue<TraceEvent> seen = new LinkedBlockingQueue<>();
    SinkSubscription subscription = bus.subscribe(seen::add);
    assertThat(bus.getSubscriberCount(), is(equalTo(1)));

    bus.publish(event(1));
    assertThat(seen.poll(TIMEOUT_MILLIS, TimeUnit.MILLISECONDS), is(notNullValue()));

    bus.unsubscribe(subscription);
    assertThat(subscription.isActive(), is(false));
    assertThat(bus.getSubscriberCount(), is(equalTo(0)));

    bus.publish(event(2));
    assertThat(seen.poll(200, TimeUnit.MILLISECONDS), is(nullValue()));
  }
}
