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

import tracescope.model.EventKind;
import tracescope.model.TraceEvent;
import tracescope.model.TracePayload;
import com.google.common.collect.ImmutableMap;

import java.util.function.BooleanSupplier;

import static org.junit.Assert.fail;

public class TestHelpers {
  public static final long TIMEOUT_MILLIS = 3000;

  public static TraceEvent event(long sequence) {
    return new TraceEvent(sequence, 1000L + sequence, EventKind.TEXT_OUTPUT, "main",
        TracePayload.text("output " + sequence));
  }

  public static TraceEvent toolCall(long sequence, String toolName) {
    return new TraceEvent(sequence, 1000L + sequence, EventKind.TOOL_CALL, "main",
        TracePayload.toolCall(toolName, ImmutableMap.of("command", "make test")));
  }

  public static TraceEvent toolResult(long sequence, String toolName, boolean success) {
    return new TraceEvent(sequence, 1000L + sequence, EventKind.TOOL_RESULT, "main",
        TracePayload.toolResult(toolName, success ? "ok" : "exit status 2", success));
  }

  /**
   * Poll the condition until it holds, failing the test if it does not within
   * {@link #TIMEOUT_MILLIS}.
   */
  public static void waitUntil(String description, BooleanSupplier condition) throws InterruptedException {
    long deadline = System.currentTimeMillis() + TIMEOUT_MILLIS;
    while (!condition.getAsBoolean()) {
      if (System.currentTimeMillis() > deadline) {
        fail("Timed out waiting until " + description);
      }
      Thread.sleep(10);
    }
  }
}
