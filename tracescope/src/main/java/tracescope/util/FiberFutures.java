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

package tracescope.util;

import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import org.jetlang.fibers.Fiber;

import java.util.function.Consumer;

/**
 * Helpers for completing guava futures on a jetlang fiber.
 */
public final class FiberFutures {
  private FiberFutures() {
  }

  /**
   * Run one of the two callbacks once the future completes. The callback is run on the
   * given fiber; it never runs on the thread that completed the future.
   */
  public static <V> void addCallback(ListenableFuture<V> future,
                                     Consumer<? super V> success,
                                     Consumer<Throwable> failure,
                                     Fiber fiber) {
    Futures.addCallback(future, new FutureCallback<V>() {
      @Override
      public void onSuccess(V result) {
        success.accept(result);
      }

      @Override
      public void onFailure(Throwable t) {
        failure.accept(t);
      }
    }, fiber);
  }
}
