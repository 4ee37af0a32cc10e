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

import org.junit.rules.TestRule;
import org.junit.runner.Description;
import org.junit.runners.model.Statement;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Collects throwables raised by fiber tasks and fails the test if there were any. Pass the
 * rule itself as the throwable handler of the test's fibers.
 */
public class JUnitRuleFiberExceptions implements TestRule, Consumer<Throwable> {
  private final List<Throwable> throwables = new CopyOnWriteArrayList<>();

  @Override
  public void accept(Throwable throwable) {
    throwables.add(throwable);
  }

  @Override
  public Statement apply(Statement base, Description description) {
    return new Statement() {
      @Override
      public void evaluate() throws Throwable {
        base.evaluate();
        if (!throwables.isEmpty()) {
          AssertionError error = new AssertionError(
              throwables.size() + " fiber task(s) threw during " + description.getDisplayName());
          error.initCause(throwables.get(0));
          throw error;
        }
      }
    };
  }
}
