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

package tracescope.interfaces.critic;

import tracescope.model.InsightDraft;
import tracescope.model.TraceEvent;

import java.util.List;

/**
 * The external analysis step. It may block for a long time, and it may throw; either way
 * the critic only loses the batch it was given.
 */
@FunctionalInterface
public interface TraceAnalyzer {
  /**
   * @param batch Events in sequence order.
   * @return Drafted insights, possibly none.
   */
  List<InsightDraft> analyze(List<TraceEvent> batch) throws Exception;
}
