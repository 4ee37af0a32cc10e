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

package tracescope.interfaces;

import tracescope.interfaces.critic.CriticState;

/**
 * Observes the trace event stream, batches it and hands the batches to an analysis
 * function. The critic never slows the event stream down: when it falls behind it drops
 * the oldest buffered events.
 */
public interface CriticModule extends TracescopeModule {

  CriticState getState();

  long getDroppedEventCount();

  long getBatchesAnalyzed();

  long getBatchesFailed();

  long getInsightsEmitted();

  long getReferencesRejected();
}
