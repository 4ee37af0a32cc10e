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

import tracescope.PipelineConfig;
import tracescope.util.FiberSupplier;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.Service;

/**
 * Stands in for the resources shared by the modules of one pipeline. Several pipelines
 * may live in one JVM, so nothing here is static.
 */
public interface PipelineServer extends Service {
  PipelineConfig getConfig();

  /**
   * Return a FiberSupplier with which the caller may create a Fiber using the pipeline's
   * shared fiber pool.
   */
  FiberSupplier getFiberSupplier();

  EventBusModule getEventBus();

  AgentEventModule getAgentEvents();

  FrameModule getFrames();

  InsightModule getInsights();

  /**
   * @return The critic, or null if the pipeline runs without one.
   */
  CriticModule getCritic();

  ListenableFuture<Void> getShutdownFuture();
}
