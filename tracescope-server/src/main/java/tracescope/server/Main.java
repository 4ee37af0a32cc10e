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

package tracescope.server;

import tracescope.PipelineConfig;
import tracescope.TracescopePipeline;
import tracescope.critic.FailedToolAnalyzer;
import tracescope.source.TraceLogTailer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.Properties;

/**
 * CLI Entry point for the tracescope server. Settings come from system properties, see
 * {@link tracescope.TracescopeConstants}.
 */
public class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  public static void main(String[] args) throws Exception {
    TracescopePipeline instance = startServer(System.getProperties());
    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      LOG.info("Shutting down");
      instance.stopAsync().awaitTerminated();
    }, "tracescope-shutdown"));

    instance.getShutdownFuture().get();
  }

  /**
   * Start a pipeline, the push server and, if a trace log is configured, a tailer for it.
   */
  public static TracescopePipeline startServer(Properties properties) {
    // use system properties for config so we don't end up writing a whole command line
    // parse framework.
    PipelineConfig config = PipelineConfig.fromProperties(properties);

    TracescopePipeline instance = new TracescopePipeline(config, new FailedToolAnalyzer());
    instance.startAsync().awaitRunning();

    if (config.getTraceLogPath() != null) {
      instance.startModule(new TraceLogTailer(
          Paths.get(config.getTraceLogPath()),
          instance.getTraceRecorder(),
          instance.getFiberSupplier(),
          config.getTraceLogPollMillis()));
    }
    instance.startModule(new PushServerService(instance, config.getPushServerPort()));
    return instance;
  }
}
