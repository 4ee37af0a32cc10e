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

public class TracescopeConstants {
  public static final int DEFAULT_BUS_SINK_QUEUE_LIMIT = 10000;

  public static final int DEFAULT_EVENT_RETENTION_COUNT = 1000;
  public static final long DEFAULT_EVENT_RETENTION_AGE_MILLIS = 0;
  public static final int DEFAULT_EVENT_OUTBOUND_LIMIT = 2000;

  public static final int DEFAULT_INSIGHT_RETENTION_COUNT = 200;
  public static final int DEFAULT_INSIGHT_OUTBOUND_LIMIT = 400;

  public static final int DEFAULT_CRITIC_BUFFER_CAPACITY = 500;
  public static final int DEFAULT_CRITIC_BATCH_SIZE = 10;
  public static final long DEFAULT_CRITIC_FLUSH_INTERVAL_MILLIS = 5000;
  public static final long DEFAULT_CRITIC_ANALYSIS_TIMEOUT_MILLIS = 30000;

  public static final long DEFAULT_TRACE_LOG_POLL_MILLIS = 250;
  public static final int DEFAULT_PUSH_SERVER_PORT = 31337;
  public static final int MAX_WEBSOCKET_FRAME_SIZE = 4 * 1024 * 1024;
  public static final int MAX_CONTENT_LENGTH_HTTP_AGG = 65536;

  public static final String MAIN_AGENT_ID = "main";
  public static final String WEBSOCKET_PATH = "/push";

  public static final String BUS_SINK_QUEUE_LIMIT_PROPERTY_NAME = "tracescope.bus.sinkQueueLimit";
  public static final String EVENT_RETENTION_COUNT_PROPERTY_NAME = "tracescope.events.retentionCount";
  public static final String EVENT_RETENTION_AGE_PROPERTY_NAME = "tracescope.events.retentionAgeMillis";
  public static final String EVENT_OUTBOUND_LIMIT_PROPERTY_NAME = "tracescope.events.outboundLimit";
  public static final String INSIGHT_RETENTION_COUNT_PROPERTY_NAME = "tracescope.insights.retentionCount";
  public static final String INSIGHT_OUTBOUND_LIMIT_PROPERTY_NAME = "tracescope.insights.outboundLimit";
  public static final String CRITIC_BUFFER_CAPACITY_PROPERTY_NAME = "tracescope.critic.bufferCapacity";
  public static final String CRITIC_BATCH_SIZE_PROPERTY_NAME = "tracescope.critic.batchSize";
  public static final String CRITIC_FLUSH_INTERVAL_PROPERTY_NAME = "tracescope.critic.flushIntervalMillis";
  public static final String CRITIC_ANALYSIS_TIMEOUT_PROPERTY_NAME = "tracescope.critic.analysisTimeoutMillis";
  public static final String CRITIC_ENABLED_PROPERTY_NAME = "tracescope.critic.enabled";
  public static final String TRACE_LOG_PROPERTY_NAME = "tracescope.traceLog";
  public static final String TRACE_LOG_POLL_PROPERTY_NAME = "tracescope.traceLog.pollMillis";
  public static final String PUSH_SERVER_PORT_PROPERTY_NAME = "tracescope.pushServerPort";

  public static final String TRACE_LOG_ENVIRONMENT_VARIABLE = "TRACESCOPE_TRACE_LOG";
}
