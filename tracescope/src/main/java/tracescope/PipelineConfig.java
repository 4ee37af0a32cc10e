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

import java.util.Properties;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Immutable settings of one pipeline. Build one with {@link #builder()}, or read one from
 * system properties with {@link #fromProperties(Properties)}; either way the settings are
 * validated before the config exists.
 */
public final class PipelineConfig {
  private final int busSinkQueueLimit;
  private final int eventRetentionCount;
  private final long eventRetentionAgeMillis;
  private final int eventOutboundLimit;
  private final int insightRetentionCount;
  private final int insightOutboundLimit;
  private final int criticBufferCapacity;
  private final int criticBatchSize;
  private final long criticFlushIntervalMillis;
  private final long criticAnalysisTimeoutMillis;
  private final boolean criticEnabled;
  private final String traceLogPath;
  private final long traceLogPollMillis;
  private final int pushServerPort;

  private PipelineConfig(Builder builder) {
    this.busSinkQueueLimit = builder.busSinkQueueLimit;
    this.eventRetentionCount = builder.eventRetentionCount;
    this.eventRetentionAgeMillis = builder.eventRetentionAgeMillis;
    this.eventOutboundLimit = builder.eventOutboundLimit;
    this.insightRetentionCount = builder.insightRetentionCount;
    this.insightOutboundLimit = builder.insightOutboundLimit;
    this.criticBufferCapacity = builder.criticBufferCapacity;
    this.criticBatchSize = builder.criticBatchSize;
    this.criticFlushIntervalMillis = builder.criticFlushIntervalMillis;
    this.criticAnalysisTimeoutMillis = builder.criticAnalysisTimeoutMillis;
    this.criticEnabled = builder.criticEnabled;
    this.traceLogPath = builder.traceLogPath;
    this.traceLogPollMillis = builder.traceLogPollMillis;
    this.pushServerPort = builder.pushServerPort;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static PipelineConfig defaults() {
    return builder().build();
  }

  /**
   * Read settings from the given properties (normally {@link System#getProperties()}),
   * falling back to the defaults in {@link TracescopeConstants} for anything unset.
   *
   * @throws IllegalArgumentException if a property is malformed or the result is invalid.
   */
  public static PipelineConfig fromProperties(Properties properties) {
    Builder builder = builder();
    if (properties.containsKey(TracescopeConstants.BUS_SINK_QUEUE_LIMIT_PROPERTY_NAME)) {
      builder.setBusSinkQueueLimit(intProperty(properties, TracescopeConstants.BUS_SINK_QUEUE_LIMIT_PROPERTY_NAME));
    }
    if (properties.containsKey(TracescopeConstants.EVENT_RETENTION_COUNT_PROPERTY_NAME)) {
      builder.setEventRetentionCount(intProperty(properties, TracescopeConstants.EVENT_RETENTION_COUNT_PROPERTY_NAME));
    }
    if (properties.containsKey(TracescopeConstants.EVENT_RETENTION_AGE_PROPERTY_NAME)) {
      builder.setEventRetentionAgeMillis(longProperty(properties, TracescopeConstants.EVENT_RETENTION_AGE_PROPERTY_NAME));
    }
    if (properties.containsKey(TracescopeConstants.EVENT_OUTBOUND_LIMIT_PROPERTY_NAME)) {
      builder.setEventOutboundLimit(intProperty(properties, TracescopeConstants.EVENT_OUTBOUND_LIMIT_PROPERTY_NAME));
    }
    if (properties.containsKey(TracescopeConstants.INSIGHT_RETENTION_COUNT_PROPERTY_NAME)) {
      builder.setInsightRetentionCount(intProperty(properties, TracescopeConstants.INSIGHT_RETENTION_COUNT_PROPERTY_NAME));
    }
    if (properties.containsKey(TracescopeConstants.INSIGHT_OUTBOUND_LIMIT_PROPERTY_NAME)) {
      builder.setInsightOutboundLimit(intProperty(properties, TracescopeConstants.INSIGHT_OUTBOUND_LIMIT_PROPERTY_NAME));
    }
    if (properties.containsKey(TracescopeConstants.CRITIC_BUFFER_CAPACITY_PROPERTY_NAME)) {
      builder.setCriticBufferCapacity(intProperty(properties, TracescopeConstants.CRITIC_BUFFER_CAPACITY_PROPERTY_NAME));
    }
    if (properties.containsKey(TracescopeConstants.CRITIC_BATCH_SIZE_PROPERTY_NAME)) {
      builder.setCriticBatchSize(intProperty(properties, TracescopeConstants.CRITIC_BATCH_SIZE_PROPERTY_NAME));
    }
    if (properties.containsKey(TracescopeConstants.CRITIC_FLUSH_INTERVAL_PROPERTY_NAME)) {
      builder.setCriticFlushIntervalMillis(longProperty(properties, TracescopeConstants.CRITIC_FLUSH_INTERVAL_PROPERTY_NAME));
    }
    if (properties.containsKey(TracescopeConstants.CRITIC_ANALYSIS_TIMEOUT_PROPERTY_NAME)) {
      builder.setCriticAnalysisTimeoutMillis(
          longProperty(properties, TracescopeConstants.CRITIC_ANALYSIS_TIMEOUT_PROPERTY_NAME));
    }
    if (properties.containsKey(TracescopeConstants.CRITIC_ENABLED_PROPERTY_NAME)) {
      builder.setCriticEnabled(
          Boolean.parseBoolean(properties.getProperty(TracescopeConstants.CRITIC_ENABLED_PROPERTY_NAME).trim()));
    }
    if (properties.containsKey(TracescopeConstants.TRACE_LOG_PROPERTY_NAME)) {
      builder.setTraceLogPath(properties.getProperty(TracescopeConstants.TRACE_LOG_PROPERTY_NAME));
    }
    if (properties.containsKey(TracescopeConstants.TRACE_LOG_POLL_PROPERTY_NAME)) {
      builder.setTraceLogPollMillis(longProperty(properties, TracescopeConstants.TRACE_LOG_POLL_PROPERTY_NAME));
    }
    if (properties.containsKey(TracescopeConstants.PUSH_SERVER_PORT_PROPERTY_NAME)) {
      builder.setPushServerPort(intProperty(properties, TracescopeConstants.PUSH_SERVER_PORT_PROPERTY_NAME));
    }
    return builder.build();
  }

  private static int intProperty(Properties properties, String name) {
    String value = properties.getProperty(name);
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Property " + name + " is not an integer: " + value, e);
    }
  }

  private static long longProperty(Properties properties, String name) {
    String value = properties.getProperty(name);
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Property " + name + " is not an integer: " + value, e);
    }
  }

  /**
   * @return How many events may wait on a single bus sink before the bus drops events for it.
   */
  public int getBusSinkQueueLimit() {
    return busSinkQueueLimit;
  }

  public int getEventRetentionCount() {
    return eventRetentionCount;
  }

  /**
   * @return Maximum age of a retained event, or 0 if events are only evicted by count.
   */
  public long getEventRetentionAgeMillis() {
    return eventRetentionAgeMillis;
  }

  public int getEventOutboundLimit() {
    return eventOutboundLimit;
  }

  public int getInsightRetentionCount() {
    return insightRetentionCount;
  }

  public int getInsightOutboundLimit() {
    return insightOutboundLimit;
  }

  public int getCriticBufferCapacity() {
    return criticBufferCapacity;
  }

  public int getCriticBatchSize() {
    return criticBatchSize;
  }

  public long getCriticFlushIntervalMillis() {
    return criticFlushIntervalMillis;
  }

  public long getCriticAnalysisTimeoutMillis() {
    return criticAnalysisTimeoutMillis;
  }

  public boolean isCriticEnabled() {
    return criticEnabled;
  }

  /**
   * @return Path of the JSONL tool-trace log to tail, or null if none is configured.
   */
  public String getTraceLogPath() {
    return traceLogPath;
  }

  public long getTraceLogPollMillis() {
    return traceLogPollMillis;
  }

  public int getPushServerPort() {
    return pushServerPort;
  }

  @Override
  public String toString() {
    return "PipelineConfig{" +
        "busSinkQueueLimit=" + busSinkQueueLimit +
        ", eventRetentionCount=" + eventRetentionCount +
        ", eventRetentionAgeMillis=" + eventRetentionAgeMillis +
        ", eventOutboundLimit=" + eventOutboundLimit +
        ", insightRetentionCount=" + insightRetentionCount +
        ", insightOutboundLimit=" + insightOutboundLimit +
        ", criticBufferCapacity=" + criticBufferCapacity +
        ", criticBatchSize=" + criticBatchSize +
        ", criticFlushIntervalMillis=" + criticFlushIntervalMillis +
        ", criticAnalysisTimeoutMillis=" + criticAnalysisTimeoutMillis +
        ", criticEnabled=" + criticEnabled +
        ", traceLogPath=" + traceLogPath +
        ", traceLogPollMillis=" + traceLogPollMillis +
        ", pushServerPort=" + pushServerPort +
        '}';
  }

  public static final class Builder {
    private int busSinkQueueLimit = TracescopeConstants.DEFAULT_BUS_SINK_QUEUE_LIMIT;
    private int eventRetentionCount = TracescopeConstants.DEFAULT_EVENT_RETENTION_COUNT;
    private long eventRetentionAgeMillis = TracescopeConstants.DEFAULT_EVENT_RETENTION_AGE_MILLIS;
    private int eventOutboundLimit = TracescopeConstants.DEFAULT_EVENT_OUTBOUND_LIMIT;
    private int insightRetentionCount = TracescopeConstants.DEFAULT_INSIGHT_RETENTION_COUNT;
    private int insightOutboundLimit = TracescopeConstants.DEFAULT_INSIGHT_OUTBOUND_LIMIT;
    private int criticBufferCapacity = TracescopeConstants.DEFAULT_CRITIC_BUFFER_CAPACITY;
    private int criticBatchSize = TracescopeConstants.DEFAULT_CRITIC_BATCH_SIZE;
    private long criticFlushIntervalMillis = TracescopeConstants.DEFAULT_CRITIC_FLUSH_INTERVAL_MILLIS;
    private long criticAnalysisTimeoutMillis = TracescopeConstants.DEFAULT_CRITIC_ANALYSIS_TIMEOUT_MILLIS;
    private boolean criticEnabled = true;
    private String traceLogPath = null;
    private long traceLogPollMillis = TracescopeConstants.DEFAULT_TRACE_LOG_POLL_MILLIS;
    private int pushServerPort = TracescopeConstants.DEFAULT_PUSH_SERVER_PORT;

    private Builder() {
    }

    public Builder setBusSinkQueueLimit(int busSinkQueueLimit) {
      this.busSinkQueueLimit = busSinkQueueLimit;
      return this;
    }

    public Builder setEventRetentionCount(int eventRetentionCount) {
      this.eventRetentionCount = eventRetentionCount;
      return this;
    }

    public Builder setEventRetentionAgeMillis(long eventRetentionAgeMillis) {
      this.eventRetentionAgeMillis = eventRetentionAgeMillis;
      return this;
    }

    public Builder setEventOutboundLimit(int eventOutboundLimit) {
      this.eventOutboundLimit = eventOutboundLimit;
      return this;
    }

    public Builder setInsightRetentionCount(int insightRetentionCount) {
      this.insightRetentionCount = insightRetentionCount;
      return this;
    }

    public Builder setInsightOutboundLimit(int insightOutboundLimit) {
      this.insightOutboundLimit = insightOutboundLimit;
      return this;
    }

    public Builder setCriticBufferCapacity(int criticBufferCapacity) {
      this.criticBufferCapacity = criticBufferCapacity;
      return this;
    }

    public Builder setCriticBatchSize(int criticBatchSize) {
      this.criticBatchSize = criticBatchSize;
      return this;
    }

    public Builder setCriticFlushIntervalMillis(long criticFlushIntervalMillis) {
      this.criticFlushIntervalMillis = criticFlushIntervalMillis;
      return this;
    }

    public Builder setCriticAnalysisTimeoutMillis(long criticAnalysisTimeoutMillis) {
      this.criticAnalysisTimeoutMillis = criticAnalysisTimeoutMillis;
      return this;
    }

    public Builder setCriticEnabled(boolean criticEnabled) {
      this.criticEnabled = criticEnabled;
      return this;
    }

    public Builder setTraceLogPath(String traceLogPath) {
      this.traceLogPath = traceLogPath;
      return this;
    }

    public Builder setTraceLogPollMillis(long traceLogPollMillis) {
      this.traceLogPollMillis = traceLogPollMillis;
      return this;
    }

    public Builder setPushServerPort(int pushServerPort) {
      this.pushServerPort = pushServerPort;
      return this;
    }

    public PipelineConfig build() {
      checkArgument(busSinkQueueLimit > 0, "bus sink queue limit must be positive");
      checkArgument(eventRetentionCount > 0, "event retention count must be positive");
      checkArgument(eventRetentionAgeMillis >= 0, "event retention age must not be negative");
      // a full replay of the retention window must fit in a subscriber's queue
      checkArgument(eventOutboundLimit >= eventRetentionCount,
          "event outbound limit %s is smaller than the retention count %s", eventOutboundLimit, eventRetentionCount);
      checkArgument(insightRetentionCount > 0, "insight retention count must be positive");
      checkArgument(insightOutboundLimit >= insightRetentionCount,
          "insight outbound limit %s is smaller than the retention count %s",
          insightOutboundLimit, insightRetentionCount);
      checkArgument(criticBatchSize > 0, "critic batch size must be positive");
      checkArgument(criticBufferCapacity >= criticBatchSize,
          "critic buffer capacity %s is smaller than the batch size %s", criticBufferCapacity, criticBatchSize);
      checkArgument(criticFlushIntervalMillis > 0, "critic flush interval must be positive");
      checkArgument(criticAnalysisTimeoutMillis > 0, "critic analysis timeout must be positive");
      checkArgument(traceLogPollMillis > 0, "trace log poll interval must be positive");
      checkArgument(pushServerPort >= 0 && pushServerPort <= 65535, "invalid push server port %s", pushServerPort);
      return new PipelineConfig(this);
    }
  }
}
