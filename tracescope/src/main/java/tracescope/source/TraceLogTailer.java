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

package tracescope.source;

import tracescope.TracescopeConstants;
import tracescope.interfaces.ModuleType;
import tracescope.interfaces.TracescopeModule;
import tracescope.model.EventKind;
import tracescope.model.TracePayload;
import tracescope.util.FiberOnly;
import tracescope.util.FiberSupplier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.AbstractService;
import org.jetlang.core.Disposable;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Follows a tool-trace log (JSON lines, see {@link ToolTraceEntries}) and records what it
 * reads as trace events. The file is polled on a fiber; only complete lines are handled,
 * and a line still being written is picked up on a later poll. If the file gets shorter it
 * is assumed to have been replaced and is read again from the start.
 * <p/>
 * A tool-trace entry becomes a tool call followed by its tool result. Lines with a
 * {@code kind} of {@code thinking} or {@code text_output} and a {@code text} become events
 * of that kind. Lines that are not JSON objects are logged and skipped.
 */
public class TraceLogTailer extends AbstractService implements TracescopeModule {
  private static final Logger LOG = LoggerFactory.getLogger(TraceLogTailer.class);
  private static final int READ_BUFFER_SIZE = 64 * 1024;
  private static final List<String> ARGUMENT_FIELDS = ImmutableList.of(
      "command", "description", "file_path", "pattern", "query", "url", "model", "subagent_type", "agent_id",
      "mcp_server", "mcp_tool");
  private static final List<String> RESULT_FIELDS = ImmutableList.of(
      "status", "http_code", "bytes", "num_matches", "num_files");

  private final Path logFile;
  private final TraceRecorder recorder;
  private final Fiber fiber;
  private final long pollMillis;

  private final AtomicLong linesRead = new AtomicLong();
  private final AtomicLong malformedLines = new AtomicLong();

  private final ByteArrayOutputStream partialLine = new ByteArrayOutputStream();
  private final ByteBuffer readBuffer = ByteBuffer.allocate(READ_BUFFER_SIZE);
  private long position = 0;
  private Disposable pollTask;

  public TraceLogTailer(Path logFile, TraceRecorder recorder, FiberSupplier fiberSupplier, long pollMillis) {
    this.logFile = logFile;
    this.recorder = recorder;
    this.pollMillis = pollMillis;
    this.fiber = fiberSupplier.getFiber(this::handleThrowable);
  }

  private void handleThrowable(Throwable fiberError) {
    LOG.error("Got fiber exception", fiberError);
  }

  @Override
  protected void doStart() {
    fiber.start();
    pollTask = fiber.scheduleWithFixedDelay(this::poll, 0, pollMillis, TimeUnit.MILLISECONDS);
    LOG.info("Tailing tool-trace log {}", logFile);
    notifyStarted();
  }

  @Override
  protected void doStop() {
    if (pollTask != null) {
      pollTask.dispose();
    }
    fiber.dispose();
    notifyStopped();
  }

  @FiberOnly
  private void poll() {
    if (!Files.exists(logFile)) {
      return;
    }
    try (SeekableByteChannel channel = Files.newByteChannel(logFile, StandardOpenOption.READ)) {
      long size = channel.size();
      if (size < position) {
        LOG.info("Tool-trace log {} shrank from {} to {} bytes, reading it from the start", logFile, position, size);
        position = 0;
        partialLine.reset();
      }
      channel.position(position);
      while (position < size) {
        readBuffer.clear();
        int read = channel.read(readBuffer);
        if (read <= 0) {
          break;
        }
        position += read;
        readBuffer.flip();
        consume(readBuffer);
      }
    } catch (IOException e) {
      LOG.warn("Unable to read tool-trace log {}", logFile, e);
    }
  }

  @FiberOnly
  private void consume(ByteBuffer bytes) {
    while (bytes.hasRemaining()) {
      byte b = bytes.get();
      if (b == '\n') {
        String line = new String(partialLine.toByteArray(), StandardCharsets.UTF_8);
        partialLine.reset();
        handleLine(line);
      } else {
        partialLine.write(b);
      }
    }
  }

  @FiberOnly
  void handleLine(String line) {
    String trimmed = line.trim();
    if (trimmed.isEmpty()) {
      return;
    }
    linesRead.incrementAndGet();

    JsonNode entry;
    try {
      entry = ToolTraceEntries.mapper().readTree(trimmed);
    } catch (JsonProcessingException e) {
      malformedLines.incrementAndGet();
      LOG.warn("Skipping malformed tool-trace line: {}", ToolTraceEntries.truncate(trimmed, 200));
      return;
    }
    if (entry == null || !entry.isObject()) {
      malformedLines.incrementAndGet();
      LOG.warn("Skipping tool-trace line that is not an object: {}", ToolTraceEntries.truncate(trimmed, 200));
      return;
    }

    String toolName = entry.path("tool_name").asText("");
    if (!toolName.isEmpty()) {
      recordToolUse(toolName, entry);
      return;
    }

    EventKind kind = textKind(entry.path("kind").asText(""));
    if (kind != null && entry.hasNonNull("text")) {
      recorder.record(kind, agentId(entry), TracePayload.text(entry.get("text").asText()));
      return;
    }
    LOG.debug("Ignoring tool-trace line without a tool name or text kind");
  }

  private void recordToolUse(String toolName, JsonNode entry) {
    Map<String, String> arguments = new LinkedHashMap<>();
    for (String field : ARGUMENT_FIELDS) {
      String value = ToolTraceEntries.serializeForLog(entry.get(field), 500);
      if (value != null) {
        arguments.put(field, value);
      }
    }
    String agentId = agentId(entry);
    recorder.record(EventKind.TOOL_CALL, agentId, TracePayload.toolCall(toolName, arguments));

    boolean interrupted = entry.path("interrupted").asBoolean(false);
    boolean hasStderr = entry.path("has_stderr").asBoolean(false);
    recorder.record(EventKind.TOOL_RESULT, agentId,
        TracePayload.toolResult(toolName, describeResult(entry, interrupted, hasStderr), !interrupted && !hasStderr));
  }

  private static String describeResult(JsonNode entry, boolean interrupted, boolean hasStderr) {
    List<String> parts = new ArrayList<>();
    if (interrupted) {
      parts.add("interrupted");
    }
    if (hasStderr) {
      parts.add("wrote to stderr");
    }
    for (String field : RESULT_FIELDS) {
      String value = ToolTraceEntries.serializeForLog(entry.get(field), 100);
      if (value != null) {
        parts.add(field + "=" + value);
      }
    }
    return parts.isEmpty() ? "ok" : Joiner.on(", ").join(parts);
  }

  /**
   * Tool entries are written by the hook of the main session; text lines may name the
   * agent that produced them.
   */
  private static String agentId(JsonNode entry) {
    if (entry.hasNonNull("tool_name")) {
      return TracescopeConstants.MAIN_AGENT_ID;
    }
    String agentId = entry.path("agent_id").asText("");
    return agentId.isEmpty() ? TracescopeConstants.MAIN_AGENT_ID : agentId;
  }

  private static EventKind textKind(String kind) {
    switch (kind) {
      case "thinking":
        return EventKind.THINKING;
      case "text_output":
        return EventKind.TEXT_OUTPUT;
      default:
        return null;
    }
  }

  public long getLinesRead() {
    return linesRead.get();
  }

  public long getMalformedLines() {
    return malformedLines.get();
  }

  @Override
  public ModuleType getModuleType() {
    return ModuleType.TraceLog;
  }
}
