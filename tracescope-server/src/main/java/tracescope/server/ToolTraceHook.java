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

import tracescope.TracescopeConstants;
import tracescope.source.ToolTraceEntries;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.io.ByteStreams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;

/**
 * Post-tool-use hook for a coding agent. Reads the hook input document from stdin and
 * appends its tool-trace entry as one line to the trace log, where a
 * {@link tracescope.source.TraceLogTailer} picks it up.
 * <p/>
 * The hook never fails the agent: whatever happens, it exits with status 0.
 */
public class ToolTraceHook {
  private static final Logger LOG = LoggerFactory.getLogger(ToolTraceHook.class);

  public static void main(String[] args) {
    System.exit(run(System.in, traceLogFile()));
  }

  public static int run(InputStream in, Path logFile) {
    try {
      ObjectNode entry = ToolTraceEntries.createLogEntry(readInput(in), System.currentTimeMillis());
      append(logFile, ToolTraceEntries.mapper().writeValueAsString(entry));
    } catch (IOException | RuntimeException e) {
      LOG.warn("Unable to record tool use in {}", logFile, e);
    }
    return 0;
  }

  private static JsonNode readInput(InputStream in) throws IOException {
    String text = new String(ByteStreams.toByteArray(in), StandardCharsets.UTF_8).trim();
    if (text.isEmpty()) {
      return ToolTraceEntries.mapper().createObjectNode();
    }
    try {
      JsonNode input = ToolTraceEntries.mapper().readTree(text);
      return input.isObject() ? input : ToolTraceEntries.mapper().createObjectNode();
    } catch (IOException e) {
      LOG.warn("Hook input is not JSON, recording an empty entry", e);
      return ToolTraceEntries.mapper().createObjectNode();
    }
  }

  private static void append(Path logFile, String line) throws IOException {
    Path parent = logFile.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.write(logFile, (line + "\n").getBytes(StandardCharsets.UTF_8),
        StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
  }

  static Path traceLogFile() {
    String path = System.getProperty(TracescopeConstants.TRACE_LOG_PROPERTY_NAME);
    if (path == null) {
      path = System.getenv(TracescopeConstants.TRACE_LOG_ENVIRONMENT_VARIABLE);
    }
    if (path == null) {
      return Paths.get(System.getProperty("user.home"), ".tracescope", "tool-trace.jsonl");
    }
    return Paths.get(path);
  }
}
