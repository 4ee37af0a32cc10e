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

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.MinimalPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableMap;

import java.io.IOException;
import java.time.Instant;

/**
 * Builds tool-trace log entries from the JSON documents a coding agent passes to its
 * post-tool-use hook. An entry is one flat JSON object per tool use; the tool-trace log is
 * a file of such objects, one per line.
 */
public final class ToolTraceEntries {
  public static final String TASK_TOOL = "Task";

  /**
   * Maximum lengths of the free-text fields of an entry.
   */
  public static final ImmutableMap<String, Integer> TRUNCATE_LIMITS = ImmutableMap.<String, Integer>builder()
      .put("command", 200)
      .put("description", 200)
      .put("file_path", 256)
      .put("pattern", 200)
      .put("query", 200)
      .put("url", 500)
      .put("model", 100)
      .put("subagent_type", 100)
      .put("status", 100)
      .build();

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final ObjectWriter LOG_WRITER = MAPPER.writer(new SpacedPrettyPrinter());
  private static final String ELLIPSIS = "...";

  private ToolTraceEntries() {
  }

  public static ObjectMapper mapper() {
    return MAPPER;
  }

  /**
   * Create the log entry for one hook input. Missing string fields of the input become
   * empty strings; nothing in the input is required.
   */
  public static ObjectNode createLogEntry(JsonNode input, long timestampMillis) {
    String toolName = textOrEmpty(input, "tool_name");
    JsonNode toolInput = parseJsonField(input == null ? null : input.get("tool_input"));
    JsonNode toolResponse = parseJsonField(input == null ? null : input.get("tool_response"));
    McpToolName mcp = McpToolName.parse(toolName);

    ObjectNode entry = MAPPER.createObjectNode();
    entry.put("timestamp", Instant.ofEpochMilli(timestampMillis).toString());
    entry.put("session_id", textOrEmpty(input, "session_id"));
    entry.put("tool_use_id", textOrEmpty(input, "tool_use_id"));
    entry.put("tool_name", toolName);
    entry.put("is_mcp", mcp.isMcp());
    entry.put("mcp_server", mcp.getServer());
    entry.put("mcp_tool", mcp.getTool());
    entry.put("permission_mode", textOrEmpty(input, "permission_mode"));
    entry.put("cwd", textOrEmpty(input, "cwd"));
    entry.setAll(extractAgentContext(toolName, toolInput, toolResponse));
    entry.setAll(extractToolFields(toolName, toolInput, toolResponse));
    return entry;
  }

  /**
   * For the {@code Task} tool, which launches a sub-agent: the sub-agent type requested in
   * the input and the agent id reported in the response. Both are null for other tools.
   */
  public static ObjectNode extractAgentContext(String toolName, JsonNode toolInput, JsonNode toolResponse) {
    ObjectNode context = MAPPER.createObjectNode();
    String subagentType = null;
    String agentId = null;
    if (TASK_TOOL.equals(toolName)) {
      subagentType = truncate(extractNested(parseJsonField(toolInput), "subagent_type"), limit("subagent_type"));
      agentId = truncate(extractNested(parseJsonField(toolResponse), "agent_id"), 100);
    }
    context.put("subagent_type", subagentType);
    context.put("agent_id", agentId);
    return context;
  }

  public static ObjectNode extractToolFields(String toolName, JsonNode toolInput, JsonNode toolResponse) {
    JsonNode in = parseJsonField(toolInput);
    JsonNode out = parseJsonField(toolResponse);

    ObjectNode fields = MAPPER.createObjectNode();
    fields.put("command", truncate(extractNested(in, "command"), limit("command")));
    fields.put("description", truncate(extractNested(in, "description"), limit("description")));
    fields.put("file_path", truncate(extractNested(in, "file_path", "filePath"), limit("file_path")));
    fields.put("pattern", truncate(extractNested(in, "pattern"), limit("pattern")));
    fields.put("query", truncate(extractNested(in, "query"), limit("query")));
    fields.put("url", truncate(extractNested(in, "url"), limit("url")));
    fields.put("model", truncate(extractNested(in, "model"), limit("model")));
    fields.set("http_code", nullToJson(extractNested(out, "http_code", "httpCode")));
    fields.set("bytes", nullToJson(extractNested(out, "bytes")));
    fields.set("num_matches", nullToJson(extractNested(out, "num_matches", "numMatches")));
    fields.set("num_files", nullToJson(extractNested(out, "num_files", "numFiles")));
    fields.put("status", truncate(extractNested(out, "status"), limit("status")));
    fields.put("interrupted", isTrue(extractNested(out, "interrupted")));
    fields.put("has_stderr", isTruthy(extractNested(out, "stderr")));
    return fields;
  }

  /**
   * Text of a value, cut to {@code limit} code points. A value that is too long keeps its
   * first {@code limit - 3} code points followed by {@code ...}. Non-text values are
   * rendered as JSON first.
   *
   * @return The truncated text, or null for a missing or null value.
   */
  public static String truncate(JsonNode value, int limit) {
    if (value == null || value.isNull() || value.isMissingNode()) {
      return null;
    }
    return truncate(value.isTextual() ? value.asText() : toLogJson(value), limit);
  }

  public static String truncate(String value, int limit) {
    if (value == null || value.codePointCount(0, value.length()) <= limit) {
      return value;
    }
    return value.substring(0, value.offsetByCodePoints(0, limit - ELLIPSIS.length())) + ELLIPSIS;
  }

  /**
   * Hooks sometimes pass nested documents as JSON text. Text holding valid JSON is parsed;
   * anything else is returned unchanged.
   */
  public static JsonNode parseJsonField(JsonNode value) {
    if (value == null || !value.isTextual()) {
      return value;
    }
    try {
      return MAPPER.readTree(value.asText());
    } catch (JsonProcessingException e) {
      return value;
    }
  }

  /**
   * @return The value of the first of {@code keys} present in {@code data}, or null if
   * there is none or {@code data} is not an object.
   */
  public static JsonNode extractNested(JsonNode data, String... keys) {
    if (data == null || !data.isObject()) {
      return null;
    }
    for (String key : keys) {
      JsonNode value = data.get(key);
      if (value != null && !value.isNull()) {
        return value;
      }
    }
    return null;
  }

  /**
   * Render a value as JSON with a space after each separator, {@code {"key": "value"}} or
   * {@code [1, 2, 3]} (text values as they are), truncated to {@code limit}.
   */
  public static String serializeForLog(JsonNode value, int limit) {
    return truncate(value, limit);
  }

  private static String toLogJson(JsonNode value) {
    try {
      return LOG_WRITER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot render " + value.getNodeType() + " node as JSON", e);
    }
  }

  private static int limit(String field) {
    return TRUNCATE_LIMITS.get(field);
  }

  private static String textOrEmpty(JsonNode input, String field) {
    if (input == null || !input.isObject()) {
      return "";
    }
    JsonNode value = input.get(field);
    return value == null || value.isNull() ? "" : value.asText();
  }

  private static JsonNode nullToJson(JsonNode value) {
    return value == null ? MAPPER.nullNode() : value;
  }

  private static boolean isTrue(JsonNode value) {
    return value != null && value.asBoolean(false);
  }

  private static boolean isTruthy(JsonNode value) {
    if (value == null || value.isNull()) {
      return false;
    }
    if (value.isTextual()) {
      return !value.asText().isEmpty();
    }
    if (value.isContainerNode()) {
      return value.size() > 0;
    }
    return value.asBoolean(true);
  }

  private static class SpacedPrettyPrinter extends MinimalPrettyPrinter {
    private static final long serialVersionUID = 1L;

    @Override
    public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
      g.writeRaw(": ");
    }

    @Override
    public void writeObjectEntrySeparator(JsonGenerator g) throws IOException {
      g.writeRaw(", ");
    }

    @Override
    public void writeArrayValueSeparator(JsonGenerator g) throws IOException {
      g.writeRaw(", ");
    }
  }
}
