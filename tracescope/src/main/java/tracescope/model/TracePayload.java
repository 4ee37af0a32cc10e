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

package tracescope.model;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Kind-specific content of a {@link TraceEvent}. Text payloads carry only {@code text};
 * tool calls carry a tool name and arguments; tool results carry a tool name, the result
 * text and whether the tool succeeded. Fields that do not apply to a payload are null
 * (or empty, for the arguments).
 */
public final class TracePayload {
  private final String text;
  private final String toolName;
  private final ImmutableMap<String, String> arguments;
  private final String result;
  private final boolean success;

  private TracePayload(String text,
                       String toolName,
                       ImmutableMap<String, String> arguments,
                       String result,
                       boolean success) {
    this.text = text;
    this.toolName = toolName;
    this.arguments = arguments;
    this.result = result;
    this.success = success;
  }

  public static TracePayload text(String text) {
    return new TracePayload(checkNotNull(text), null, ImmutableMap.of(), null, true);
  }

  public static TracePayload toolCall(String toolName, Map<String, String> arguments) {
    return new TracePayload(null, checkNotNull(toolName), ImmutableMap.copyOf(arguments), null, true);
  }

  public static TracePayload toolResult(String toolName, String result, boolean success) {
    return new TracePayload(null, checkNotNull(toolName), ImmutableMap.of(), result, success);
  }

  public String getText() {
    return text;
  }

  public String getToolName() {
    return toolName;
  }

  public ImmutableMap<String, String> getArguments() {
    return arguments;
  }

  public String getResult() {
    return result;
  }

  public boolean isSuccess() {
    return success;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    TracePayload that = (TracePayload) o;

    if (success != that.success) {
      return false;
    }
    if (text != null ? !text.equals(that.text) : that.text != null) {
      return false;
    }
    if (toolName != null ? !toolName.equals(that.toolName) : that.toolName != null) {
      return false;
    }
    if (result != null ? !result.equals(that.result) : that.result != null) {
      return false;
    }
    return arguments.equals(that.arguments);
  }

  @Override
  public int hashCode() {
    int hash = text != null ? text.hashCode() : 0;
    hash = 31 * hash + (toolName != null ? toolName.hashCode() : 0);
    hash = 31 * hash + arguments.hashCode();
    hash = 31 * hash + (result != null ? result.hashCode() : 0);
    hash = 31 * hash + (success ? 1 : 0);
    return hash;
  }

  @Override
  public String toString() {
    if (toolName == null) {
      return "TracePayload{text=" + text + '}';
    }
    return "TracePayload{" +
        "toolName=" + toolName +
        ", arguments=" + arguments +
        ", result=" + result +
        ", success=" + success +
        '}';
  }
}
