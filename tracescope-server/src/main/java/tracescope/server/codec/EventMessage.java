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

package tracescope.server.codec;

import tracescope.model.TraceEvent;
import tracescope.model.TracePayload;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Wire form of a {@link TraceEvent}. Payload fields that do not apply to the event kind
 * are left unset and omitted from the encoding.
 */
public class EventMessage {
  private long sequence;
  private long timestamp;
  private String kind;
  private String agentId;
  private String text;
  private String toolName;
  private List<ArgumentMessage> arguments;
  private String result;
  private Boolean success;

  public EventMessage() {
  }

  public static EventMessage from(TraceEvent event) {
    EventMessage message = new EventMessage();
    message.sequence = event.getSequence();
    message.timestamp = event.getTimestamp();
    message.kind = event.getKind().name();
    message.agentId = event.getAgentId();

    TracePayload payload = event.getPayload();
    switch (event.getKind()) {
      case THINKING:
      case TEXT_OUTPUT:
        message.text = payload.getText();
        break;
      case TOOL_CALL:
        message.toolName = payload.getToolName();
        message.arguments = new ArrayList<>();
        for (Map.Entry<String, String> argument : payload.getArguments().entrySet()) {
          message.arguments.add(new ArgumentMessage(argument.getKey(), argument.getValue()));
        }
        break;
      case TOOL_RESULT:
        message.toolName = payload.getToolName();
        message.result = payload.getResult();
        message.success = payload.isSuccess();
        break;
    }
    return message;
  }

  public long getSequence() {
    return sequence;
  }

  public long getTimestamp() {
    return timestamp;
  }

  public String getKind() {
    return kind;
  }

  public String getAgentId() {
    return agentId;
  }

  public String getText() {
    return text;
  }

  public String getToolName() {
    return toolName;
  }

  public List<ArgumentMessage> getArguments() {
    return arguments;
  }

  public String getResult() {
    return result;
  }

  public Boolean getSuccess() {
    return success;
  }
}
