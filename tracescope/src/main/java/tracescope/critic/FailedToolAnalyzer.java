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

package tracescope.critic;

import tracescope.interfaces.critic.TraceAnalyzer;
import tracescope.model.EventKind;
import tracescope.model.InsightCategory;
import tracescope.model.InsightDraft;
import tracescope.model.Severity;
import tracescope.model.TraceEvent;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/**
 * A local analyzer that needs no model: every failed tool result becomes an error insight,
 * and each batch gets a summary of its tool activity.
 */
public class FailedToolAnalyzer implements TraceAnalyzer {
  private static final int MAX_RESULT_LENGTH = 200;

  @Override
  public List<InsightDraft> analyze(List<TraceEvent> batch) {
    ImmutableList.Builder<InsightDraft> drafts = ImmutableList.builder();
    List<Long> sequences = new ArrayList<>(batch.size());
    int toolCalls = 0;
    int failures = 0;

    for (TraceEvent event : batch) {
      sequences.add(event.getSequence());
      if (event.getKind() == EventKind.TOOL_CALL) {
        toolCalls++;
      }
      if (event.isFailedToolResult()) {
        failures++;
        drafts.add(new InsightDraft(
            InsightCategory.ERROR,
            Severity.WARNING,
            "Tool " + event.getPayload().getToolName() + " failed: " + abbreviate(event.getPayload().getResult()),
            ImmutableList.of(event.getSequence())));
      }
    }

    if (!batch.isEmpty()) {
      drafts.add(new InsightDraft(
          InsightCategory.SUMMARY,
          failures > 0 ? Severity.WARNING : Severity.INFO,
          batch.size() + " events, " + toolCalls + " tool calls, " + failures + " failed",
          sequences));
    }
    return drafts.build();
  }

  private static String abbreviate(String result) {
    if (result == null || result.isEmpty()) {
      return "(no output)";
    }
    if (result.length() <= MAX_RESULT_LENGTH) {
      return result;
    }
    return result.substring(0, MAX_RESULT_LENGTH - 3) + "...";
  }
}
