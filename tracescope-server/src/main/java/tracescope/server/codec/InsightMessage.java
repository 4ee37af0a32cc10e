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

import tracescope.model.Insight;

import java.util.ArrayList;
import java.util.List;

public class InsightMessage {
  private long sequence;
  private String id;
  private String category;
  private String severity;
  private String message;
  private List<Long> relatedSequences;
  private long producedAt;

  public InsightMessage() {
  }

  public static InsightMessage from(Insight insight) {
    InsightMessage message = new InsightMessage();
    message.sequence = insight.getSequence();
    message.id = insight.getId();
    message.category = insight.getCategory().name();
    message.severity = insight.getSeverity().name();
    message.message = insight.getMessage();
    message.relatedSequences = new ArrayList<>(insight.getRelatedSequences());
    message.producedAt = insight.getProducedAt();
    return message;
  }

  public long getSequence() {
    return sequence;
  }

  public String getId() {
    return id;
  }

  public String getCategory() {
    return category;
  }

  public String getSeverity() {
    return severity;
  }

  public String getMessage() {
    return message;
  }

  public List<Long> getRelatedSequences() {
    return relatedSequences;
  }

  public long getProducedAt() {
    return producedAt;
  }
}
