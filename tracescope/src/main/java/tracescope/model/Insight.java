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

import com.google.common.collect.ImmutableSortedSet;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An observation produced by the critic about a batch of trace events. Every sequence in
 * {@link #getRelatedSequences()} refers to an event of that batch.
 * <p/>
 * The publish {@link #getSequence() sequence} is 0 until the insight publisher stamps it.
 */
public final class Insight {
  private final String id;
  private final long sequence;
  private final InsightCategory category;
  private final Severity severity;
  private final String message;
  private final ImmutableSortedSet<Long> relatedSequences;
  private final long producedAt;

  public Insight(String id,
                 long sequence,
                 InsightCategory category,
                 Severity severity,
                 String message,
                 Iterable<Long> relatedSequences,
                 long producedAt) {
    checkArgument(sequence >= 0);
    this.id = checkNotNull(id);
    this.sequence = sequence;
    this.category = checkNotNull(category);
    this.severity = checkNotNull(severity);
    this.message = checkNotNull(message);
    this.relatedSequences = ImmutableSortedSet.copyOf(relatedSequences);
    this.producedAt = producedAt;
  }

  public Insight withSequence(long newSequence) {
    return new Insight(id, newSequence, category, severity, message, relatedSequences, producedAt);
  }

  public String getId() {
    return id;
  }

  public long getSequence() {
    return sequence;
  }

  public InsightCategory getCategory() {
    return category;
  }

  public Severity getSeverity() {
    return severity;
  }

  public String getMessage() {
    return message;
  }

  public ImmutableSortedSet<Long> getRelatedSequences() {
    return relatedSequences;
  }

  public long getProducedAt() {
    return producedAt;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    Insight insight = (Insight) o;

    return sequence == insight.sequence
        && producedAt == insight.producedAt
        && id.equals(insight.id)
        && category == insight.category
        && severity == insight.severity
        && message.equals(insight.message)
        && relatedSequences.equals(insight.relatedSequences);
  }

  @Override
  public int hashCode() {
    int result = id.hashCode();
    result = 31 * result + (int) (sequence ^ (sequence >>> 32));
    return result;
  }

  @Override
  public String toString() {
    return "Insight{" +
        "id=" + id +
        ", sequence=" + sequence +
        ", category=" + category +
        ", severity=" + severity +
        ", message=" + message +
        ", relatedSequences=" + relatedSequences +
        ", producedAt=" + producedAt +
        '}';
  }
}
