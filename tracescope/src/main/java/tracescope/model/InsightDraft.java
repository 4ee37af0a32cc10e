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

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An insight as returned by the analysis function, before the critic has checked its
 * references and given it an identity.
 */
public final class InsightDraft {
  public final InsightCategory category;
  public final Severity severity;
  public final String message;
  public final ImmutableSortedSet<Long> relatedSequences;

  public InsightDraft(InsightCategory category,
                      Severity severity,
                      String message,
                      Iterable<Long> relatedSequences) {
    this.category = checkNotNull(category);
    this.severity = checkNotNull(severity);
    this.message = checkNotNull(message);
    this.relatedSequences = ImmutableSortedSet.copyOf(relatedSequences);
  }

  @Override
  public String toString() {
    return "InsightDraft{" +
        "category=" + category +
        ", severity=" + severity +
        ", message=" + message +
        ", relatedSequences=" + relatedSequences +
        '}';
  }
}
