/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
*/

package org.semql.query.analysis;

import java.util.List;
import java.util.Set;

import org.semql.metadata.model.AggregationType;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * A question broken down into what to aggregate, what to group by and which time range.
 * All terms are lower-cased and stemmed; aggregation cue words are kept apart from them.
 */
public class AnalyzedQuestion {

    private final String question;
    private final List<String> terms;//content terms in question order, no duplicates
    private final Set<AggregationCue> cues;
    private final List<List<String>> metricClauses;
    private final List<List<String>> groupClauses;
    private final TimeWindow timeWindow;

    public AnalyzedQuestion(String question, List<String> terms, Set<AggregationCue> cues, List<List<String>> metricClauses, List<List<String>> groupClauses, TimeWindow timeWindow) {
        this.question = question;
        this.terms = ImmutableList.copyOf(terms);
        this.cues = ImmutableSet.copyOf(cues);
        this.metricClauses = copy(metricClauses);
        this.groupClauses = copy(groupClauses);
        this.timeWindow = timeWindow;
    }

    private static List<List<String>> copy(List<List<String>> clauses) {
        ImmutableList.Builder<List<String>> builder = ImmutableList.builder();
        for (List<String> clause : clauses) {
            builder.add(ImmutableList.copyOf(clause));
        }
        return builder.build();
    }

    public boolean isAggregation() {
        return !cues.isEmpty();
    }

    /**
     * True when some cue of the question hints at {@code type}, e.g. "average" at AVERAGE.
     */
    public boolean hintsAt(AggregationType type) {
        for (AggregationCue cue : cues) {
            if (cue.hints(type))
                return true;
        }
        return false;
    }

    public String getQuestion() {
        return question;
    }

    public List<String> getTerms() {
        return terms;
    }

    public Set<AggregationCue> getCues() {
        return cues;
    }

    public List<List<String>> getMetricClauses() {
        return metricClauses;
    }

    public List<List<String>> getGroupClauses() {
        return groupClauses;
    }

    public TimeWindow getTimeWindow() {
        return timeWindow;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("terms", terms).add("cues", cues).add("metrics", metricClauses).add("groups", groupClauses).add("time", timeWindow).toString();
    }
}
