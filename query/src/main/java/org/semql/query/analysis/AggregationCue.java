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

import java.util.Set;

import org.semql.metadata.model.AggregationType;

import com.google.common.collect.ImmutableSet;

/**
 * Words that make a question ask for an aggregate, with the aggregation they hint at.
 */
public enum AggregationCue {
    TOTAL(ImmutableSet.of(AggregationType.SUM, AggregationType.SUM_DISTINCT), "total", "sum"), //
    AVERAGE(ImmutableSet.of(AggregationType.AVERAGE), "average", "avg", "mean"), //
    COUNT(ImmutableSet.of(AggregationType.COUNT, AggregationType.COUNT_DISTINCT), "count", "number", "how many"), //
    MIN(ImmutableSet.of(AggregationType.MIN), "min", "minimum", "lowest"), //
    MAX(ImmutableSet.of(AggregationType.MAX), "max", "maximum", "highest"), //
    MEDIAN(ImmutableSet.of(AggregationType.MEDIAN), "median"), //
    RATIO(ImmutableSet.of(AggregationType.NUMBER), "rate", "growth", "percent", "percentage", "ratio");

    private final Set<AggregationType> hinted;
    private final Set<String> phrases;

    AggregationCue(Set<AggregationType> hinted, String... phrases) {
        this.hinted = hinted;
        this.phrases = ImmutableSet.copyOf(phrases);
    }

    public boolean hints(AggregationType type) {
        return type != null && hinted.contains(type);
    }

    /**
     * The cue a single word or a two-word phrase stands for, or null.
     */
    public static AggregationCue fromPhrase(String phrase) {
        for (AggregationCue cue : values()) {
            if (cue.phrases.contains(phrase))
                return cue;
        }
        return null;
    }
}
