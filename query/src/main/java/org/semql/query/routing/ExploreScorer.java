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

package org.semql.query.routing;

import java.util.Collection;
import java.util.List;
import java.util.Set;

import org.semql.grounding.GroundedField;
import org.semql.grounding.GroundingIndex;
import org.semql.metadata.model.ExploreGraph;
import org.semql.metadata.model.JoinDesc;
import org.semql.query.planner.FieldScorer;

import com.google.common.collect.Sets;

/**
 * Scores an explore against question terms: for each term its best matching field,
 * summed over terms. Of equally good fields, the one needing fewer joins counts.
 */
public class ExploreScorer {

    public ExploreCandidate score(GroundingIndex index, List<String> terms) {
        ExploreGraph graph = index.getExplore();
        FieldScorer scorer = new FieldScorer();

        double total = 0;
        Set<String> views = Sets.newHashSet();
        for (String term : terms) {
            GroundedField best = null;
            double bestWeight = 0;
            int bestCost = 0;
            for (GroundedField field : candidatesFor(index, term)) {
                double weight = scorer.termWeight(field, term);
                if (weight <= 0 || weight < bestWeight)
                    continue;
                int cost = graph.getJoinPath(field.getReferencedViews()).size();
                if (weight > bestWeight || cost < bestCost) {
                    best = field;
                    bestWeight = weight;
                    bestCost = cost;
                }
            }
            if (best != null) {
                total += bestWeight;
                views.addAll(best.getReferencedViews());
            }
        }

        List<JoinDesc> path = graph.getJoinPath(views);
        int cost = path.size();
        for (JoinDesc join : graph.getJoins()) {
            if (join.isRequired() && !path.contains(join))
                cost++;
        }
        return new ExploreCandidate(index, total, cost);
    }

    // glossary hits always outweigh view-name matches, so the full scan is only needed without one
    private static Collection<GroundedField> candidatesFor(GroundingIndex index, String term) {
        List<GroundedField> hits = index.findByTerm(term);
        return hits.isEmpty() ? index.getFields() : hits;
    }
}
