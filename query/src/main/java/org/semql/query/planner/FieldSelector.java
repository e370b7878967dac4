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

package org.semql.query.planner;

import java.util.List;
import java.util.Set;

import org.semql.grounding.GroundedField;
import org.semql.grounding.GroundingIndex;
import org.semql.grounding.TermUtil;
import org.semql.metadata.model.ViewDesc;
import org.semql.query.analysis.AnalyzedQuestion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

/**
 * Picks the fields of one explore that answer a question.
 * <p>
 * An aggregation question gets one measure per metric clause and one dimension per
 * grouping clause; any other question gets the best field of each clause. A metric
 * clause no measure covers is refused rather than guessed. Ties go to the higher score,
 * then the preferred kind, then declaration order.
 */
public class FieldSelector {

    private static final Logger logger = LoggerFactory.getLogger(FieldSelector.class);

    // added when the measure's aggregation is what the question asks for
    public static final double CUE_BONUS = 1.0;

    /**
     * @return qualified field names, dimensions first, then measures
     */
    public List<String> select(AnalyzedQuestion question, GroundingIndex index) throws PlanningException {
        FieldScorer scorer = new FieldScorer();
        List<GroundedField> dimensions = Lists.newArrayList();
        List<GroundedField> measures = Lists.newArrayList();

        if (question.isAggregation()) {
            selectMeasures(question, index, scorer, measures);
            if (measures.isEmpty())
                throw new PlanningException(FailureKind.NO_MEASURE_FOUND, "No measure of explore '" + index.getExploreName() + "' matches " + question.getMetricClauses() + " for " + question.getCues());

            for (List<String> clause : question.getGroupClauses()) {
                GroundedField best = best(index, scorer, clause, Kind.DIMENSION, dimensions);
                if (best == null)
                    logger.warn("No dimension of explore '" + index.getExploreName() + "' matches grouping " + clause + ", ignored");
                else
                    dimensions.add(best);
            }
        } else {
            List<List<String>> clauses = Lists.newArrayList(question.getMetricClauses());
            clauses.addAll(question.getGroupClauses());
            for (List<String> clause : clauses) {
                GroundedField best = best(index, scorer, clause, Kind.ANY, concat(dimensions, measures));
                if (best == null)
                    continue;
                if (best.isMeasure())
                    measures.add(best);
                else
                    dimensions.add(best);
            }
            if (dimensions.isEmpty() && measures.isEmpty())
                throw new PlanningException(FailureKind.NO_EXPLORE_MATCH, "No field of explore '" + index.getExploreName() + "' matches " + question.getTerms());
        }

        List<String> names = Lists.newArrayList();
        for (GroundedField field : dimensions) {
            names.add(field.getQualifiedName());
        }
        for (GroundedField field : measures) {
            names.add(field.getQualifiedName());
        }
        logger.debug("Selected " + names + " from explore '" + index.getExploreName() + "'");
        return names;
    }

    private void selectMeasures(AnalyzedQuestion question, GroundingIndex index, FieldScorer scorer, List<GroundedField> measures) throws PlanningException {
        Set<String> entityTerms = entityTerms(index);
        for (List<String> clause : question.getMetricClauses()) {
            List<String> attributes = Lists.newArrayList();
            for (String term : clause) {
                if (!entityTerms.contains(term))
                    attributes.add(term);
            }

            GroundedField best = null;
            double bestScore = 0;
            for (GroundedField field : index.getFields()) {
                if (!field.isMeasure() || measures.contains(field) || !covers(scorer, field, attributes))
                    continue;
                double score = scorer.score(field, clause);
                if (score <= 0)
                    continue;
                if (question.hintsAt(field.getAggregationType()))
                    score += CUE_BONUS;
                if (score > bestScore) {
                    best = field;
                    bestScore = score;
                }
            }
            if (best == null)
                throw new PlanningException(FailureKind.NO_MEASURE_FOUND, "No measure of explore '" + index.getExploreName() + "' covers " + attributes + " of " + clause + " for " + question.getCues());
            measures.add(best);
        }

        // "how many" alone asks for the cued measure of the base view
        if (question.getMetricClauses().isEmpty()) {
            String baseView = index.getExplore().getBaseView().getName();
            for (GroundedField field : index.getFields()) {
                if (field.isMeasure() && baseView.equals(field.getViewName()) && question.hintsAt(field.getAggregationType())) {
                    measures.add(field);
                    break;
                }
            }
        }
    }

    // words naming the explore or one of its views, e.g. "user" or "order"
    private static Set<String> entityTerms(GroundingIndex index) {
        Set<String> terms = Sets.newHashSet(TermUtil.nameTerms(index.getExploreName()));
        for (ViewDesc view : index.getExplore().getViews()) {
            terms.addAll(TermUtil.nameTerms(view.getName()));
        }
        return terms;
    }

    /**
     * A measure answers a clause only if its name or description carries every term
     * that is not an entity word.
     */
    private static boolean covers(FieldScorer scorer, GroundedField field, List<String> attributes) {
        for (String term : attributes) {
            if (scorer.termWeight(field, term) < FieldScorer.DESCRIPTION_WEIGHT)
                return false;
        }
        return true;
    }

    private enum Kind {
        DIMENSION, ANY
    }

    private GroundedField best(GroundingIndex index, FieldScorer scorer, List<String> clause, Kind kind, List<GroundedField> taken) {
        GroundedField best = null;
        double bestScore = 0;
        for (GroundedField field : index.getFields()) {
            if ((kind == Kind.DIMENSION && field.isMeasure()) || taken.contains(field))
                continue;
            double score = scorer.score(field, clause);
            if (score <= 0)
                continue;
            // fields come in declaration order, so only a strictly better score or a dimension on a tie replaces
            if (score > bestScore || (score == bestScore && best.isMeasure() && !field.isMeasure())) {
                best = field;
                bestScore = score;
            }
        }
        return best;
    }

    private static List<GroundedField> concat(List<GroundedField> a, List<GroundedField> b) {
        List<GroundedField> all = Lists.newArrayList(a);
        all.addAll(b);
        return all;
    }
}
