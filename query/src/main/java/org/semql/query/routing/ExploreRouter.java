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

import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.semql.grounding.GroundingIndex;
import org.semql.grounding.GroundingSnapshot;
import org.semql.query.analysis.AnalyzedQuestion;
import org.semql.query.planner.FailureKind;
import org.semql.query.planner.PlanningException;
import org.semql.query.planner.PlanningFailure;
import org.semql.query.routing.rules.DeclaredFirstRule;
import org.semql.query.routing.rules.ExploreNameRule;
import org.semql.query.routing.rules.FewerJoinsRule;
import org.semql.query.routing.rules.ScoreRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

/**
 * Chooses the explore that answers a question.
 * <p>
 * Candidates are scored, then ordered by the ranking rules. Only candidates whose score is
 * within epsilon of the best compete on the later rules.
 */
public class ExploreRouter {

    private static final Logger logger = LoggerFactory.getLogger(ExploreRouter.class);

    private final List<ExploreRankingRule> rules = Lists.newLinkedList();
    private final ExploreScorer scorer = new ExploreScorer();
    private final double epsilon;

    public ExploreRouter(double epsilon) {
        this.epsilon = epsilon;
        rules.add(new ScoreRule(epsilon));
        rules.add(new FewerJoinsRule());
        rules.add(new DeclaredFirstRule());
        rules.add(new ExploreNameRule());
    }

    /**
     * @param applyOrder rules apply in order, a rule only breaks the ties of those before it
     */
    public void registerRule(ExploreRankingRule rule, int applyOrder) {
        if (applyOrder > rules.size()) {
            logger.warn("apply order " + applyOrder + " is larger than rules size " + rules.size() + ", will put the new rule at the end");
            rules.add(rule);
            return;
        }
        rules.add(applyOrder, rule);
    }

    public void removeRule(Class<? extends ExploreRankingRule> ruleClass) {
        for (Iterator<ExploreRankingRule> iter = rules.iterator(); iter.hasNext();) {
            if (iter.next().getClass() == ruleClass)
                iter.remove();
        }
    }

    public List<ExploreRankingRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    public ExploreCandidate route(AnalyzedQuestion question, GroundingSnapshot snapshot) throws PlanningException {
        List<ExploreCandidate> candidates = rank(question, snapshot);
        if (candidates.isEmpty() || candidates.get(0).getScore() <= 0)
            throw new PlanningException(new PlanningFailure(FailureKind.NO_EXPLORE_MATCH, "No explore matches " + question.getTerms(), scores(candidates), null));

        ExploreCandidate first = candidates.get(0);
        if (candidates.size() > 1) {
            ExploreCandidate second = candidates.get(1);
            if (second.getScore() > 0 && tiedOnDecisiveRules(first, second)) {
                throw new PlanningException(new PlanningFailure(FailureKind.AMBIGUOUS_INTENT, //
                        "Explores '" + first.getName() + "' and '" + second.getName() + "' answer the question equally well", scores(candidates), null));
            }
        }

        logger.info("Routed question '" + question.getQuestion() + "' to explore " + first);
        return first;
    }

    /**
     * All visible explores, best first.
     */
    public List<ExploreCandidate> rank(AnalyzedQuestion question, GroundingSnapshot snapshot) {
        List<ExploreCandidate> candidates = Lists.newArrayList();
        for (GroundingIndex index : snapshot.getIndexes()) {
            if (index.getExplore().getExplore().isHidden())
                continue;
            ExploreCandidate candidate = scorer.score(index, question.getTerms());
            logger.debug("Explore " + candidate);
            candidates.add(candidate);
        }

        Collections.sort(candidates, new Comparator<ExploreCandidate>() {
            @Override
            public int compare(ExploreCandidate a, ExploreCandidate b) {
                return Double.compare(b.getScore(), a.getScore());
            }
        });
        if (candidates.isEmpty())
            return candidates;

        // the head within epsilon of the best score is settled by the rules
        double top = candidates.get(0).getScore();
        int tied = 0;
        while (tied < candidates.size() && top - candidates.get(tied).getScore() <= epsilon) {
            tied++;
        }
        List<ExploreCandidate> head = Lists.newArrayList(candidates.subList(0, tied));
        String before = head.toString();
        Collections.sort(head, new Comparator<ExploreCandidate>() {
            @Override
            public int compare(ExploreCandidate a, ExploreCandidate b) {
                for (ExploreRankingRule rule : rules) {
                    int c = rule.compare(a, b);
                    if (c != 0)
                        return c;
                }
                return 0;
            }
        });
        if (tied > 1)
            logger.debug("Applying rules " + rules + ", candidates before: " + before + ", after: " + head);

        List<ExploreCandidate> ranked = Lists.newArrayList(head);
        ranked.addAll(candidates.subList(tied, candidates.size()));
        return ranked;
    }

    private boolean tiedOnDecisiveRules(ExploreCandidate a, ExploreCandidate b) {
        for (ExploreRankingRule rule : rules) {
            if (rule.isDecisive() && rule.compare(a, b) != 0)
                return false;
        }
        return true;
    }

    private static Map<String, Double> scores(List<ExploreCandidate> candidates) {
        Map<String, Double> scores = new LinkedHashMap<String, Double>();
        for (ExploreCandidate candidate : candidates) {
            scores.put(candidate.getName(), candidate.getScore());
        }
        return scores;
    }
}
