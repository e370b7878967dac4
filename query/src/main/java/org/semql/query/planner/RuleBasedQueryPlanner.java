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

import org.semql.common.SemqlConfig;
import org.semql.grounding.GroundingIndex;
import org.semql.grounding.GroundingSnapshot;
import org.semql.metadata.expression.ExpressionResolver;
import org.semql.query.analysis.AnalyzedQuestion;
import org.semql.query.analysis.QuestionAnalyzer;
import org.semql.query.routing.ExploreCandidate;
import org.semql.query.routing.ExploreRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plans by keyword matching: routes to an explore, selects fields, adds a time filter,
 * then assembles the plan through the index.
 */
public class RuleBasedQueryPlanner implements IQueryPlanner {

    private static final Logger logger = LoggerFactory.getLogger(RuleBasedQueryPlanner.class);

    private final QuestionAnalyzer analyzer = new QuestionAnalyzer();
    private final FieldSelector selector = new FieldSelector();
    private final FilterExtractor filterExtractor = new FilterExtractor();
    private final ExploreRouter router;
    private final PlanAssembler assembler;

    public RuleBasedQueryPlanner() {
        this(SemqlConfig.getInstanceFromEnv());
    }

    public RuleBasedQueryPlanner(SemqlConfig config) {
        this.router = new ExploreRouter(config.getAmbiguityEpsilon());
        this.assembler = new PlanAssembler(new ExpressionResolver(config.getExpressionMaxDepth()), config.getMaxJoins());
    }

    @Override
    public PlanResult plan(String question, GroundingSnapshot snapshot) {
        try {
            AnalyzedQuestion analyzed = analyzer.analyze(question);
            ExploreCandidate candidate = router.route(analyzed, snapshot);
            GroundingIndex index = candidate.getIndex();

            List<String> fields = selector.select(analyzed, index);
            PlanRequest request = new PlanRequest(index.getExploreName());
            for (String field : fields) {
                request.addField(field);
            }
            filterExtractor.extract(analyzed.getTimeWindow(), fields, index, request);

            QueryPlan plan = assembler.assemble(index, request);
            logger.info("Planned '" + question + "': " + plan);
            return PlanResult.success(plan);
        } catch (PlanningException e) {
            logger.info("Cannot plan '" + question + "': " + e.getMessage());
            return PlanResult.failure(e.getFailure());
        }
    }
}
