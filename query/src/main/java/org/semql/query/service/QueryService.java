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

package org.semql.query.service;

import org.semql.common.SemqlConfig;
import org.semql.grounding.GroundingIndexManager;
import org.semql.grounding.GroundingSnapshot;
import org.semql.query.planner.IQueryPlanner;
import org.semql.query.planner.PlanResult;
import org.semql.query.planner.QueryPlannerFactory;
import org.semql.query.sql.LimitGuardrail;
import org.semql.query.sql.SqlGenerator;
import org.semql.query.validation.IDryRunClient;
import org.semql.query.validation.SqlValidator;
import org.semql.query.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Question in, guarded SQL out: plans against the current grounding snapshot,
 * renders, applies the limit guardrail and validates.
 */
public class QueryService {

    private static final Logger logger = LoggerFactory.getLogger(QueryService.class);

    private final GroundingIndexManager indexManager;
    private final IQueryPlanner planner;
    private final SqlGenerator generator;
    private final SqlValidator validator;

    public QueryService(SemqlConfig config, GroundingIndexManager indexManager, IDryRunClient dryRunClient) {
        this(indexManager, QueryPlannerFactory.createPlanner(config), new SqlGenerator(config), new SqlValidator(config, dryRunClient));
    }

    public QueryService(GroundingIndexManager indexManager, IQueryPlanner planner, SqlGenerator generator, SqlValidator validator) {
        this.indexManager = indexManager;
        this.planner = planner;
        this.generator = generator;
        this.validator = validator;
    }

    /**
     * @throws IllegalStateException if the index manager has not been refreshed from a catalog yet
     */
    public QueryResult generate(String question) {
        GroundingSnapshot snapshot = indexManager.getSnapshot();
        PlanResult result = planner.plan(question, snapshot);
        if (!result.isSuccess())
            return QueryResult.failure(result.getFailure());

        String rendered = generator.render(result.getPlan());
        boolean limitApplied = !LimitGuardrail.hasLimit(rendered);
        String sql = generator.getGuardrail().apply(rendered);

        ValidationResult validation = validator.validate(sql, result.getPlan());
        logger.info("Generated SQL for '" + question + "' through explore " + result.getPlan().getExplore() + (validation.isValid() ? "" : ", " + validation));
        return QueryResult.success(sql, result.getPlan(), limitApplied, validation);
    }
}
