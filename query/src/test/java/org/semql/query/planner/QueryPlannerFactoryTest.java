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

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.semql.common.SemqlConfig;
import org.semql.grounding.GroundingSnapshot;
import org.semql.query.QueryFixtures;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class QueryPlannerFactoryTest {

    public static class NoMatchPlanner implements IQueryPlanner {
        @Override
        public PlanResult plan(String question, GroundingSnapshot snapshot) {
            return PlanResult.failure(new PlanningFailure(FailureKind.NO_EXPLORE_MATCH, "never"));
        }
    }

    @Test
    void default_planner_is_rule_based() {
        assertTrue(QueryPlannerFactory.createPlanner(QueryFixtures.config()) instanceof RuleBasedQueryPlanner);
    }

    @Test
    void planner_class_comes_from_config() {
        SemqlConfig config = QueryFixtures.config();
        config.setProperty("semql.query.planner", NoMatchPlanner.class.getName());

        assertTrue(QueryPlannerFactory.createPlanner(config) instanceof NoMatchPlanner);
    }

    @Test
    void unknown_planner_class_fails() {
        SemqlConfig config = QueryFixtures.config();
        config.setProperty("semql.query.planner", "org.semql.query.planner.NoSuchPlanner");

        assertThrows(IllegalArgumentException.class, () -> QueryPlannerFactory.createPlanner(config));
    }
}
