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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.semql.grounding.GroundedField;
import org.semql.grounding.GroundingSnapshot;
import org.semql.query.QueryFixtures;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class RuleBasedQueryPlannerTest {

    private RuleBasedQueryPlanner planner;
    private GroundingSnapshot snapshot;

    @BeforeEach
    void setUp() throws Exception {
        planner = new RuleBasedQueryPlanner(QueryFixtures.config());
        snapshot = QueryFixtures.thelook();
    }

    @Test
    void plans_a_grouped_aggregate_through_one_join() {
        PlanResult result = planner.plan("average order value by device", snapshot);

        assertTrue(result.isSuccess());
        QueryPlan plan = result.getPlan();
        assertEquals("order_items", plan.getExplore());
        assertEquals("users.traffic_source", plan.getSelectedFields().get(0).getQualifiedName());
        assertEquals("order_items.average_sale_price", plan.getSelectedFields().get(1).getQualifiedName());
        assertEquals(1, plan.getJoinPath().size());
        assertEquals("users", plan.getJoinPath().get(0).getAlias());
        assertNull(plan.getLimit());
    }

    @Test
    void failures_are_returned_not_thrown() {
        PlanResult result = planner.plan("calculate the average of customer names", snapshot);

        assertFalse(result.isSuccess());
        assertEquals(FailureKind.NO_MEASURE_FOUND, result.getFailure().getKind());

        PlanResult nothing = planner.plan("", snapshot);
        assertEquals(FailureKind.NO_EXPLORE_MATCH, nothing.getFailure().getKind());
    }

    @Test
    void question_limit_is_not_the_plan_limit() {
        QueryPlan plan = planner.plan("total sale price limit 5000", snapshot).getPlan();

        assertEquals("order_items.total_sale_price", plan.getSelectedFields().get(0).getQualifiedName());
        assertNull(plan.getLimit());
    }

    @Test
    void time_window_becomes_a_filter() {
        QueryPlan plan = planner.plan("total sale price in the last 30 days", snapshot).getPlan();

        assertEquals(Arrays.asList("DATE_DIFF(CURRENT_DATE(), DATE(order_items.created_at), DAY) <= 30"), plan.getFilters());
        assertTrue(plan.getJoinPath().isEmpty());
    }

    @Test
    void selected_fields_stay_inside_the_index() {
        for (String question : Arrays.asList("how many users by state", "average retail price by distribution center name", "status and category", "total gross margin per brand")) {
            PlanResult result = planner.plan(question, snapshot);
            assertTrue(result.isSuccess(), question);
            for (GroundedField field : result.getPlan().getSelectedFields()) {
                assertEquals(field, snapshot.lookup(result.getPlan().getExplore(), field.getQualifiedName()));
            }
        }
    }

    @Test
    void same_question_gives_the_same_plan() {
        QueryPlan first = planner.plan("average retail price by distribution center name", snapshot).getPlan();
        QueryPlan second = planner.plan("average retail price by distribution center name", snapshot).getPlan();

        assertEquals(first.getSelectedFields(), second.getSelectedFields());
        assertEquals(first.getJoinPath().toString(), second.getJoinPath().toString());
        assertEquals(first.getFilters(), second.getFilters());
    }
}
