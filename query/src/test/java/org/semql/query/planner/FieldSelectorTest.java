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
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.semql.grounding.GroundingSnapshot;
import org.semql.query.QueryFixtures;
import org.semql.query.analysis.QuestionAnalyzer;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class FieldSelectorTest {

    private final QuestionAnalyzer analyzer = new QuestionAnalyzer();
    private final FieldSelector selector = new FieldSelector();
    private GroundingSnapshot snapshot;

    @BeforeEach
    void setUp() throws Exception {
        snapshot = QueryFixtures.thelook();
    }

    @Test
    void cue_decides_between_equally_named_measures() throws Exception {
        assertEquals(Collections.singletonList("order_items.average_sale_price"), //
                selector.select(analyzer.analyze("average sale price"), snapshot.getIndex("order_items")));
        assertEquals(Collections.singletonList("order_items.total_sale_price"), //
                selector.select(analyzer.analyze("total sale price"), snapshot.getIndex("order_items")));
    }

    @Test
    void dimensions_come_before_measures_in_question_order() throws Exception {
        assertEquals(Arrays.asList("order_items.status", "products.category", "order_items.total_sale_price"), //
                selector.select(analyzer.analyze("total sale price by status and category"), snapshot.getIndex("order_items")));
    }

    @Test
    void description_matches_ground_a_dimension() throws Exception {
        assertEquals(Arrays.asList("users.traffic_source", "order_items.average_sale_price"), //
                selector.select(analyzer.analyze("average order value by device"), snapshot.getIndex("order_items")));
    }

    @Test
    void bare_count_cue_picks_the_base_view_count() throws Exception {
        assertEquals(Arrays.asList("users.state", "order_items.count"), //
                selector.select(analyzer.analyze("how many by state"), snapshot.getIndex("order_items")));
    }

    @Test
    void unmatched_grouping_is_ignored() throws Exception {
        assertEquals(Collections.singletonList("order_items.total_sale_price"), //
                selector.select(analyzer.analyze("total sale price by zodiac"), snapshot.getIndex("order_items")));
    }

    @Test
    void aggregation_without_matching_measure_is_refused() {
        PlanningException e = assertThrows(PlanningException.class, () -> selector.select(analyzer.analyze("average of customer names"), snapshot.getIndex("users")));

        assertEquals(FailureKind.NO_MEASURE_FOUND, e.getFailure().getKind());
    }

    @Test
    void measure_matching_only_the_entity_word_is_refused() {
        // "Mean age of users" mentions users, but nothing about names
        PlanningException e = assertThrows(PlanningException.class, () -> selector.select(analyzer.analyze("average of user names"), snapshot.getIndex("users")));

        assertEquals(FailureKind.NO_MEASURE_FOUND, e.getFailure().getKind());
    }

    @Test
    void every_requested_metric_needs_a_measure() {
        PlanningException e = assertThrows(PlanningException.class, () -> selector.select(analyzer.analyze("total sale price and average zodiac"), snapshot.getIndex("order_items")));

        assertEquals(FailureKind.NO_MEASURE_FOUND, e.getFailure().getKind());
    }

    @Test
    void plain_question_selects_the_best_field_per_clause() throws Exception {
        assertEquals(Arrays.asList("order_items.status", "products.category"), //
                selector.select(analyzer.analyze("status and category"), snapshot.getIndex("order_items")));
    }
}
