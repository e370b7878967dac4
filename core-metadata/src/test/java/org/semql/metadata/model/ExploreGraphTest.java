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

package org.semql.metadata.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.semql.metadata.ModelFixtures.explore;
import static org.semql.metadata.ModelFixtures.join;
import static org.semql.metadata.ModelFixtures.view;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.semql.metadata.ModelAssembler;
import org.semql.metadata.ModelFixtures;

import com.google.common.collect.Lists;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ExploreGraphTest {

    private ExploreGraph orderItems;

    @BeforeEach
    void setUp() throws Exception {
        orderItems = ModelFixtures.thelook().getExplore("order_items");
    }

    @Test
    void base_view_needs_no_join() {
        assertTrue(orderItems.getJoinPath(Collections.singleton("order_items")).isEmpty());
    }

    @Test
    void join_path_contains_only_needed_joins() {
        List<JoinDesc> path = orderItems.getJoinPath(Arrays.asList("order_items", "users"));
        assertEquals(1, path.size());
        assertEquals("users", path.get(0).getViewName());
    }

    @Test
    void join_path_pulls_in_intermediate_views_in_topological_order() {
        List<JoinDesc> path = orderItems.getJoinPath(Collections.singleton("distribution_centers"));
        assertEquals(Arrays.asList("products", "distribution_centers"), names(path));
    }

    @Test
    void unknown_view_is_not_reachable() {
        assertThrows(IllegalArgumentException.class, () -> orderItems.getJoinPath(Collections.singleton("inventory")));
        assertNull(orderItems.getAlias("inventory"));
    }

    @Test
    void alias_is_the_normalized_view_name() {
        assertEquals("distribution_centers", orderItems.getAlias("Distribution-Centers"));
    }

    @Test
    void joins_declared_before_their_parent_are_reordered() {
        ViewDesc a = view("a", "db.a");
        ViewDesc b = view("b", "db.b");
        ViewDesc c = view("c", "db.c");
        // c hangs off b but is declared first
        ExploreDesc explore = explore("a", "a", join("c", "${b.id} = ${c.b_id}"), join("b", "${a.id} = ${b.a_id}"));

        ExploreGraph graph = new ModelAssembler().assemble(Lists.newArrayList(a, b, c), Lists.newArrayList(explore)).getExplore("a");
        assertEquals(Arrays.asList("b", "c"), names(graph.getJoins()));
        assertEquals(Arrays.asList("b", "c"), names(graph.getJoinPath(Collections.singleton("c"))));
    }

    @Test
    void finds_fields_by_qualified_name() {
        assertEquals("traffic_source", orderItems.findField("users.traffic_source").getName());
        assertNull(orderItems.findField("users.nothing"));
        assertNull(orderItems.findField("traffic_source"));
    }

    private static List<String> names(List<JoinDesc> joins) {
        List<String> names = Lists.newArrayList();
        for (JoinDesc join : joins) {
            names.add(join.getViewName());
        }
        return names;
    }
}
