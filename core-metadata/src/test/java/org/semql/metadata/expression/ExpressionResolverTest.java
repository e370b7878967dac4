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

package org.semql.metadata.expression;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.semql.metadata.ModelFixtures.dimension;
import static org.semql.metadata.ModelFixtures.explore;
import static org.semql.metadata.ModelFixtures.join;
import static org.semql.metadata.ModelFixtures.measure;
import static org.semql.metadata.ModelFixtures.view;

import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.semql.metadata.ModelAssembler;
import org.semql.metadata.ModelFixtures;
import org.semql.metadata.model.ExploreGraph;
import org.semql.metadata.model.MeasureDesc;
import org.semql.metadata.model.SemanticModel;
import org.semql.metadata.model.ViewDesc;

import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ExpressionResolverTest {

    private final ExpressionResolver resolver = new ExpressionResolver(5);
    private ExploreGraph orderItems;

    @BeforeEach
    void setUp() throws Exception {
        orderItems = ModelFixtures.thelook().getExplore("order_items");
    }

    @Test
    void table_placeholder_becomes_own_alias() {
        assertEquals("users.traffic_source", resolver.resolveField(orderItems, orderItems.findField("users.traffic_source")));
    }

    @Test
    void dimension_without_sql_defaults_to_its_column() {
        ViewDesc v = view("v", "db.v");
        dimension(v, "plain", "string", null);
        ExploreGraph graph = new ModelAssembler().assemble(Lists.newArrayList(v), Lists.newArrayList(explore("v", "v"))).getExplore("v");

        assertEquals("v.plain", resolver.resolveField(graph, graph.findField("v.plain")));
    }

    @Test
    void cross_view_references_are_parenthesized_when_complex() {
        Set<String> touched = Sets.newTreeSet();
        String sql = resolver.resolveField(orderItems, orderItems.findField("order_items.total_gross_margin"), touched);

        assertEquals("SUM((order_items.sale_price - products.cost))", sql);
        assertEquals(Sets.newTreeSet(Lists.newArrayList("order_items", "products")), touched);
    }

    @Test
    void measures_resolve_to_their_aggregate_form() {
        assertEquals("AVG(order_items.sale_price)", resolver.resolveField(orderItems, orderItems.findField("order_items.average_sale_price")));
        assertEquals("COUNT(*)", resolver.resolveAggregate(orderItems, (MeasureDesc) orderItems.findField("users.count")));
    }

    @Test
    void measure_references_inside_measures_use_the_aggregate() {
        ViewDesc v = view("v", "db.v");
        dimension(v, "amount", "number", null);
        measure(v, "total", "sum", "${amount}");
        measure(v, "count", "count", null);
        measure(v, "avg_amount", "number", "${total} / NULLIF(${count}, 0)");
        ExploreGraph graph = new ModelAssembler().assemble(Lists.newArrayList(v), Lists.newArrayList(explore("v", "v"))).getExplore("v");

        assertEquals("SUM(v.amount) / NULLIF(COUNT(*), 0)", resolver.resolveField(graph, graph.findField("v.avg_amount")));
    }

    @Test
    void join_condition_resolves_against_explore_aliases() {
        assertEquals("order_items.user_id = users.id", resolver.resolve(orderItems, "users", orderItems.getJoin("users").getSqlOn()));
    }

    @Test
    void resolved_text_passes_through_unchanged() {
        String once = resolver.resolveField(orderItems, orderItems.findField("order_items.gross_margin"));
        assertEquals(once, resolver.resolve(orderItems, "order_items", once));
        assertEquals("CASE WHEN 1 = 1 THEN 'a' END", resolver.resolve(orderItems, "order_items", "CASE WHEN 1 = 1 THEN 'a' END"));
    }

    @Test
    void cyclic_reference_fails() {
        ViewDesc v = view("v", "db.v");
        dimension(v, "a", "number", "${b} + 1");
        dimension(v, "b", "number", "${a} + 1");
        ExploreGraph graph = new ModelAssembler().assemble(Lists.newArrayList(v), Lists.newArrayList(explore("v", "v"))).getExplore("v");

        ExpressionException e = assertThrows(ExpressionException.class, () -> resolver.resolveField(graph, graph.findField("v.a")));
        assertTrue(e.getMessage().contains("v.a -> v.b -> v.a"), e.getMessage());
    }

    @Test
    void reference_chain_deeper_than_bound_fails() {
        ViewDesc v = view("v", "db.v");
        dimension(v, "d0", "number", null);
        for (int i = 1; i <= 4; i++) {
            dimension(v, "d" + i, "number", "${d" + (i - 1) + "} + 1");
        }
        ExploreGraph graph = new ModelAssembler().assemble(Lists.newArrayList(v), Lists.newArrayList(explore("v", "v"))).getExplore("v");

        ExpressionResolver shallow = new ExpressionResolver(3);
        assertEquals("(((v.d0 + 1) + 1) + 1) + 1", new ExpressionResolver(5).resolveField(graph, graph.findField("v.d4")));
        assertThrows(ExpressionException.class, () -> shallow.resolveField(graph, graph.findField("v.d4")));
    }

    @Test
    void unknown_field_or_view_fails() {
        ViewDesc v = view("v", "db.v");
        ViewDesc w = view("w", "db.w");
        dimension(v, "bad_field", "number", "${nope}");
        dimension(v, "bad_view", "number", "${w.x}");
        SemanticModel model = new ModelAssembler().assemble(Lists.newArrayList(v, w), Lists.newArrayList(explore("v", "v")));
        ExploreGraph graph = model.getExplore("v");

        assertThrows(ExpressionException.class, () -> resolver.resolveField(graph, graph.findField("v.bad_field")));
        ExpressionException e = assertThrows(ExpressionException.class, () -> resolver.resolveField(graph, graph.findField("v.bad_view")));
        assertTrue(e.getMessage().contains("not part of explore 'v'"), e.getMessage());
    }

    @Test
    void measure_without_sql_other_than_count_fails() {
        ViewDesc v = view("v", "db.v");
        measure(v, "total", "sum", null);
        ExploreGraph graph = new ModelAssembler().assemble(Lists.newArrayList(v), Lists.newArrayList(explore("v", "v"))).getExplore("v");

        assertThrows(ExpressionException.class, () -> resolver.resolveField(graph, graph.findField("v.total")));
    }

    @Test
    void wraps_only_complex_substitutions() {
        assertEquals("users.id", ExpressionResolver.wrapIfComplex("users.id"));
        assertEquals("SUM(x.a)", ExpressionResolver.wrapIfComplex("SUM(x.a)"));
        assertEquals("(a + b)", ExpressionResolver.wrapIfComplex("(a + b)"));
        assertEquals("(SUM(a) / SUM(b))", ExpressionResolver.wrapIfComplex("SUM(a) / SUM(b)"));
        assertEquals("(x.a + 1)", ExpressionResolver.wrapIfComplex("x.a + 1"));
    }
}
