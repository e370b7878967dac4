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

package org.semql.grounding;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.semql.metadata.JsonModelReader;
import org.semql.metadata.ModelAssembler;
import org.semql.metadata.catalog.CatalogSnapshot;
import org.semql.metadata.catalog.JsonCatalogReader;
import org.semql.metadata.expression.ExpressionResolver;
import org.semql.metadata.model.AggregationType;
import org.semql.metadata.model.DimensionDesc;
import org.semql.metadata.model.ExploreDesc;
import org.semql.metadata.model.SemanticModel;
import org.semql.metadata.model.ValueKind;
import org.semql.metadata.model.ViewDesc;

import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class GroundingIndexBuilderTest {

    private SemanticModel model;
    private GroundingIndexBuilder builder;

    @BeforeEach
    void setUp() throws Exception {
        model = new ModelAssembler().assemble(JsonModelReader.readResource("thelook_model.json"));
        CatalogSnapshot catalog = JsonCatalogReader.readResource("thelook_catalog.json");
        builder = new GroundingIndexBuilder(catalog, new ExpressionResolver(5));
    }

    @Test
    void indexes_every_visible_field_of_every_view_in_the_explore() {
        GroundingIndex index = builder.build(model.getExplore("order_items"));

        assertEquals("users.traffic_source", index.lookup("users.traffic_source").getQualifiedName());
        assertEquals("distribution_centers.name", index.lookup("distribution_centers.name").getQualifiedName());
        assertEquals("order_items", index.getExploreName());
        assertTrue(index.getExcludedFields().isEmpty());
    }

    @Test
    void hidden_and_unknown_fields_are_not_found() {
        GroundingIndex index = builder.build(model.getExplore("order_items"));

        assertNull(index.lookup("order_items.user_id"));
        assertNull(index.lookup("distribution_centers.latitude"));
        assertNull(index.lookup("users.shoe_size"));
        assertNull(index.lookup(null));
    }

    @Test
    void fields_outside_the_explore_are_not_indexed() {
        GroundingIndex index = builder.build(model.getExplore("users"));

        assertNull(index.lookup("order_items.count"));
        for (GroundedField field : index.getFields()) {
            assertEquals("users", field.getViewName());
        }
    }

    @Test
    void merges_catalog_type_and_description() {
        GroundingIndex index = builder.build(model.getExplore("order_items"));

        GroundedField source = index.lookup("users.traffic_source");
        assertEquals("users.traffic_source", source.getResolvedExpression());
        assertEquals("STRING", source.getPhysicalType());
        assertEquals("Marketing channel or device the user signed up through", source.getDescription());
        assertEquals(ValueKind.STRING, source.getValueKind());

        // semantic description wins
        GroundedField avg = index.lookup("order_items.average_sale_price");
        assertEquals("Average order value, the mean sale price per item", avg.getDescription());
        assertEquals("FLOAT64", avg.getPhysicalType());
        assertEquals("AVG(order_items.sale_price)", avg.getResolvedExpression());
        assertEquals(AggregationType.AVERAGE, avg.getAggregationType());
        assertTrue(avg.isMeasure());

        assertEquals("INT64", index.lookup("order_items.count").getPhysicalType());
        assertEquals("", index.lookup("users.email").getDescription());
        assertNull(index.lookup("order_items.gross_margin").getPhysicalType());
    }

    @Test
    void records_every_view_an_expression_touches() {
        GroundingIndex index = builder.build(model.getExplore("order_items"));

        assertEquals(Sets.newHashSet("order_items", "products"), index.lookup("order_items.gross_margin").getReferencedViews());
        assertEquals(Sets.newHashSet("order_items"), index.lookup("order_items.count").getReferencedViews());
    }

    @Test
    void glossary_maps_name_tokens_and_description_keywords() {
        GroundingIndex index = builder.build(model.getExplore("order_items"));

        assertTrue(index.findByTerm("device").contains(index.lookup("users.traffic_source")));
        assertTrue(index.findByTerm("source").contains(index.lookup("users.traffic_source")));
        assertTrue(index.findByTerm("warehouse").contains(index.lookup("distribution_centers.name")));
        assertTrue(index.findByTerm("nothing").isEmpty());
    }

    @Test
    void unresolvable_fields_are_excluded_not_fatal() {
        ViewDesc v = new ViewDesc();
        v.setName("v");
        v.setSqlTableName("db.v");
        DimensionDesc good = new DimensionDesc();
        good.setName("good");
        DimensionDesc bad = new DimensionDesc();
        bad.setName("bad");
        bad.setSql("${missing} + 1");
        v.getDimensions().add(good);
        v.getDimensions().add(bad);
        ExploreDesc explore = new ExploreDesc();
        explore.setName("v");
        SemanticModel small = new ModelAssembler().assemble(Lists.newArrayList(v), Lists.newArrayList(explore));

        GroundingIndex index = builder.build(small.getExplore("v"));
        assertEquals(1, index.size());
        assertFalse(index.getFields().isEmpty());
        assertNull(index.lookup("v.bad"));
        assertEquals(Sets.newHashSet("v.bad"), index.getExcludedFields());
    }
}
