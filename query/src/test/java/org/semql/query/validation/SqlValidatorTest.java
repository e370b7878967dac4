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

package org.semql.query.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.semql.metadata.expression.ExpressionResolver;
import org.semql.query.QueryFixtures;
import org.semql.query.planner.PlanAssembler;
import org.semql.query.planner.PlanRequest;
import org.semql.query.planner.QueryPlan;
import org.semql.query.sql.SqlGenerator;

@ExtendWith(MockitoExtension.class)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SqlValidatorTest {

    @Mock
    private IDryRunClient dryRunClient;

    private QueryPlan plan;
    private String sql;

    @BeforeEach
    void setUp() throws Exception {
        plan = new PlanAssembler(new ExpressionResolver(5), 10).assemble(QueryFixtures.thelook().getIndex("order_items"), //
                new PlanRequest("order_items").addField("users.traffic_source").addField("order_items.average_sale_price"));
        sql = new SqlGenerator(QueryFixtures.config()).generate(plan);
    }

    @Test
    void generated_sql_passes_and_is_dry_run() throws Exception {
        ValidationResult result = new SqlValidator(dryRunClient, true).validate(sql, plan);

        assertTrue(result.isValid());
        assertSame(sql, result.getSql());
        verify(dryRunClient).dryRun(sql);
    }

    @Test
    void dry_run_is_skipped_when_disabled() throws Exception {
        assertTrue(new SqlValidator(dryRunClient, false).validate(sql, plan).isValid());
        verify(dryRunClient, never()).dryRun(sql);
    }

    @Test
    void dry_run_error_is_tagged_and_sql_kept() throws Exception {
        doThrow(new DryRunException("Not found: Table thelook_ecommerce.order_items was not found in location US")).when(dryRunClient).dryRun(sql);

        ValidationResult result = new SqlValidator(dryRunClient, true).validate(sql, plan);

        assertFalse(result.isValid());
        assertEquals(ValidationTag.MISSING_TABLE, result.getTag());
        assertSame(sql, result.getSql());
    }

    @Test
    void two_limits_violate() {
        ValidationResult result = new SqlValidator(null, false).validate(sql + "\nLIMIT 5", plan);

        assertEquals(ValidationTag.LIMIT_VIOLATION, result.getTag());
    }

    @Test
    void limit_must_be_last() {
        String moved = sql.replace("\nLIMIT 100", "").replace("GROUP BY 1", "LIMIT 100\nGROUP BY 1");

        assertEquals(ValidationTag.LIMIT_VIOLATION, new SqlValidator(null, false).validate(moved, plan).getTag());
    }

    @Test
    void comments_are_rejected_but_not_inside_literals() {
        SqlValidator validator = new SqlValidator(null, false);

        assertEquals(ValidationTag.COMMENT_PRESENT, validator.validate(sql.replace("SELECT", "SELECT -- hi\n"), plan).getTag());
        assertEquals(ValidationTag.COMMENT_PRESENT, validator.validate(sql.replace("SELECT", "SELECT /* hi */"), plan).getTag());
        assertTrue(validator.validate(sql.replace("SELECT\n", "SELECT\n  '--not a comment' AS x,\n"), plan).isValid());
    }

    @Test
    void aliases_outside_the_join_path_are_rejected() {
        ValidationResult result = new SqlValidator(null, false).validate(sql.replace("users.traffic_source AS", "products.brand AS"), plan);

        assertEquals(ValidationTag.UNKNOWN_ALIAS, result.getTag());
    }

    @Test
    void qualified_function_names_are_not_aliases() {
        assertTrue(new SqlValidator(null, false).validate(sql.replace("AVG(", "SAFE.AVG("), plan).isValid());
    }
}
