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

package org.semql.query.sql;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class LimitGuardrailTest {

    private final LimitGuardrail guardrail = new LimitGuardrail(100);

    @Test
    void existing_limit_is_kept_whatever_the_case() {
        assertEquals("SELECT 1\nlimit 5", guardrail.apply("SELECT 1\nlimit 5"));
        assertTrue(LimitGuardrail.hasLimit("SELECT 1 LIMIT   10"));
    }

    @Test
    void limit_inside_an_identifier_does_not_count() {
        assertFalse(LimitGuardrail.hasLimit("SELECT credit_limit FROM t"));
        assertFalse(LimitGuardrail.hasLimit("SELECT x AS nolimit FROM t"));
        assertEquals("SELECT credit_limit FROM t\nLIMIT 100", guardrail.apply("SELECT credit_limit FROM t"));
    }

    @Test
    void limit_inside_a_string_literal_does_not_count() {
        String sql = "SELECT\n  CASE WHEN tickets.p > 5 THEN 'NO LIMIT 5' ELSE 'LOW' END AS tickets_priority_label\nFROM tickets AS tickets";

        assertFalse(LimitGuardrail.hasLimit(sql));
        assertEquals(sql + "\nLIMIT 100", guardrail.apply(sql));
    }

    @Test
    void only_a_trailing_limit_counts() {
        assertFalse(LimitGuardrail.hasLimit("SELECT (SELECT MAX(id) FROM t LIMIT 1) AS m FROM u"));
        assertTrue(LimitGuardrail.hasLimit("SELECT id FROM u\nLIMIT 20;"));
    }

    @Test
    void default_limit_must_be_positive() {
        assertThrows(IllegalArgumentException.class, () -> new LimitGuardrail(0));
    }
}
