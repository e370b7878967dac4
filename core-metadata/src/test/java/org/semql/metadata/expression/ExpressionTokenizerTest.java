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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.semql.metadata.expression.ExpressionToken.Kind;

import com.google.common.collect.Lists;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ExpressionTokenizerTest {

    @Test
    void splits_literals_and_placeholders() {
        List<ExpressionToken> tokens = ExpressionTokenizer.tokenize("${TABLE}.sale_price - ${products.cost} * ${rate}");

        assertEquals(Arrays.asList(Kind.TABLE_REF, Kind.LITERAL, Kind.FIELD_REF, Kind.LITERAL, Kind.FIELD_REF), kinds(tokens));
        assertEquals(".sale_price - ", tokens.get(1).getText());
        assertEquals("products", tokens.get(2).getViewName());
        assertEquals("cost", tokens.get(2).getFieldName());
        assertNull(tokens.get(4).getViewName());
        assertEquals("rate", tokens.get(4).getFieldName());
    }

    @Test
    void plain_text_is_one_literal() {
        List<ExpressionToken> tokens = ExpressionTokenizer.tokenize("CASE WHEN x > 1 THEN 'a' END");
        assertEquals(1, tokens.size());
        assertEquals(Kind.LITERAL, tokens.get(0).getKind());
        assertFalse(ExpressionTokenizer.hasPlaceholders("CASE WHEN x > 1 THEN 'a' END"));
    }

    @Test
    void collects_referenced_views_once() {
        assertEquals(Lists.newArrayList("order_items", "users"),
                Lists.newArrayList(ExpressionTokenizer.referencedViews("${order_items.user_id} = ${users.id} AND ${users.age} > ${TABLE}.x")));
    }

    @Test
    void rejects_empty_placeholder() {
        assertThrows(ExpressionException.class, () -> ExpressionTokenizer.tokenize("${} + 1"));
        assertThrows(ExpressionException.class, () -> ExpressionTokenizer.tokenize("${users.}"));
    }

    private static List<Kind> kinds(List<ExpressionToken> tokens) {
        List<Kind> kinds = Lists.newArrayList();
        for (ExpressionToken token : tokens) {
            kinds.add(token.getKind());
        }
        return kinds;
    }
}
