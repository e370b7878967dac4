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

package org.semql.query.routing.rules;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.semql.query.routing.ExploreCandidate;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ExploreRankingRulesTest {

    private static ExploreCandidate candidate(String name, double score, int joins) {
        ExploreCandidate candidate = mock(ExploreCandidate.class);
        when(candidate.getName()).thenReturn(name);
        when(candidate.getScore()).thenReturn(score);
        when(candidate.getJoinCost()).thenReturn(joins);
        return candidate;
    }

    @Test
    void scores_within_epsilon_are_equal() {
        ScoreRule rule = new ScoreRule(0.25);

        assertEquals(0, rule.compare(candidate("a", 5.0, 0), candidate("b", 4.8, 0)));
        assertTrue(rule.compare(candidate("a", 5.0, 0), candidate("b", 4.0, 0)) < 0);
        assertTrue(rule.compare(candidate("a", 4.0, 0), candidate("b", 5.0, 0)) > 0);
    }

    @Test
    void fewer_joins_come_first() {
        assertTrue(new FewerJoinsRule().compare(candidate("a", 1, 0), candidate("b", 1, 2)) < 0);
    }

    @Test
    void name_orders_but_does_not_decide() {
        ExploreNameRule rule = new ExploreNameRule();

        assertTrue(rule.compare(candidate("alpha", 1, 0), candidate("beta", 1, 0)) < 0);
        assertFalse(rule.isDecisive());
        assertTrue(new DeclaredFirstRule().isDecisive());
    }
}
