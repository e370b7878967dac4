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

import java.util.Collection;
import java.util.Map;

import org.semql.grounding.GroundedField;
import org.semql.grounding.TermUtil;

import com.google.common.collect.Maps;

/**
 * Weighs how well a field answers a set of question terms. A term counts once, at its
 * strongest match: field name, then description, then the name of the owning view.
 */
public class FieldScorer {

    public static final double NAME_WEIGHT = 3.0;
    public static final double DESCRIPTION_WEIGHT = 2.0;
    public static final double VIEW_WEIGHT = 1.0;

    private final Map<String, Collection<String>> viewTerms = Maps.newHashMap();

    public double termWeight(GroundedField field, String term) {
        if (field.getNameTerms().contains(term))
            return NAME_WEIGHT;
        if (field.getDescriptionTerms().contains(term))
            return DESCRIPTION_WEIGHT;
        if (viewTermsOf(field.getViewName()).contains(term))
            return VIEW_WEIGHT;
        return 0;
    }

    public double score(GroundedField field, Collection<String> terms) {
        double score = 0;
        for (String term : terms) {
            score += termWeight(field, term);
        }
        return score;
    }

    private Collection<String> viewTermsOf(String viewName) {
        Collection<String> terms = viewTerms.get(viewName);
        if (terms == null) {
            terms = TermUtil.nameTerms(viewName);
            viewTerms.put(viewName, terms);
        }
        return terms;
    }
}
