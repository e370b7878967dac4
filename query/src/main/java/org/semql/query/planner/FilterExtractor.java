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

import java.util.List;

import org.semql.grounding.GroundedField;
import org.semql.grounding.GroundingIndex;
import org.semql.metadata.model.ValueKind;
import org.semql.query.analysis.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a question's time window into a predicate on a DATE dimension. Best effort:
 * without a DATE dimension to bind to, the window is dropped.
 */
public class FilterExtractor {

    private static final Logger logger = LoggerFactory.getLogger(FilterExtractor.class);

    /**
     * Adds at most one filter to {@code request}, bound to the first selected DATE dimension,
     * else to the first DATE dimension of the base view.
     */
    public void extract(TimeWindow window, List<String> selected, GroundingIndex index, PlanRequest request) {
        if (window == null)
            return;

        GroundedField target = null;
        for (String name : selected) {
            GroundedField field = index.lookup(name);
            if (isDate(field)) {
                target = field;
                break;
            }
        }
        if (target == null) {
            String baseView = index.getExplore().getBaseView().getName();
            for (GroundedField field : index.getFields()) {
                if (isDate(field) && baseView.equals(field.getViewName())) {
                    target = field;
                    break;
                }
            }
        }
        if (target == null) {
            logger.warn("No date dimension in explore '" + index.getExploreName() + "' for '" + window + "', filter dropped");
            return;
        }

        request.addFilter(predicate(window, target.getResolvedExpression()), target.getQualifiedName());
    }

    static String predicate(TimeWindow window, String expression) {
        String unit = window.getUnit().name();
        if (!window.isCurrentPeriod())
            return "DATE_DIFF(CURRENT_DATE(), DATE(" + expression + "), " + unit + ") <= " + window.getAmount();
        if (window.getUnit() == TimeWindow.Unit.YEAR)
            return "EXTRACT(YEAR FROM " + expression + ") = EXTRACT(YEAR FROM CURRENT_DATE())";
        return "DATE_TRUNC(DATE(" + expression + "), " + unit + ") = DATE_TRUNC(CURRENT_DATE(), " + unit + ")";
    }

    private static boolean isDate(GroundedField field) {
        return field != null && !field.isMeasure() && field.getValueKind() == ValueKind.DATE;
    }
}
