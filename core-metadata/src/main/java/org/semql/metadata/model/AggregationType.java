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

import java.util.Locale;

/**
 * How a measure's expression is aggregated in the SELECT list.
 */
public enum AggregationType {
    COUNT("COUNT"), //
    COUNT_DISTINCT("COUNT"), //
    SUM("SUM"), //
    SUM_DISTINCT("SUM"), //
    AVERAGE("AVG"), //
    MIN("MIN"), //
    MAX("MAX"), //
    MEDIAN("APPROX_QUANTILES"), //
    NUMBER(null); // expression is already an aggregate, e.g. ${total} / NULLIF(${count}, 0)

    public static final String COUNT_ALL = "*";

    private final String function;

    AggregationType(String function) {
        this.function = function;
    }

    public String getFunction() {
        return function;
    }

    public boolean isDistinct() {
        return this == COUNT_DISTINCT || this == SUM_DISTINCT;
    }

    /**
     * Wrap a resolved expression into its aggregate form, e.g. SUM(order_items.sale_price).
     */
    public String wrap(String resolvedExpression) {
        if (function == null)
            return resolvedExpression;

        String arg = resolvedExpression == null ? COUNT_ALL : resolvedExpression;
        if (isDistinct())
            return function + "(DISTINCT " + arg + ")";
        if (this == MEDIAN)
            return function + "(" + arg + ", 2)[OFFSET(1)]";
        return function + "(" + arg + ")";
    }

    /**
     * Maps a declared measure type; non-aggregating types (number, string, date, yesno)
     * and unknown types pass the expression through.
     */
    public static AggregationType fromDeclaredType(String type) {
        if (type == null)
            return COUNT;
        String t = type.trim().toLowerCase(Locale.ROOT);
        if ("count".equals(t))
            return COUNT;
        if ("count_distinct".equals(t))
            return COUNT_DISTINCT;
        if ("sum".equals(t))
            return SUM;
        if ("sum_distinct".equals(t))
            return SUM_DISTINCT;
        if ("average".equals(t) || "avg".equals(t) || "average_distinct".equals(t))
            return AVERAGE;
        if ("min".equals(t))
            return MIN;
        if ("max".equals(t))
            return MAX;
        if ("median".equals(t))
            return MEDIAN;
        return NUMBER;
    }
}
