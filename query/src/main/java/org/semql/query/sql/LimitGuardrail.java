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

import java.util.regex.Pattern;

/**
 * Makes sure a statement carries a row limit.
 */
public class LimitGuardrail {

    public static final Pattern LIMIT = Pattern.compile("\\bLIMIT\\s+\\d+\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_LIMIT = Pattern.compile("\\bLIMIT\\s+\\d+\\s*;?\\s*$", Pattern.CASE_INSENSITIVE);

    private final int defaultLimit;

    public LimitGuardrail(int defaultLimit) {
        if (defaultLimit <= 0)
            throw new IllegalArgumentException("Default limit must be positive, but it is " + defaultLimit);
        this.defaultLimit = defaultLimit;
    }

    /**
     * True when the statement ends with {@code LIMIT <int>}. Quoted text is ignored, and so is
     * a limit inside a subquery.
     */
    public static boolean hasLimit(String sql) {
        return TRAILING_LIMIT.matcher(SqlTextUtil.maskQuoted(sql)).find();
    }

    /**
     * Appends {@code LIMIT <default>} unless the statement has a limit already.
     */
    public String apply(String sql) {
        if (hasLimit(sql))
            return sql;
        return sql + "\nLIMIT " + defaultLimit;
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }
}
