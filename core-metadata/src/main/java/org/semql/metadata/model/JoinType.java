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

public enum JoinType {
    INNER("INNER JOIN"), LEFT_OUTER("LEFT JOIN"), FULL_OUTER("FULL OUTER JOIN"), CROSS("CROSS JOIN");

    private final String keyword;

    JoinType(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    public boolean needsCondition() {
        return this != CROSS;
    }

    /**
     * Missing type defaults to {@link #LEFT_OUTER}; "left" and "full" are accepted as short forms.
     */
    public static JoinType fromDeclaredType(String type) {
        if (type == null || type.trim().isEmpty())
            return LEFT_OUTER;
        String t = type.trim().toLowerCase(Locale.ROOT);
        if ("inner".equals(t))
            return INNER;
        if ("left_outer".equals(t) || "left".equals(t))
            return LEFT_OUTER;
        if ("full_outer".equals(t) || "full".equals(t))
            return FULL_OUTER;
        if ("cross".equals(t))
            return CROSS;
        throw new IllegalArgumentException("Unsupported join type: " + type);
    }
}
