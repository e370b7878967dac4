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

import java.util.Locale;

/**
 * Why a generated statement failed validation.
 */
public enum ValidationTag {
    MISSING_TABLE, MISSING_COLUMN, MISSING_DATASET, REFERENCE_ERROR, SYNTAX_ERROR, PERMISSION_ERROR, INVALID_QUERY, UNKNOWN_ERROR, //
    LIMIT_VIOLATION, COMMENT_PRESENT, UNKNOWN_ALIAS;

    /**
     * Tags a warehouse error message by its wording.
     */
    public static ValidationTag classify(String message) {
        String msg = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (msg.contains("not found")) {
            if (msg.contains("table"))
                return MISSING_TABLE;
            if (msg.contains("column"))
                return MISSING_COLUMN;
            if (msg.contains("dataset"))
                return MISSING_DATASET;
            return REFERENCE_ERROR;
        }
        if (msg.contains("syntax error"))
            return SYNTAX_ERROR;
        if (msg.contains("permission") || msg.contains("access"))
            return PERMISSION_ERROR;
        if (msg.contains("invalid"))
            return INVALID_QUERY;
        return UNKNOWN_ERROR;
    }
}
