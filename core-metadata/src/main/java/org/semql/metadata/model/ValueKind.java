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
import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * The value domain of a dimension.
 */
public enum ValueKind {
    STRING, NUMBER, DATE, BOOLEAN, YESNO;

    // declared dimension type -> value kind
    private static final Map<String, ValueKind> DECLARED_TYPES = ImmutableMap.<String, ValueKind> builder()//
            .put("string", STRING).put("tier", STRING).put("zipcode", STRING).put("location", STRING)//
            .put("number", NUMBER).put("int", NUMBER).put("integer", NUMBER).put("distance", NUMBER)//
            .put("date", DATE).put("time", DATE).put("date_time", DATE).put("datetime", DATE).put("timestamp", DATE)//
            .put("boolean", BOOLEAN)//
            .put("yesno", YESNO)//
            .build();

    /**
     * Unknown or missing declared types are treated as {@link #STRING}.
     */
    public static ValueKind fromDeclaredType(String type) {
        if (type == null)
            return STRING;
        ValueKind kind = DECLARED_TYPES.get(type.trim().toLowerCase(Locale.ROOT));
        return kind == null ? STRING : kind;
    }
}
