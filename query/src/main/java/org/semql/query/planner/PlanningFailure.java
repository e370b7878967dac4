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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.base.MoreObjects;

/**
 * A typed planning refusal with enough detail to explain it: the explore
 * candidates with their scores, or the field that could not be reached.
 */
public class PlanningFailure {

    private final FailureKind kind;
    private final String message;
    private final Map<String, Double> candidates;//explore name -> score, best first
    private final String missingField;

    public PlanningFailure(FailureKind kind, String message) {
        this(kind, message, Collections.<String, Double> emptyMap(), null);
    }

    public PlanningFailure(FailureKind kind, String message, Map<String, Double> candidates, String missingField) {
        this.kind = kind;
        this.message = message;
        this.candidates = Collections.unmodifiableMap(new LinkedHashMap<String, Double>(candidates));
        this.missingField = missingField;
    }

    public static PlanningFailure unreachable(String field, String message) {
        return new PlanningFailure(FailureKind.UNREACHABLE_FIELD, message, Collections.<String, Double> emptyMap(), field);
    }

    public FailureKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Double> getCandidates() {
        return candidates;
    }

    public String getMissingField() {
        return missingField;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues().add("kind", kind).add("message", message).add("missingField", missingField).toString();
    }
}
