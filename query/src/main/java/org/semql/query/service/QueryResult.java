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

package org.semql.query.service;

import org.semql.query.planner.FailureKind;
import org.semql.query.planner.PlanningFailure;
import org.semql.query.planner.QueryPlan;
import org.semql.query.validation.ValidationResult;

/**
 * Either a complete statement with its plan, or the reason there is none.
 */
public class QueryResult {

    private final String sql;
    private final QueryPlan plan;
    private final boolean limitApplied;//the default limit was appended
    private final ValidationResult validation;
    private final PlanningFailure failure;

    private QueryResult(String sql, QueryPlan plan, boolean limitApplied, ValidationResult validation, PlanningFailure failure) {
        this.sql = sql;
        this.plan = plan;
        this.limitApplied = limitApplied;
        this.validation = validation;
        this.failure = failure;
    }

    static QueryResult success(String sql, QueryPlan plan, boolean limitApplied, ValidationResult validation) {
        return new QueryResult(sql, plan, limitApplied, validation, null);
    }

    static QueryResult failure(PlanningFailure failure) {
        return new QueryResult(null, null, false, null, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public String getSql() {
        return sql;
    }

    public QueryPlan getPlan() {
        return plan;
    }

    public boolean isLimitApplied() {
        return limitApplied;
    }

    public ValidationResult getValidation() {
        return validation;
    }

    public PlanningFailure getFailure() {
        return failure;
    }

    public FailureKind getErrorKind() {
        return failure == null ? null : failure.getKind();
    }

    public String getMessage() {
        return failure == null ? null : failure.getMessage();
    }
}
