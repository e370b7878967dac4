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

/**
 * Either a plan or a typed failure, never both.
 */
public class PlanResult {

    private final QueryPlan plan;
    private final PlanningFailure failure;

    private PlanResult(QueryPlan plan, PlanningFailure failure) {
        this.plan = plan;
        this.failure = failure;
    }

    public static PlanResult success(QueryPlan plan) {
        if (plan == null)
            throw new IllegalArgumentException("plan is null");
        return new PlanResult(plan, null);
    }

    public static PlanResult failure(PlanningFailure failure) {
        if (failure == null)
            throw new IllegalArgumentException("failure is null");
        return new PlanResult(null, failure);
    }

    public boolean isSuccess() {
        return plan != null;
    }

    public QueryPlan getPlan() {
        return plan;
    }

    public PlanningFailure getFailure() {
        return failure;
    }

    @Override
    public String toString() {
        return isSuccess() ? "PlanResult [" + plan + "]" : "PlanResult [" + failure + "]";
    }
}
