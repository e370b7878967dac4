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
import java.util.List;

import com.google.common.collect.Lists;

/**
 * What a planner decided, by name, before it is checked against the grounding index:
 * the explore, qualified field names, filters and an optional row limit.
 */
public class PlanRequest {

    private final String explore;
    private final List<String> fields = Lists.newArrayList();
    private final List<Filter> filters = Lists.newArrayList();
    private Integer limit;

    public PlanRequest(String explore) {
        this.explore = explore;
    }

    public PlanRequest addField(String qualifiedName) {
        if (!fields.contains(qualifiedName))
            fields.add(qualifiedName);
        return this;
    }

    /**
     * @param boundField the field whose views the predicate needs joined, may be null
     */
    public PlanRequest addFilter(String predicate, String boundField) {
        filters.add(new Filter(predicate, boundField));
        return this;
    }

    public PlanRequest setLimit(Integer limit) {
        this.limit = limit;
        return this;
    }

    public String getExplore() {
        return explore;
    }

    public List<String> getFields() {
        return Collections.unmodifiableList(fields);
    }

    public List<Filter> getFilters() {
        return Collections.unmodifiableList(filters);
    }

    public Integer getLimit() {
        return limit;
    }

    public static class Filter {
        private final String predicate;
        private final String boundField;

        Filter(String predicate, String boundField) {
            this.predicate = predicate;
            this.boundField = boundField;
        }

        public String getPredicate() {
            return predicate;
        }

        public String getBoundField() {
            return boundField;
        }
    }
}
