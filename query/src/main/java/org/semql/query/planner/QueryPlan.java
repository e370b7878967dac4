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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * The fields, joins, filters and row limit of one question against one explore. Immutable.
 */
public class QueryPlan {

    private final String explore;
    private final String baseTable;
    private final String baseAlias;
    private final List<GroundedField> selectedFields;//dimensions first, then measures
    private final List<PlannedJoin> joinPath;//topological from the base view
    private final Integer limit;//null means the configured default
    private final List<String> filters;

    public QueryPlan(String explore, String baseTable, String baseAlias, List<GroundedField> selectedFields, List<PlannedJoin> joinPath, Integer limit, List<String> filters) {
        this.explore = explore;
        this.baseTable = baseTable;
        this.baseAlias = baseAlias;
        this.selectedFields = ImmutableList.copyOf(selectedFields);
        this.joinPath = ImmutableList.copyOf(joinPath);
        this.limit = limit;
        this.filters = ImmutableList.copyOf(filters);
    }

    public boolean hasMeasure() {
        for (GroundedField field : selectedFields) {
            if (field.isMeasure())
                return true;
        }
        return false;
    }

    public String getExplore() {
        return explore;
    }

    public String getBaseTable() {
        return baseTable;
    }

    public String getBaseAlias() {
        return baseAlias;
    }

    public List<GroundedField> getSelectedFields() {
        return selectedFields;
    }

    public List<PlannedJoin> getJoinPath() {
        return joinPath;
    }

    public Integer getLimit() {
        return limit;
    }

    public List<String> getFilters() {
        return filters;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("explore", explore).add("fields", selectedFields.size()).add("joins", joinPath).add("limit", limit).toString();
    }
}
