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

import java.util.List;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.collect.Lists;

/**
 * A selectable, non-aggregated field; its value kind is derived from the declared type.
 */
@JsonAutoDetect(fieldVisibility = Visibility.NONE, getterVisibility = Visibility.NONE, isGetterVisibility = Visibility.NONE, setterVisibility = Visibility.NONE)
public class DimensionDesc extends FieldDesc {

    @JsonProperty("primary_key")
    private boolean primaryKey;
    @JsonProperty("timeframes")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private List<String> timeframes = Lists.newArrayList();//only meaningful for date dimensions

    private ValueKind valueKind;

    @Override
    public void init(ViewDesc view) {
        super.init(view);
        valueKind = ValueKind.fromDeclaredType(getType());
        if (timeframes == null)
            timeframes = Lists.newArrayList();
    }

    @Override
    public boolean isMeasure() {
        return false;
    }

    /**
     * Defaults to "${TABLE}.name" when no sql is declared.
     */
    public String getExpression() {
        return getSql() != null ? getSql() : "${TABLE}." + getName();
    }

    public ValueKind getValueKind() {
        return valueKind;
    }

    public boolean isPrimaryKey() {
        return primaryKey;
    }

    public void setPrimaryKey(boolean primaryKey) {
        this.primaryKey = primaryKey;
    }

    public List<String> getTimeframes() {
        return timeframes;
    }

    public void setTimeframes(List<String> timeframes) {
        this.timeframes = timeframes;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("name", getName()).add("type", getType()).add("sql", getSql()).toString();
    }
}
