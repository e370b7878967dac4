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

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.semql.common.util.StringUtil;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * A logical view over one physical table: its dimensions and measures.
 */
@JsonAutoDetect(fieldVisibility = Visibility.NONE, getterVisibility = Visibility.NONE, isGetterVisibility = Visibility.NONE, setterVisibility = Visibility.NONE)
public class ViewDesc {

    @JsonProperty("name")
    private String name;
    @JsonProperty("sql_table_name")
    private String sqlTableName;//fully-qualified physical table, e.g. `project.dataset.users`
    @JsonProperty("primary_key")
    private String primaryKey;
    @JsonProperty("dimensions")
    private List<DimensionDesc> dimensions = Lists.newArrayList();
    @JsonProperty("measures")
    private List<MeasureDesc> measures = Lists.newArrayList();

    // computed, dimensions first then measures, in declared order
    private Map<String, FieldDesc> fields = Maps.newLinkedHashMap();

    /**
     * Field names must already be known unique, see DuplicateNameRule.
     */
    public void init() {
        name = StringUtil.normalizeIdentifier(name);
        if (dimensions == null)
            dimensions = Lists.newArrayList();
        if (measures == null)
            measures = Lists.newArrayList();

        Map<String, FieldDesc> all = Maps.newLinkedHashMap();
        for (DimensionDesc dim : dimensions) {
            dim.init(this);
            all.put(dim.getName(), dim);
            if (primaryKey == null && dim.isPrimaryKey())
                primaryKey = dim.getName();
        }
        for (MeasureDesc measure : measures) {
            measure.init(this);
            all.put(measure.getName(), measure);
        }
        fields = Collections.unmodifiableMap(all);
        if (primaryKey != null)
            primaryKey = StringUtil.normalizeIdentifier(primaryKey);
    }

    public FieldDesc findField(String fieldName) {
        if (fieldName == null)
            return null;
        return fields.get(StringUtil.normalizeIdentifier(fieldName));
    }

    public Collection<FieldDesc> getFields() {
        return fields.values();
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getSqlTableName() {
        return sqlTableName;
    }

    public void setSqlTableName(String sqlTableName) {
        this.sqlTableName = sqlTableName;
    }

    /**
     * The bare table name the physical catalog is keyed by, e.g. "users" for `project.dataset.users`.
     */
    public String getCatalogTableName() {
        return StringUtil.lastSegment(StringUtil.stripQuotes(sqlTableName));
    }

    public String getPrimaryKey() {
        return primaryKey;
    }

    public void setPrimaryKey(String primaryKey) {
        this.primaryKey = primaryKey;
    }

    public List<DimensionDesc> getDimensions() {
        return dimensions;
    }

    public void setDimensions(List<DimensionDesc> dimensions) {
        this.dimensions = dimensions;
    }

    public List<MeasureDesc> getMeasures() {
        return measures;
    }

    public void setMeasures(List<MeasureDesc> measures) {
        this.measures = measures;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        ViewDesc other = (ViewDesc) o;
        return name == null ? other.name == null : name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return name == null ? 0 : name.hashCode();
    }

    @Override
    public String toString() {
        return "ViewDesc [name=" + name + "]";
    }
}
