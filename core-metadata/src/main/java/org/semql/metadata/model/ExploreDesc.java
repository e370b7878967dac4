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

import org.semql.common.util.StringUtil;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.Lists;

/**
 * A rooted join graph of views, defining which cross-view relationships are legal for a query.
 */
@JsonAutoDetect(fieldVisibility = Visibility.NONE, getterVisibility = Visibility.NONE, isGetterVisibility = Visibility.NONE, setterVisibility = Visibility.NONE)
public class ExploreDesc {

    @JsonProperty("name")
    private String name;
    @JsonProperty("view_name")
    private String viewName;
    @JsonProperty("from")
    private String from;
    @JsonProperty("label")
    private String label;
    @JsonProperty("description")
    private String description;
    @JsonProperty("hidden")
    private boolean hidden;
    @JsonProperty("joins")
    private List<JoinDesc> joins = Lists.newArrayList();

    private String modelName;
    private int declaredIndex;//position among the explores of its model

    public void init(String modelName, int declaredIndex) {
        this.name = StringUtil.normalizeIdentifier(name);
        this.modelName = modelName;
        this.declaredIndex = declaredIndex;
        if (joins == null)
            joins = Lists.newArrayList();
        for (JoinDesc join : joins) {
            join.init();
        }
    }

    /**
     * view_name, else from, else the explore's own name.
     */
    public String getBaseViewName() {
        if (viewName != null)
            return StringUtil.normalizeIdentifier(viewName);
        if (from != null)
            return StringUtil.normalizeIdentifier(from);
        return StringUtil.normalizeIdentifier(name);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getViewName() {
        return viewName;
    }

    public void setViewName(String viewName) {
        this.viewName = viewName;
    }

    public String getFrom() {
        return from;
    }

    public void setFrom(String from) {
        this.from = from;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public boolean isHidden() {
        return hidden;
    }

    public void setHidden(boolean hidden) {
        this.hidden = hidden;
    }

    public List<JoinDesc> getJoins() {
        return joins;
    }

    public void setJoins(List<JoinDesc> joins) {
        this.joins = joins;
    }

    public String getModelName() {
        return modelName;
    }

    public int getDeclaredIndex() {
        return declaredIndex;
    }

    @Override
    public String toString() {
        return "ExploreDesc [name=" + name + "]";
    }
}
