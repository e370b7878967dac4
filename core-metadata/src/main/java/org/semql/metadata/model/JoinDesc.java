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

import java.util.Set;

import org.semql.common.util.StringUtil;
import org.semql.metadata.expression.ExpressionTokenizer;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

/**
 * A join from an explore to one more view. The join hangs off the views its
 * sql_on references; with no reference it hangs off the explore's base view.
 */
@JsonAutoDetect(fieldVisibility = Visibility.NONE, getterVisibility = Visibility.NONE, isGetterVisibility = Visibility.NONE, setterVisibility = Visibility.NONE)
public class JoinDesc {

    @JsonProperty("view_name")
    private String viewName;//target view
    @JsonProperty("type")
    private String type;//inner, left_outer, full_outer, cross
    @JsonProperty("sql_on")
    private String sqlOn;
    @JsonProperty("relationship")
    private String relationship;
    @JsonProperty("required")
    private boolean required;

    private Set<String> parentViews = ImmutableSet.of();//views the ON condition depends on

    public void init() {
        this.viewName = StringUtil.normalizeIdentifier(viewName);
        Set<String> referenced = Sets.newLinkedHashSet(ExpressionTokenizer.referencedViews(sqlOn));
        referenced.remove(viewName);
        this.parentViews = ImmutableSet.copyOf(referenced);
    }

    public String getViewName() {
        return viewName;
    }

    public void setViewName(String viewName) {
        this.viewName = viewName;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getSqlOn() {
        return sqlOn;
    }

    public void setSqlOn(String sqlOn) {
        this.sqlOn = sqlOn;
    }

    public String getRelationship() {
        return relationship;
    }

    public void setRelationship(String relationship) {
        this.relationship = relationship;
    }

    public boolean isRequired() {
        return required;
    }

    public void setRequired(boolean required) {
        this.required = required;
    }

    public JoinType getJoinType() {
        return JoinType.fromDeclaredType(type);
    }

    public Relationship getRelationshipType() {
        return Relationship.fromDeclared(relationship);
    }

    public Set<String> getParentViews() {
        return parentViews;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("view", viewName).add("type", type).add("sqlOn", sqlOn).toString();
    }
}
