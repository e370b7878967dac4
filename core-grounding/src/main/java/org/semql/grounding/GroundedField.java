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

package org.semql.grounding;

import java.util.Set;

import org.semql.metadata.model.AggregationType;
import org.semql.metadata.model.ValueKind;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;

/**
 * A selectable field of one explore: its resolved SQL, physical type and merged description.
 * Immutable.
 */
public class GroundedField {

    private final String qualifiedName;
    private final String viewName;
    private final String fieldName;
    private final String resolvedExpression;//aggregate form for measures
    private final String physicalType;//null when the catalog does not know the column
    private final String description;//never null
    private final boolean measure;
    private final ValueKind valueKind;
    private final AggregationType aggregationType;//null for dimensions
    private final Set<String> referencedViews;//every view alias the expression uses, owning view included
    private final int position;//declaration order within the index

    private final Set<String> nameTerms;
    private final Set<String> descriptionTerms;

    public GroundedField(String viewName, String fieldName, String resolvedExpression, String physicalType, String description, boolean measure, ValueKind valueKind, AggregationType aggregationType, Set<String> referencedViews, int position) {
        this.qualifiedName = viewName + "." + fieldName;
        this.viewName = viewName;
        this.fieldName = fieldName;
        this.resolvedExpression = resolvedExpression;
        this.physicalType = physicalType;
        this.description = description == null ? "" : description;
        this.measure = measure;
        this.valueKind = valueKind;
        this.aggregationType = aggregationType;
        this.referencedViews = ImmutableSet.copyOf(referencedViews);
        this.position = position;
        this.nameTerms = ImmutableSet.copyOf(TermUtil.nameTerms(fieldName));
        this.descriptionTerms = ImmutableSet.copyOf(TermUtil.keywords(this.description));
    }

    public String getQualifiedName() {
        return qualifiedName;
    }

    public String getViewName() {
        return viewName;
    }

    public String getFieldName() {
        return fieldName;
    }

    public String getResolvedExpression() {
        return resolvedExpression;
    }

    public String getPhysicalType() {
        return physicalType;
    }

    public String getDescription() {
        return description;
    }

    public boolean isMeasure() {
        return measure;
    }

    public ValueKind getValueKind() {
        return valueKind;
    }

    public AggregationType getAggregationType() {
        return aggregationType;
    }

    public Set<String> getReferencedViews() {
        return referencedViews;
    }

    public int getPosition() {
        return position;
    }

    public Set<String> getNameTerms() {
        return nameTerms;
    }

    public Set<String> getDescriptionTerms() {
        return descriptionTerms;
    }

    /**
     * Column alias in generated SQL, e.g. "users_traffic_source".
     */
    public String getSqlAlias() {
        return viewName + "_" + fieldName;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("name", qualifiedName).add("sql", resolvedExpression).add("type", physicalType).toString();
    }
}
