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

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.semql.common.util.StringUtil;
import org.semql.metadata.model.ExploreGraph;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ListMultimap;

/**
 * Every selectable field of one explore, keyed by qualified name, plus a glossary
 * from terms (field-name tokens and description keywords) to fields. Immutable once built.
 */
public class GroundingIndex {

    private final ExploreGraph explore;
    private final String catalogFingerprint;
    private final Map<String, GroundedField> fields;//declaration order
    private final ListMultimap<String, GroundedField> glossary;
    private final Set<String> excludedFields;

    GroundingIndex(ExploreGraph explore, String catalogFingerprint, List<GroundedField> fields, Set<String> excludedFields) {
        this.explore = explore;
        this.catalogFingerprint = catalogFingerprint;

        ImmutableMap.Builder<String, GroundedField> byName = ImmutableMap.builder();
        ImmutableListMultimap.Builder<String, GroundedField> terms = ImmutableListMultimap.builder();
        for (GroundedField field : fields) {
            byName.put(field.getQualifiedName(), field);
            for (String term : field.getNameTerms()) {
                terms.put(term, field);
            }
            for (String term : field.getDescriptionTerms()) {
                if (!field.getNameTerms().contains(term))
                    terms.put(term, field);
            }
        }
        this.fields = byName.build();
        this.glossary = terms.build();
        this.excludedFields = ImmutableSet.copyOf(excludedFields);
    }

    /**
     * @return the field, or null when the name is unknown, hidden or failed to resolve
     */
    public GroundedField lookup(String qualifiedName) {
        return qualifiedName == null ? null : fields.get(StringUtil.normalizeIdentifier(qualifiedName));
    }

    public Collection<GroundedField> getFields() {
        return fields.values();
    }

    /**
     * Fields whose name or description carries the (stemmed) term.
     */
    public List<GroundedField> findByTerm(String term) {
        return term == null ? Collections.<GroundedField> emptyList() : glossary.get(term);
    }

    public ExploreGraph getExplore() {
        return explore;
    }

    public String getExploreName() {
        return explore.getName();
    }

    public String getCatalogFingerprint() {
        return catalogFingerprint;
    }

    /**
     * Fields left out because their expression failed to resolve.
     */
    public Set<String> getExcludedFields() {
        return excludedFields;
    }

    public int size() {
        return fields.size();
    }

    @Override
    public String toString() {
        return "GroundingIndex [explore=" + explore.getName() + ", fields=" + fields.size() + ", terms=" + glossary.keySet().size() + "]";
    }
}
