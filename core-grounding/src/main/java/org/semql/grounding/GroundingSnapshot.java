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

import java.util.List;
import java.util.Map;

import org.semql.common.util.StringUtil;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * The grounding indexes of all explores, built against one catalog fingerprint.
 * Readers hold on to one snapshot for a whole question.
 */
public class GroundingSnapshot {

    private final String catalogFingerprint;
    private final List<GroundingIndex> indexes;//explore declaration order
    private final Map<String, GroundingIndex> byExplore;

    public GroundingSnapshot(String catalogFingerprint, List<GroundingIndex> indexes) {
        this.catalogFingerprint = catalogFingerprint;
        this.indexes = ImmutableList.copyOf(indexes);
        ImmutableMap.Builder<String, GroundingIndex> builder = ImmutableMap.builder();
        for (GroundingIndex index : indexes) {
            builder.put(index.getExploreName(), index);
        }
        this.byExplore = builder.build();
    }

    public GroundingIndex getIndex(String explore) {
        return explore == null ? null : byExplore.get(StringUtil.normalizeIdentifier(explore));
    }

    /**
     * @return the field, or null when the explore or the field is unknown
     */
    public GroundedField lookup(String explore, String qualifiedName) {
        GroundingIndex index = getIndex(explore);
        return index == null ? null : index.lookup(qualifiedName);
    }

    public List<GroundingIndex> getIndexes() {
        return indexes;
    }

    public String getCatalogFingerprint() {
        return catalogFingerprint;
    }

    @Override
    public String toString() {
        return "GroundingSnapshot [fingerprint=" + catalogFingerprint + ", explores=" + byExplore.keySet() + "]";
    }
}
