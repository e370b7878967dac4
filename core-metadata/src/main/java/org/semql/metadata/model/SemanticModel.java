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
import java.util.List;
import java.util.Map;

import org.semql.common.util.StringUtil;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * The assembled, immutable semantic model: every declared view plus one join graph per explore.
 */
public class SemanticModel {

    private final Map<String, ViewDesc> views;
    private final List<ExploreGraph> explores;//model declaration order, then explore declaration order
    private final Map<String, ExploreGraph> exploresByName;

    public SemanticModel(Map<String, ViewDesc> views, List<ExploreGraph> explores) {
        this.views = ImmutableMap.copyOf(views);
        this.explores = ImmutableList.copyOf(explores);
        ImmutableMap.Builder<String, ExploreGraph> builder = ImmutableMap.builder();
        for (ExploreGraph graph : explores) {
            builder.put(graph.getName(), graph);
        }
        this.exploresByName = builder.build();
    }

    public Collection<ViewDesc> getViews() {
        return views.values();
    }

    public ViewDesc getView(String name) {
        return name == null ? null : views.get(StringUtil.normalizeIdentifier(name));
    }

    public List<ExploreGraph> getExplores() {
        return explores;
    }

    public ExploreGraph getExplore(String name) {
        return name == null ? null : exploresByName.get(StringUtil.normalizeIdentifier(name));
    }

    @Override
    public String toString() {
        return "SemanticModel [views=" + views.size() + ", explores=" + exploresByName.keySet() + "]";
    }
}
