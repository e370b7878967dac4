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

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.semql.common.util.StringUtil;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

/**
 * The join dependency graph of one explore.
 * <p>
 * Every view of the explore gets one table alias. A join depends on the views its
 * ON condition references; a join referencing nothing but its own target depends on the base view.
 */
public class ExploreGraph {

    private final ExploreDesc explore;
    private final ViewDesc baseView;
    private final Map<String, ViewDesc> views;//base view first, then join targets in topological order
    private final Map<String, JoinDesc> joinsByView;
    private final List<JoinDesc> orderedJoins;

    /**
     * @param joinedViews target view of every join, keyed by normalized view name
     */
    public ExploreGraph(ExploreDesc explore, ViewDesc baseView, Map<String, ViewDesc> joinedViews) {
        this.explore = explore;
        this.baseView = baseView;

        List<JoinDesc> sorted = topologicalOrder(baseView.getName(), explore.getJoins());
        if (sorted.size() != explore.getJoins().size())
            throw new ModelException("Explore '" + explore.getName() + "' has a cyclic join graph");
        this.orderedJoins = ImmutableList.copyOf(sorted);

        Map<String, ViewDesc> allViews = Maps.newLinkedHashMap();
        Map<String, JoinDesc> byView = Maps.newHashMap();
        allViews.put(baseView.getName(), baseView);
        for (JoinDesc join : orderedJoins) {
            ViewDesc target = joinedViews.get(join.getViewName());
            if (target == null)
                throw new ModelException("Explore '" + explore.getName() + "' joins undeclared view '" + join.getViewName() + "'");
            allViews.put(join.getViewName(), target);
            byView.put(join.getViewName(), join);
        }
        this.views = Collections.unmodifiableMap(allViews);
        this.joinsByView = ImmutableMap.copyOf(byView);
    }

    /**
     * Kahn's algorithm, ties broken by declaration order. Joins caught in a cycle,
     * or depending on a view never reached, are left out of the result.
     */
    public static List<JoinDesc> topologicalOrder(String baseViewName, List<JoinDesc> joins) {
        Set<String> placed = Sets.newHashSet();
        placed.add(baseViewName);
        List<JoinDesc> remaining = Lists.newArrayList(joins);
        List<JoinDesc> result = Lists.newArrayList();

        boolean progress = true;
        while (progress && !remaining.isEmpty()) {
            progress = false;
            for (int i = 0; i < remaining.size(); i++) {
                JoinDesc join = remaining.get(i);
                if (!placed.contains(join.getViewName()) && placed.containsAll(dependenciesOf(join, baseViewName))) {
                    result.add(join);
                    placed.add(join.getViewName());
                    remaining.remove(i);
                    progress = true;
                    break;
                }
            }
        }
        return result;
    }

    private static Set<String> dependenciesOf(JoinDesc join, String baseViewName) {
        if (join.getParentViews().isEmpty())
            return Collections.singleton(baseViewName);
        return join.getParentViews();
    }

    public String getName() {
        return explore.getName();
    }

    public ExploreDesc getExplore() {
        return explore;
    }

    public ViewDesc getBaseView() {
        return baseView;
    }

    public Collection<ViewDesc> getViews() {
        return views.values();
    }

    public boolean containsView(String viewName) {
        return viewName != null && views.containsKey(StringUtil.normalizeIdentifier(viewName));
    }

    public ViewDesc getView(String viewName) {
        return viewName == null ? null : views.get(StringUtil.normalizeIdentifier(viewName));
    }

    /**
     * The table alias of a view of this explore, or null if the view is not part of it.
     */
    public String getAlias(String viewName) {
        ViewDesc view = getView(viewName);
        return view == null ? null : view.getName();
    }

    public JoinDesc getJoin(String viewName) {
        return viewName == null ? null : joinsByView.get(StringUtil.normalizeIdentifier(viewName));
    }

    /**
     * All joins, topologically ordered from the base view.
     */
    public List<JoinDesc> getJoins() {
        return orderedJoins;
    }

    /**
     * Finds "view.field" among the views of this explore, hidden fields included.
     */
    public FieldDesc findField(String qualifiedName) {
        if (qualifiedName == null)
            return null;
        int cut = qualifiedName.indexOf('.');
        if (cut < 0)
            return null;
        ViewDesc view = getView(qualifiedName.substring(0, cut));
        return view == null ? null : view.findField(qualifiedName.substring(cut + 1));
    }

    /**
     * The minimal set of joins connecting the base view to every requested view,
     * in topological order. The base view itself needs no join.
     *
     * @throws IllegalArgumentException if a requested view is not part of this explore
     */
    public List<JoinDesc> getJoinPath(Collection<String> viewNames) {
        Set<String> needed = Sets.newHashSet();
        Deque<String> pending = new ArrayDeque<String>();
        for (String viewName : viewNames) {
            if (!containsView(viewName))
                throw new IllegalArgumentException("View '" + viewName + "' is not reachable in explore '" + getName() + "'");
            pending.push(StringUtil.normalizeIdentifier(viewName));
        }

        while (!pending.isEmpty()) {
            String viewName = pending.pop();
            if (viewName.equals(baseView.getName()) || !needed.add(viewName))
                continue;
            for (String parent : joinsByView.get(viewName).getParentViews()) {
                pending.push(parent);
            }
        }

        List<JoinDesc> path = Lists.newArrayList();
        for (JoinDesc join : orderedJoins) {
            if (needed.contains(join.getViewName()))
                path.add(join);
        }
        return path;
    }

    @Override
    public String toString() {
        return "ExploreGraph [explore=" + explore.getName() + ", views=" + views.keySet() + "]";
    }
}
