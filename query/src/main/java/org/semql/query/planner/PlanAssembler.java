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
import java.util.Set;

import org.semql.grounding.GroundedField;
import org.semql.grounding.GroundingIndex;
import org.semql.metadata.expression.ExpressionException;
import org.semql.metadata.expression.ExpressionResolver;
import org.semql.metadata.model.ExploreGraph;
import org.semql.metadata.model.JoinDesc;
import org.semql.metadata.model.ViewDesc;

import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

/**
 * Checks a {@link PlanRequest} against the grounding index and turns it into a {@link QueryPlan}.
 * Every planner goes through here, so no plan can name a field outside the index
 * or a join outside the explore.
 */
public class PlanAssembler {

    private final ExpressionResolver resolver;
    private final int maxJoins;

    public PlanAssembler(ExpressionResolver resolver, int maxJoins) {
        this.resolver = resolver;
        this.maxJoins = maxJoins;
    }

    public QueryPlan assemble(GroundingIndex index, PlanRequest request) throws PlanningException {
        ExploreGraph graph = index.getExplore();
        if (!graph.getName().equals(request.getExplore()))
            throw new PlanningException(FailureKind.NO_EXPLORE_MATCH, "Plan request for explore '" + request.getExplore() + "' given the index of '" + graph.getName() + "'");

        List<GroundedField> dimensions = Lists.newArrayList();
        List<GroundedField> measures = Lists.newArrayList();
        Set<String> views = Sets.newLinkedHashSet();
        for (String name : request.getFields()) {
            GroundedField field = lookup(index, name);
            if (field.isMeasure())
                measures.add(field);
            else
                dimensions.add(field);
            views.addAll(field.getReferencedViews());
        }
        if (dimensions.isEmpty() && measures.isEmpty())
            throw new PlanningException(FailureKind.NO_EXPLORE_MATCH, "No field selected from explore '" + graph.getName() + "'");

        List<String> filters = Lists.newArrayList();
        for (PlanRequest.Filter filter : request.getFilters()) {
            if (filter.getBoundField() != null)
                views.addAll(lookup(index, filter.getBoundField()).getReferencedViews());
            filters.add(filter.getPredicate());
        }

        List<JoinDesc> path;
        try {
            path = graph.getJoinPath(views);
        } catch (IllegalArgumentException e) {
            throw new PlanningException(PlanningFailure.unreachable(null, e.getMessage()));
        }
        if (path.size() > maxJoins)
            throw new PlanningException(PlanningFailure.unreachable(null, "Join path of " + path.size() + " joins exceeds the limit of " + maxJoins));

        List<PlannedJoin> joins = Lists.newArrayList();
        for (JoinDesc join : path) {
            ViewDesc view = graph.getView(join.getViewName());
            String condition = null;
            if (join.getJoinType().needsCondition()) {
                try {
                    condition = resolver.resolve(graph, join.getViewName(), join.getSqlOn());
                } catch (ExpressionException e) {
                    throw new PlanningException(PlanningFailure.unreachable(null, "Cannot join view '" + view.getName() + "': " + e.getMessage()));
                }
            }
            joins.add(new PlannedJoin(graph.getAlias(view.getName()), view.getSqlTableName(), join.getJoinType(), condition));
        }

        List<GroundedField> selected = Lists.newArrayList(dimensions);
        selected.addAll(measures);
        Integer limit = request.getLimit() == null || request.getLimit() <= 0 ? null : request.getLimit();
        ViewDesc base = graph.getBaseView();
        return new QueryPlan(graph.getName(), base.getSqlTableName(), graph.getAlias(base.getName()), selected, joins, limit, filters);
    }

    private static GroundedField lookup(GroundingIndex index, String name) throws PlanningException {
        GroundedField field = index.lookup(name);
        if (field == null)
            throw new PlanningException(PlanningFailure.unreachable(name, "Field '" + name + "' is not selectable in explore '" + index.getExploreName() + "'"));
        return field;
    }
}
