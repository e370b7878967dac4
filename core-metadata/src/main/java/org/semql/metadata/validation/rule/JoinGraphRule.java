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

package org.semql.metadata.validation.rule;

import java.util.List;
import java.util.Set;

import org.semql.metadata.model.ExploreDesc;
import org.semql.metadata.model.ExploreGraph;
import org.semql.metadata.model.JoinDesc;
import org.semql.metadata.model.ModelDesc;
import org.semql.metadata.model.ProjectDesc;
import org.semql.metadata.validation.IValidatorRule;
import org.semql.metadata.validation.ResultLevel;
import org.semql.metadata.validation.ValidateContext;

import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

/**
 * The join graph of an explore must be acyclic: a view appears at most once,
 * the base view is never joined again, and no two joins depend on each other.
 */
public class JoinGraphRule implements IValidatorRule<ProjectDesc> {

    @Override
    public void validate(ProjectDesc project, ValidateContext context) {
        for (ModelDesc model : project.getModels()) {
            for (ExploreDesc explore : model.getExplores()) {
                validateExplore(explore, context);
            }
        }
    }

    private void validateExplore(ExploreDesc explore, ValidateContext context) {
        String base = explore.getBaseViewName();
        Set<String> members = Sets.newHashSet(base);
        List<JoinDesc> candidates = Lists.newArrayList();

        for (JoinDesc join : explore.getJoins()) {
            String target = join.getViewName();
            if (target == null)
                continue;
            if (target.equals(base)) {
                context.addResult(ResultLevel.ERROR, "Explore '" + explore.getName() + "' joins its base view '" + base + "' again, which forms a cycle");
            } else if (!members.add(target)) {
                context.addResult(ResultLevel.ERROR, "Explore '" + explore.getName() + "' joins view '" + target + "' more than once, which forms a cycle");
            } else {
                candidates.add(join);
            }
        }

        List<JoinDesc> ordered = ExploreGraph.topologicalOrder(base, candidates);
        if (ordered.size() == candidates.size())
            return;

        List<String> cyclic = Lists.newArrayList();
        for (JoinDesc join : candidates) {
            // dangling references are reported by ExploreReferenceRule
            if (!ordered.contains(join) && members.containsAll(join.getParentViews()))
                cyclic.add(join.getViewName());
        }
        if (!cyclic.isEmpty())
            context.addResult(ResultLevel.ERROR, "Explore '" + explore.getName() + "' has joins depending on each other: " + cyclic);
    }
}
