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

import java.util.Map;
import java.util.Set;

import org.apache.commons.lang.StringUtils;
import org.semql.metadata.expression.ExpressionException;
import org.semql.metadata.expression.ExpressionTokenizer;
import org.semql.metadata.model.ExploreDesc;
import org.semql.metadata.model.JoinDesc;
import org.semql.metadata.model.JoinType;
import org.semql.metadata.model.ModelDesc;
import org.semql.metadata.model.ProjectDesc;
import org.semql.metadata.model.Relationship;
import org.semql.metadata.model.ViewDesc;
import org.semql.metadata.validation.IValidatorRule;
import org.semql.metadata.validation.ResultLevel;
import org.semql.metadata.validation.ValidateContext;

import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

/**
 * Every view an explore touches must be declared and backed by a physical table:
 * the base view, each join target and each view named in a join's sql_on.
 * Join types and relationships must be known.
 */
public class ExploreReferenceRule implements IValidatorRule<ProjectDesc> {

    @Override
    public void validate(ProjectDesc project, ValidateContext context) {
        Map<String, ViewDesc> declared = Maps.newHashMap();
        for (ViewDesc view : project.getAllViews()) {
            if (view.getName() != null && !declared.containsKey(view.getName()))
                declared.put(view.getName(), view);
        }

        for (ModelDesc model : project.getModels()) {
            for (ExploreDesc explore : model.getExplores()) {
                validateExplore(explore, declared, context);
            }
        }
    }

    private void validateExplore(ExploreDesc explore, Map<String, ViewDesc> declared, ValidateContext context) {
        String base = explore.getBaseViewName();
        Set<String> members = Sets.newHashSet();
        members.add(base);
        checkView(explore, base, declared, context);

        for (JoinDesc join : explore.getJoins()) {
            if (StringUtils.isEmpty(join.getViewName())) {
                context.addResult(ResultLevel.ERROR, "Explore '" + explore.getName() + "' declares a join without view_name");
                continue;
            }
            members.add(join.getViewName());
            checkView(explore, join.getViewName(), declared, context);
            checkTypes(explore, join, context);
        }

        for (JoinDesc join : explore.getJoins()) {
            if (join.getViewName() == null)
                continue;
            if (isConditionMissing(join))
                context.addResult(ResultLevel.ERROR, "Join to '" + join.getViewName() + "' in explore '" + explore.getName() + "' declares no sql_on");
            Set<String> referenced;
            try {
                referenced = ExpressionTokenizer.referencedViews(join.getSqlOn());
            } catch (ExpressionException e) {
                context.addResult(ResultLevel.ERROR, "Join to '" + join.getViewName() + "' in explore '" + explore.getName() + "': " + e.getMessage());
                continue;
            }
            for (String view : referenced) {
                if (!members.contains(view))
                    context.addResult(ResultLevel.ERROR, "Join to '" + join.getViewName() + "' in explore '" + explore.getName() + "' references view '" + view + "' which is not part of the explore");
            }
        }
    }

    private void checkView(ExploreDesc explore, String viewName, Map<String, ViewDesc> declared, ValidateContext context) {
        ViewDesc view = declared.get(viewName);
        if (view == null) {
            context.addResult(ResultLevel.ERROR, "Explore '" + explore.getName() + "' references undeclared view '" + viewName + "'");
        } else if (StringUtils.isEmpty(view.getSqlTableName())) {
            context.addResult(ResultLevel.ERROR, "View '" + viewName + "' used by explore '" + explore.getName() + "' declares no sql_table_name");
        }
    }

    private void checkTypes(ExploreDesc explore, JoinDesc join, ValidateContext context) {
        try {
            JoinType.fromDeclaredType(join.getType());
        } catch (IllegalArgumentException e) {
            context.addResult(ResultLevel.ERROR, "Join to '" + join.getViewName() + "' in explore '" + explore.getName() + "': " + e.getMessage());
        }
        try {
            Relationship.fromDeclared(join.getRelationship());
        } catch (IllegalArgumentException e) {
            context.addResult(ResultLevel.ERROR, "Join to '" + join.getViewName() + "' in explore '" + explore.getName() + "': " + e.getMessage());
        }
    }

    private boolean isConditionMissing(JoinDesc join) {
        try {
            return join.getJoinType().needsCondition() && StringUtils.isBlank(join.getSqlOn());
        } catch (IllegalArgumentException e) {
            return false;// reported by checkTypes
        }
    }
}
