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

import org.apache.commons.lang.StringUtils;
import org.semql.metadata.model.ExploreDesc;
import org.semql.metadata.model.FieldDesc;
import org.semql.metadata.model.ModelDesc;
import org.semql.metadata.model.ProjectDesc;
import org.semql.metadata.model.ViewDesc;
import org.semql.metadata.validation.IValidatorRule;
import org.semql.metadata.validation.ResultLevel;
import org.semql.metadata.validation.ValidateContext;

import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

/**
 * Names must be present and unique: views and explores across the project,
 * fields within a view (dimensions and measures share one namespace).
 */
public class DuplicateNameRule implements IValidatorRule<ProjectDesc> {

    @Override
    public void validate(ProjectDesc project, ValidateContext context) {
        Set<String> viewNames = Sets.newHashSet();
        for (ViewDesc view : project.getAllViews()) {
            if (StringUtils.isEmpty(view.getName())) {
                context.addResult(ResultLevel.ERROR, "A view declares no name");
                continue;
            }
            if (!viewNames.add(view.getName()))
                context.addResult(ResultLevel.ERROR, "View '" + view.getName() + "' is declared more than once");
            validateFieldNames(view, context);
        }

        Set<String> exploreNames = Sets.newHashSet();
        for (ModelDesc model : project.getModels()) {
            for (ExploreDesc explore : model.getExplores()) {
                if (StringUtils.isEmpty(explore.getName())) {
                    context.addResult(ResultLevel.ERROR, "Model '" + model.getName() + "' declares an explore without name");
                } else if (!exploreNames.add(explore.getName())) {
                    context.addResult(ResultLevel.ERROR, "Explore '" + explore.getName() + "' is declared more than once");
                }
            }
        }
    }

    private void validateFieldNames(ViewDesc view, ValidateContext context) {
        Set<String> fieldNames = Sets.newHashSet();
        for (FieldDesc field : concat(view)) {
            if (StringUtils.isEmpty(field.getName())) {
                context.addResult(ResultLevel.ERROR, "View '" + view.getName() + "' declares a field without name");
            } else if (!fieldNames.add(field.getName())) {
                context.addResult(ResultLevel.ERROR, "View '" + view.getName() + "' declares field '" + field.getName() + "' more than once");
            }
        }
    }

    private static List<FieldDesc> concat(ViewDesc view) {
        List<FieldDesc> all = Lists.newArrayList();
        all.addAll(view.getDimensions());
        all.addAll(view.getMeasures());
        return all;
    }
}
