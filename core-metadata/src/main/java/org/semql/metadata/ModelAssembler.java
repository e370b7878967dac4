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

package org.semql.metadata;

import java.util.List;
import java.util.Map;

import org.semql.metadata.expression.ExpressionException;
import org.semql.metadata.model.ExploreDesc;
import org.semql.metadata.model.ExploreGraph;
import org.semql.metadata.model.ModelDesc;
import org.semql.metadata.model.ModelException;
import org.semql.metadata.model.ProjectDesc;
import org.semql.metadata.model.SemanticModel;
import org.semql.metadata.model.ViewDesc;
import org.semql.metadata.validation.ModelValidator;
import org.semql.metadata.validation.ResultLevel;
import org.semql.metadata.validation.ValidateContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * Turns parsed view and explore declarations into a {@link SemanticModel}.
 * <p>
 * All problems are collected first and reported together in one {@link ModelException};
 * a model that fails validation is never partially built.
 */
public class ModelAssembler {

    private static final Logger logger = LoggerFactory.getLogger(ModelAssembler.class);

    public static final String DEFAULT_MODEL = "default";

    private final ModelValidator validator = new ModelValidator();

    public SemanticModel assemble(List<ViewDesc> views, List<ExploreDesc> explores) {
        ModelDesc model = new ModelDesc();
        model.setName(DEFAULT_MODEL);
        model.setViews(views);
        model.setExplores(explores);
        ProjectDesc project = new ProjectDesc();
        project.setModels(Lists.newArrayList(model));
        return assemble(project);
    }

    public SemanticModel assemble(ProjectDesc project) {
        ValidateContext context = new ValidateContext();
        init(project, context);
        validator.validate(project, context);

        for (String warning : context.getMessages(ResultLevel.WARN)) {
            logger.warn(warning);
        }
        if (!context.ifPass()) {
            List<String> errors = context.getMessages(ResultLevel.ERROR);
            logger.error("Semantic model rejected with " + errors.size() + " error(s)");
            throw new ModelException(errors);
        }

        Map<String, ViewDesc> views = Maps.newLinkedHashMap();
        for (ViewDesc view : project.getAllViews()) {
            views.put(view.getName(), view);
        }

        List<ExploreGraph> graphs = Lists.newArrayList();
        for (ModelDesc model : project.getModels()) {
            for (ExploreDesc explore : model.getExplores()) {
                graphs.add(new ExploreGraph(explore, views.get(explore.getBaseViewName()), views));
            }
        }

        SemanticModel result = new SemanticModel(views, graphs);
        logger.info("Assembled " + result);
        return result;
    }

    private void init(ProjectDesc project, ValidateContext context) {
        for (ViewDesc view : project.getAllViews()) {
            view.init();
            if (view.getFields().isEmpty())
                context.addResult(ResultLevel.WARN, "View '" + view.getName() + "' declares no fields");
        }

        for (ModelDesc model : project.getModels()) {
            List<ExploreDesc> explores = model.getExplores();
            for (int i = 0; i < explores.size(); i++) {
                ExploreDesc explore = explores.get(i);
                try {
                    explore.init(model.getName(), i);
                } catch (ExpressionException e) {
                    context.addResult(ResultLevel.ERROR, "Explore '" + explore.getName() + "': " + e.getMessage());
                }
            }
        }
    }
}
