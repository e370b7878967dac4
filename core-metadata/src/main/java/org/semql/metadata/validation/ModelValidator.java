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

package org.semql.metadata.validation;

import org.semql.metadata.model.ProjectDesc;
import org.semql.metadata.validation.rule.DuplicateNameRule;
import org.semql.metadata.validation.rule.ExploreReferenceRule;
import org.semql.metadata.validation.rule.JoinGraphRule;

/**
 * Runs every model rule in order over an initialized project.
 */
public class ModelValidator {

    @SuppressWarnings("unchecked")
    private IValidatorRule<ProjectDesc>[] rules = new IValidatorRule[] { new DuplicateNameRule(), new ExploreReferenceRule(), new JoinGraphRule() };

    public ValidateContext validate(ProjectDesc project) {
        ValidateContext context = new ValidateContext();
        validate(project, context);
        return context;
    }

    public void validate(ProjectDesc project, ValidateContext context) {
        for (int i = 0; i < rules.length; i++) {
            rules[i].validate(project, context);
        }
    }
}
