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

import java.util.List;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.Lists;

/**
 * Everything the model-file parser emits for one project: its models plus
 * standalone view files that belong to no model.
 */
@JsonAutoDetect(fieldVisibility = Visibility.NONE, getterVisibility = Visibility.NONE, isGetterVisibility = Visibility.NONE, setterVisibility = Visibility.NONE)
public class ProjectDesc {

    @JsonProperty("models")
    private List<ModelDesc> models = Lists.newArrayList();
    @JsonProperty("views")
    private List<ViewDesc> views = Lists.newArrayList();

    public List<ModelDesc> getModels() {
        return models == null ? Lists.<ModelDesc> newArrayList() : models;
    }

    public void setModels(List<ModelDesc> models) {
        this.models = models;
    }

    public List<ViewDesc> getViews() {
        return views == null ? Lists.<ViewDesc> newArrayList() : views;
    }

    public void setViews(List<ViewDesc> views) {
        this.views = views;
    }

    /**
     * Standalone views first, then each model's views.
     */
    public List<ViewDesc> getAllViews() {
        List<ViewDesc> all = Lists.newArrayList(getViews());
        for (ModelDesc model : getModels()) {
            all.addAll(model.getViews());
        }
        return all;
    }
}
