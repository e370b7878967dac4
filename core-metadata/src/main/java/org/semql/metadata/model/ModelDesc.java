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
 * One parsed model file: a connection plus the views and explores it declares.
 */
@JsonAutoDetect(fieldVisibility = Visibility.NONE, getterVisibility = Visibility.NONE, isGetterVisibility = Visibility.NONE, setterVisibility = Visibility.NONE)
public class ModelDesc {

    @JsonProperty("name")
    private String name;
    @JsonProperty("connection")
    private String connection;
    @JsonProperty("views")
    private List<ViewDesc> views = Lists.newArrayList();
    @JsonProperty("explores")
    private List<ExploreDesc> explores = Lists.newArrayList();

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getConnection() {
        return connection;
    }

    public void setConnection(String connection) {
        this.connection = connection;
    }

    public List<ViewDesc> getViews() {
        return views == null ? Lists.<ViewDesc> newArrayList() : views;
    }

    public void setViews(List<ViewDesc> views) {
        this.views = views;
    }

    public List<ExploreDesc> getExplores() {
        return explores == null ? Lists.<ExploreDesc> newArrayList() : explores;
    }

    public void setExplores(List<ExploreDesc> explores) {
        this.explores = explores;
    }

    @Override
    public String toString() {
        return "ModelDesc [name=" + name + "]";
    }
}
