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

import java.io.IOException;

import org.semql.metadata.catalog.CatalogSnapshot;
import org.semql.metadata.catalog.JsonCatalogReader;
import org.semql.metadata.model.DimensionDesc;
import org.semql.metadata.model.ExploreDesc;
import org.semql.metadata.model.JoinDesc;
import org.semql.metadata.model.MeasureDesc;
import org.semql.metadata.model.SemanticModel;
import org.semql.metadata.model.ViewDesc;

import com.google.common.collect.Lists;

/**
 * Hand-built model pieces and the shared thelook fixtures.
 */
public class ModelFixtures {

    public static SemanticModel thelook() throws IOException {
        return new ModelAssembler().assemble(JsonModelReader.readResource("thelook_model.json"));
    }

    public static CatalogSnapshot thelookCatalog() throws IOException {
        return JsonCatalogReader.readResource("thelook_catalog.json");
    }

    public static ViewDesc view(String name, String table) {
        ViewDesc view = new ViewDesc();
        view.setName(name);
        view.setSqlTableName(table);
        return view;
    }

    public static DimensionDesc dimension(ViewDesc view, String name, String type, String sql) {
        DimensionDesc dim = new DimensionDesc();
        dim.setName(name);
        dim.setType(type);
        dim.setSql(sql);
        view.getDimensions().add(dim);
        return dim;
    }

    public static MeasureDesc measure(ViewDesc view, String name, String type, String sql) {
        MeasureDesc measure = new MeasureDesc();
        measure.setName(name);
        measure.setType(type);
        measure.setSql(sql);
        view.getMeasures().add(measure);
        return measure;
    }

    public static ExploreDesc explore(String name, String baseView, JoinDesc... joins) {
        ExploreDesc explore = new ExploreDesc();
        explore.setName(name);
        explore.setViewName(baseView);
        explore.setJoins(Lists.newArrayList(joins));
        return explore;
    }

    public static JoinDesc join(String viewName, String sqlOn) {
        JoinDesc join = new JoinDesc();
        join.setViewName(viewName);
        join.setSqlOn(sqlOn);
        return join;
    }
}
